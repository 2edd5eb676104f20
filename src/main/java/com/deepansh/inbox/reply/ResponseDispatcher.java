package com.deepansh.inbox.reply;

import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.model.ExecutionResult;
import com.deepansh.inbox.model.ReplyTarget;
import com.deepansh.inbox.model.Session;
import com.deepansh.inbox.model.ToolDescriptor;
import com.deepansh.inbox.model.ToolInvocation;
import com.deepansh.inbox.tool.ToolRegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends the final answer back on the originating thread by executing the
 * configured reply tool ({@code catalog.reply.tool-id}).
 */
@Component
@Slf4j
public class ResponseDispatcher {

    private final ToolRegistryClient toolRegistryClient;
    private final CatalogProperties.Reply replyConfig;

    public ResponseDispatcher(ToolRegistryClient toolRegistryClient, CatalogProperties catalogProperties) {
        this.toolRegistryClient = toolRegistryClient;
        this.replyConfig = catalogProperties.getReply();
    }

    public ExecutionResult reply(Session session, ReplyTarget target, String message) {
        ToolDescriptor replyTool = new ToolDescriptor(
                replyConfig.getToolId(), replyConfig.getApp(), "Reply on an e-mail thread", null, Map.of());

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("thread_id", target.threadId());
        input.put("recipient_email", target.recipient());
        input.put("message_body", message);
        input.put("is_html", replyConfig.isHtml());
        input.put("user_id", "me");

        log.info("Sending reply [userId={}, threadId={}, recipient={}]",
                session.getUserId(), target.threadId(), target.recipient());

        List<ExecutionResult> results = toolRegistryClient.executeTools(
                session, List.of(new ToolInvocation(replyTool, input)));
        ExecutionResult result = results.get(0);

        if (result.success()) {
            log.info("Reply sent [threadId={}]", target.threadId());
        } else {
            log.error("Reply failed [threadId={}, kind={}]: {}",
                    target.threadId(), result.errorKind(), result.errorMessage());
        }
        return result;
    }
}
