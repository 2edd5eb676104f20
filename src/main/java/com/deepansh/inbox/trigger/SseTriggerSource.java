package com.deepansh.inbox.trigger;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.exception.SubscriptionConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Trigger events from a server-sent event stream ({@code agent.trigger.stream-url}).
 *
 * Each SSE event's data lines form one raw event. Comment lines (heartbeats)
 * and event types are ignored. The request is sent when
 * {@link TriggerConnection#forEachEvent} is called.
 */
@Component
@Slf4j
public class SseTriggerSource implements TriggerSource {

    private final RestClient restClient;
    private final String streamUrl;

    public SseTriggerSource(@Qualifier("streamingRestClientBuilder") RestClient.Builder restClientBuilder,
                            AgentProperties agentProperties,
                            CatalogProperties catalogProperties) {
        this.streamUrl = agentProperties.getTrigger().getStreamUrl();
        this.restClient = restClientBuilder.clone()
                .defaultHeader("x-api-key", catalogProperties.getApiKey())
                .build();
    }

    @Override
    public TriggerConnection open() {
        return new SseConnection();
    }

    private class SseConnection implements TriggerConnection {

        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicBoolean connected = new AtomicBoolean(false);
        private final AtomicReference<InputStream> body = new AtomicReference<>();

        @Override
        public void forEachEvent(Consumer<String> handler) {
            try {
                restClient.get()
                        .uri(streamUrl)
                        .header(HttpHeaders.ACCEPT, MediaType.TEXT_EVENT_STREAM_VALUE)
                        .exchange((request, response) -> {
                            if (response.getStatusCode().isError()) {
                                throw new SubscriptionConnectionException(
                                        "Trigger stream returned HTTP " + response.getStatusCode().value());
                            }
                            connected.set(true);
                            log.info("Trigger stream connected [url={}]", streamUrl);
                            InputStream in = response.getBody();
                            body.set(in);
                            if (closed.get()) {
                                return null;
                            }
                            readEvents(in, handler);
                            return null;
                        });
            } catch (SubscriptionConnectionException e) {
                throw e;
            } catch (RestClientException e) {
                if (closed.get()) {
                    return;
                }
                throw new SubscriptionConnectionException("Trigger stream failed: " + e.getMessage(), e);
            }
        }

        private void readEvents(InputStream in, Consumer<String> handler) throws IOException {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            StringBuilder data = new StringBuilder();
            String line;
            while (!closed.get() && (line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (!data.isEmpty()) {
                        handler.accept(data.toString());
                        data.setLength(0);
                    }
                } else if (line.startsWith("data:")) {
                    if (!data.isEmpty()) {
                        data.append('\n');
                    }
                    data.append(line.substring(5).stripLeading());
                }
            }
            if (!closed.get()) {
                log.warn("Trigger stream ended by the server");
            }
        }

        @Override
        public boolean isConnected() {
            return connected.get();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            InputStream in = body.get();
            if (in != null) {
                try {
                    in.close();
                } catch (IOException e) {
                    log.debug("Closing trigger stream: {}", e.getMessage());
                }
            }
        }
    }
}
