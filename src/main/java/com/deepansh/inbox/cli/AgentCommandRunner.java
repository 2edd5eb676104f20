package com.deepansh.inbox.cli;

import com.deepansh.inbox.core.AgentRunService;
import com.deepansh.inbox.model.RunResult;
import com.deepansh.inbox.trigger.TriggerSubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * Command-line entry points.
 *
 * <pre>
 *   listen                                           run the trigger subscriber until stopped
 *   interactive --user-id=a@b.c --instruction="..."   one run, reply printed
 *   interactive [--user-id=a@b.c]                    read instructions from stdin until quit
 * </pre>
 *
 * Exit codes: 0 clean shutdown or last run DONE, 1 last run FAILED, 2 usage error.
 */
@Component
@Slf4j
public class AgentCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> QUIT_WORDS = Set.of("quit", "exit", "q");

    private final TriggerSubscriber triggerSubscriber;
    private final AgentRunService agentRunService;
    private final InputStream in;
    private final PrintStream out;

    private volatile int exitCode = EXIT_OK;

    @Autowired
    public AgentCommandRunner(TriggerSubscriber triggerSubscriber, AgentRunService agentRunService) {
        this(triggerSubscriber, agentRunService, System.in, System.out);
    }

    AgentCommandRunner(TriggerSubscriber triggerSubscriber,
                       AgentRunService agentRunService,
                       InputStream in,
                       PrintStream out) {
        this.triggerSubscriber = triggerSubscriber;
        this.agentRunService = agentRunService;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        String mode = commands.isEmpty() ? "interactive" : commands.get(0);

        switch (mode) {
            case "listen" -> listen();
            case "interactive" -> interactive(option(args, "user-id"), option(args, "instruction"));
            default -> {
                out.println("Unknown mode '" + mode + "'");
                printUsage();
                exitCode = EXIT_USAGE;
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void listen() {
        log.info("Starting in listen mode; stop with Ctrl+C");
        triggerSubscriber.start();
        exitCode = EXIT_OK;
    }

    private void interactive(String userId, String instruction) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

        if (userId == null) {
            out.print("Enter your user ID (email): ");
            out.flush();
            userId = readLine(reader);
            if (userId == null || userId.isBlank()) {
                out.println("A user ID is required.");
                exitCode = EXIT_USAGE;
                return;
            }
            userId = userId.trim();
        }

        if (instruction != null) {
            exitCode = runOnce(userId, instruction);
            return;
        }

        while (true) {
            out.print("\nUser: ");
            out.flush();
            String line = readLine(reader);
            if (line == null || QUIT_WORDS.contains(line.trim().toLowerCase())) {
                out.println("Goodbye!");
                return;
            }
            if (!line.isBlank()) {
                exitCode = runOnce(userId, line.trim());
            }
        }
    }

    private int runOnce(String userId, String instruction) {
        RunResult result = agentRunService.runInstruction(userId, instruction);
        if (result.isDone()) {
            out.println("Assistant: " + (result.getReplyMessage() != null
                    ? result.getReplyMessage()
                    : "(finished without a reply)"));
            return EXIT_OK;
        }
        out.println("Failed (" + result.getCondition() + "): " + result.getFailureReason());
        return EXIT_RUN_FAILED;
    }

    private void printUsage() {
        out.println("Usage:");
        out.println("  listen                                        listen for e-mail triggers");
        out.println("  interactive [--user-id=<email>] [--instruction=<text>]");
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static String readLine(BufferedReader reader) {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read from standard input", e);
        }
    }
}
