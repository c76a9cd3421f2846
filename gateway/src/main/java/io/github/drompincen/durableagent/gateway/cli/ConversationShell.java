package io.github.drompincen.durableagent.gateway.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.durableagent.protocol.api.ConversationHitDto;
import io.github.drompincen.durableagent.protocol.api.TurnStatus;
import io.github.drompincen.durableagent.runtime.agent.ConversationService;
import io.github.drompincen.durableagent.runtime.agent.TurnResult;
import io.github.drompincen.durableagent.runtime.index.SearchFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interactive console for one user. Plain lines are sent as turns on the current session;
 * lines starting with {@code /} are commands.
 */
@Component
@ConditionalOnProperty(name = "durableagent.cli.enabled", havingValue = "true")
public class ConversationShell implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConversationShell.class);
    private static final int SEARCH_LIMIT = 10;

    static final String HELP = """
            Commands:
              /new               start a new conversation
              /resume <session>  continue an existing session
              /search <text>     search your past conversations
              /stats             show your conversation statistics
              /help              show this help
              /quit              leave the shell
            Anything else is sent to the assistant.""";

    private final ConversationService conversationService;
    private final ObjectMapper objectMapper;
    private final String userId;

    private String sessionId;

    public ConversationShell(ConversationService conversationService,
                             ObjectMapper objectMapper,
                             @Value("${durableagent.cli.user-id:cli-user}") String userId) {
        this.conversationService = conversationService;
        this.objectMapper = objectMapper;
        this.userId = userId;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        runInteractive(in, System.out);
    }

    /** Reads commands until {@code /quit} or end of input. */
    public void runInteractive(BufferedReader in, PrintStream out) throws IOException {
        out.println("Customer support shell for user '" + userId + "' ("
                + (conversationService.isDurable() ? "durable" : "in-memory") + " checkpoints). Type /help.");
        while (true) {
            prompt(out);
            String line = in.readLine();
            if (line == null) {
                return;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (!line.startsWith("/")) {
                send(line, out);
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            String arg = parts.length > 1 ? parts[1].trim() : "";
            switch (parts[0].toLowerCase()) {
                case "/quit", "/exit" -> {
                    out.println("Bye.");
                    return;
                }
                case "/new" -> {
                    sessionId = null;
                    out.println("Next message starts a new conversation.");
                }
                case "/resume" -> {
                    if (arg.isEmpty()) {
                        out.println("Usage: /resume <session>");
                    } else {
                        sessionId = arg;
                        out.println("Resuming session " + sessionId + ".");
                    }
                }
                case "/search" -> search(arg, out);
                case "/stats" -> out.println(toJson(conversationService.statistics(userId)));
                case "/help" -> out.println(HELP);
                default -> out.println("Unknown command " + parts[0] + ". Type /help.");
            }
        }
    }

    String currentSession() {
        return sessionId;
    }

    private void prompt(PrintStream out) {
        out.print(sessionId == null ? "> " : "[" + sessionId + "] > ");
        out.flush();
    }

    private void send(String message, PrintStream out) {
        TurnResult result = conversationService.runTurn(userId, message, sessionId);
        if (result.newSession()) {
            out.println("(new session " + result.sessionId() + ")");
        }
        sessionId = result.sessionId();
        out.println(result.reply());
        if (result.status() == TurnStatus.AWAITING_INPUT) {
            out.println("(waiting for a reviewer: reply with 'approved: ...' or 'denied: ...')");
        } else if (result.failed()) {
            log.warn("Turn failed: {} {}", result.failureKind(), result.errorMessage());
            out.println("(turn failed: " + result.failureKind() + ")");
        }
    }

    private void search(String text, PrintStream out) {
        if (text.isEmpty()) {
            out.println("Usage: /search <text>");
            return;
        }
        List<ConversationHitDto> hits = conversationService.search(text, SearchFilter.forUser(userId), SEARCH_LIMIT);
        if (hits.isEmpty()) {
            out.println("No matching conversations.");
            return;
        }
        for (ConversationHitDto hit : hits) {
            out.printf("%s  %-6s %s  %d message(s)  %s%n", hit.sessionId(),
                    hit.intent() == null ? "-" : hit.intent(),
                    hit.resolved() ? "resolved  " : "unresolved", hit.messageCount(), hit.timestamp());
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render " + value.getClass().getSimpleName(), e);
        }
    }
}
