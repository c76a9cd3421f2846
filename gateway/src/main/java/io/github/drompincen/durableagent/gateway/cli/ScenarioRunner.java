package io.github.drompincen.durableagent.gateway.cli;

import io.github.drompincen.durableagent.protocol.api.CheckpointDto;
import io.github.drompincen.durableagent.protocol.api.ConversationHitDto;
import io.github.drompincen.durableagent.protocol.api.TurnStatus;
import io.github.drompincen.durableagent.protocol.api.UserStatisticsDto;
import io.github.drompincen.durableagent.runtime.agent.ConversationService;
import io.github.drompincen.durableagent.runtime.agent.TurnResult;
import io.github.drompincen.durableagent.runtime.index.Indexer;
import io.github.drompincen.durableagent.runtime.index.SearchFilter;
import io.github.drompincen.durableagent.runtime.index.SearchIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Plays the scripted customer-support conversations named by {@code durableagent.scenario}
 * ({@code basic}, {@code hitl}, {@code durability}, {@code search} or {@code all}, comma separated)
 * and reports exit code 0 when every check passed, 1 otherwise.
 */
@Component
@ConditionalOnProperty(name = "durableagent.scenario")
public class ScenarioRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);
    private static final Duration INDEX_WAIT = Duration.ofSeconds(10);
    private static final List<String> ALL = List.of("basic", "hitl", "durability", "search");

    private final ConversationService conversationService;
    private final Indexer indexer;
    private final SearchIndex searchIndex;
    private final String scenarios;
    private final String runId = UUID.randomUUID().toString().substring(0, 6);

    private final List<String> failures = new ArrayList<>();
    private int checks;

    public ScenarioRunner(ConversationService conversationService,
                          Indexer indexer,
                          SearchIndex searchIndex,
                          @Value("${durableagent.scenario}") String scenarios) {
        this.conversationService = conversationService;
        this.indexer = indexer;
        this.searchIndex = searchIndex;
        this.scenarios = scenarios;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String name : selected()) {
            int before = failures.size();
            log.info("[Scenario] ==== {} ====", name);
            switch (name) {
                case "basic" -> basic();
                case "hitl" -> humanInTheLoop();
                case "durability" -> durability();
                case "search" -> search();
                default -> fail(name, "unknown scenario");
            }
            results.put(name, failures.size() == before);
        }
        results.forEach((name, passed) -> log.info("[Scenario] {} {}", passed ? "PASS" : "FAIL", name));
        log.info("[Scenario] {} check(s), {} failure(s)", checks, failures.size());
        failures.forEach(f -> log.error("[Scenario] failed: {}", f));
    }

    @Override
    public int getExitCode() {
        return failures.isEmpty() ? 0 : 1;
    }

    List<String> failures() {
        return failures;
    }

    private List<String> selected() {
        List<String> names = Arrays.stream(scenarios.split(","))
                .map(s -> s.trim().toLowerCase())
                .filter(s -> !s.isEmpty())
                .toList();
        return names.contains("all") ? ALL : names;
    }

    private void basic() {
        String user = user("basic");
        TurnResult faq = conversationService.runTurn(user, "What's your return policy?", null);
        check("basic", faq.status() == TurnStatus.COMPLETED, "return policy turn completes");
        check("basic", faq.state().intent().filter("faq"::equals).isPresent(), "return policy is an faq");
        check("basic", faq.reply().contains("30 days"), "reply states the 30 day window");
        check("basic", faq.state().resolution().orElse(false), "faq turn is resolved");

        TurnResult order = conversationService.runTurn(user, "Where is my order #67890?", null);
        check("basic", order.state().orderId().filter("67890"::equals).isPresent(), "order id is captured");
        check("basic", order.reply().contains("Delivered"), "order status is reported");
    }

    private void humanInTheLoop() {
        String user = user("hitl");
        TurnResult angry = conversationService.runTurn(user, "This is unacceptable, I want a refund now!", null);
        check("hitl", angry.status() == TurnStatus.AWAITING_INPUT, "angry refund request halts for review");
        check("hitl", angry.state().intent().filter("human"::equals).isPresent(), "intent is human");
        check("hitl", angry.state().isAwaitingExternalInput(), "thread awaits external input");
        check("hitl", !angry.state().resolution().orElse(true), "escalated turn is unresolved");

        TurnResult approved = conversationService.runTurn(user, "Approved: refund issued", angry.sessionId());
        check("hitl", approved.status() == TurnStatus.COMPLETED, "reviewer approval completes the thread");
        check("hitl", !approved.state().isAwaitingExternalInput(), "thread no longer awaits input");
        check("hitl", approved.state().resolution().orElse(false), "approved thread is resolved");
    }

    private void durability() {
        String user = user("durability");
        TurnResult first = conversationService.runTurn(user, "Where is my order #67890?", null);
        String threadId = first.state().getThreadId();
        Optional<CheckpointDto> saved = conversationService.checkpoint(threadId);
        check("durability", saved.isPresent(), "checkpoint written after first turn");
        long firstVersion = saved.map(CheckpointDto::version).orElse(0L);

        TurnResult followUp = conversationService.runTurn(user, "When will it arrive?", first.sessionId());
        check("durability", !followUp.newSession(), "follow-up resumes the same session");
        check("durability", followUp.state().orderId().filter("67890"::equals).isPresent(),
                "order id remembered from the checkpoint");
        check("durability", followUp.state().getTurns().size() == 4, "history holds both turns");
        check("durability", conversationService.checkpoint(threadId)
                .map(CheckpointDto::version).orElse(0L) > firstVersion, "checkpoint version advanced");
        if (!conversationService.isDurable()) {
            log.warn("[Scenario] durability ran against the in-memory store; restart survival not exercised");
        }
    }

    private void search() throws InterruptedException {
        if (!searchIndex.isAvailable()) {
            log.warn("[Scenario] search index disabled, skipping search scenario");
            return;
        }
        String user = user("search");
        conversationService.runTurn(user, "What's your return policy?", null);
        conversationService.runTurn(user, "Where is my order #12345?", null);
        check("search", indexer.awaitIdle(INDEX_WAIT), "indexer drains within " + INDEX_WAIT.toSeconds() + "s");

        List<ConversationHitDto> hits = conversationService.search("return", SearchFilter.forUser(user), 10);
        check("search", hits.size() == 1, "text search finds the return conversation");
        UserStatisticsDto stats = conversationService.statistics(user);
        check("search", stats.totalConversations() == 2, "statistics count both conversations");
    }

    private String user(String scenario) {
        return "scenario-" + scenario + "-" + runId;
    }

    private void check(String scenario, boolean condition, String description) {
        checks++;
        if (condition) {
            log.info("[Scenario] ok   {}: {}", scenario, description);
        } else {
            fail(scenario, description);
        }
    }

    private void fail(String scenario, String description) {
        log.error("[Scenario] FAIL {}: {}", scenario, description);
        failures.add(scenario + ": " + description);
    }
}
