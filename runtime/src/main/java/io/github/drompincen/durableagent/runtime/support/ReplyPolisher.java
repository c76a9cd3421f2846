package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.agent.llm.LlmService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Rewrites a draft reply with the LLM under a time limit. Never fails: when the model is
 * unavailable, slow or broken the draft is returned as is.
 */
@Component
public class ReplyPolisher {

    private static final Logger log = LoggerFactory.getLogger(ReplyPolisher.class);

    static final String SYSTEM_PROMPT = "You are a friendly customer service agent. "
            + "Rewrite the draft reply with empathy and professionalism. "
            + "Keep it concise (2-3 sentences).";

    private final LlmService llmService;
    private final long timeoutMs;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "reply-polisher");
        t.setDaemon(true);
        return t;
    });

    public ReplyPolisher(LlmService llmService,
                         @Value("${durableagent.llm.timeout-ms:10000}") long timeoutMs) {
        this.llmService = llmService;
        this.timeoutMs = timeoutMs;
    }

    public PolishResult polish(String customerMessage, String draft) {
        if (!llmService.isAvailable()) {
            return PolishResult.fallback(draft, "llm unavailable");
        }
        String userPrompt = "Customer: " + customerMessage + "\n\nDraft reply: " + draft;
        CompletableFuture<String> call =
                CompletableFuture.supplyAsync(() -> llmService.complete(SYSTEM_PROMPT, userPrompt), executor);
        try {
            String text = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                return PolishResult.fallback(draft, "empty completion");
            }
            return PolishResult.enriched(text.strip());
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Tone adjustment timed out after {} ms, using draft", timeoutMs);
            return PolishResult.fallback(draft, "timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Tone adjustment failed: {}, using draft", cause.getMessage());
            return PolishResult.fallback(draft, cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PolishResult.fallback(draft, "interrupted");
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
