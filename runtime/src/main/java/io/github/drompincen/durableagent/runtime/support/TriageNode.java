package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.graph.NodeFunction;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies the customer's message as {@code faq}, {@code order} or {@code human}. Angry messages
 * are escalated; order questions pick up the order reference; follow-up questions about delivery
 * stay on the order remembered from earlier turns.
 */
@Component
public class TriageNode implements NodeFunction {

    private static final Logger log = LoggerFactory.getLogger(TriageNode.class);

    public static final String INTENT_FAQ = "faq";
    public static final String INTENT_ORDER = "order";
    public static final String INTENT_HUMAN = "human";
    public static final String ACTION_ESCALATE = "escalate";

    static final String ESCALATION_NOTICE = """
            **Your request has been escalated to a support engineer.**

            A human specialist will review your case and respond shortly.

            _Please provide any additional details that may help resolve your issue._""";

    private static final List<String> ANGER_KEYWORDS =
            List.of("angry", "furious", "unacceptable", "refund now", "cancel immediately");
    private static final List<String> FOLLOW_UP_KEYWORDS =
            List.of("arrive", "deliver", "where is", "status", "track");
    private static final Pattern ORDER_REF = Pattern.compile("#?(\\d{5})");

    @Override
    public WorkflowState apply(WorkflowState state) {
        String message = state.getMessage() == null ? "" : state.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);

        if (ANGER_KEYWORDS.stream().anyMatch(lower::contains)) {
            log.info("[{}] Anger detected, escalating to human", state.getTraceId());
            return state.withField(StateField.INTENT, INTENT_HUMAN)
                    .withField(StateField.PENDING_ACTION, ACTION_ESCALATE)
                    .withField(StateField.DRAFT_REPLY, ESCALATION_NOTICE);
        }

        WorkflowState next = state.withField(StateField.PENDING_ACTION, null);
        Optional<String> reference = extractOrderReference(message);
        if (lower.contains("order") || message.contains("#")) {
            if (reference.isPresent()) {
                next = next.withField(StateField.ORDER_ID, reference.get());
            }
            log.info("[{}] Order query detected: {}", state.getTraceId(), next.orderId().orElse("none"));
            return next.withField(StateField.INTENT, INTENT_ORDER);
        }
        if (state.orderId().isPresent() && FOLLOW_UP_KEYWORDS.stream().anyMatch(lower::contains)) {
            log.info("[{}] Follow-up on order {}", state.getTraceId(), state.orderId().get());
            return next.withField(StateField.INTENT, INTENT_ORDER);
        }
        log.info("[{}] FAQ query detected", state.getTraceId());
        return next.withField(StateField.INTENT, INTENT_FAQ);
    }

    static Optional<String> extractOrderReference(String message) {
        Matcher m = ORDER_REF.matcher(message);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** Conditional edge out of triage. */
    public static String route(WorkflowState state) {
        return state.intent().orElse(INTENT_FAQ);
    }
}
