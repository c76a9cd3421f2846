package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.graph.NodeFunction;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class FaqNode implements NodeFunction {

    private static final Logger log = LoggerFactory.getLogger(FaqNode.class);

    static final String GENERIC_REPLY =
            "I'd be happy to help! Could you please provide more details about your question?";

    private static final Map<String, String> ANSWERS = new LinkedHashMap<>();

    static {
        ANSWERS.put("return", "Our return policy allows returns within 30 days of purchase. "
                + "Items must be unused and in original packaging.");
        ANSWERS.put("shipping", "Standard shipping takes 5-7 business days. "
                + "Express shipping is available for 2-3 day delivery.");
        ANSWERS.put("payment", "We accept all major credit cards, PayPal, and Apple Pay.");
        ANSWERS.put("contact", "You can reach us at support@example.com or call 1-800-SUPPORT.");
    }

    @Override
    public WorkflowState apply(WorkflowState state) {
        String lower = state.getMessage() == null ? "" : state.getMessage().toLowerCase(Locale.ROOT);
        String reply = ANSWERS.entrySet().stream()
                .filter(e -> lower.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(GENERIC_REPLY);
        log.debug("[{}] FAQ reply: {}", state.getTraceId(), reply);
        return state.withField(StateField.DRAFT_REPLY, reply);
    }
}
