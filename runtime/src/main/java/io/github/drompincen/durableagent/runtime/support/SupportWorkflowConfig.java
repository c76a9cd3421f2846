package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.graph.GraphDefinition;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * The customer-support graph: triage routes to an FAQ answer, an order lookup or a human reviewer,
 * and every branch ends in tone polishing. The graph halts before the human reviewer until the
 * reviewer's decision arrives as the next message of the thread.
 */
@Configuration
public class SupportWorkflowConfig {

    public static final String TRIAGE = "triage";
    public static final String FAQ = "faq";
    public static final String ORDER = "order";
    public static final String HUMAN = "human";
    public static final String TONE = "tone";

    @Bean
    public GraphDefinition supportWorkflow(TriageNode triage, FaqNode faq, OrderLookupNode order,
                                           HumanReviewNode human, TonePolishNode tone) {
        return build(triage, faq, order, human, tone);
    }

    public static GraphDefinition build(TriageNode triage, FaqNode faq, OrderLookupNode order,
                                        HumanReviewNode human, TonePolishNode tone) {
        return GraphDefinition.builder("customer-support")
                .node(TRIAGE, triage, StateField.INTENT, StateField.ORDER_ID,
                        StateField.PENDING_ACTION, StateField.DRAFT_REPLY)
                .node(FAQ, faq, StateField.DRAFT_REPLY)
                .node(ORDER, order, StateField.DRAFT_REPLY, StateField.PENDING_ACTION)
                .node(HUMAN, human, StateField.DRAFT_REPLY, StateField.PENDING_ACTION, StateField.ORDER_ID)
                .node(TONE, tone, StateField.FINAL_REPLY, StateField.REPLY_SOURCE)
                .start(TRIAGE)
                .conditionalEdge(TRIAGE, TriageNode::route, Map.of(
                        TriageNode.INTENT_FAQ, FAQ,
                        TriageNode.INTENT_ORDER, ORDER,
                        TriageNode.INTENT_HUMAN, HUMAN))
                .edge(FAQ, TONE)
                .edge(ORDER, TONE)
                .edge(HUMAN, TONE)
                .edge(TONE, GraphDefinition.END)
                .interruptBefore(HUMAN)
                .resolutionPolicy(state -> !state.pendingAction()
                        .filter(OrderLookupNode.ACTION_VERIFY_ORDER::equals)
                        .isPresent())
                .build();
    }
}
