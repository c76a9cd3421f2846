package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.graph.NodeFunction;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/** Looks up the thread's order reference in the order catalogue. */
@Component
public class OrderLookupNode implements NodeFunction {

    private static final Logger log = LoggerFactory.getLogger(OrderLookupNode.class);

    public static final String ACTION_VERIFY_ORDER = "verify-order";

    static final String ASK_FOR_ORDER =
            "I'd be happy to help with your order. Could you provide your order number? (Format: #12345)";

    record OrderStatus(String status, String delivery) {}

    private static final Map<String, OrderStatus> CATALOGUE = Map.of(
            "12345", new OrderStatus("In Transit", "Thursday, Dec 12"),
            "67890", new OrderStatus("Delivered", "Dec 8"),
            "11111", new OrderStatus("Processing", "Dec 15"));

    @Override
    public WorkflowState apply(WorkflowState state) {
        Optional<String> orderId = state.orderId();
        if (orderId.isEmpty()) {
            return state.withField(StateField.DRAFT_REPLY, ASK_FOR_ORDER)
                    .withField(StateField.PENDING_ACTION, ACTION_VERIFY_ORDER);
        }
        OrderStatus order = CATALOGUE.get(orderId.get());
        if (order == null) {
            log.info("[{}] Order {} not found", state.getTraceId(), orderId.get());
            return state.withField(StateField.DRAFT_REPLY, "I couldn't find order #" + orderId.get()
                            + ". Please check the order number and try again.")
                    .withField(StateField.PENDING_ACTION, ACTION_VERIFY_ORDER);
        }
        log.info("[{}] Order lookup complete: {}", state.getTraceId(), orderId.get());
        return state.withField(StateField.DRAFT_REPLY, "Order #" + orderId.get() + " status: **" + order.status()
                        + "**\nExpected delivery: " + order.delivery()
                        + "\n\nIs there anything else I can help you with?")
                .withField(StateField.PENDING_ACTION, null);
    }
}
