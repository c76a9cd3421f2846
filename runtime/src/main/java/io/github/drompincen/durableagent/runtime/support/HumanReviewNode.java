package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.graph.NodeFunction;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs when an escalated thread receives the reviewer's answer. The input message is the decision,
 * for example {@code "approved: refund issued"} or {@code "denied - outside return window"}.
 */
@Component
public class HumanReviewNode implements NodeFunction {

    private static final Logger log = LoggerFactory.getLogger(HumanReviewNode.class);

    public static final String ACTION_APPROVED = "approved";
    public static final String ACTION_DENIED = "denied";
    public static final String ACTION_REVIEWED = "reviewed";

    private static final Pattern DECISION =
            Pattern.compile("^\\s*(approved?|denied|deny|rejected?)\\b[\\s:,.\\-]*(.*)$",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    @Override
    public WorkflowState apply(WorkflowState state) {
        String input = state.getMessage() == null ? "" : state.getMessage().trim();
        String action = ACTION_REVIEWED;
        String note = input;
        Matcher m = DECISION.matcher(input);
        if (m.matches()) {
            action = m.group(1).toLowerCase(Locale.ROOT).startsWith("approve") ? ACTION_APPROVED : ACTION_DENIED;
            note = m.group(2).trim();
        }

        String reply = switch (action) {
            case ACTION_APPROVED -> "Good news: a support specialist approved your request.";
            case ACTION_DENIED -> "A support specialist reviewed your request and was unable to approve it.";
            default -> "A support specialist has reviewed your case.";
        };
        if (!note.isEmpty()) {
            reply = reply + " Note from our team: " + note;
        }
        log.info("[{}] Human review recorded: {}", state.getTraceId(), action);

        WorkflowState next = state.withField(StateField.PENDING_ACTION, action)
                .withField(StateField.DRAFT_REPLY, reply);
        var reference = TriageNode.extractOrderReference(input);
        if (reference.isPresent()) {
            next = next.withField(StateField.ORDER_ID, reference.get());
        }
        return next;
    }
}
