package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.graph.NodeFunction;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TonePolishNode implements NodeFunction {

    private static final Logger log = LoggerFactory.getLogger(TonePolishNode.class);

    static final String DEFAULT_DRAFT = "I'm here to help!";

    private final ReplyPolisher polisher;

    public TonePolishNode(ReplyPolisher polisher) {
        this.polisher = polisher;
    }

    @Override
    public WorkflowState apply(WorkflowState state) {
        String draft = state.draftReply().orElse(DEFAULT_DRAFT);
        PolishResult result = polisher.polish(state.getMessage(), draft);
        if (result.isFallback()) {
            log.debug("[{}] Sending draft unpolished ({})", state.getTraceId(), result.fallbackReason());
        } else {
            log.info("[{}] Tone-adjusted reply generated", state.getTraceId());
        }
        return state.withField(StateField.FINAL_REPLY, result.text())
                .withField(StateField.REPLY_SOURCE, result.source().label());
    }
}
