package io.github.drompincen.durableagent.runtime.graph;

import io.github.drompincen.durableagent.runtime.checkpoint.Checkpoint;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Decides where execution halts for external input and recognises a resume into such a node. */
@Component
public class InterruptController {

    public boolean shouldInterrupt(GraphDefinition graph, String candidateNode) {
        return candidateNode != null && graph.interruptBefore().contains(candidateNode);
    }

    /**
     * True when the prior checkpoint halted before an interrupt node, so the current input is the
     * external input that node was waiting for.
     */
    public boolean isResumeInto(Optional<Checkpoint> checkpoint, GraphDefinition graph) {
        return checkpoint.filter(Checkpoint::hasNextNode)
                .map(cp -> shouldInterrupt(graph, cp.nextNode()))
                .orElse(false);
    }
}
