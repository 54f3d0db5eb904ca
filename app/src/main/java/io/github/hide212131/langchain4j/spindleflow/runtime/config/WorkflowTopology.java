package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Shape of a workflow: either an ordered list of steps or a fan-out with an aggregator.
 */
public interface WorkflowTopology {

    /** Every agent id the topology references, in declaration order. */
    List<String> referencedAgents();

    record Sequential(List<String> steps) implements WorkflowTopology {
        public Sequential {
            steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
        }

        @Override
        public List<String> referencedAgents() {
            return steps;
        }
    }

    record Parallel(List<String> branches, String aggregator, FeedbackLoopSettings feedbackLoop)
            implements WorkflowTopology {
        public Parallel {
            branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
            Objects.requireNonNull(aggregator, "aggregator");
        }

        public Optional<FeedbackLoopSettings> activeFeedbackLoop() {
            return feedbackLoop != null && feedbackLoop.enabled() ? Optional.of(feedbackLoop) : Optional.empty();
        }

        @Override
        public List<String> referencedAgents() {
            ArrayList<String> ids = new ArrayList<>(branches);
            ids.add(aggregator);
            return List.copyOf(ids);
        }
    }
}
