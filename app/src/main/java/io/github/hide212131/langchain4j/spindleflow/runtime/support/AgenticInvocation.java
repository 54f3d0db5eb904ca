package io.github.hide212131.langchain4j.spindleflow.runtime.support;

import dev.langchain4j.agentic.AgenticServices;
import dev.langchain4j.agentic.UntypedAgent;
import dev.langchain4j.agentic.scope.AgenticScope;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One run of a workflow assembled from {@link AgenticServices} actions.
 *
 * <p>Actions created through {@link #action} remember the first exception they throw. When the
 * workflow fails, {@link #invoke} rethrows that exception instead of whatever wrapper the agentic
 * runtime put around it, so callers see the same failure a direct call would have raised.</p>
 */
public final class AgenticInvocation {

    static final String INPUT_KEY = "input";

    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

    /** Wraps {@code body} as a non-AI agent suitable for {@code subAgents(...)}. */
    public Object action(Consumer<AgenticScope> body) {
        Objects.requireNonNull(body, "body");
        AgenticServices.AgenticScopeAction.NonThrowingConsumer<AgenticScope> guarded = scope -> {
            try {
                body.accept(scope);
            } catch (RuntimeException e) {
                failure.compareAndSet(null, e);
                throw e;
            }
        };
        return AgenticServices.agentAction(guarded);
    }

    public Object invoke(UntypedAgent workflow, String input) {
        Objects.requireNonNull(workflow, "workflow");
        try {
            return workflow.invoke(Map.of(INPUT_KEY, input == null ? "" : input));
        } catch (RuntimeException e) {
            RuntimeException original = failure.get();
            throw original != null ? original : e;
        }
    }
}
