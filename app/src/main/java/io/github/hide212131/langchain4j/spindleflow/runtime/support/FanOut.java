package io.github.hide212131.langchain4j.spindleflow.runtime.support;

import dev.langchain4j.agentic.AgenticServices;
import dev.langchain4j.agentic.UntypedAgent;
import dev.langchain4j.agentic.scope.AgenticScope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs tasks as branches of an agentic parallel workflow and waits for all of them.
 *
 * <p>Each branch writes its outcome under its own scope key. A trailing action reads the outcomes
 * in task order, rethrows the first failure (in task order) once every branch has settled, and
 * otherwise hands the results to the barrier. The barrier runs on the calling thread.</p>
 */
public final class FanOut {

    private static final ScopeKey<List> RESULTS = ScopeKey.of("fanout.results", List.class);

    private FanOut() {
    }

    public static <T> List<T> all(List<Supplier<T>> tasks, ExecutorService executor) {
        return all(tasks, executor, results -> {
        });
    }

    public static <T> List<T> all(List<Supplier<T>> tasks, ExecutorService executor, Consumer<List<T>> barrier) {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(barrier, "barrier");
        if (tasks.isEmpty()) {
            barrier.accept(List.of());
            return List.of();
        }
        AgenticInvocation invocation = new AgenticInvocation();
        List<ScopeKey<Outcome>> keys = new ArrayList<>();
        Object[] branches = new Object[tasks.size()];
        for (int i = 0; i < tasks.size(); i++) {
            ScopeKey<Outcome> key = ScopeKey.of("fanout.branch-" + (i + 1), Outcome.class);
            Supplier<T> task = tasks.get(i);
            keys.add(key);
            branches[i] = invocation.action(scope -> key.write(scope, Outcome.of(task)));
        }
        UntypedAgent parallel = AgenticServices.parallelBuilder()
                .name("fan-out")
                .executor(executor)
                .subAgents(branches)
                .build();
        UntypedAgent workflow = AgenticServices.sequenceBuilder()
                .name("fan-out-barrier")
                .subAgents(parallel, invocation.action(scope -> {
                    List<T> results = collect(scope, keys);
                    barrier.accept(results);
                    RESULTS.write(scope, results);
                }))
                .output(RESULTS::readRequired)
                .build();
        @SuppressWarnings("unchecked")
        List<T> results = (List<T>) invocation.invoke(workflow, "fan-out of " + tasks.size());
        return results;
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> collect(AgenticScope scope, List<ScopeKey<Outcome>> keys) {
        List<T> results = new ArrayList<>();
        for (ScopeKey<Outcome> key : keys) {
            Outcome outcome = key.readRequired(scope);
            if (outcome.failure() != null) {
                throw outcome.failure();
            }
            results.add((T) outcome.value());
        }
        return Collections.unmodifiableList(results);
    }

    private record Outcome(Object value, RuntimeException failure) {

        static Outcome of(Supplier<?> task) {
            try {
                return new Outcome(task.get(), null);
            } catch (RuntimeException e) {
                return new Outcome(null, e);
            }
        }
    }
}
