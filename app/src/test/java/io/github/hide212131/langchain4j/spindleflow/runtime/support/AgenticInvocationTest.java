package io.github.hide212131.langchain4j.spindleflow.runtime.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.agentic.AgenticServices;
import dev.langchain4j.agentic.UntypedAgent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AgenticInvocationTest {

    private static final ScopeKey<String> GREETING = ScopeKey.of("greeting", String.class);
    private static final ScopeKey<Integer> COUNT = ScopeKey.of("count", Integer.class);

    @Test
    void invoke_shouldRunActionsInOrderAndShareScope() {
        AgenticInvocation invocation = new AgenticInvocation();
        List<String> calls = new ArrayList<>();
        UntypedAgent workflow = AgenticServices.sequenceBuilder()
                .subAgents(
                        invocation.action(scope -> {
                            calls.add("first");
                            GREETING.write(scope, "hello");
                        }),
                        invocation.action(scope -> {
                            calls.add("second");
                            GREETING.write(scope, GREETING.readRequired(scope) + " world");
                        }))
                .output(GREETING::readRequired)
                .build();

        Object result = invocation.invoke(workflow, "input");

        assertThat(result).isEqualTo("hello world");
        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    void invoke_whenActionFails_shouldRethrowOriginalExceptionAndStop() {
        AgenticInvocation invocation = new AgenticInvocation();
        List<String> calls = new ArrayList<>();
        UntypedAgent workflow = AgenticServices.sequenceBuilder()
                .subAgents(
                        invocation.action(scope -> {
                            throw new IllegalStateException("step one broke");
                        }),
                        invocation.action(scope -> calls.add("second")))
                .build();

        assertThatThrownBy(() -> invocation.invoke(workflow, "input"))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("step one broke");
        assertThat(calls).isEmpty();
    }

    @Test
    void readRequired_whenValueHasOtherType_shouldFail() {
        AgenticInvocation invocation = new AgenticInvocation();
        UntypedAgent workflow = AgenticServices.sequenceBuilder()
                .subAgents(invocation.action(scope -> {
                    scope.writeState(COUNT.key(), "three");
                    COUNT.readRequired(scope);
                }))
                .build();

        assertThatThrownBy(() -> invocation.invoke(workflow, "input"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected type java.lang.Integer");
    }
}
