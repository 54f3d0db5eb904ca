package io.github.hide212131.langchain4j.spindleflow.runtime.support;

import dev.langchain4j.agentic.scope.AgenticScope;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed name for a value kept in an {@link AgenticScope} while a workflow runs.
 */
public final class ScopeKey<T> {

    private final String key;
    private final Class<T> type;

    private ScopeKey(String key, Class<T> type) {
        this.key = Objects.requireNonNull(key, "key");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> ScopeKey<T> of(String key, Class<T> type) {
        return new ScopeKey<>(key, type);
    }

    public void write(AgenticScope scope, T value) {
        Objects.requireNonNull(scope, "scope");
        scope.writeState(key, Objects.requireNonNull(value, "value"));
    }

    public Optional<T> readOptional(AgenticScope scope) {
        Objects.requireNonNull(scope, "scope");
        if (!scope.hasState(key)) {
            return Optional.empty();
        }
        Object value = scope.readState(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Scope value '" + key + "' expected type "
                    + type.getName() + " but found " + value.getClass().getName());
        }
        return Optional.of(type.cast(value));
    }

    public T readRequired(AgenticScope scope) {
        return readOptional(scope)
                .orElseThrow(() -> new IllegalStateException("Missing required scope value: " + key));
    }

    public String key() {
        return key;
    }
}
