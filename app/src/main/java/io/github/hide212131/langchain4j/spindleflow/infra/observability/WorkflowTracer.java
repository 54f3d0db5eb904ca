package io.github.hide212131.langchain4j.spindleflow.infra.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Creates spans around workflow runs, fan-outs, agent turns and review iterations.
 */
public final class WorkflowTracer {

    private final Tracer tracer;
    private final boolean enabled;

    public WorkflowTracer(Tracer tracer, boolean enabled) {
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static WorkflowTracer disabled() {
        return new WorkflowTracer(OpenTelemetry.noop().getTracer("spindleflow"), false);
    }

    public static WorkflowTracer from(ObservabilityConfig config) {
        return new WorkflowTracer(config.tracer(), config.isEnabled());
    }

    /**
     * Executes an operation inside a span named {@code operationName}. Exceptions are recorded on the
     * span and rethrown untouched.
     */
    public <T> T trace(String operationName, Map<String, Object> attributes, Supplier<T> operation) {
        if (!enabled) {
            return operation.get();
        }
        Span span = startSpan(operationName, attributes);
        try (Scope ignored = span.makeCurrent()) {
            T result = operation.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void trace(String operationName, Map<String, Object> attributes, Runnable operation) {
        trace(operationName, attributes, () -> {
            operation.run();
            return null;
        });
    }

    public Span startSpan(String operationName, Map<String, Object> attributes) {
        if (!enabled) {
            return Span.getInvalid();
        }
        Span span = tracer.spanBuilder(operationName)
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        if (attributes != null) {
            attributes.forEach((key, value) -> applyAttribute(span, key, value));
        }
        return span;
    }

    public void addEvent(String eventName, Map<String, String> attributes) {
        if (!enabled) {
            return;
        }
        Span currentSpan = Span.current();
        if (!currentSpan.isRecording()) {
            return;
        }
        if (attributes == null || attributes.isEmpty()) {
            currentSpan.addEvent(eventName);
            return;
        }
        AttributesBuilder builder = Attributes.builder();
        attributes.forEach(builder::put);
        currentSpan.addEvent(eventName, builder.build());
    }

    /** Wraps an executor so worker tasks run under the submitting thread's trace context. */
    public ExecutorService propagating(ExecutorService executor) {
        if (!enabled) {
            return executor;
        }
        return Context.taskWrapping(executor);
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static void applyAttribute(Span span, String key, Object value) {
        if (value instanceof String str) {
            span.setAttribute(key, str);
        } else if (value instanceof Long l) {
            span.setAttribute(key, l);
        } else if (value instanceof Integer i) {
            span.setAttribute(key, i.longValue());
        } else if (value instanceof Boolean b) {
            span.setAttribute(key, b);
        } else if (value != null) {
            span.setAttribute(key, value.toString());
        }
    }
}
