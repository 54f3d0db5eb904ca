package io.github.hide212131.langchain4j.spindleflow.infra.observability;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Configures OpenTelemetry tracing for workflow runs. Spans are exported over OTLP HTTP when an
 * endpoint is configured; otherwise a no-op tracer is used.
 */
public final class ObservabilityConfig {

    static final String ENV_ENDPOINT = "SPINDLEFLOW_OTLP_ENDPOINT";
    static final String ENV_HEADERS = "SPINDLEFLOW_OTLP_HEADERS";
    static final String ENV_SERVICE_NAME = "SPINDLEFLOW_SERVICE_NAME";
    private static final String DEFAULT_SERVICE_NAME = "spindleflow";

    private static final WorkflowLogger LOGGER = new WorkflowLogger(ObservabilityConfig.class);

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final boolean enabled;

    private ObservabilityConfig(OpenTelemetry openTelemetry, Tracer tracer, boolean enabled) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.enabled = enabled;
    }

    /**
     * Builds a configuration from environment variables.
     *
     * <ul>
     *   <li>SPINDLEFLOW_OTLP_ENDPOINT: OTLP HTTP traces endpoint; tracing is disabled when absent.</li>
     *   <li>SPINDLEFLOW_OTLP_HEADERS: comma separated {@code key=value} pairs sent with each export.</li>
     *   <li>SPINDLEFLOW_SERVICE_NAME: service name resource attribute, defaults to spindleflow.</li>
     * </ul>
     */
    public static ObservabilityConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ObservabilityConfig fromEnvironment(EnvironmentVariables environment) {
        String endpoint = trimToNull(environment.get(ENV_ENDPOINT));
        if (endpoint == null) {
            LOGGER.debug("No OTLP endpoint configured; tracing disabled");
            return disabled();
        }
        String serviceName = trimToNull(environment.get(ENV_SERVICE_NAME));
        if (serviceName == null) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
        Map<String, String> headers = parseHeaders(environment.get(ENV_HEADERS));

        Resource resource = Resource.getDefault().merge(Resource.create(
                Attributes.of(AttributeKey.stringKey("service.name"), serviceName)));

        OtlpHttpSpanExporter spanExporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(30, TimeUnit.SECONDS)
                .setHeaders(() -> headers)
                .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setResource(resource)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                openTelemetry.close();
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to flush spans on shutdown: {}", e.getMessage());
            }
        }, "opentelemetry-shutdown"));

        LOGGER.info("Tracing enabled; exporting spans to {} as {}", endpoint, serviceName);
        return new ObservabilityConfig(openTelemetry, openTelemetry.getTracer("spindleflow"), true);
    }

    public static ObservabilityConfig disabled() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new ObservabilityConfig(noop, noop.getTracer("noop"), false);
    }

    public OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    public Tracer tracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return enabled;
    }

    static Map<String, String> parseHeaders(String raw) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return headers;
        }
        for (String pair : raw.split(",")) {
            int separator = pair.indexOf('=');
            if (separator <= 0) {
                LOGGER.warn("Ignoring malformed OTLP header entry '{}'", pair.trim());
                continue;
            }
            String key = pair.substring(0, separator).trim();
            String value = pair.substring(separator + 1).trim();
            if (!key.isEmpty()) {
                headers.put(key, value);
            }
        }
        return headers;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @FunctionalInterface
    interface EnvironmentVariables {
        String get(String key);
    }
}
