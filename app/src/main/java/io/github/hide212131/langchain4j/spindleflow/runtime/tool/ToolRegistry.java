package io.github.hide212131.langchain4j.spindleflow.runtime.tool;

import io.github.hide212131.langchain4j.spindleflow.infra.logging.WorkflowLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ToolInvoker} over a fixed set of registered tools. Unknown tools and tool exceptions become
 * unsuccessful results rather than aborting the turn.
 */
public final class ToolRegistry implements ToolInvoker {

    private final Map<String, Tool> tools;
    private final WorkflowLogger logger;
    private final Clock clock;

    public ToolRegistry(List<Tool> tools, WorkflowLogger logger) {
        this(tools, logger, Clock.systemUTC());
    }

    ToolRegistry(List<Tool> tools, WorkflowLogger logger, Clock clock) {
        Map<String, Tool> byName = new LinkedHashMap<>();
        for (Tool tool : tools) {
            if (byName.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Tool '" + tool.name() + "' is registered twice");
            }
        }
        this.tools = Map.copyOf(byName);
        this.logger = Objects.requireNonNull(logger, "logger");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Registry with the tools bundled with the engine. */
    public static ToolRegistry withBuiltins(WorkflowLogger logger) {
        return new ToolRegistry(List.of(new EchoInputTool(), new PreviousOutputsTool()), logger);
    }

    public Set<String> names() {
        return tools.keySet().stream().sorted().collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public List<ToolResult> invoke(List<String> toolNames, ToolContext context) {
        List<ToolResult> results = new ArrayList<>(toolNames.size());
        for (String name : toolNames) {
            results.add(invokeOne(name, context));
        }
        return results;
    }

    private ToolResult invokeOne(String name, ToolContext context) {
        Tool tool = tools.get(name);
        if (tool == null) {
            logger.warn("Tool '{}' is not registered (available: {})", name, names());
            return new ToolResult(name, false, 0, "Tool '" + name + "' is not registered");
        }
        Instant start = clock.instant();
        try {
            String payload = tool.execute(context);
            return new ToolResult(name, true, elapsed(start), payload);
        } catch (RuntimeException e) {
            logger.warn("Tool '{}' failed: {}", name, e.getMessage());
            return new ToolResult(name, false, elapsed(start), "Error: " + e.getMessage());
        }
    }

    private long elapsed(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    static final class EchoInputTool implements Tool {
        @Override
        public String name() {
            return "echo_input";
        }

        @Override
        public String execute(ToolContext context) {
            return context.userInput();
        }
    }

    static final class PreviousOutputsTool implements Tool {
        @Override
        public String name() {
            return "previous_outputs";
        }

        @Override
        public String execute(ToolContext context) {
            if (context.previousOutputs().isEmpty()) {
                return "(no previous outputs)";
            }
            return context.previousOutputs().entrySet().stream()
                    .map(entry -> entry.getKey() + ":\n" + entry.getValue())
                    .collect(Collectors.joining("\n\n"));
        }
    }
}
