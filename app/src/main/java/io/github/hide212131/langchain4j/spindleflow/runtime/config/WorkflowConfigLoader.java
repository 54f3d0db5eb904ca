package io.github.hide212131.langchain4j.spindleflow.runtime.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a workflow YAML file into a {@link WorkflowConfig} and validates it.
 */
public final class WorkflowConfigLoader {

    private static final Set<String> ALLOWED_ROOT_KEYS = Set.of(
            "agents", "workflow", "context", "memory", "models", "provider", "tool_config");
    private static final Set<String> IGNORED_ROOT_KEYS = Set.of("models", "provider", "tool_config");
    private static final Set<String> AGENT_KEYS = Set.of(
            "id", "role", "goal", "tools", "sub_agents", "delegation_strategy", "enable_persistent_memory");
    private static final Set<String> SUB_AGENT_KEYS = Set.of(
            "id", "role", "goal", "tools", "specialization", "trigger_conditions");

    private final WorkflowConfigValidator validator;

    public WorkflowConfigLoader() {
        this(new WorkflowConfigValidator());
    }

    WorkflowConfigLoader(WorkflowConfigValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public LoadResult load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new WorkflowConfigurationException(
                    "Configuration file not found: " + file,
                    List.of("Check the --config path", "Relative paths resolve against " + Path.of("").toAbsolutePath()));
        }
        if (!Files.isRegularFile(file)) {
            throw new WorkflowConfigurationException(
                    "Configuration path is not a file: " + file,
                    List.of("Point --config at a YAML file, not a directory"));
        }
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new WorkflowConfigurationException(
                    "Failed to read configuration file: " + file, List.of("Check file permissions"), e);
        }
        if (content.isBlank()) {
            throw new WorkflowConfigurationException(
                    "Configuration file is empty: " + file,
                    List.of("Declare at least 'agents' and 'workflow'"));
        }
        return parse(content, file.toString());
    }

    public LoadResult parse(String content, String sourceName) {
        Object root;
        try {
            root = new Yaml().load(content);
        } catch (YAMLException e) {
            throw new WorkflowConfigurationException(
                    "Invalid YAML in " + sourceName + ": " + e.getMessage(),
                    List.of("Check indentation and quoting", "Use spaces, not tabs"),
                    e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new WorkflowConfigurationException(
                    "Configuration root of " + sourceName + " must be a mapping",
                    List.of("Declare 'agents' and 'workflow' at the top level"));
        }
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Object key : map.keySet()) {
            String name = String.valueOf(key);
            if (!ALLOWED_ROOT_KEYS.contains(name)) {
                warnings.add("Unknown top-level key '" + name + "' ignored");
            } else if (IGNORED_ROOT_KEYS.contains(name)) {
                warnings.add("Top-level key '" + name + "' is not used by the workflow engine");
            }
        }

        List<AgentDefinition> agents = parseAgents(map.get("agents"), errors, warnings);
        WorkflowTopology topology = parseTopology(map.get("workflow"), errors);
        int maxContextItems = parseContext(map.get("context"), errors);
        MemorySettings memory = parseMemory(map.get("memory"), errors);

        if (!errors.isEmpty() || topology == null) {
            throw invalid(sourceName, errors);
        }
        WorkflowConfig config = new WorkflowConfig(agents, topology, maxContextItems, memory);
        List<String> semanticErrors = validator.validate(config);
        if (!semanticErrors.isEmpty()) {
            throw invalid(sourceName, semanticErrors);
        }
        return new LoadResult(config, List.copyOf(warnings));
    }

    private List<AgentDefinition> parseAgents(Object raw, List<String> errors, List<String> warnings) {
        List<AgentDefinition> agents = new ArrayList<>();
        if (raw == null) {
            errors.add("'agents' is required");
            return agents;
        }
        if (!(raw instanceof List<?> list)) {
            errors.add("'agents' must be a list");
            return agents;
        }
        for (int i = 0; i < list.size(); i++) {
            String path = "agents[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> entry)) {
                errors.add(path + " must be a mapping");
                continue;
            }
            warnUnknownKeys(entry, AGENT_KEYS, path, warnings);
            String id = requiredString(entry, "id", path, errors);
            String role = requiredString(entry, "role", path, errors);
            String goal = requiredString(entry, "goal", path, errors);
            List<String> tools = stringList(entry.get("tools"), path + ".tools", errors);
            List<SubAgentDefinition> subAgents = parseSubAgents(entry.get("sub_agents"), path, errors, warnings);
            DelegationStrategy strategy = DelegationStrategy.AUTO;
            try {
                strategy = DelegationStrategy.from(optionalString(entry.get("delegation_strategy")));
            } catch (IllegalArgumentException e) {
                errors.add(path + ".delegation_strategy: " + e.getMessage() + " (expected auto, sequential or parallel)");
            }
            boolean memory = Boolean.TRUE.equals(entry.get("enable_persistent_memory"));
            if (id != null && role != null && goal != null) {
                agents.add(new AgentDefinition(id, role, goal, tools, subAgents, strategy, memory));
            }
        }
        return agents;
    }

    private List<SubAgentDefinition> parseSubAgents(
            Object raw, String parentPath, List<String> errors, List<String> warnings) {
        List<SubAgentDefinition> subAgents = new ArrayList<>();
        if (raw == null) {
            return subAgents;
        }
        if (!(raw instanceof List<?> list)) {
            errors.add(parentPath + ".sub_agents must be a list");
            return subAgents;
        }
        for (int i = 0; i < list.size(); i++) {
            String path = parentPath + ".sub_agents[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> entry)) {
                errors.add(path + " must be a mapping");
                continue;
            }
            warnUnknownKeys(entry, SUB_AGENT_KEYS, path, warnings);
            String id = requiredString(entry, "id", path, errors);
            String role = requiredString(entry, "role", path, errors);
            String goal = requiredString(entry, "goal", path, errors);
            if (id != null && role != null && goal != null) {
                subAgents.add(new SubAgentDefinition(
                        id,
                        role,
                        goal,
                        stringList(entry.get("tools"), path + ".tools", errors),
                        optionalString(entry.get("specialization")),
                        stringList(entry.get("trigger_conditions"), path + ".trigger_conditions", errors)));
            }
        }
        return subAgents;
    }

    private WorkflowTopology parseTopology(Object raw, List<String> errors) {
        if (!(raw instanceof Map<?, ?> workflow)) {
            errors.add(raw == null ? "'workflow' is required" : "'workflow' must be a mapping");
            return null;
        }
        String type = optionalString(workflow.get("type"));
        if (type == null) {
            errors.add("workflow.type is required (sequential or parallel)");
            return null;
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "sequential" -> new WorkflowTopology.Sequential(parseSteps(workflow.get("steps"), errors));
            case "parallel" -> parseParallel(workflow, errors);
            default -> {
                errors.add("workflow.type '" + type + "' is not supported (expected sequential or parallel)");
                yield null;
            }
        };
    }

    private List<String> parseSteps(Object raw, List<String> errors) {
        List<String> steps = new ArrayList<>();
        if (!(raw instanceof List<?> list)) {
            errors.add("workflow.steps must be a list of {agent: <id>} entries");
            return steps;
        }
        for (int i = 0; i < list.size(); i++) {
            Object step = list.get(i);
            if (step instanceof Map<?, ?> map && optionalString(map.get("agent")) != null) {
                steps.add(optionalString(map.get("agent")));
            } else if (step instanceof String id && !id.isBlank()) {
                steps.add(id.trim());
            } else {
                errors.add("workflow.steps[" + i + "] must declare an 'agent'");
            }
        }
        return steps;
    }

    private WorkflowTopology parseParallel(Map<?, ?> workflow, List<String> errors) {
        List<String> branches = stringList(workflow.get("branches"), "workflow.branches", errors);
        if (workflow.get("branches") == null) {
            errors.add("workflow.branches is required for a parallel workflow");
        }
        if (!(workflow.get("then") instanceof Map<?, ?> then)) {
            errors.add("workflow.then is required for a parallel workflow");
            return null;
        }
        String aggregator = optionalString(then.get("agent"));
        if (aggregator == null) {
            errors.add("workflow.then.agent is required");
            return null;
        }
        return new WorkflowTopology.Parallel(branches, aggregator, parseFeedbackLoop(then.get("feedback_loop"), errors));
    }

    private FeedbackLoopSettings parseFeedbackLoop(Object raw, List<String> errors) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> loop)) {
            errors.add("workflow.then.feedback_loop must be a mapping");
            return null;
        }
        int maxIterations = FeedbackLoopSettings.DEFAULT_MAX_ITERATIONS;
        Object rawMax = loop.get("max_iterations");
        if (rawMax instanceof Number number) {
            maxIterations = number.intValue();
        } else if (rawMax != null) {
            errors.add("workflow.then.feedback_loop.max_iterations must be a number");
        }
        String keyword = optionalString(loop.get("approval_keyword"));
        return new FeedbackLoopSettings(
                !Boolean.FALSE.equals(loop.get("enabled")),
                maxIterations,
                keyword != null ? keyword : FeedbackLoopSettings.DEFAULT_APPROVAL_KEYWORD,
                stringList(loop.get("feedback_targets"), "workflow.then.feedback_loop.feedback_targets", errors));
    }

    private int parseContext(Object raw, List<String> errors) {
        if (raw == null) {
            return 0;
        }
        if (raw instanceof Map<?, ?> context && context.get("max_items") instanceof Number number) {
            if (number.intValue() < 1) {
                errors.add("context.max_items must be at least 1");
            }
            return number.intValue();
        }
        errors.add("context must be a mapping with a numeric 'max_items'");
        return 0;
    }

    private MemorySettings parseMemory(Object raw, List<String> errors) {
        if (raw == null) {
            return MemorySettings.disabled();
        }
        if (!(raw instanceof Map<?, ?> memory)) {
            errors.add("memory must be a mapping");
            return MemorySettings.disabled();
        }
        String storePath = optionalString(memory.get("store_path"));
        int topK = MemorySettings.DEFAULT_TOP_K;
        if (memory.get("top_k") instanceof Number number) {
            topK = number.intValue();
            if (topK < 1) {
                errors.add("memory.top_k must be at least 1");
            }
        }
        return new MemorySettings(
                Boolean.TRUE.equals(memory.get("enabled")),
                storePath != null ? Path.of(storePath) : MemorySettings.DEFAULT_STORE_PATH,
                topK);
    }

    private static void warnUnknownKeys(Map<?, ?> entry, Set<String> allowed, String path, List<String> warnings) {
        for (Object key : entry.keySet()) {
            if (!allowed.contains(String.valueOf(key))) {
                warnings.add("Unknown key '" + key + "' in " + path + " ignored");
            }
        }
    }

    private static String requiredString(Map<?, ?> entry, String key, String path, List<String> errors) {
        String value = optionalString(entry.get(key));
        if (value == null) {
            errors.add(path + "." + key + " is required");
        }
        return value;
    }

    private static String optionalString(Object value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static List<String> stringList(Object value, String path, List<String> errors) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            errors.add(path + " must be a list");
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (Object item : list) {
            String text = optionalString(item);
            if (text != null) {
                values.add(text);
            }
        }
        return values;
    }

    private static WorkflowConfigurationException invalid(String sourceName, List<String> errors) {
        return new WorkflowConfigurationException(
                "Invalid workflow configuration in " + sourceName + ":\n  - " + String.join("\n  - ", errors),
                List.of("Every referenced agent must be declared under 'agents'",
                        "Run 'spindleflow validate --config <file>' after editing"));
    }

    public record LoadResult(WorkflowConfig config, List<String> warnings) {
        public LoadResult {
            Objects.requireNonNull(config, "config");
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }
}
