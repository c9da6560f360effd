package com.rpaflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rpaflow.core.log.LogLevel;
import com.rpaflow.core.variables.VariableScope;
import com.rpaflow.core.variables.Variables;
import com.rpaflow.debug.Debug;
import com.rpaflow.script.parser.Value;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads project files produced by the editor.
 *
 * Accepted shape (a {"project": {...}} wrapper is optional):
 * <pre>
 * { "name": "...",
 *   "main_scenario": { "id", "name", "nodes": [ { "id", "activity": {"Log": {"level": "Info", "message": "..."}} } ],
 *                      "connections": [ { "id", "from_node", "to_node", "branch_type": "TrueBranch" } ],
 *                      "parameters": [ { "var_name", "direction": "In" } ],
 *                      "variables": { "x": 5, "y": { "value": "a", "scope": "Scenario" } } },
 *   "scenarios": [ ... ],
 *   "variables": { ... } }
 * </pre>
 * Activities use the tagged form {"Variant": {fields}}; field-less variants may be a bare string.
 * Layout fields (position, width, height) are ignored.
 */
public final class ProjectLoader {

    private static final String TAG = "rpa.loader";

    private final ObjectMapper om;

    public ProjectLoader() {
        this(new ObjectMapper());
    }

    public ProjectLoader(ObjectMapper om) {
        this.om = om;
    }

    public Project load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public Project load(InputStream in) throws IOException {
        return fromJson(om.readTree(in));
    }

    public Project parse(String json) throws IOException {
        return fromJson(om.readTree(json));
    }

    public Project fromJson(JsonNode root) {
        if (root == null || !root.isObject()) throw new IllegalArgumentException("Project JSON must be an object");
        JsonNode p = root.has("project") ? root.get("project") : root;

        JsonNode main = field(p, "main_scenario", "mainScenario");
        if (main == null || !main.isObject()) throw new IllegalArgumentException("Project has no main_scenario");

        Scenario mainScenario = scenario(main);
        List<Scenario> scenarios = new ArrayList<>();
        JsonNode list = p.get("scenarios");
        if (list != null && list.isArray()) {
            for (JsonNode s : list) scenarios.add(scenario(s));
        }

        Variables globals = variables(p.get("variables"), VariableScope.GLOBAL);
        Project project = new Project(p.path("name").asText(""), mainScenario, scenarios, globals);
        Debug.get().d(TAG, "loaded project '" + project.getName() + "' with " + (scenarios.size() + 1) + " scenarios");
        return project;
    }

    private Scenario scenario(JsonNode s) {
        String id = requireText(s, "id");
        List<Node> nodes = new ArrayList<>();
        for (JsonNode n : s.path("nodes")) {
            nodes.add(new Node(requireText(n, "id"), activity(n.get("activity"))));
        }
        List<Connection> connections = new ArrayList<>();
        for (JsonNode c : s.path("connections")) {
            String from = text(field(c, "from_node", "fromNode"));
            String to = text(field(c, "to_node", "toNode"));
            if (from == null || to == null) throw new IllegalArgumentException("Connection needs from_node and to_node in scenario " + id);
            String cid = c.hasNonNull("id") ? c.get("id").asText() : from + "->" + to;
            JsonNode bt = field(c, "branch_type", "branchType");
            connections.add(new Connection(cid, from, to,
                    bt == null ? BranchType.DEFAULT : enumValue(BranchType.class, bt.asText())));
        }
        List<ScenarioParameter> parameters = new ArrayList<>();
        for (JsonNode prm : s.path("parameters")) {
            parameters.add(new ScenarioParameter(
                    text(field(prm, "var_name", "varName")),
                    enumValue(VariableDirection.class, prm.path("direction").asText("In"))));
        }
        return new Scenario(id, s.path("name").asText(id), nodes, connections, parameters,
                variables(s.get("variables"), VariableScope.SCENARIO));
    }

    Activity activity(JsonNode a) {
        if (a == null || a.isNull()) throw new IllegalArgumentException("Node has no activity");

        String variant;
        JsonNode f;
        if (a.isTextual()) {
            variant = a.asText();
            f = om.createObjectNode();
        } else if (a.isObject() && a.has("type")) {
            variant = a.get("type").asText();
            f = a;
        } else if (a.isObject() && a.size() == 1) {
            Map.Entry<String, JsonNode> only = a.fields().next();
            variant = only.getKey();
            f = only.getValue() == null || only.getValue().isNull() ? om.createObjectNode() : only.getValue();
        } else {
            throw new IllegalArgumentException("Unrecognised activity: " + a);
        }

        switch (enumValue(ActivityType.class, variant)) {
            case START: return new Activity.Start(text(field(f, "scenario_id", "scenarioId"), ""));
            case END: return new Activity.End(text(field(f, "scenario_id", "scenarioId"), ""));
            case LOG: return new Activity.Log(enumValue(LogLevel.class, f.path("level").asText("Info")), f.path("message").asText(""));
            case DELAY: return new Activity.Delay(f.path("milliseconds").asLong(0));
            case SET_VARIABLE:
                return new Activity.SetVariable(f.path("name").asText(""), scalarText(f.get("value")),
                        field(f, "is_global", "global") != null && field(f, "is_global", "global").asBoolean(false));
            case EVALUATE: return new Activity.Evaluate(f.path("expression").asText(""));
            case IF_CONDITION: return new Activity.IfCondition(f.path("condition").asText(""));
            case LOOP:
                return new Activity.Loop(f.path("start").asLong(0), f.path("end").asLong(0),
                        f.path("step").asLong(1), f.path("index").asText(""));
            case WHILE: return new Activity.While(f.path("condition").asText(""));
            case CONTINUE: return new Activity.Continue();
            case BREAK: return new Activity.Break();
            case CALL_SCENARIO: {
                List<VariablesBinding> bindings = new ArrayList<>();
                for (JsonNode b : f.path("parameters")) {
                    JsonNode scope = field(b, "source_scope", "sourceScope");
                    bindings.add(new VariablesBinding(
                            text(field(b, "target_var_name", "targetVarName"), ""),
                            text(field(b, "source_var_name", "sourceVarName"), ""),
                            enumValue(VariableDirection.class, b.path("direction").asText("In")),
                            scope == null || scope.isNull() ? null : enumValue(VariableScope.class, scope.asText())));
                }
                return new Activity.CallScenario(text(field(f, "scenario_id", "scenarioId"), ""), bindings);
            }
            case RUN_POWERSHELL: return new Activity.RunPowershell(f.path("code").asText(""));
            case NOTE: return new Activity.Note(f.path("text").asText(""));
            case TRY_CATCH: return new Activity.TryCatch();
            default: throw new IllegalArgumentException("Unsupported activity: " + variant);
        }
    }

    Variables variables(JsonNode node, VariableScope defaultScope) {
        Variables vars = new Variables();
        if (node == null || node.isNull()) return vars;
        // serde form wraps the map in {"values": {...}}
        if (node.isObject() && node.size() == 1 && node.has("values") && node.get("values").isObject()) {
            node = node.get("values");
        }
        if (node.isArray()) {
            for (JsonNode v : node) {
                String name = requireText(v, "name");
                vars.define(name, value(v.get("value")), scopeOf(v, defaultScope));
            }
            return vars;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (v.isObject() && v.has("value")) {
                vars.define(e.getKey(), value(v.get("value")), scopeOf(v, defaultScope));
            } else {
                vars.define(e.getKey(), value(v), defaultScope);
            }
        }
        return vars;
    }

    /** JSON scalar to Value; also accepts the tagged form {"Number": 5}. */
    static Value value(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return Value.undefined();
        if (v.isNumber()) return Value.number(v.asDouble());
        if (v.isBoolean()) return Value.bool(v.asBoolean());
        if (v.isTextual()) {
            return "Undefined".equals(v.asText()) ? Value.undefined() : Value.string(v.asText());
        }
        if (v.isObject() && v.size() == 1) {
            Map.Entry<String, JsonNode> only = v.fields().next();
            switch (only.getKey()) {
                case "Number": return Value.number(only.getValue().asDouble());
                case "Boolean": return Value.bool(only.getValue().asBoolean());
                case "String": return Value.string(only.getValue().asText());
                default: break;
            }
        }
        throw new IllegalArgumentException("Unsupported variable value: " + v);
    }

    private static VariableScope scopeOf(JsonNode v, VariableScope fallback) {
        JsonNode s = v.get("scope");
        return s == null || s.isNull() ? fallback : enumValue(VariableScope.class, s.asText());
    }

    private static String scalarText(JsonNode v) {
        if (v == null || v.isNull()) return "";
        return v.isValueNode() ? v.asText() : v.toString();
    }

    private static JsonNode field(JsonNode n, String snake, String camel) {
        JsonNode v = n.get(snake);
        return v != null ? v : n.get(camel);
    }

    private static String text(JsonNode n) {
        return n == null || n.isNull() ? null : n.asText();
    }

    private static String text(JsonNode n, String fallback) {
        String t = text(n);
        return t == null ? fallback : t;
    }

    private static String requireText(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("Missing '" + field + "' in " + n);
        return v.asText();
    }

    /** Matches "TrueBranch", "TRUE_BRANCH", "true_branch" and "Info" (for INFO) alike. */
    static <E extends Enum<E>> E enumValue(Class<E> type, String raw) {
        String wanted = normalize(raw);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted)) return constant;
        }
        // LogLevel labels such as "WARN"
        if (type == LogLevel.class) {
            for (E constant : type.getEnumConstants()) {
                if (normalize(((LogLevel) constant).label()).equals(wanted)) return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + raw);
    }

    private static String normalize(String s) {
        return s == null ? "" : s.replace("_", "").replace(" ", "").toLowerCase(Locale.ROOT);
    }
}
