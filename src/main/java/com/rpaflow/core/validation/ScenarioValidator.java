package com.rpaflow.core.validation;

import com.rpaflow.core.CoreConstants;
import com.rpaflow.core.model.Activity;
import com.rpaflow.core.model.ActivityType;
import com.rpaflow.core.model.BranchType;
import com.rpaflow.core.model.Connection;
import com.rpaflow.core.model.Node;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.Scenario;
import com.rpaflow.core.model.ScenarioParameter;
import com.rpaflow.core.model.VariablesBinding;
import com.rpaflow.script.ExpressionEngine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static checks run on every scenario before compilation. Structural problems (no Start, no End,
 * dangling connections) stop the remaining checks for that scenario.
 */
public final class ScenarioValidator {

    private static final Pattern VARIABLE_REF = Pattern.compile("[$@]([A-Za-z_][A-Za-z0-9_]*)");

    private final Project project;
    private final CallGraph callGraph;

    public ScenarioValidator(Project project) {
        this.project = project;
        this.callGraph = CallGraph.of(project);
    }

    public CallGraph getCallGraph() { return callGraph; }

    /** Validates every scenario, main first. Reachable nodes are not recorded on the merged result. */
    public ValidationResult validateAll() {
        ValidationResult all = new ValidationResult();
        for (Scenario s : project.allScenarios()) {
            ValidationResult r = validate(s);
            all.addAll(r.getErrors());
            all.addAll(r.getWarnings());
        }
        return all;
    }

    public ValidationResult validate(Scenario scenario) {
        ValidationResult result = new ValidationResult();
        String sid = scenario.getId();

        Node start = scenario.findFirst(ActivityType.START);
        if (start == null) result.add(new ValidationIssue(ErrorCode.E001, sid, null, "Scenario has no Start node"));
        if (scenario.findFirst(ActivityType.END) == null) {
            result.add(new ValidationIssue(ErrorCode.E002, sid, null, "Scenario has no End node"));
        }
        for (Connection c : scenario.getConnections()) {
            if (scenario.getNode(c.getFromNode()) == null) {
                result.add(new ValidationIssue(ErrorCode.E004, sid, null,
                        "Connection " + c.getId() + " starts at unknown node '" + c.getFromNode() + "'"));
            }
            if (scenario.getNode(c.getToNode()) == null) {
                result.add(new ValidationIssue(ErrorCode.E004, sid, null,
                        "Connection " + c.getId() + " points to unknown node '" + c.getToNode() + "'"));
            }
        }
        if (!result.isValid()) return result;

        Set<String> reachable = forwardReachable(scenario, start.getId());
        result.setReachableNodes(reachable);

        Set<String> reachesEnd = reachesEnd(scenario);
        Set<String> regionNodes = regionNodes(scenario);
        for (String id : reachable) {
            if (!reachesEnd.contains(id) && !regionNodes.contains(id)) {
                result.add(new ValidationIssue(ErrorCode.E003, sid, id, "Node '" + id + "' never reaches an End node"));
            }
        }

        for (String id : reachable) {
            checkNode(scenario, scenario.getNode(id), result);
        }

        List<String> cycle = callGraph.findCycle(sid);
        if (!cycle.isEmpty() && cycle.get(0).equals(sid)) {
            result.add(new ValidationIssue(ErrorCode.W006, sid, null,
                    "Recursive scenario call chain: " + String.join(" -> ", cycle)));
        }

        checkVariableUse(scenario, reachable, result);
        return result;
    }

    private void checkNode(Scenario scenario, Node node, ValidationResult result) {
        String sid = scenario.getId();
        String id = node.getId();
        switch (node.getType()) {
            case IF_CONDITION: {
                Activity.IfCondition a = (Activity.IfCondition) node.getActivity();
                checkCondition(sid, id, a.condition, result);
                if (!scenario.hasConnection(id, BranchType.TRUE_BRANCH)) {
                    result.add(new ValidationIssue(ErrorCode.W001, sid, id, "If has no True branch"));
                }
                if (!scenario.hasConnection(id, BranchType.FALSE_BRANCH)) {
                    result.add(new ValidationIssue(ErrorCode.W002, sid, id, "If has no False branch"));
                }
                break;
            }
            case LOOP: {
                Activity.Loop a = (Activity.Loop) node.getActivity();
                if (a.step == 0) result.add(new ValidationIssue(ErrorCode.E101, sid, id, "Loop step cannot be 0"));
                if (a.index.trim().isEmpty()) {
                    result.add(new ValidationIssue(ErrorCode.E201, sid, id, "Loop index name is empty"));
                }
                if (!scenario.hasConnection(id, BranchType.LOOP_BODY)) {
                    result.add(new ValidationIssue(ErrorCode.W007, sid, id, "Loop has no body"));
                }
                break;
            }
            case WHILE: {
                Activity.While a = (Activity.While) node.getActivity();
                checkCondition(sid, id, a.condition, result);
                if (!scenario.hasConnection(id, BranchType.LOOP_BODY)) {
                    result.add(new ValidationIssue(ErrorCode.W007, sid, id, "While has no body"));
                }
                break;
            }
            case TRY_CATCH:
                if (!scenario.hasConnection(id, BranchType.TRY_BRANCH)) {
                    result.add(new ValidationIssue(ErrorCode.W003, sid, id, "TryCatch has no Try branch"));
                }
                if (!scenario.hasConnection(id, BranchType.CATCH_BRANCH)) {
                    result.add(new ValidationIssue(ErrorCode.W004, sid, id, "TryCatch has no Catch branch"));
                }
                break;
            case SET_VARIABLE: {
                Activity.SetVariable a = (Activity.SetVariable) node.getActivity();
                if (a.name.trim().isEmpty()) {
                    result.add(new ValidationIssue(ErrorCode.E201, sid, id, "Variable name is empty"));
                }
                break;
            }
            case CALL_SCENARIO: {
                Activity.CallScenario a = (Activity.CallScenario) node.getActivity();
                if (project.findScenario(a.scenarioId) == null) {
                    result.add(new ValidationIssue(ErrorCode.E103, sid, id,
                            "Called scenario '" + a.scenarioId + "' does not exist"));
                }
                break;
            }
            default:
                break;
        }
    }

    private static void checkCondition(String sid, String nodeId, String condition, ValidationResult result) {
        String err = ExpressionEngine.syntaxError(condition);
        if (err != null) {
            result.add(new ValidationIssue(ErrorCode.E104, sid, nodeId, "Invalid condition '" + condition + "': " + err));
        }
    }

    private void checkVariableUse(Scenario scenario, Set<String> reachable, ValidationResult result) {
        Set<String> defined = new HashSet<>(project.getVariables().names());
        defined.addAll(scenario.getVariables().names());
        defined.add(CoreConstants.ERROR_VARIABLE_NAME);
        for (ScenarioParameter p : scenario.getParameters()) defined.add(p.getVarName());
        for (String id : reachable) {
            Activity a = scenario.getNode(id).getActivity();
            if (a instanceof Activity.SetVariable) defined.add(((Activity.SetVariable) a).name);
            else if (a instanceof Activity.Loop) defined.add(((Activity.Loop) a).index);
            else if (a instanceof Activity.CallScenario) {
                for (VariablesBinding b : ((Activity.CallScenario) a).parameters) {
                    if (b.getDirection().copiesOut()) defined.add(b.getSourceVarName());
                }
            }
        }
        // globals set by any scenario count as defined
        for (Scenario other : project.allScenarios()) {
            for (Node n : other.getNodes()) {
                if (n.getActivity() instanceof Activity.SetVariable && ((Activity.SetVariable) n.getActivity()).global) {
                    defined.add(((Activity.SetVariable) n.getActivity()).name);
                }
            }
        }

        for (String id : reachable) {
            Set<String> reported = new LinkedHashSet<>();
            for (String used : referencedVariables(scenario.getNode(id).getActivity())) {
                if (!defined.contains(used) && reported.add(used)) {
                    result.add(new ValidationIssue(ErrorCode.W005, scenario.getId(), id,
                            "Variable '" + used + "' may be used before it is defined"));
                }
            }
        }
    }

    static Set<String> referencedVariables(Activity a) {
        String text;
        switch (a.getType()) {
            case LOG: text = ((Activity.Log) a).message; break;
            case SET_VARIABLE: text = ((Activity.SetVariable) a).value; break;
            case EVALUATE: text = ((Activity.Evaluate) a).expression; break;
            case IF_CONDITION: text = ((Activity.IfCondition) a).condition; break;
            case WHILE: text = ((Activity.While) a).condition; break;
            default: text = "";
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher m = VARIABLE_REF.matcher(text);
        while (m.find()) names.add(m.group(1));
        return names;
    }

    private static Set<String> forwardReachable(Scenario scenario, String startId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.push(startId);
        while (!work.isEmpty()) {
            String cur = work.pop();
            if (!seen.add(cur)) continue;
            List<Connection> out = scenario.outgoing(cur);
            for (int i = out.size() - 1; i >= 0; i--) work.push(out.get(i).getToNode());
        }
        return seen;
    }

    private static Set<String> reachesEnd(Scenario scenario) {
        Map<String, Set<String>> incoming = new HashMap<>();
        for (Connection c : scenario.getConnections()) {
            incoming.computeIfAbsent(c.getToNode(), k -> new HashSet<>()).add(c.getFromNode());
        }
        Set<String> seen = new HashSet<>();
        Deque<String> work = new ArrayDeque<>();
        for (Node n : scenario.getNodes()) {
            if (n.getType() == ActivityType.END) work.push(n.getId());
        }
        while (!work.isEmpty()) {
            String cur = work.pop();
            if (!seen.add(cur)) continue;
            for (String from : incoming.getOrDefault(cur, new HashSet<>())) work.push(from);
        }
        return seen;
    }

    /**
     * Nodes inside a body with a defined fall-through: loop and while bodies, try, catch and error
     * branches, and the branches of an If that has a merge (Default) edge.
     */
    private static Set<String> regionNodes(Scenario scenario) {
        Set<String> region = new HashSet<>();
        Deque<String> work = new ArrayDeque<>();
        for (Connection c : scenario.getConnections()) {
            BranchType b = c.getBranchType();
            boolean entry = b == BranchType.LOOP_BODY || b == BranchType.TRY_BRANCH
                    || b == BranchType.CATCH_BRANCH || b == BranchType.ERROR_BRANCH;
            if ((b == BranchType.TRUE_BRANCH || b == BranchType.FALSE_BRANCH)
                    && scenario.hasConnection(c.getFromNode(), BranchType.DEFAULT)) {
                entry = true;
            }
            if (entry) work.push(c.getToNode());
        }
        while (!work.isEmpty()) {
            String cur = work.pop();
            if (!region.add(cur)) continue;
            for (Connection c : scenario.outgoing(cur)) work.push(c.getToNode());
        }
        return region;
    }
}
