package com.rpaflow.core.validation;

import com.rpaflow.core.model.Activity;
import com.rpaflow.core.model.ActivityType;
import com.rpaflow.core.model.Node;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.Scenario;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Which scenario calls which, and which scenarios can re-enter themselves. */
public final class CallGraph {

    private final Map<String, Set<String>> calls;
    private final Set<String> recursive;

    private CallGraph(Map<String, Set<String>> calls, Set<String> recursive) {
        this.calls = calls;
        this.recursive = recursive;
    }

    public static CallGraph of(Project project) {
        Map<String, Set<String>> calls = new LinkedHashMap<>();
        for (Scenario s : project.allScenarios()) {
            Set<String> callees = new LinkedHashSet<>();
            for (Node n : s.getNodes()) {
                if (n.getType() == ActivityType.CALL_SCENARIO) {
                    String target = ((Activity.CallScenario) n.getActivity()).scenarioId;
                    if (!target.isEmpty()) callees.add(target);
                }
            }
            calls.put(s.getId(), Collections.unmodifiableSet(callees));
        }

        Set<String> recursive = new LinkedHashSet<>();
        for (String id : calls.keySet()) {
            if (reaches(calls, calls.get(id), id)) recursive.add(id);
        }
        return new CallGraph(Collections.unmodifiableMap(calls), Collections.unmodifiableSet(recursive));
    }

    private static boolean reaches(Map<String, Set<String>> calls, Set<String> from, String target) {
        Deque<String> work = new ArrayDeque<>(from);
        Set<String> seen = new HashSet<>();
        while (!work.isEmpty()) {
            String cur = work.pop();
            if (cur.equals(target)) return true;
            if (!seen.add(cur)) continue;
            work.addAll(calls.getOrDefault(cur, Collections.emptySet()));
        }
        return false;
    }

    public Map<String, Set<String>> getCalls() { return calls; }

    public Set<String> getRecursiveScenarios() { return recursive; }

    public boolean isRecursive(String scenarioId) { return recursive.contains(scenarioId); }

    /**
     * First call cycle found from {@code startId} by depth-first search, as the scenario ids
     * along the cycle; empty when none.
     */
    public List<String> findCycle(String startId) {
        List<String> path = new ArrayList<>();
        List<String> cycle = dfs(startId, path, new HashSet<>());
        return cycle == null ? Collections.emptyList() : cycle;
    }

    private List<String> dfs(String id, List<String> path, Set<String> done) {
        int at = path.indexOf(id);
        if (at >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(at, path.size()));
            cycle.add(id);
            return cycle;
        }
        if (done.contains(id)) return null;
        path.add(id);
        for (String callee : calls.getOrDefault(id, Collections.emptySet())) {
            List<String> found = dfs(callee, path, done);
            if (found != null) return found;
        }
        path.remove(path.size() - 1);
        done.add(id);
        return null;
    }
}
