package com.rpaflow.core.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rpaflow.core.log.LogEntry;
import com.rpaflow.script.parser.Value;

import java.util.Map;

/**
 * JSON rendering of run events for hosts:
 * <pre>
 * {"type":"log","entry":{"timestamp":"[00:00.012]","node_id":"n1","level":"INFO","activity":"LOG","message":"5"}}
 * {"type":"state_snapshot","timestamp":"...","scenario_id":"main","global_vars":{...},"scenario_vars":{...}}
 * {"type":"completed","stopped":false}
 * {"type":"error","message":"Division by zero"}
 * </pre>
 * Undefined values render as null; integral numbers as JSON integers.
 */
public final class ExecutionEventJson {

    private final ObjectMapper om;

    public ExecutionEventJson() {
        this(new ObjectMapper());
    }

    public ExecutionEventJson(ObjectMapper om) {
        this.om = om;
    }

    public ObjectNode toJson(ExecutionEvent event) {
        ObjectNode n = om.createObjectNode();
        switch (event.getKind()) {
            case LOG:
                n.put("type", "log");
                n.set("entry", entry(((ExecutionEvent.Log) event).entry));
                break;
            case STATE_SNAPSHOT: {
                ExecutionEvent.StateSnapshot s = (ExecutionEvent.StateSnapshot) event;
                n.put("type", "state_snapshot");
                n.put("timestamp", s.timestamp);
                n.put("scenario_id", s.scenarioId);
                n.set("global_vars", values(s.globalVars));
                n.set("scenario_vars", values(s.scenarioVars));
                break;
            }
            case COMPLETED:
                n.put("type", "completed");
                n.put("stopped", ((ExecutionEvent.Completed) event).stopped);
                break;
            case ERROR:
                n.put("type", "error");
                n.put("message", ((ExecutionEvent.Error) event).message);
                break;
            default:
                throw new IllegalArgumentException("Unknown event " + event.getKind());
        }
        return n;
    }

    /** Single-line JSON text. */
    public String toJsonString(ExecutionEvent event) {
        try {
            return om.writeValueAsString(toJson(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.getKind(), e);
        }
    }

    public ObjectNode entry(LogEntry e) {
        ObjectNode n = om.createObjectNode();
        n.put("timestamp", e.getTimestamp());
        n.put("node_id", e.getNodeId());
        n.put("level", e.getLevel().label());
        n.put("activity", e.getActivity().label());
        n.put("message", e.getMessage());
        return n;
    }

    public ObjectNode values(Map<String, Value> vars) {
        ObjectNode n = om.createObjectNode();
        for (Map.Entry<String, Value> e : vars.entrySet()) {
            n.set(e.getKey(), value(e.getValue()));
        }
        return n;
    }

    public JsonNode value(Value v) {
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                if (d == Math.rint(d) && Math.abs(d) < 1e15) return om.getNodeFactory().numberNode((long) d);
                return om.getNodeFactory().numberNode(d);
            }
            case BOOL: return om.getNodeFactory().booleanNode(v.asBool());
            case STRING: return om.getNodeFactory().textNode(v.asString());
            default: return om.getNodeFactory().nullNode();
        }
    }
}
