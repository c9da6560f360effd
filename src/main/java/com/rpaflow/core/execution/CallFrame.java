package com.rpaflow.core.execution;

import com.rpaflow.core.model.VariablesBinding;
import com.rpaflow.core.variables.Variables;

import java.util.List;

/** One in-flight scenario invocation. The main scenario's frame has no return address. */
final class CallFrame {
    final int returnAddress;
    final Variables locals;
    final String scenarioId;
    final List<VariablesBinding> bindings;

    CallFrame(int returnAddress, Variables locals, String scenarioId, List<VariablesBinding> bindings) {
        this.returnAddress = returnAddress;
        this.locals = locals;
        this.scenarioId = scenarioId;
        this.bindings = bindings;
    }
}
