package com.rpaflow.core.ir;

import com.rpaflow.core.model.Activity;
import com.rpaflow.core.model.ActivityType;
import com.rpaflow.core.model.BranchType;
import com.rpaflow.core.model.Node;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.Scenario;
import com.rpaflow.core.validation.CallGraph;
import com.rpaflow.core.validation.ScenarioValidator;
import com.rpaflow.core.validation.ValidationIssue;
import com.rpaflow.core.validation.ValidationResult;
import com.rpaflow.core.variables.VariableScope;
import com.rpaflow.debug.Debug;
import com.rpaflow.script.ExpressionEngine;
import com.rpaflow.script.parser.Expr;
import com.rpaflow.script.parser.ExpressionException;
import com.rpaflow.script.parser.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a project's scenario graphs into one flat {@link IrProgram}.
 *
 * Each scenario is walked depth-first from its Start node. A node is compiled once; reaching it
 * again emits a Jump to its first instruction. Structured activities (If, Loop, While, TryCatch,
 * error branches) open a region whose body falls through to a fixed exit when its path ends.
 * Forward references are recorded as fixups and patched once the label is bound.
 *
 * Compilation is all-or-nothing: every error is collected and reported in one
 * {@link CompileException}.
 */
public final class IrCompiler {

    private static final String TAG = "rpa.compiler";

    public IrProgram compile(Project project) throws CompileException {
        ScenarioValidator validator = new ScenarioValidator(project);
        List<CompileError> errors = new ArrayList<>();
        for (Scenario s : project.allScenarios()) {
            ValidationResult r = validator.validate(s);
            for (ValidationIssue i : r.getErrors()) {
                errors.add(new CompileError(s.getId(), i.getNodeId(), i.getCode().name(), i.getMessage()));
            }
            for (ValidationIssue i : r.getWarnings()) {
                Debug.get().w(TAG, s.getId() + ": " + i);
            }
        }
        if (!errors.isEmpty()) throw new CompileException(errors);

        List<Instruction> code = new ArrayList<>();
        Map<String, Integer> starts = new LinkedHashMap<>();
        for (Scenario s : project.allScenarios()) {
            starts.put(s.getId(), code.size());
            int before = code.size();
            new ScenarioCompiler(s, code, errors).compile();
            Debug.get().d(TAG, "scenario " + s.getId() + ": " + (code.size() - before) + " instructions at " + before);
        }
        if (!errors.isEmpty()) throw new CompileException(errors);

        for (int i = 0; i < code.size(); i++) {
            for (int target : code.get(i).targets()) {
                if (target < 0 || target >= code.size()) {
                    throw new IllegalStateException("Unresolved jump target " + target + " at instruction " + i);
                }
            }
        }

        CallGraph graph = validator.getCallGraph();
        IrProgram program = new IrProgram(code, starts.get(project.getMainScenario().getId()), starts,
                graph.getCalls(), graph.getRecursiveScenarios());
        Debug.get().i(TAG, "compiled '" + project.getName() + "': " + program.size() + " instructions, "
                + starts.size() + " scenarios");
        return program;
    }

    // -------------------------
    // Labels and regions
    // -------------------------

    private static final class Fixup {
        final int instruction;
        final Instruction.Slot slot;

        Fixup(int instruction, Instruction.Slot slot) {
            this.instruction = instruction;
            this.slot = slot;
        }
    }

    private static final class Label {
        int index = Instruction.UNRESOLVED;
        final List<Fixup> fixups = new ArrayList<>();

        boolean isBound() { return index != Instruction.UNRESOLVED; }
        boolean isReferenced() { return !fixups.isEmpty(); }
    }

    private enum RegionKind { LOOP, WHILE, TRY, CATCH, BRANCH }

    /** A structured body. {@code exit} is where a path that simply ends continues. */
    private static final class Region {
        final RegionKind kind;
        final String ownerId;
        final String afterId;
        final Label exit;
        final Label breakLabel;
        final Label continueLabel;

        Region(RegionKind kind, String ownerId, String afterId, Label exit, Label breakLabel, Label continueLabel) {
            this.kind = kind;
            this.ownerId = ownerId;
            this.afterId = afterId;
            this.exit = exit;
            this.breakLabel = breakLabel;
            this.continueLabel = continueLabel;
        }

        static Region body(RegionKind kind, String ownerId, String afterId, Label exit) {
            return new Region(kind, ownerId, afterId, exit, null, null);
        }

        boolean isLoop() { return kind == RegionKind.LOOP || kind == RegionKind.WHILE; }
        boolean isEnterable() { return kind == RegionKind.CATCH || kind == RegionKind.BRANCH; }
    }

    private static final class CompiledNode {
        final int index;
        final List<Region> regions;

        CompiledNode(int index, List<Region> regions) {
            this.index = index;
            this.regions = regions;
        }
    }

    // -------------------------
    // Per-scenario walk
    // -------------------------

    private static final class ScenarioCompiler {
        private final Scenario scenario;
        private final List<Instruction> code;
        private final List<CompileError> errors;
        private final Map<String, CompiledNode> compiled = new HashMap<>();
        private final List<Region> regions = new ArrayList<>();
        private final Label implicitEnd = new Label();

        ScenarioCompiler(Scenario scenario, List<Instruction> code, List<CompileError> errors) {
            this.scenario = scenario;
            this.code = code;
            this.errors = errors;
        }

        void compile() {
            Node start = scenario.findFirst(ActivityType.START);
            compileFrom(start.getId());
            // a top-level path that ends without an End node returns from the scenario
            if (implicitEnd.isReferenced()) {
                bind(implicitEnd);
                emit(new Instruction.End(scenario.getId()));
            }
        }

        private void compileFrom(String nodeId) {
            if (nodeId == null) {
                fallOff();
                return;
            }

            for (int i = regions.size() - 1; i >= 0; i--) {
                Region r = regions.get(i);
                if (r.isLoop() && nodeId.equals(r.ownerId)) {
                    popHandlers(i + 1);
                    jump(r.continueLabel);
                    return;
                }
                if (nodeId.equals(r.afterId)) {
                    popHandlers(i + 1);
                    jump(r.isLoop() ? r.breakLabel : r.exit);
                    return;
                }
            }

            CompiledNode prev = compiled.get(nodeId);
            if (prev != null) {
                jumpToCompiled(nodeId, prev);
                return;
            }

            Node node = scenario.getNode(nodeId);
            compiled.put(nodeId, new CompiledNode(code.size(), new ArrayList<>(regions)));
            if (node.getType() != ActivityType.NOTE) {
                emit(new Instruction.DebugMarker(nodeId, node.getActivity().toString()));
            }
            compileNode(node);
        }

        private void compileNode(Node node) {
            String id = node.getId();
            Activity a = node.getActivity();
            switch (node.getType()) {
                case START:
                    emit(new Instruction.Start(scenario.getId()));
                    compileFrom(next(id, BranchType.DEFAULT));
                    break;
                case END:
                    emit(new Instruction.End(scenario.getId()));
                    break;
                case LOG: {
                    Activity.Log log = (Activity.Log) a;
                    emit(new Instruction.Log(log.level, logMessage(id, log.message)));
                    compileFrom(next(id, BranchType.DEFAULT));
                    break;
                }
                case DELAY:
                    emit(new Instruction.Delay(((Activity.Delay) a).milliseconds));
                    compileFrom(next(id, BranchType.DEFAULT));
                    break;
                case SET_VARIABLE: {
                    Activity.SetVariable sv = (Activity.SetVariable) a;
                    emit(new Instruction.SetVar(sv.name, expression(id, sv.value, "value"),
                            sv.global ? VariableScope.GLOBAL : VariableScope.SCENARIO));
                    compileFrom(next(id, BranchType.DEFAULT));
                    break;
                }
                case EVALUATE:
                    emit(new Instruction.Evaluate(expression(id, ((Activity.Evaluate) a).expression, "expression")));
                    compileFrom(next(id, BranchType.DEFAULT));
                    break;
                case IF_CONDITION:
                    compileIf(id, (Activity.IfCondition) a);
                    break;
                case LOOP:
                    compileLoop(id, (Activity.Loop) a);
                    break;
                case WHILE:
                    compileWhile(id, (Activity.While) a);
                    break;
                case CONTINUE:
                case BREAK:
                    compileLoopExit(id, node.getType() == ActivityType.BREAK);
                    break;
                case TRY_CATCH:
                    compileTryCatch(id);
                    break;
                case CALL_SCENARIO: {
                    Activity.CallScenario call = (Activity.CallScenario) a;
                    compileGuarded(id, new Instruction.CallScenario(call.scenarioId, call.parameters));
                    break;
                }
                case RUN_POWERSHELL:
                    compileGuarded(id, new Instruction.RunPowershell(((Activity.RunPowershell) a).code));
                    break;
                case NOTE:
                    compileFrom(next(id, BranchType.DEFAULT));
                    break;
                default:
                    error(id, null, "Unsupported activity " + node.getType());
            }
        }

        private void compileIf(String id, Activity.IfCondition a) {
            String onTrue = next(id, BranchType.TRUE_BRANCH);
            String onFalse = next(id, BranchType.FALSE_BRANCH);
            String merge = next(id, BranchType.DEFAULT);

            Label falseLabel = new Label();
            Label mergeLabel = new Label();
            ref(falseLabel, emit(Instruction.CondJump.jumpIfNot(expression(id, a.condition, "condition"),
                    Instruction.UNRESOLVED)), Instruction.Slot.TARGET);

            Region branch = merge == null ? null : Region.body(RegionKind.BRANCH, id, merge, mergeLabel);
            if (branch != null) regions.add(branch);
            compileFrom(onTrue);
            bind(falseLabel);
            compileFrom(onFalse);
            if (branch != null) {
                popRegion();
                bind(mergeLabel);
                compileFrom(merge);
            }
        }

        private void compileLoop(String id, Activity.Loop a) {
            String body = next(id, BranchType.LOOP_BODY);
            String after = next(id, BranchType.DEFAULT);
            if (body == null) {
                compileFrom(after);
                return;
            }

            Label check = new Label();
            Label bodyLabel = new Label();
            Label nextLabel = new Label();
            Label endLabel = new Label();

            emit(new Instruction.LoopInit(a.index, a.start));
            emit(new Instruction.LoopLog(a.index, a.start, a.end, a.step));
            bind(check);
            int c = emit(new Instruction.LoopCheck(a.index, a.end, a.step, Instruction.UNRESOLVED, Instruction.UNRESOLVED));
            ref(bodyLabel, c, Instruction.Slot.BODY);
            ref(endLabel, c, Instruction.Slot.END);

            bind(bodyLabel);
            regions.add(new Region(RegionKind.LOOP, id, after, nextLabel, endLabel, nextLabel));
            compileFrom(body);
            popRegion();

            bind(nextLabel);
            ref(check, emit(new Instruction.LoopNext(a.index, a.step, Instruction.UNRESOLVED)), Instruction.Slot.CHECK);
            bind(endLabel);
            compileFrom(after);
        }

        private void compileWhile(String id, Activity.While a) {
            String body = next(id, BranchType.LOOP_BODY);
            String after = next(id, BranchType.DEFAULT);
            Expr.ExprInterface condition = expression(id, a.condition, "condition");
            if (body == null) {
                compileFrom(after);
                return;
            }

            Label check = new Label();
            Label bodyLabel = new Label();
            Label endLabel = new Label();

            bind(check);
            int w = emit(new Instruction.WhileCheck(condition, Instruction.UNRESOLVED, Instruction.UNRESOLVED));
            ref(bodyLabel, w, Instruction.Slot.BODY);
            ref(endLabel, w, Instruction.Slot.END);

            bind(bodyLabel);
            regions.add(new Region(RegionKind.WHILE, id, after, check, endLabel, check));
            compileFrom(body);
            popRegion();

            bind(endLabel);
            compileFrom(after);
        }

        private void compileLoopExit(String id, boolean isBreak) {
            int at = -1;
            for (int i = regions.size() - 1; i >= 0; i--) {
                if (regions.get(i).isLoop()) {
                    at = i;
                    break;
                }
            }
            if (at < 0) {
                error(id, null, (isBreak ? "Break" : "Continue") + " outside of a loop");
                return;
            }
            Region loop = regions.get(at);
            popHandlers(at + 1);
            if (isBreak) {
                ref(loop.breakLabel, emit(new Instruction.LoopBreak(Instruction.UNRESOLVED)), Instruction.Slot.END);
            } else {
                ref(loop.continueLabel, emit(new Instruction.LoopContinue(Instruction.UNRESOLVED)), Instruction.Slot.CHECK);
            }
        }

        private void compileTryCatch(String id) {
            String tryBody = next(id, BranchType.TRY_BRANCH);
            String catchBody = next(id, BranchType.CATCH_BRANCH);
            String after = next(id, BranchType.DEFAULT);

            Label catchLabel = new Label();
            Label popLabel = new Label();
            Label afterLabel = new Label();

            ref(catchLabel, emit(new Instruction.PushErrorHandler(Instruction.UNRESOLVED)), Instruction.Slot.CATCH);
            regions.add(Region.body(RegionKind.TRY, id, after, popLabel));
            compileFrom(tryBody);
            popRegion();

            bind(popLabel);
            emit(new Instruction.PopErrorHandler());
            ref(afterLabel, emit(new Instruction.Jump(Instruction.UNRESOLVED)), Instruction.Slot.TARGET);

            // without a catch body the error is swallowed and execution resumes after the block
            bind(catchLabel);
            regions.add(Region.body(RegionKind.CATCH, id, after, afterLabel));
            compileFrom(catchBody);
            popRegion();

            bind(afterLabel);
            compileFrom(after);
        }

        /** CallScenario and RunPowershell: an ErrorBranch edge wraps the single instruction in a handler. */
        private void compileGuarded(String id, Instruction instruction) {
            String onError = next(id, BranchType.ERROR_BRANCH);
            String after = next(id, BranchType.DEFAULT);
            if (onError == null) {
                emit(instruction);
                compileFrom(after);
                return;
            }

            Label errorLabel = new Label();
            Label afterLabel = new Label();
            ref(errorLabel, emit(new Instruction.PushErrorHandler(Instruction.UNRESOLVED)), Instruction.Slot.CATCH);
            emit(instruction);
            emit(new Instruction.PopErrorHandler());
            ref(afterLabel, emit(new Instruction.Jump(Instruction.UNRESOLVED)), Instruction.Slot.TARGET);

            bind(errorLabel);
            regions.add(Region.body(RegionKind.CATCH, id, after, afterLabel));
            compileFrom(onError);
            popRegion();

            bind(afterLabel);
            compileFrom(after);
        }

        private void jumpToCompiled(String nodeId, CompiledNode target) {
            int common = 0;
            while (common < target.regions.size() && common < regions.size()
                    && target.regions.get(common) == regions.get(common)) {
                common++;
            }
            for (int i = common; i < target.regions.size(); i++) {
                if (!target.regions.get(i).isEnterable()) {
                    error(nodeId, null, "Node '" + nodeId + "' is reached from outside the body it belongs to");
                    return;
                }
            }
            popHandlers(common);
            emit(new Instruction.Jump(target.index));
        }

        private void fallOff() {
            jump(regions.isEmpty() ? implicitEnd : regions.get(regions.size() - 1).exit);
        }

        /** Emits one PopErrorHandler for every open try body at depth {@code from} and deeper. */
        private void popHandlers(int from) {
            for (int i = regions.size() - 1; i >= from; i--) {
                if (regions.get(i).kind == RegionKind.TRY) emit(new Instruction.PopErrorHandler());
            }
        }

        private void popRegion() {
            regions.remove(regions.size() - 1);
        }

        // -------------------------
        // Emission
        // -------------------------

        private int emit(Instruction instruction) {
            code.add(instruction);
            return code.size() - 1;
        }

        private void jump(Label label) {
            ref(label, emit(new Instruction.Jump(Instruction.UNRESOLVED)), Instruction.Slot.TARGET);
        }

        private void ref(Label label, int instruction, Instruction.Slot slot) {
            if (label.isBound()) {
                code.get(instruction).setTarget(slot, label.index);
            } else {
                label.fixups.add(new Fixup(instruction, slot));
            }
        }

        private void bind(Label label) {
            label.index = code.size();
            for (Fixup f : label.fixups) code.get(f.instruction).setTarget(f.slot, label.index);
        }

        // -------------------------
        // Helpers
        // -------------------------

        private String next(String nodeId, BranchType branch) {
            return scenario.next(nodeId, branch);
        }

        private Expr.ExprInterface expression(String nodeId, String source, String what) {
            try {
                return ExpressionEngine.parse(source);
            } catch (ExpressionException e) {
                error(nodeId, "E104", "Invalid " + what + " '" + source + "': " + e.getMessage());
                return new Expr.Literal(Value.undefined());
            }
        }

        /** Log messages are expressions when they parse, otherwise text with {expr} holes. */
        private Expr.ExprInterface logMessage(String nodeId, String message) {
            try {
                return ExpressionEngine.parse(message);
            } catch (ExpressionException asExpression) {
                try {
                    return ExpressionEngine.parseTemplate(message);
                } catch (ExpressionException e) {
                    error(nodeId, "E104", "Invalid log message '" + message + "': " + e.getMessage());
                    return new Expr.Literal(Value.undefined());
                }
            }
        }

        private void error(String nodeId, String code, String message) {
            errors.add(new CompileError(scenario.getId(), nodeId, code, message));
        }
    }
}
