package com.rpaflow.core.ir;

import com.rpaflow.core.log.LogLevel;
import com.rpaflow.core.model.VariablesBinding;
import com.rpaflow.core.variables.VariableScope;
import com.rpaflow.script.parser.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One step of a compiled program. Jump-carrying instructions expose their targets through
 * {@link Slot}s so the compiler can patch forward and backward references once the
 * destination index is known.
 */
public abstract class Instruction {

    public enum Opcode {
        START, END, LOG, DELAY, SET_VAR, EVALUATE,
        JUMP, JUMP_IF, JUMP_IF_NOT,
        LOOP_INIT, LOOP_LOG, LOOP_CHECK, LOOP_NEXT, LOOP_BREAK, LOOP_CONTINUE,
        WHILE_CHECK,
        PUSH_ERROR_HANDLER, POP_ERROR_HANDLER,
        CALL_SCENARIO, RUN_POWERSHELL, DEBUG_MARKER
    }

    /** Patchable target fields. */
    public enum Slot { TARGET, BODY, END, CHECK, CATCH }

    static final int UNRESOLVED = -1;

    private final Opcode opcode;

    protected Instruction(Opcode opcode) {
        this.opcode = opcode;
    }

    public Opcode getOpcode() { return opcode; }

    /** Targets referenced by this instruction, for bounds checks. */
    public List<Integer> targets() { return Collections.emptyList(); }

    void setTarget(Slot slot, int index) {
        throw new IllegalStateException(opcode + " has no " + slot + " target");
    }

    // -------------------------
    // Scenario boundaries
    // -------------------------

    public static final class Start extends Instruction {
        public final String scenarioId;

        public Start(String scenarioId) {
            super(Opcode.START);
            this.scenarioId = scenarioId;
        }

        @Override public String toString() { return "Start " + scenarioId; }
    }

    public static final class End extends Instruction {
        public final String scenarioId;

        public End(String scenarioId) {
            super(Opcode.END);
            this.scenarioId = scenarioId;
        }

        @Override public String toString() { return "End " + scenarioId; }
    }

    // -------------------------
    // Straight-line activities
    // -------------------------

    public static final class Log extends Instruction {
        public final LogLevel level;
        public final Expr.ExprInterface message;

        public Log(LogLevel level, Expr.ExprInterface message) {
            super(Opcode.LOG);
            this.level = level;
            this.message = message;
        }

        @Override public String toString() { return "Log " + level + " " + message; }
    }

    public static final class Delay extends Instruction {
        public final long milliseconds;

        public Delay(long milliseconds) {
            super(Opcode.DELAY);
            this.milliseconds = milliseconds;
        }

        @Override public String toString() { return "Delay " + milliseconds; }
    }

    public static final class SetVar extends Instruction {
        public final String var;
        public final Expr.ExprInterface expr;
        public final VariableScope scope;

        public SetVar(String var, Expr.ExprInterface expr, VariableScope scope) {
            super(Opcode.SET_VAR);
            this.var = var;
            this.expr = expr;
            this.scope = scope;
        }

        @Override public String toString() { return "SetVar " + scope + " " + var + " = " + expr; }
    }

    public static final class Evaluate extends Instruction {
        public final Expr.ExprInterface expr;

        public Evaluate(Expr.ExprInterface expr) {
            super(Opcode.EVALUATE);
            this.expr = expr;
        }

        @Override public String toString() { return "Evaluate " + expr; }
    }

    public static final class RunPowershell extends Instruction {
        public final String code;

        public RunPowershell(String code) {
            super(Opcode.RUN_POWERSHELL);
            this.code = code;
        }

        @Override public String toString() { return "RunPowershell " + code.length() + " chars"; }
    }

    public static final class DebugMarker extends Instruction {
        public final String nodeId;
        public final String description;

        public DebugMarker(String nodeId, String description) {
            super(Opcode.DEBUG_MARKER);
            this.nodeId = nodeId;
            this.description = description;
        }

        @Override public String toString() { return "DebugMarker " + nodeId + " " + description; }
    }

    // -------------------------
    // Jumps
    // -------------------------

    public static final class Jump extends Instruction {
        private int target;

        public Jump(int target) {
            super(Opcode.JUMP);
            this.target = target;
        }

        public int getTarget() { return target; }

        @Override public List<Integer> targets() { return Collections.singletonList(target); }
        @Override void setTarget(Slot slot, int index) { require(slot, Slot.TARGET); target = index; }
        @Override public String toString() { return "Jump -> " + target; }
    }

    /** Conditional jump; {@code jumpWhen} selects JumpIf (true) or JumpIfNot (false). */
    public static final class CondJump extends Instruction {
        public final Expr.ExprInterface condition;
        public final boolean jumpWhen;
        private int target;

        private CondJump(Opcode opcode, Expr.ExprInterface condition, boolean jumpWhen, int target) {
            super(opcode);
            this.condition = condition;
            this.jumpWhen = jumpWhen;
            this.target = target;
        }

        public static CondJump jumpIf(Expr.ExprInterface condition, int target) {
            return new CondJump(Opcode.JUMP_IF, condition, true, target);
        }

        public static CondJump jumpIfNot(Expr.ExprInterface condition, int target) {
            return new CondJump(Opcode.JUMP_IF_NOT, condition, false, target);
        }

        public int getTarget() { return target; }

        @Override public List<Integer> targets() { return Collections.singletonList(target); }
        @Override void setTarget(Slot slot, int index) { require(slot, Slot.TARGET); target = index; }
        @Override public String toString() { return getOpcode() + " " + condition + " -> " + target; }
    }

    // -------------------------
    // Counting loops
    // -------------------------

    public static final class LoopInit extends Instruction {
        public final String index;
        public final long start;

        public LoopInit(String index, long start) {
            super(Opcode.LOOP_INIT);
            this.index = index;
            this.start = start;
        }

        @Override public String toString() { return "LoopInit " + index + " = " + start; }
    }

    public static final class LoopLog extends Instruction {
        public final String index;
        public final long start;
        public final long end;
        public final long step;

        public LoopLog(String index, long start, long end, long step) {
            super(Opcode.LOOP_LOG);
            this.index = index;
            this.start = start;
            this.end = end;
            this.step = step;
        }

        @Override public String toString() { return "LoopLog " + index + " " + start + ".." + end + " step " + step; }
    }

    /** Continues into the body while the index has not passed {@code end} (inclusive, in the step's direction). */
    public static final class LoopCheck extends Instruction {
        public final String index;
        public final long end;
        public final long step;
        private int bodyTarget;
        private int endTarget;

        public LoopCheck(String index, long end, long step, int bodyTarget, int endTarget) {
            super(Opcode.LOOP_CHECK);
            this.index = index;
            this.end = end;
            this.step = step;
            this.bodyTarget = bodyTarget;
            this.endTarget = endTarget;
        }

        public int getBodyTarget() { return bodyTarget; }
        public int getEndTarget() { return endTarget; }

        @Override public List<Integer> targets() { return List.of(bodyTarget, endTarget); }

        @Override
        void setTarget(Slot slot, int index) {
            if (slot == Slot.BODY) bodyTarget = index;
            else if (slot == Slot.END) endTarget = index;
            else super.setTarget(slot, index);
        }

        @Override
        public String toString() {
            return "LoopCheck " + index + " to " + end + " step " + step + " body " + bodyTarget + " end " + endTarget;
        }
    }

    public static final class LoopNext extends Instruction {
        public final String index;
        public final long step;
        private int checkTarget;

        public LoopNext(String index, long step, int checkTarget) {
            super(Opcode.LOOP_NEXT);
            this.index = index;
            this.step = step;
            this.checkTarget = checkTarget;
        }

        public int getCheckTarget() { return checkTarget; }

        @Override public List<Integer> targets() { return Collections.singletonList(checkTarget); }
        @Override void setTarget(Slot slot, int index) { require(slot, Slot.CHECK); checkTarget = index; }
        @Override public String toString() { return "LoopNext " + index + " += " + step + " -> " + checkTarget; }
    }

    public static final class LoopBreak extends Instruction {
        private int endTarget;

        public LoopBreak(int endTarget) {
            super(Opcode.LOOP_BREAK);
            this.endTarget = endTarget;
        }

        public int getEndTarget() { return endTarget; }

        @Override public List<Integer> targets() { return Collections.singletonList(endTarget); }
        @Override void setTarget(Slot slot, int index) { require(slot, Slot.END); endTarget = index; }
        @Override public String toString() { return "LoopBreak -> " + endTarget; }
    }

    /** Jumps to the loop's next-iteration point: LoopNext for counting loops, WhileCheck for while loops. */
    public static final class LoopContinue extends Instruction {
        private int checkTarget;

        public LoopContinue(int checkTarget) {
            super(Opcode.LOOP_CONTINUE);
            this.checkTarget = checkTarget;
        }

        public int getCheckTarget() { return checkTarget; }

        @Override public List<Integer> targets() { return Collections.singletonList(checkTarget); }
        @Override void setTarget(Slot slot, int index) { require(slot, Slot.CHECK); checkTarget = index; }
        @Override public String toString() { return "LoopContinue -> " + checkTarget; }
    }

    public static final class WhileCheck extends Instruction {
        public final Expr.ExprInterface condition;
        private int bodyTarget;
        private int endTarget;

        public WhileCheck(Expr.ExprInterface condition, int bodyTarget, int endTarget) {
            super(Opcode.WHILE_CHECK);
            this.condition = condition;
            this.bodyTarget = bodyTarget;
            this.endTarget = endTarget;
        }

        public int getBodyTarget() { return bodyTarget; }
        public int getEndTarget() { return endTarget; }

        @Override public List<Integer> targets() { return List.of(bodyTarget, endTarget); }

        @Override
        void setTarget(Slot slot, int index) {
            if (slot == Slot.BODY) bodyTarget = index;
            else if (slot == Slot.END) endTarget = index;
            else super.setTarget(slot, index);
        }

        @Override public String toString() { return "WhileCheck " + condition + " body " + bodyTarget + " end " + endTarget; }
    }

    // -------------------------
    // Error handling and calls
    // -------------------------

    public static final class PushErrorHandler extends Instruction {
        private int catchTarget;

        public PushErrorHandler(int catchTarget) {
            super(Opcode.PUSH_ERROR_HANDLER);
            this.catchTarget = catchTarget;
        }

        public int getCatchTarget() { return catchTarget; }

        @Override public List<Integer> targets() { return Collections.singletonList(catchTarget); }
        @Override void setTarget(Slot slot, int index) { require(slot, Slot.CATCH); catchTarget = index; }
        @Override public String toString() { return "PushErrorHandler catch " + catchTarget; }
    }

    public static final class PopErrorHandler extends Instruction {
        public PopErrorHandler() {
            super(Opcode.POP_ERROR_HANDLER);
        }

        @Override public String toString() { return "PopErrorHandler"; }
    }

    public static final class CallScenario extends Instruction {
        public final String scenarioId;
        public final List<VariablesBinding> parameters;

        public CallScenario(String scenarioId, List<VariablesBinding> parameters) {
            super(Opcode.CALL_SCENARIO);
            this.scenarioId = scenarioId;
            this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        }

        @Override public String toString() { return "CallScenario " + scenarioId + " " + parameters; }
    }

    private static void require(Slot actual, Slot expected) {
        if (actual != expected) throw new IllegalStateException("Expected slot " + expected + ", got " + actual);
    }
}
