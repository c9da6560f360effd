package com.rpaflow.core.model;

import com.rpaflow.core.log.LogLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The typed operation a graph node performs. A closed set of variants; callers switch on
 * {@link #getType()} and cast to the matching nested class.
 */
public abstract class Activity {

    private final ActivityType type;

    protected Activity(ActivityType type) {
        this.type = type;
    }

    public ActivityType getType() { return type; }

    @Override
    public String toString() {
        return type.name();
    }

    // -------------------------
    // Variants
    // -------------------------

    public static final class Start extends Activity {
        public final String scenarioId;

        public Start(String scenarioId) {
            super(ActivityType.START);
            this.scenarioId = Objects.requireNonNull(scenarioId, "scenarioId");
        }

        @Override
        public String toString() { return "Start(" + scenarioId + ")"; }
    }

    public static final class End extends Activity {
        public final String scenarioId;

        public End(String scenarioId) {
            super(ActivityType.END);
            this.scenarioId = Objects.requireNonNull(scenarioId, "scenarioId");
        }

        @Override
        public String toString() { return "End(" + scenarioId + ")"; }
    }

    public static final class Log extends Activity {
        public final LogLevel level;
        public final String message;

        public Log(LogLevel level, String message) {
            super(ActivityType.LOG);
            this.level = level == null ? LogLevel.INFO : level;
            this.message = message == null ? "" : message;
        }

        @Override
        public String toString() { return "Log(" + level + ", " + message + ")"; }
    }

    public static final class Delay extends Activity {
        public final long milliseconds;

        public Delay(long milliseconds) {
            super(ActivityType.DELAY);
            this.milliseconds = Math.max(0, milliseconds);
        }

        @Override
        public String toString() { return "Delay(" + milliseconds + ")"; }
    }

    /** Assigns an expression result; {@code global} selects the project store over the scenario one. */
    public static final class SetVariable extends Activity {
        public final String name;
        public final String value;
        public final boolean global;

        public SetVariable(String name, String value, boolean global) {
            super(ActivityType.SET_VARIABLE);
            this.name = name == null ? "" : name;
            this.value = value == null ? "" : value;
            this.global = global;
        }

        @Override
        public String toString() { return "SetVariable(" + name + " = " + value + (global ? ", global" : "") + ")"; }
    }

    public static final class Evaluate extends Activity {
        public final String expression;

        public Evaluate(String expression) {
            super(ActivityType.EVALUATE);
            this.expression = expression == null ? "" : expression;
        }

        @Override
        public String toString() { return "Evaluate(" + expression + ")"; }
    }

    public static final class IfCondition extends Activity {
        public final String condition;

        public IfCondition(String condition) {
            super(ActivityType.IF_CONDITION);
            this.condition = condition == null ? "" : condition;
        }

        @Override
        public String toString() { return "IfCondition(" + condition + ")"; }
    }

    /** Counting loop over {@code start..end} inclusive, moving by {@code step}. */
    public static final class Loop extends Activity {
        public final long start;
        public final long end;
        public final long step;
        public final String index;

        public Loop(long start, long end, long step, String index) {
            super(ActivityType.LOOP);
            this.start = start;
            this.end = end;
            this.step = step;
            this.index = index == null ? "" : index;
        }

        @Override
        public String toString() { return "Loop(" + index + ": " + start + ".." + end + " step " + step + ")"; }
    }

    public static final class While extends Activity {
        public final String condition;

        public While(String condition) {
            super(ActivityType.WHILE);
            this.condition = condition == null ? "" : condition;
        }

        @Override
        public String toString() { return "While(" + condition + ")"; }
    }

    public static final class Continue extends Activity {
        public Continue() { super(ActivityType.CONTINUE); }

        @Override
        public String toString() { return "Continue"; }
    }

    public static final class Break extends Activity {
        public Break() { super(ActivityType.BREAK); }

        @Override
        public String toString() { return "Break"; }
    }

    public static final class CallScenario extends Activity {
        public final String scenarioId;
        public final List<VariablesBinding> parameters;

        public CallScenario(String scenarioId, List<VariablesBinding> parameters) {
            super(ActivityType.CALL_SCENARIO);
            this.scenarioId = scenarioId == null ? "" : scenarioId;
            this.parameters = parameters == null
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(parameters));
        }

        @Override
        public String toString() { return "CallScenario(" + scenarioId + ", " + parameters + ")"; }
    }

    public static final class RunPowershell extends Activity {
        public final String code;

        public RunPowershell(String code) {
            super(ActivityType.RUN_POWERSHELL);
            this.code = code == null ? "" : code;
        }

        @Override
        public String toString() { return "RunPowershell"; }
    }

    public static final class Note extends Activity {
        public final String text;

        public Note(String text) {
            super(ActivityType.NOTE);
            this.text = text == null ? "" : text;
        }

        @Override
        public String toString() { return "Note"; }
    }

    public static final class TryCatch extends Activity {
        public TryCatch() { super(ActivityType.TRY_CATCH); }

        @Override
        public String toString() { return "TryCatch"; }
    }
}
