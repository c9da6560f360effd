package com.rpaflow.core.log;

/** What produced a log entry; the label is what hosts print. */
public enum LogActivity {
    START("START"),
    END("END"),
    LOG("LOG"),
    DELAY("DELAY"),
    SET_VARIABLE("SET VARIABLE"),
    EVALUATE("EVALUATE"),
    IF_CONDITION("IF CONDITION"),
    LOOP("LOOP"),
    WHILE("WHILE"),
    CONTINUE("CONTINUE"),
    BREAK("BREAK"),
    CALL_SCENARIO("CALL SCENARIO"),
    RUN_POWERSHELL("RUN POWERSHELL"),
    NOTE("NOTE"),
    TRY_CATCH("TRY CATCH"),
    EXECUTION("EXECUTION"),
    SYSTEM("SYSTEM");

    private final String label;

    LogActivity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
