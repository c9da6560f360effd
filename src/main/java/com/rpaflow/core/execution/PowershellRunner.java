package com.rpaflow.core.execution;

/** Runs a PowerShell script for the RunPowershell activity. */
@FunctionalInterface
public interface PowershellRunner {

    /**
     * @return captured output, possibly empty
     * @throws ActivityException when the script cannot be started or exits unsuccessfully
     */
    String run(String code);
}
