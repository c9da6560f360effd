package com.rpaflow.core.execution;

import com.rpaflow.debug.Debug;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** Runs scripts through a local PowerShell executable ({@code pwsh} by default). */
public final class ProcessPowershellRunner implements PowershellRunner {

    private static final String TAG = "rpa.vm";

    private final String executable;

    public ProcessPowershellRunner() {
        this("pwsh");
    }

    public ProcessPowershellRunner(String executable) {
        this.executable = executable;
    }

    @Override
    public String run(String code) {
        ProcessBuilder pb = new ProcessBuilder(executable, "-NoProfile", "-NonInteractive", "-Command", code);
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ActivityException("Failed to start PowerShell (" + executable + "): " + e.getMessage(), e);
        }

        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            process.destroy();
            throw new ActivityException("Failed to read PowerShell output: " + e.getMessage(), e);
        }

        int exit;
        try {
            exit = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new ActivityException("Interrupted while waiting for PowerShell", e);
        }
        Debug.get().d(TAG, "powershell exited with " + exit);
        if (exit != 0) {
            throw new ActivityException("PowerShell exited with code " + exit + (output.isEmpty() ? "" : ": " + output));
        }
        return output;
    }
}
