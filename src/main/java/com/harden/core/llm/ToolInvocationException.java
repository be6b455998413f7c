package com.harden.core.llm;

/**
 * Thrown when the external reasoning tool exits unsuccessfully, times out or cannot be started.
 * Carries the exit code and a truncated capture of the combined output.
 */
public class ToolInvocationException extends RuntimeException {

    /** Exit code reported when the process never produced one (start failure, timeout). */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final String output;

    public ToolInvocationException(String message, int exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    public ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = NO_EXIT_CODE;
        this.output = "";
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }
}
