package com.smelldetector.cli;

/**
 * Process exit codes shared by the commands.
 */
public final class ExitCodes {

    public static final int OK = 0;

    /** Invalid configuration, missing input or unreadable directory. */
    public static final int ERROR = 1;

    /** Analysis succeeded but found smells at or above the {@code --fail-on} severity. */
    public static final int FINDINGS = 2;

    private ExitCodes() {
        // Constants only
    }
}
