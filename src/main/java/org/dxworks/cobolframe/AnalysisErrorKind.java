package org.dxworks.cobolframe;

/**
 * Failure categories reported at the process boundary, each with its own exit code.
 */
public enum AnalysisErrorKind {
    ANALYSIS_FAILED(1),
    USAGE(2),
    INPUT_NOT_FOUND(3);

    private final int exitCode;

    AnalysisErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
