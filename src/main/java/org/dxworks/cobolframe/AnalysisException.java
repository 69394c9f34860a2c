package org.dxworks.cobolframe;

public class AnalysisException extends RuntimeException {

    private final AnalysisErrorKind kind;

    public AnalysisException(AnalysisErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalysisException(AnalysisErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AnalysisErrorKind getKind() {
        return kind;
    }
}
