package org.dxworks.cobolframe.analyzer.cobol.structure;

public class StructuralParseException extends Exception {

    public StructuralParseException(String message) {
        super(message);
    }

    public StructuralParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
