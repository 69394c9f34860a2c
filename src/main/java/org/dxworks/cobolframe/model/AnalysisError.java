package org.dxworks.cobolframe.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"status", "message"})
public class AnalysisError implements Analysis {
    public String status = STATUS_ERROR;
    public String message;

    public static AnalysisError of(String message) {
        AnalysisError error = new AnalysisError();
        error.message = singleLine(message);
        return error;
    }

    // Line breaks become spaces, other control characters are dropped.
    static String singleLine(String message) {
        if (message == null || message.isEmpty()) {
            return "unknown error";
        }
        StringBuilder sb = new StringBuilder(message.length());
        for (int i = 0; i < message.length(); i++) {
            char c = message.charAt(i);
            if (c == '\n' || c == '\r') {
                sb.append(' ');
            } else if (!Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String getStatus() {
        return status;
    }
}
