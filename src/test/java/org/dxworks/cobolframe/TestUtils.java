package org.dxworks.cobolframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.cobolframe.model.cobol.COBOLProgramAnalysis;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Replaces the machine dependent parts (absolute path, content hash) so approved output is stable.
     */
    public static COBOLProgramAnalysis scrub(COBOLProgramAnalysis analysis) {
        analysis.file = "<file>";
        analysis.notes.replaceAll(note -> note.startsWith("sha256=") ? "sha256=<sha256>" : note);
        return analysis;
    }

    public static String withTrailingNewline(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }
}
