package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.SourceFormat;
import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.model.cobol.COBOLDivisions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CobolDivisionDetectorTest {

    private final CobolDivisionDetector detector = new CobolDivisionDetector();

    private static CobolSourceDocument document(String... lines) {
        return CobolSourceDocument.of(String.join("\n", lines) + "\n", SourceFormat.FIXED, "/tmp/div.cbl");
    }

    @Test
    void detectsHeadersTextually() {
        COBOLDivisions divisions = detector.detect(document(
                "       ID DIVISION.",
                "       PROGRAM-ID. SHORT.",
                "       data   division.",
                "       PROCEDURE DIVISION USING LK-AREA."), Optional.empty());

        assertEquals(Boolean.TRUE, divisions.identification.present);
        assertNull(divisions.environment.present);
        assertEquals(Boolean.TRUE, divisions.data.present);
        assertEquals(Boolean.TRUE, divisions.procedure.present);
    }

    @Test
    void commentedHeadersDoNotCount() {
        COBOLDivisions divisions = detector.detect(document(
                "      *ENVIRONMENT DIVISION.",
                "       PROCEDURE DIVISION. *> DATA DIVISION"), Optional.empty());

        assertNull(divisions.environment.present);
        assertNull(divisions.data.present);
        assertEquals(Boolean.TRUE, divisions.procedure.present);
    }

    @Test
    void emptyDocumentHasNoDivisions() {
        COBOLDivisions divisions = detector.detect(document(""), Optional.empty());

        assertNull(divisions.identification.present);
        assertNull(divisions.procedure.present);
    }
}
