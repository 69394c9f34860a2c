package org.dxworks.cobolframe.analyzer.cobol.structure;

import org.dxworks.cobolframe.SourceFormat;
import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;

import static org.junit.jupiter.api.Assertions.*;

class ProLeapStructuralParserTest {

    @Test
    void missingEngineYieldsNoStructure() throws Exception {
        ProLeapStructuralParser parser = new ProLeapStructuralParser(new URLClassLoader(new URL[0], null));
        CobolSourceDocument document = CobolSourceDocument.of("       PROCEDURE DIVISION.\n",
                SourceFormat.FIXED, "/tmp/none.cbl");

        assertFalse(parser.isAvailable());
        assertTrue(parser.parse(document).isEmpty());
        assertEquals("proleap", parser.engineName());
    }

    @Test
    void hintsAreAppendedForKnownUnsupportedConstructs() {
        assertTrue(ProLeapStructuralParser.withHints("mismatched input 'EXEC DLI'")
                .contains("[Hint: IMS/EXEC DLI statements are not supported"));
        assertTrue(ProLeapStructuralParser.withHints("no viable alternative at SEND-PLAIN-TEXT")
                .contains("CICS BMS macro form"));
        assertEquals("line 3: syntax error", ProLeapStructuralParser.withHints("line 3: syntax error"));
    }
}
