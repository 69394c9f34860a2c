package org.dxworks.cobolframe.analyzer.cobol.source;

import org.dxworks.cobolframe.SourceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CobolSourceDocumentTest {

    @TempDir
    Path tempDir;

    @Test
    void loadStripsByteOrderMarkAndHashesRawBytes() throws Exception {
        Path file = tempDir.resolve("bom.cbl");
        byte[] body = "       PROCEDURE DIVISION.\n".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);
        Files.write(file, withBom);

        CobolSourceDocument document = CobolSourceDocument.load(file, SourceFormat.FIXED);

        assertEquals("       PROCEDURE DIVISION.\n", document.getText());
        assertEquals(body.length, document.length());
        assertEquals(file.toAbsolutePath().toString(), document.getAbsolutePath());
        assertEquals(64, document.getSha256().length());
    }

    @Test
    void loadToleratesMalformedBytes() throws Exception {
        Path file = tempDir.resolve("latin1.cbl");
        Files.write(file, new byte[]{'A', (byte) 0xE9, 'B', '\n'});

        CobolSourceDocument document = CobolSourceDocument.load(file, SourceFormat.VARIABLE);

        assertEquals(4, document.length());
        assertTrue(document.getText().startsWith("A"));
        assertEquals(SourceFormat.VARIABLE, document.getFormat());
    }

    @Test
    void identicalContentHasIdenticalHash() throws Exception {
        Path first = tempDir.resolve("a.cbl");
        Path second = tempDir.resolve("b.cbl");
        Files.writeString(first, "       MAIN-PARA.\n");
        Files.writeString(second, "       MAIN-PARA.\n");

        assertEquals(CobolSourceDocument.load(first, SourceFormat.FIXED).getSha256(),
                CobolSourceDocument.load(second, SourceFormat.FIXED).getSha256());
    }
}
