package org.dxworks.cobolframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.cobolframe.analyzer.cobol.COBOLAnalyzer;
import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.analyzer.cobol.structure.ProgramStructure;
import org.dxworks.cobolframe.analyzer.cobol.structure.StructuralParseException;
import org.dxworks.cobolframe.analyzer.cobol.structure.StructuralParser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {
    private static final String MINIMAL_SAMPLE = "src/test/resources/samples/cobol/minimal-program.cbl";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(Map<String, String> environment, String... args) {
        return run(new COBOLAnalyzer(StructuralParser.disabled(), CobolframeConfig.defaults()), environment, args);
    }

    private int run(COBOLAnalyzer analyzer, Map<String, String> environment, String... args) {
        return App.run(args, environment, () -> analyzer,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private JsonNode artifact() throws Exception {
        String stdout = out.toString(StandardCharsets.UTF_8);
        assertEquals(1, stdout.trim().lines().count(), stdout);
        return MAPPER.readTree(stdout);
    }

    @Test
    void missingArgumentPrintsUsage() throws Exception {
        int exitCode = run(Map.of());

        assertEquals(2, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
        JsonNode error = artifact();
        assertEquals("error", error.get("status").asText());
        assertEquals("missing input file", error.get("message").asText());
    }

    @Test
    void missingFileReportsAbsolutePath() throws Exception {
        int exitCode = run(Map.of(), "no-such-dir/missing.cbl");

        assertEquals(3, exitCode);
        JsonNode error = artifact();
        assertEquals("error", error.get("status").asText());
        String expectedPath = Paths.get("no-such-dir/missing.cbl").toAbsolutePath().toString();
        assertTrue(error.get("message").asText().contains(expectedPath), error.toString());
        assertFalse(error.has("paragraphs"));
    }

    @Test
    void analyzesFileAsSingleJsonLine() throws Exception {
        int exitCode = run(Map.of(), MINIMAL_SAMPLE);

        assertEquals(0, exitCode);
        JsonNode analysis = artifact();
        assertEquals("ok", analysis.get("status").asText());
        assertEquals("cobolframe", analysis.get("engine").asText());
        assertEquals("MINIMAL", analysis.get("programId").asText());
        assertEquals("FIXED", analysis.get("sourceFormat").asText());
        assertTrue(analysis.get("copybooks_used").isArray());
        assertEquals(0, analysis.get("copybooks_used").size());
        assertEquals(2, analysis.get("paragraphs").size());
        assertEquals("SUB-PARA", analysis.get("paragraphs").get(0).get("performs").get(0).asText());
    }

    @Test
    void rejectedSourceReportsOneLineError() throws Exception {
        StructuralParser rejecting = new StructuralParser() {
            @Override
            public String engineName() {
                return "fake";
            }

            @Override
            public Optional<ProgramStructure> parse(CobolSourceDocument document) throws StructuralParseException {
                throw new StructuralParseException("line 4: mismatched input\r\n\tnear \"EXEC DLI\"\u0007");
            }
        };

        int exitCode = run(new COBOLAnalyzer(rejecting, CobolframeConfig.defaults()), Map.of(), MINIMAL_SAMPLE);

        assertEquals(1, exitCode);
        JsonNode error = artifact();
        assertEquals("error", error.get("status").asText());
        String message = error.get("message").asText();
        assertTrue(message.startsWith("line 4: mismatched input"), message);
        assertTrue(message.contains("\"EXEC DLI\""), message);
        assertTrue(message.chars().noneMatch(Character::isISOControl), message);
        assertFalse(error.has("paragraphs"));
    }

    @Test
    void environmentSelectsVariableFormat() throws Exception {
        int exitCode = run(Map.of(SourceFormat.ENVIRONMENT_VARIABLE, " variable "), MINIMAL_SAMPLE);

        assertEquals(0, exitCode);
        assertEquals("VARIABLE", artifact().get("sourceFormat").asText());
    }

    @Test
    void unknownFormatFallsBackToFixed() throws Exception {
        run(Map.of(SourceFormat.ENVIRONMENT_VARIABLE, "TANDEM"), MINIMAL_SAMPLE);

        assertEquals("FIXED", artifact().get("sourceFormat").asText());
    }

    @Test
    void publicEntryPointUsesDefaultConfiguration() throws Exception {
        int exitCode = App.run(new String[]{MINIMAL_SAMPLE}, Map.of(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(0, exitCode);
        assertEquals("ok", artifact().get("status").asText());
    }
}
