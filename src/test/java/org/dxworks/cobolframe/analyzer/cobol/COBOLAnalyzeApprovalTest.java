package org.dxworks.cobolframe.analyzer.cobol;

import org.approvaltests.Approvals;
import org.dxworks.cobolframe.CobolframeConfig;
import org.dxworks.cobolframe.SourceFormat;
import org.dxworks.cobolframe.TestUtils;
import org.dxworks.cobolframe.analyzer.cobol.structure.StructuralParser;
import org.dxworks.cobolframe.model.cobol.COBOLProgramAnalysis;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

public class COBOLAnalyzeApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/cobol/";

    @Test
    void analyze_COBOL_BasicProgram() throws Exception {
        verify("basic-program.cbl");
    }

    @Test
    void analyze_COBOL_Sections() throws Exception {
        verify("sections.cbl");
    }

    @Test
    void analyze_COBOL_FileOperations() throws Exception {
        verify("file-operations.cbl");
    }

    private static void verify(String filePath) throws Exception {
        COBOLAnalyzer analyzer = new COBOLAnalyzer(StructuralParser.disabled(), CobolframeConfig.defaults());
        COBOLProgramAnalysis analysis = analyzer.analyze(Paths.get(SAMPLES_BASE_PATH + filePath), SourceFormat.FIXED);
        String json = TestUtils.APPROVAL_MAPPER.writeValueAsString(TestUtils.scrub(analysis));
        Approvals.verify(TestUtils.withTrailingNewline(json));
    }
}
