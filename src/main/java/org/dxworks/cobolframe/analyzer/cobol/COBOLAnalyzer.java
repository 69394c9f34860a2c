package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.AnalysisErrorKind;
import org.dxworks.cobolframe.AnalysisException;
import org.dxworks.cobolframe.CobolframeConfig;
import org.dxworks.cobolframe.SourceFormat;
import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.analyzer.cobol.structure.ParagraphNames;
import org.dxworks.cobolframe.analyzer.cobol.structure.ProLeapStructuralParser;
import org.dxworks.cobolframe.analyzer.cobol.structure.ProgramStructure;
import org.dxworks.cobolframe.analyzer.cobol.structure.StructuralParseException;
import org.dxworks.cobolframe.analyzer.cobol.structure.StructuralParser;
import org.dxworks.cobolframe.model.cobol.COBOLParagraph;
import org.dxworks.cobolframe.model.cobol.COBOLProgramAnalysis;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the structural model of one COBOL compilation unit.
 *
 * <p>Authoritative structure from the {@link StructuralParser} is preferred; without it every part of
 * the model comes from the text heuristics. A source the parser rejects fails the whole run.
 */
public class COBOLAnalyzer {

    public static final String ENGINE = "cobolframe";

    private final StructuralParser structuralParser;
    private final CobolframeConfig config;

    private final CobolCopybookScanner copybookScanner = new CobolCopybookScanner();
    private final CobolParagraphIndexBuilder indexBuilder = new CobolParagraphIndexBuilder();
    private final CobolParagraphFactExtractor factExtractor = new CobolParagraphFactExtractor();
    private final CobolDivisionDetector divisionDetector = new CobolDivisionDetector();
    private final CobolProgramIdDetector programIdDetector = new CobolProgramIdDetector();

    public COBOLAnalyzer(StructuralParser structuralParser, CobolframeConfig config) {
        this.structuralParser = Objects.requireNonNull(structuralParser, "structuralParser");
        this.config = Objects.requireNonNull(config, "config");
    }

    public static COBOLAnalyzer fromConfig(CobolframeConfig config) {
        StructuralParser parser = config.isStructuralParserEnabled()
                ? new ProLeapStructuralParser()
                : StructuralParser.disabled();
        return new COBOLAnalyzer(parser, config);
    }

    public COBOLProgramAnalysis analyze(Path filePath, SourceFormat format) {
        Path absolutePath = filePath.toAbsolutePath();
        if (!Files.isRegularFile(absolutePath) || !Files.isReadable(absolutePath)) {
            throw new AnalysisException(AnalysisErrorKind.INPUT_NOT_FOUND, "file not found: " + absolutePath);
        }

        CobolSourceDocument document;
        try {
            document = CobolSourceDocument.load(absolutePath, format);
        } catch (IOException e) {
            throw readFailure(absolutePath, e);
        }
        return analyze(document);
    }

    // Losing the file between the checks and the read still counts as a missing input.
    static AnalysisException readFailure(Path absolutePath, IOException e) {
        if (e instanceof NoSuchFileException || e instanceof AccessDeniedException) {
            return new AnalysisException(AnalysisErrorKind.INPUT_NOT_FOUND, "file not found: " + absolutePath, e);
        }
        return new AnalysisException(AnalysisErrorKind.ANALYSIS_FAILED,
                "cannot read " + absolutePath + ": " + e.getMessage(), e);
    }

    public COBOLProgramAnalysis analyze(CobolSourceDocument document) {
        Optional<ProgramStructure> structure = parseStructure(document);

        CobolParagraphIndex index = indexBuilder.build(document, ParagraphNames.from(structure));
        List<COBOLParagraph> paragraphs = factExtractor.extractAll(
                document, index.paragraphs(), config.getParallelThreshold());
        List<String> copybooks = copybookScanner.scan(document);

        COBOLProgramAnalysis analysis = new COBOLProgramAnalysis();
        analysis.engine = ENGINE;
        analysis.programId = programIdDetector.detect(document, structure);
        analysis.sourceFormat = document.getFormat().name();
        analysis.file = document.getAbsolutePath();
        analysis.divisions = divisionDetector.detect(document, structure);
        analysis.paragraphs.addAll(paragraphs);
        analysis.copybooksUsed.addAll(copybooks);

        addNotes(analysis, document, structure.isPresent(), index);
        return analysis;
    }

    private Optional<ProgramStructure> parseStructure(CobolSourceDocument document) {
        try {
            Optional<ProgramStructure> structure = structuralParser.parse(document);
            return structure != null ? structure : Optional.empty();
        } catch (StructuralParseException | RuntimeException e) {
            System.err.println("[COBOLAnalyzer] " + structuralParser.engineName() + " rejected "
                    + document.getAbsolutePath() + ": " + e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            throw new AnalysisException(AnalysisErrorKind.ANALYSIS_FAILED, message, e);
        }
    }

    private void addNotes(COBOLProgramAnalysis analysis, CobolSourceDocument document,
                          boolean authoritativeStructure, CobolParagraphIndex index) {
        List<String> notes = analysis.notes;
        notes.add("sourceFormat=" + document.getFormat().name());
        notes.add("engine=" + ENGINE);
        notes.add("structuralParser=" + structuralParser.engineName());
        notes.add("structure=" + (authoritativeStructure ? "authoritative" : "heuristic"));
        notes.add("paragraphNames=" + (index.getSource().isAuthoritative() ? "authoritative" : "heuristic"));
        notes.add("paragraphs.count=" + analysis.paragraphs.size());
        notes.add("copybooks.count=" + analysis.copybooksUsed.size());
        notes.add("raw_source_len=" + document.length());
        notes.add("sha256=" + document.getSha256());

        for (String duplicate : index.duplicateNames()) {
            System.err.println("[COBOLAnalyzer] Duplicate paragraph label " + duplicate + " in "
                    + document.getAbsolutePath() + "; the last occurrence defines its span");
            notes.add("duplicateParagraph=" + duplicate);
        }
    }
}
