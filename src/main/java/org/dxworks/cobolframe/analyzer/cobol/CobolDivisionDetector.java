package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.analyzer.cobol.structure.ProgramStructure;
import org.dxworks.cobolframe.model.cobol.COBOLDivision;
import org.dxworks.cobolframe.model.cobol.COBOLDivisions;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports which of the four divisions are present. An authoritative structure decides when one is
 * available; otherwise a {@code <NAME> DIVISION} header in program text counts as presence.
 * Presence says the header was located, not that the division is valid.
 */
final class CobolDivisionDetector {

    private static final Pattern IDENTIFICATION = divisionHeader("(?:IDENTIFICATION|ID)");
    private static final Pattern ENVIRONMENT = divisionHeader("ENVIRONMENT");
    private static final Pattern DATA = divisionHeader("DATA");
    private static final Pattern PROCEDURE = divisionHeader("PROCEDURE");

    COBOLDivisions detect(CobolSourceDocument document, Optional<ProgramStructure> structure) {
        if (structure.isPresent()) {
            return fromStructure(structure.get());
        }

        COBOLDivisions divisions = new COBOLDivisions();
        divisions.identification = COBOLDivision.of(hasHeader(document, IDENTIFICATION));
        divisions.environment = COBOLDivision.of(hasHeader(document, ENVIRONMENT));
        divisions.data = COBOLDivision.of(hasHeader(document, DATA));
        divisions.procedure = COBOLDivision.of(hasHeader(document, PROCEDURE));
        return divisions;
    }

    private static COBOLDivisions fromStructure(ProgramStructure structure) {
        COBOLDivisions divisions = new COBOLDivisions();
        divisions.identification = COBOLDivision.of(structure.hasIdentificationDivision());
        divisions.environment = COBOLDivision.of(structure.hasEnvironmentDivision());
        divisions.data = COBOLDivision.of(structure.hasDataDivision());
        divisions.procedure = COBOLDivision.of(structure.hasProcedureDivision());
        return divisions;
    }

    private static boolean hasHeader(CobolSourceDocument document, Pattern pattern) {
        Matcher matcher = pattern.matcher(document.getText());
        while (matcher.find()) {
            if (document.lines().isKeywordAt(matcher.start())) {
                return true;
            }
        }
        return false;
    }

    private static Pattern divisionHeader(String name) {
        return Pattern.compile(
            CobolPatterns.KEYWORD_START + name + "\\s+DIVISION(?![A-Za-z0-9-])",
            Pattern.CASE_INSENSITIVE
        );
    }
}
