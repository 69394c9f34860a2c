package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.analyzer.cobol.structure.ProgramStructure;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort program name: the authoritative one when known, else the first
 * {@code PROGRAM-ID. name} in code text, else the empty string.
 */
final class CobolProgramIdDetector {

    private static final Pattern PROGRAM_ID_PATTERN = Pattern.compile(
        CobolPatterns.KEYWORD_START + "PROGRAM-ID\\s*\\.?\\s*[\"']?(" + CobolPatterns.NAME + ")",
        Pattern.CASE_INSENSITIVE
    );

    String detect(CobolSourceDocument document, Optional<ProgramStructure> structure) {
        String authoritative = structure.map(ProgramStructure::programId).orElse(null);
        if (authoritative != null && !authoritative.isBlank()) {
            return authoritative.trim().toUpperCase(Locale.ROOT);
        }

        Matcher matcher = PROGRAM_ID_PATTERN.matcher(document.getText());
        while (matcher.find()) {
            String name = document.lines().isKeywordAt(matcher.start())
                    ? document.lines().codeToken(matcher.start(1), matcher.end(1))
                    : null;
            if (name != null && !name.isEmpty()) {
                return name.toUpperCase(Locale.ROOT);
            }
        }
        return "";
    }
}
