package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceLines;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects COPY dependencies over the whole document, Data Division included.
 * Names are upper-cased and deduplicated in order of first occurrence.
 */
final class CobolCopybookScanner {

    // COPY name | COPY "name" | COPY 'name'; a COPY with no name-shaped token matches nothing
    private static final Pattern COPY_PATTERN = Pattern.compile(
        CobolPatterns.KEYWORD_START + "COPY\\s+[\"']?([A-Z0-9_-]+)",
        Pattern.CASE_INSENSITIVE
    );

    List<String> scan(CobolSourceDocument document) {
        CobolSourceLines lines = document.lines();
        Set<String> names = new LinkedHashSet<>();

        Matcher matcher = COPY_PATTERN.matcher(document.getText());
        while (matcher.find()) {
            if (!lines.isKeywordAt(matcher.start())) {
                continue;
            }
            String name = lines.codeToken(matcher.start(1), matcher.end(1));
            if (name != null && !name.isEmpty()) {
                names.add(name.toUpperCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(names);
    }
}
