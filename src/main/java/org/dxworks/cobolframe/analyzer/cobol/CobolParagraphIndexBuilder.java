package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceLines;
import org.dxworks.cobolframe.analyzer.cobol.structure.ParagraphNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates paragraph headers and computes the span each paragraph body owns.
 *
 * <p>A header is a line holding only a label and a period ({@code MAIN-PARA.}). Section headers,
 * comment lines and single-word statements with the same shape ({@code EXIT.}, {@code GOBACK.},
 * {@code END-IF.} ...) are not headers. When the document has a PROCEDURE DIVISION header only the
 * lines after it are considered.
 */
final class CobolParagraphIndexBuilder {

    private static final Pattern HEADER_PATTERN = Pattern.compile(
        "\\s*(" + CobolPatterns.NAME + ")\\s*\\.\\s*"
    );

    private static final Pattern SECTION_PATTERN = Pattern.compile(
        "\\bSECTION\\s*\\.", Pattern.CASE_INSENSITIVE);

    private static final Pattern PROCEDURE_DIVISION_PATTERN = Pattern.compile(
        CobolPatterns.KEYWORD_START + "PROCEDURE\\s+DIVISION(?![A-Za-z0-9-])", Pattern.CASE_INSENSITIVE);

    // Statements and directives that can stand alone on a line ending in a period
    private static final Set<String> NON_PARAGRAPH_WORDS = Set.of(
        "SECTION", "DECLARATIVES", "EXIT", "GOBACK", "CONTINUE", "ELSE", "EJECT", "SKIP1", "SKIP2", "SKIP3",
        "END-IF", "END-PERFORM", "END-EVALUATE", "END-READ", "END-WRITE", "END-REWRITE", "END-CALL",
        "END-COMPUTE", "END-STRING", "END-UNSTRING", "END-SEARCH", "END-START", "END-DELETE",
        "END-RETURN", "END-ADD", "END-SUBTRACT", "END-MULTIPLY", "END-DIVIDE", "END-EXEC",
        "END-ACCEPT", "END-DISPLAY", "END-RECEIVE", "END-INVOKE", "END-JSON", "END-XML"
    );

    CobolParagraphIndex build(CobolSourceDocument document, ParagraphNames accepted) {
        CobolSourceLines lines = document.lines();
        String text = document.getText();
        int procedureStart = locateProcedureBody(document);

        List<String> names = new ArrayList<>();
        List<Integer> headerOffsets = new ArrayList<>();
        List<Integer> bodyStarts = new ArrayList<>();

        Matcher header = HEADER_PATTERN.matcher(text);
        Matcher section = SECTION_PATTERN.matcher(text);
        for (int line = lines.lineIndexAt(procedureStart); line < lines.lineCount(); line++) {
            if (lines.lineStart(line) < procedureStart || lines.isCommentLine(line)) {
                continue;
            }

            int from = lines.contentStart(line);
            int to = lines.codeEnd(line);
            if (from >= to) {
                continue;
            }

            header.region(from, to);
            if (!header.matches()) {
                continue;
            }
            section.region(from, to);
            if (section.find()) {
                continue;
            }

            String name = header.group(1).toUpperCase(Locale.ROOT);
            if (NON_PARAGRAPH_WORDS.contains(name) || !accepted.accepts(name)) {
                continue;
            }

            names.add(name);
            headerOffsets.add(lines.lineStart(line));
            bodyStarts.add(lines.nextLineStart(line));
        }

        int count = names.size();
        int[] headerArray = new int[count];
        int[] bodyArray = new int[count];
        int[] endArray = new int[count];
        for (int i = 0; i < count; i++) {
            headerArray[i] = headerOffsets.get(i);
            bodyArray[i] = bodyStarts.get(i);
            endArray[i] = i + 1 < count ? headerOffsets.get(i + 1) : text.length();
        }

        return new CobolParagraphIndex(procedureStart, names.toArray(new String[0]),
                headerArray, bodyArray, endArray, accepted);
    }

    /**
     * Offset of the first line after the PROCEDURE DIVISION header sentence (which may carry a
     * multi-line USING list), or 0 when the document has no such header.
     */
    int locateProcedureBody(CobolSourceDocument document) {
        CobolSourceLines lines = document.lines();
        String text = document.getText();

        Matcher matcher = PROCEDURE_DIVISION_PATTERN.matcher(text);
        while (matcher.find()) {
            if (!lines.isKeywordAt(matcher.start())) {
                continue;
            }
            for (int i = matcher.end(); i < text.length(); i++) {
                if (text.charAt(i) == '.' && lines.isKeywordAt(i) && endsSentence(lines, text, i)) {
                    return lines.nextLineStart(lines.lineIndexAt(i));
                }
            }
            return lines.nextLineStart(lines.lineIndexAt(matcher.start()));
        }
        return 0;
    }

    // A period ends a sentence when program text ends or whitespace follows it.
    private static boolean endsSentence(CobolSourceLines lines, String text, int period) {
        int next = period + 1;
        return next >= lines.codeEnd(lines.lineIndexAt(period)) || Character.isWhitespace(text.charAt(next));
    }
}
