package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;
import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceLines;
import org.dxworks.cobolframe.model.cobol.COBOLCallReference;
import org.dxworks.cobolframe.model.cobol.COBOLIoOperation;
import org.dxworks.cobolframe.model.cobol.COBOLParagraph;
import org.dxworks.cobolframe.model.cobol.COBOLPerformEdge;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracts PERFORM edges, CALL references and file I/O operations from paragraph bodies.
 *
 * <p>Each paragraph is scanned on its own span only (matcher regions), so nothing leaks across
 * paragraph boundaries and spans can be processed in parallel. Keywords must start in program text
 * outside comments and literals, and captured names are cut at the end of program text. Statements the patterns do not recognize simply produce no fact.
 */
final class CobolParagraphFactExtractor {

    // PERFORM name [THRU|THROUGH name2]; "PERFORM n TIMES" is an inline loop, not a target
    private static final Pattern PERFORM_PATTERN = Pattern.compile(
        CobolPatterns.KEYWORD_START + "PERFORM\\s+(" + CobolPatterns.NAME + ")"
            + "(?!\\s+TIMES(?![A-Za-z0-9-]))"
            + "(?:\\s+(?:THRU|THROUGH)\\s+(" + CobolPatterns.NAME + "))?",
        Pattern.CASE_INSENSITIVE
    );

    // CALL 'PROG' | CALL "PROG" | CALL identifier
    private static final Pattern CALL_PATTERN = Pattern.compile(
        CobolPatterns.KEYWORD_START + "CALL\\s+(?:'([^'\\r\\n]+)'|\"([^\"\\r\\n]+)\"|(" + CobolPatterns.NAME + "))",
        Pattern.CASE_INSENSITIVE
    );

    // OPEN/READ/WRITE/REWRITE/CLOSE [INPUT|OUTPUT|I-O|EXTEND] file-name
    private static final Pattern IO_PATTERN = Pattern.compile(
        CobolPatterns.KEYWORD_START + "(OPEN|READ|WRITE|REWRITE|CLOSE)\\s+"
            + "(?:(?:INPUT|OUTPUT|I-O|EXTEND)\\s+)?(" + CobolPatterns.NAME + ")",
        Pattern.CASE_INSENSITIVE
    );

    // Words after PERFORM that open an inline perform rather than name a procedure
    private static final Set<String> INLINE_PERFORM_WORDS = Set.of(
        "UNTIL", "VARYING", "WITH", "TEST", "FOREVER",
        "ACCEPT", "ADD", "CALL", "COMPUTE", "CONTINUE", "DISPLAY", "EVALUATE", "IF", "INITIALIZE",
        "INSPECT", "MOVE", "MULTIPLY", "DIVIDE", "SUBTRACT", "READ", "WRITE", "REWRITE", "OPEN",
        "CLOSE", "SET", "STRING", "UNSTRING", "SEARCH", "EXEC", "PERFORM", "GO", "EXIT"
    );

    private static final Set<String> OPEN_MODES = Set.of("INPUT", "OUTPUT", "I-O", "EXTEND");

    /**
     * Facts for every span, in the order given; spans are scanned in parallel from
     * {@code parallelThreshold} paragraphs on.
     */
    List<COBOLParagraph> extractAll(CobolSourceDocument document, List<CobolParagraphSpan> spans,
                                    int parallelThreshold) {
        Stream<CobolParagraphSpan> stream = spans.size() >= parallelThreshold
                ? spans.parallelStream()
                : spans.stream();
        return stream
                .map(span -> extract(document, span))
                .collect(Collectors.toList());
    }

    COBOLParagraph extract(CobolSourceDocument document, CobolParagraphSpan span) {
        COBOLParagraph paragraph = new COBOLParagraph();
        paragraph.name = span.getName();

        extractPerforms(document, span, paragraph);
        extractCalls(document, span, paragraph);
        extractIoOperations(document, span, paragraph);
        return paragraph;
    }

    private void extractPerforms(CobolSourceDocument document, CobolParagraphSpan span, COBOLParagraph paragraph) {
        Matcher matcher = bodyMatcher(PERFORM_PATTERN, document, span);
        CobolSourceLines lines = document.lines();
        while (matcher.find()) {
            if (!lines.isKeywordAt(matcher.start())) {
                continue;
            }
            String target = token(lines, matcher, 1);
            if (target == null || INLINE_PERFORM_WORDS.contains(target)) {
                continue;
            }

            COBOLPerformEdge edge = new COBOLPerformEdge();
            edge.sourceParagraph = span.getName();
            edge.target = target;
            if (matcher.group(2) != null) {
                edge.thruParagraph = token(lines, matcher, 2);
            }
            paragraph.addPerform(edge);
        }
    }

    private void extractCalls(CobolSourceDocument document, CobolParagraphSpan span, COBOLParagraph paragraph) {
        Matcher matcher = bodyMatcher(CALL_PATTERN, document, span);
        CobolSourceLines lines = document.lines();
        while (matcher.find()) {
            if (!lines.isKeywordAt(matcher.start())) {
                continue;
            }
            int literalGroup = matcher.group(1) != null ? 1 : matcher.group(2) != null ? 2 : 0;
            String quoted = literalGroup == 0 ? null
                    : lines.codeToken(matcher.start(literalGroup), matcher.end(literalGroup));

            COBOLCallReference call = new COBOLCallReference();
            call.sourceParagraph = span.getName();
            if (literalGroup != 0) {
                call.target = quoted == null ? null : upper(quoted.trim());
                call.dynamic = false;
            } else {
                call.target = token(lines, matcher, 3);
                call.dynamic = true;
            }
            if (call.target != null && !call.target.isEmpty()) {
                paragraph.calls.add(call);
            }
        }
    }

    private void extractIoOperations(CobolSourceDocument document, CobolParagraphSpan span, COBOLParagraph paragraph) {
        Matcher matcher = bodyMatcher(IO_PATTERN, document, span);
        CobolSourceLines lines = document.lines();
        while (matcher.find()) {
            if (!lines.isKeywordAt(matcher.start())) {
                continue;
            }
            String dataset = token(lines, matcher, 2);
            if (dataset == null || OPEN_MODES.contains(dataset)) {
                continue;
            }

            COBOLIoOperation op = new COBOLIoOperation();
            op.sourceParagraph = span.getName();
            op.op = upper(matcher.group(1));
            op.datasetRef = dataset;
            paragraph.ioOperations.add(op);
        }
    }

    private static Matcher bodyMatcher(Pattern pattern, CobolSourceDocument document, CobolParagraphSpan span) {
        Matcher matcher = pattern.matcher(document.getText());
        matcher.region(span.getStart(), span.getEnd());
        return matcher;
    }

    // Upper-cased name captured by the group, or null when it lies outside program text
    private static String token(CobolSourceLines lines, Matcher matcher, int group) {
        String token = lines.codeToken(matcher.start(group), matcher.end(group));
        return token == null || token.isEmpty() ? null : upper(token);
    }

    private static String upper(String value) {
        return value.toUpperCase(Locale.ROOT);
    }
}
