package org.dxworks.cobolframe.analyzer.cobol.source;

import org.dxworks.cobolframe.SourceFormat;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Line-addressable view over COBOL source text that classifies lines without rewriting them.
 *
 * <p>Offsets always refer to the original text, so spans computed by the scanners stay valid
 * against it. Columns 1-6 (sequence area, any content) and column 7 (indicator) are never program
 * text; in fixed format neither are columns 73-80 (identification area). A line is a full-line
 * comment when:
 * <ul>
 *   <li>column 7 (the indicator area) holds {@code *} or {@code /}, or</li>
 *   <li>its first non-blank character sits in columns 1-7 and is {@code *} or {@code /}, or</li>
 *   <li>it starts, after blanks, with the floating comment marker {@code *>}.</li>
 * </ul>
 * A {@code *>} found later on a code line (outside literals) turns the rest of that line into comment text.
 */
public final class CobolSourceLines {

    private static final int INDICATOR_COLUMN = 6;
    private static final int PROGRAM_TEXT_START = 7;
    private static final int FIXED_FORMAT_TEXT_END = 72;
    private static final int NO_COMMENT = Integer.MAX_VALUE;

    private final String text;
    private final SourceFormat format;
    private final int[] lineStarts;
    private final int[] lineEnds;
    // absolute offset where comment text begins on each line, NO_COMMENT for pure code lines
    private final int[] commentStarts;
    // characters of alphanumeric literals, quotes included
    private final BitSet literals;

    CobolSourceLines(String text, SourceFormat format) {
        this.text = text;
        this.format = format;

        int capacity = 16;
        int[] starts = new int[capacity];
        int[] ends = new int[capacity];
        int count = 0;

        int lineStart = 0;
        int length = text.length();
        int i = 0;
        while (i <= length) {
            boolean atEnd = i == length;
            char c = atEnd ? '\n' : text.charAt(i);
            if (atEnd || c == '\n' || c == '\r') {
                if (count == capacity) {
                    capacity *= 2;
                    starts = Arrays.copyOf(starts, capacity);
                    ends = Arrays.copyOf(ends, capacity);
                }
                starts[count] = lineStart;
                ends[count] = i;
                count++;
                if (atEnd) {
                    break;
                }
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                lineStart = i + 1;
                if (lineStart == length) {
                    // trailing terminator: no empty phantom line after it
                    break;
                }
            }
            i++;
        }

        this.lineStarts = Arrays.copyOf(starts, count);
        this.lineEnds = Arrays.copyOf(ends, count);
        this.commentStarts = new int[count];
        this.literals = new BitSet(length);
        for (int line = 0; line < count; line++) {
            commentStarts[line] = findCommentStart(line);
            markLiterals(line);
        }
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineStart(int line) {
        return lineStarts[line];
    }

    /**
     * Offset just past the last character of the line, before its terminator.
     */
    public int lineEnd(int line) {
        return lineEnds[line];
    }

    /**
     * Offset of the first character of the following line, or the text length for the last line.
     */
    public int nextLineStart(int line) {
        return line + 1 < lineStarts.length ? lineStarts[line + 1] : text.length();
    }

    public String lineText(int line) {
        return text.substring(lineStarts[line], lineEnds[line]);
    }

    /**
     * Index of the line holding {@code offset}; offsets on a terminator belong to the line it ends.
     */
    public int lineIndexAt(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        if (index >= 0) {
            return index;
        }
        int insertion = -index - 1;
        return Math.max(0, insertion - 1);
    }

    public boolean isCommentLine(int line) {
        return commentStarts[line] == lineStarts[line];
    }

    /**
     * True when the character at {@code offset} is comment text: either a full comment line or
     * the tail of a line after a floating {@code *>} marker.
     */
    public boolean isCommentAt(int offset) {
        return offset >= commentStarts[lineIndexAt(offset)];
    }

    /**
     * True when {@code offset} lies in program text: past the indicator column, before any comment
     * and, in fixed format, within column 72. Literals count as program text.
     */
    public boolean isCodeAt(int offset) {
        int line = lineIndexAt(offset);
        return offset >= contentStart(line) && offset < codeEnd(line);
    }

    public boolean isLiteralAt(int offset) {
        return literals.get(offset);
    }

    /**
     * True when a keyword may start at {@code offset}: program text outside comments and literals.
     */
    public boolean isKeywordAt(int offset) {
        return isCodeAt(offset) && !isLiteralAt(offset);
    }

    /**
     * The token {@code [start, end)} cut at the end of the program text of its line, or null when
     * it does not start in program text.
     */
    public String codeToken(int start, int end) {
        if (!isCodeAt(start)) {
            return null;
        }
        return text.substring(start, Math.min(end, codeEnd(lineIndexAt(start))));
    }

    /**
     * End of the program text of the line: the start of a floating comment, column 72 in fixed
     * format, or the line end.
     */
    public int codeEnd(int line) {
        int end = Math.min(lineEnds[line], commentStarts[line]);
        if (format == SourceFormat.FIXED) {
            end = Math.min(end, lineStarts[line] + FIXED_FORMAT_TEXT_END);
        }
        return end;
    }

    /**
     * Start of the program text on the line: column 8 when the line reaches past the sequence
     * area, otherwise the line start.
     */
    public int contentStart(int line) {
        int start = lineStarts[line];
        if (lineEnds[line] - start <= INDICATOR_COLUMN) {
            return start;
        }
        return start + PROGRAM_TEXT_START;
    }

    private int findCommentStart(int line) {
        int start = lineStarts[line];
        int end = lineEnds[line];

        if (end - start > INDICATOR_COLUMN) {
            char indicator = text.charAt(start + INDICATOR_COLUMN);
            if (indicator == '*' || indicator == '/') {
                return start;
            }
        }

        int firstNonBlank = start;
        while (firstNonBlank < end && Character.isWhitespace(text.charAt(firstNonBlank))) {
            firstNonBlank++;
        }
        if (firstNonBlank == end) {
            return NO_COMMENT;
        }
        char first = text.charAt(firstNonBlank);
        if ((first == '*' || first == '/') && firstNonBlank - start <= INDICATOR_COLUMN) {
            return start;
        }
        if (startsFloatingComment(firstNonBlank, end)) {
            return start;
        }

        char quote = 0;
        for (int i = Math.max(firstNonBlank, contentStart(line)); i < end; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (startsFloatingComment(i, end)) {
                return i;
            }
        }
        return NO_COMMENT;
    }

    // An unterminated literal runs to the end of the program text of its line.
    private void markLiterals(int line) {
        int end = codeEnd(line);
        int literalStart = -1;
        char quote = 0;
        for (int i = contentStart(line); i < end; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    literals.set(literalStart, i + 1);
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                literalStart = i;
            }
        }
        if (quote != 0) {
            literals.set(literalStart, end);
        }
    }

    private boolean startsFloatingComment(int offset, int end) {
        return offset + 1 < end && text.charAt(offset) == '*' && text.charAt(offset + 1) == '>';
    }
}
