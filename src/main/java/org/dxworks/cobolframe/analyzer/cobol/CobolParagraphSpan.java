package org.dxworks.cobolframe.analyzer.cobol;

/**
 * A paragraph's place in the source: its header line starts at {@code headerOffset}, its body runs
 * from {@code start} (first character after the header line) to {@code end} (exclusive), which is the
 * next header's offset or the document end.
 */
public final class CobolParagraphSpan {

    private final String name;
    private final int headerOffset;
    private final int start;
    private final int end;

    CobolParagraphSpan(String name, int headerOffset, int start, int end) {
        this.name = name;
        this.headerOffset = headerOffset;
        this.start = start;
        this.end = end;
    }

    public String getName() {
        return name;
    }

    public int getHeaderOffset() {
        return headerOffset;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return name + "[" + headerOffset + "," + start + "," + end + ")";
    }
}
