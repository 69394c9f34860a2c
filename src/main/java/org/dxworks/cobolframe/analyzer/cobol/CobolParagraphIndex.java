package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.structure.ParagraphNames;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Paragraph headers of one document, in document order, held as parallel offset arrays over the
 * shared source text.
 *
 * <p>{@link #headers()} keeps every boundary, so together with the region before the first header the
 * header-to-end ranges tile the Procedure Division exactly. {@link #paragraphs()} is the keyed view used
 * for reporting: one entry per name, placed where the name first occurs, carrying the span of its
 * last occurrence.
 */
public final class CobolParagraphIndex {

    private final int procedureStart;
    private final String[] names;
    private final int[] headerOffsets;
    private final int[] bodyStarts;
    private final int[] ends;
    private final ParagraphNames source;

    CobolParagraphIndex(int procedureStart, String[] names, int[] headerOffsets, int[] bodyStarts,
                        int[] ends, ParagraphNames source) {
        this.procedureStart = procedureStart;
        this.names = names;
        this.headerOffsets = headerOffsets;
        this.bodyStarts = bodyStarts;
        this.ends = ends;
        this.source = source;
    }

    /**
     * Offset where the Procedure Division body begins (0 when no PROCEDURE DIVISION header was found).
     */
    public int getProcedureStart() {
        return procedureStart;
    }

    public ParagraphNames getSource() {
        return source;
    }

    public int size() {
        return names.length;
    }

    public CobolParagraphSpan get(int index) {
        return new CobolParagraphSpan(names[index], headerOffsets[index], bodyStarts[index], ends[index]);
    }

    public List<CobolParagraphSpan> headers() {
        List<CobolParagraphSpan> spans = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            spans.add(get(i));
        }
        return spans;
    }

    public List<CobolParagraphSpan> paragraphs() {
        Map<String, CobolParagraphSpan> byName = new LinkedHashMap<>();
        for (int i = 0; i < names.length; i++) {
            byName.put(names[i], get(i));
        }
        return new ArrayList<>(byName.values());
    }

    /**
     * Names that head more than one paragraph, in order of their first repeat.
     */
    public List<String> duplicateNames() {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                duplicates.add(name);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(duplicates));
    }

    /**
     * The paragraph whose header-to-end range contains {@code offset}; empty before the first header.
     */
    public Optional<CobolParagraphSpan> paragraphAt(int offset) {
        int index = Arrays.binarySearch(headerOffsets, offset);
        if (index < 0) {
            index = -index - 2;
        }
        if (index < 0 || offset >= ends[index]) {
            return Optional.empty();
        }
        return Optional.of(get(index));
    }
}
