package org.dxworks.cobolframe.analyzer.cobol;

/**
 * Regex fragments shared by the text scanners.
 */
final class CobolPatterns {

    private CobolPatterns() {
        // utility class
    }

    /**
     * A keyword may not continue a word: {@code END-CALL} holds no {@code CALL}, {@code WS-READ} no {@code READ}.
     */
    static final String KEYWORD_START = "(?<![A-Za-z0-9_-])";

    /**
     * Paragraph, program or file name: letters, digits and hyphens, not starting with a hyphen.
     * Possessive so a following lookahead cannot shorten it.
     */
    static final String NAME = "[A-Za-z0-9][A-Za-z0-9-]*+";
}
