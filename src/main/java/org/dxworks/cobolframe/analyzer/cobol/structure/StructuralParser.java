package org.dxworks.cobolframe.analyzer.cobol.structure;

import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;

import java.util.Optional;

/**
 * Grammar-based parser consulted for authoritative program structure.
 *
 * <p>An empty result means no authoritative structure is available (engine missing, disabled, or
 * it produced nothing); callers then fall back to text heuristics. A thrown
 * {@link StructuralParseException} means the engine rejected the source as invalid COBOL.
 */
public interface StructuralParser {

    /**
     * Identifier of the engine, used in the artifact notes.
     */
    String engineName();

    Optional<ProgramStructure> parse(CobolSourceDocument document) throws StructuralParseException;

    static StructuralParser disabled() {
        return new StructuralParser() {
            @Override
            public String engineName() {
                return "none";
            }

            @Override
            public Optional<ProgramStructure> parse(CobolSourceDocument document) {
                return Optional.empty();
            }
        };
    }
}
