package org.dxworks.cobolframe.analyzer.cobol.structure;

import java.util.List;

/**
 * Authoritative structure of a compilation unit as reported by a {@link StructuralParser}.
 */
public interface ProgramStructure {

    /**
     * Program name from the PROGRAM-ID paragraph, or null when the engine could not supply it.
     */
    String programId();

    boolean hasIdentificationDivision();

    boolean hasEnvironmentDivision();

    boolean hasDataDivision();

    boolean hasProcedureDivision();

    /**
     * Paragraph names of the Procedure Division in document order; empty when unknown.
     */
    List<String> paragraphNames();
}
