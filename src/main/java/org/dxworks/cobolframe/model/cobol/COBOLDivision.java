package org.dxworks.cobolframe.model.cobol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Serializes as {@code {"present":true}} when the division header was located and as {@code {}} otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class COBOLDivision {
    public Boolean present;

    public static COBOLDivision of(boolean present) {
        return present ? present() : absent();
    }

    public static COBOLDivision present() {
        COBOLDivision division = new COBOLDivision();
        division.present = Boolean.TRUE;
        return division;
    }

    public static COBOLDivision absent() {
        return new COBOLDivision();
    }
}
