package org.dxworks.cobolframe;

import java.util.Locale;

/**
 * Reference format of the COBOL source, selected through {@value #ENVIRONMENT_VARIABLE}.
 */
public enum SourceFormat {
    FIXED,
    VARIABLE;

    public static final String ENVIRONMENT_VARIABLE = "COBOL_SOURCE_FORMAT";

    /**
     * Only an explicit {@code VARIABLE} selects variable format; anything else, absence included, is FIXED.
     */
    public static SourceFormat fromSetting(String value) {
        if (value != null && VARIABLE.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
            return VARIABLE;
        }
        return FIXED;
    }
}
