package org.dxworks.cobolframe.analyzer.cobol.structure;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Which paragraph names count as paragraph boundaries: either the list an authoritative parse
 * supplied ({@link Authoritative}) or every textually detected header ({@link Heuristic}).
 */
public abstract class ParagraphNames {

    private ParagraphNames() {
    }

    public static ParagraphNames authoritative(List<String> names) {
        return new Authoritative(names);
    }

    public static ParagraphNames heuristic() {
        return Heuristic.INSTANCE;
    }

    /**
     * Authoritative when the structure lists at least one paragraph, heuristic otherwise.
     */
    public static ParagraphNames from(Optional<ProgramStructure> structure) {
        List<String> names = structure.map(ProgramStructure::paragraphNames).orElse(null);
        if (names == null || names.isEmpty()) {
            return heuristic();
        }
        Authoritative authoritative = new Authoritative(names);
        return authoritative.names().isEmpty() ? heuristic() : authoritative;
    }

    /**
     * Whether a textually detected header named {@code name} (upper case) is a paragraph boundary.
     */
    public abstract boolean accepts(String name);

    public abstract boolean isAuthoritative();

    public static final class Authoritative extends ParagraphNames {
        private final Set<String> names;

        private Authoritative(List<String> names) {
            Set<String> normalized = new LinkedHashSet<>();
            for (String name : names) {
                if (name != null && !name.isBlank()) {
                    normalized.add(name.trim().toUpperCase(Locale.ROOT));
                }
            }
            this.names = Collections.unmodifiableSet(normalized);
        }

        public Set<String> names() {
            return names;
        }

        @Override
        public boolean accepts(String name) {
            return names.contains(name);
        }

        @Override
        public boolean isAuthoritative() {
            return true;
        }
    }

    public static final class Heuristic extends ParagraphNames {
        private static final Heuristic INSTANCE = new Heuristic();

        private Heuristic() {
        }

        @Override
        public boolean accepts(String name) {
            return true;
        }

        @Override
        public boolean isAuthoritative() {
            return false;
        }
    }
}
