package org.dxworks.cobolframe.analyzer.cobol.structure;

import org.dxworks.cobolframe.analyzer.cobol.source.CobolSourceDocument;

import java.io.File;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Binds to the ProLeap COBOL parser when it is on the classpath.
 *
 * <p>ProLeap is not a compile-time dependency: the runner and its ASG are reached reflectively, the
 * same way optional grammars are loaded by name. Without ProLeap, or with an API this adapter does not
 * recognize, {@link #parse} returns empty and the analyzer runs on heuristics alone. A source that
 * ProLeap rejects raises {@link StructuralParseException}.
 */
public final class ProLeapStructuralParser implements StructuralParser {

    static final String RUNNER_CLASS = "io.proleap.cobol.asg.runner.impl.CobolParserRunnerImpl";
    static final String FORMAT_ENUM_CLASS = "io.proleap.cobol.preprocessor.CobolPreprocessor$CobolSourceFormatEnum";

    private final ClassLoader classLoader;

    public ProLeapStructuralParser() {
        this(ProLeapStructuralParser.class.getClassLoader());
    }

    ProLeapStructuralParser(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public String engineName() {
        return "proleap";
    }

    public boolean isAvailable() {
        try {
            Class.forName(RUNNER_CLASS, false, classLoader);
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    @Override
    public Optional<ProgramStructure> parse(CobolSourceDocument document) throws StructuralParseException {
        if (!isAvailable()) {
            return Optional.empty();
        }

        Object runner;
        Method analyzeFile;
        Object format;
        try {
            Class<?> runnerClass = Class.forName(RUNNER_CLASS, true, classLoader);
            Class<?> formatClass = Class.forName(FORMAT_ENUM_CLASS, true, classLoader);
            runner = runnerClass.getDeclaredConstructor().newInstance();
            analyzeFile = runnerClass.getMethod("analyzeFile", File.class, formatClass);
            format = enumConstant(formatClass, document.getFormat().name());
        } catch (ReflectiveOperationException | LinkageError e) {
            System.err.println("[ProLeap] Unsupported parser API, using heuristics only: " + e);
            return Optional.empty();
        }

        Object program;
        try {
            program = analyzeFile.invoke(runner, new File(document.getAbsolutePath()), format);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StructuralParseException(withHints(messageOf(cause)), cause);
        } catch (IllegalAccessException e) {
            System.err.println("[ProLeap] Parser runner not accessible, using heuristics only: " + e);
            return Optional.empty();
        }

        if (program == null) {
            return Optional.empty();
        }
        return Optional.of(ProLeapProgramStructure.of(program));
    }

    private static Object enumConstant(Class<?> enumClass, String name) throws NoSuchFieldException {
        Object[] constants = enumClass.getEnumConstants();
        if (constants != null) {
            for (Object constant : constants) {
                if (((Enum<?>) constant).name().equals(name)) {
                    return constant;
                }
            }
        }
        throw new NoSuchFieldException(enumClass.getName() + "." + name);
    }

    private static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    // Known constructs the stock ProLeap grammar does not accept.
    static String withHints(String message) {
        if (message.contains("EXEC DLI")) {
            return message + " [Hint: IMS/EXEC DLI statements are not supported by the stock ProLeap grammar.]";
        }
        if (message.contains("SEND-PLAIN-TEXT")) {
            return message + " [Hint: This looks like a CICS BMS macro form. "
                    + "The stock grammar doesn't accept 'SEND-PLAIN-TEXT' as a verb; "
                    + "vendor extensions or CICS macro preprocessing may be needed.]";
        }
        return message;
    }

    /**
     * Structure captured eagerly from a ProLeap {@code Program}; any node the ASG does not expose counts as absent.
     */
    private static final class ProLeapProgramStructure implements ProgramStructure {
        private final String programId;
        private final boolean identification;
        private final boolean environment;
        private final boolean data;
        private final boolean procedure;
        private final List<String> paragraphNames;

        private ProLeapProgramStructure(String programId, boolean identification, boolean environment,
                                        boolean data, boolean procedure, List<String> paragraphNames) {
            this.programId = programId;
            this.identification = identification;
            this.environment = environment;
            this.data = data;
            this.procedure = procedure;
            this.paragraphNames = paragraphNames;
        }

        static ProLeapProgramStructure of(Object program) {
            Object compilationUnit = first(call(program, "getCompilationUnits"));
            Object programUnit = call(compilationUnit, "getProgramUnit");

            Object identificationDivision = call(programUnit, "getIdentificationDivision");
            Object procedureDivision = call(programUnit, "getProcedureDivision");

            String programId = asString(call(call(identificationDivision, "getProgramIdParagraph"), "getName"));
            if (programId == null) {
                programId = asString(call(compilationUnit, "getName"));
            }

            List<String> paragraphNames = new ArrayList<>();
            Object paragraphs = call(procedureDivision, "getParagraphs");
            if (paragraphs instanceof Collection) {
                for (Object paragraph : (Collection<?>) paragraphs) {
                    String name = asString(call(paragraph, "getName"));
                    if (name != null && !name.isEmpty()) {
                        paragraphNames.add(name);
                    }
                }
            }

            return new ProLeapProgramStructure(
                    programId,
                    identificationDivision != null,
                    call(programUnit, "getEnvironmentDivision") != null,
                    call(programUnit, "getDataDivision") != null,
                    procedureDivision != null,
                    Collections.unmodifiableList(paragraphNames)
            );
        }

        // Null target or missing accessor yields null: the node is treated as not retrievable.
        private static Object call(Object target, String method) {
            if (target == null) {
                return null;
            }
            try {
                return target.getClass().getMethod(method).invoke(target);
            } catch (ReflectiveOperationException e) {
                return null;
            }
        }

        private static Object first(Object collection) {
            if (collection instanceof Collection && !((Collection<?>) collection).isEmpty()) {
                return ((Collection<?>) collection).iterator().next();
            }
            return null;
        }

        private static String asString(Object value) {
            if (value == null) {
                return null;
            }
            String text = value.toString().trim();
            return text.isEmpty() ? null : text;
        }

        @Override
        public String programId() {
            return programId;
        }

        @Override
        public boolean hasIdentificationDivision() {
            return identification;
        }

        @Override
        public boolean hasEnvironmentDivision() {
            return environment;
        }

        @Override
        public boolean hasDataDivision() {
            return data;
        }

        @Override
        public boolean hasProcedureDivision() {
            return procedure;
        }

        @Override
        public List<String> paragraphNames() {
            return paragraphNames;
        }
    }
}
