package org.dxworks.cobolframe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.cobolframe.analyzer.cobol.COBOLAnalyzer;
import org.dxworks.cobolframe.model.AnalysisError;
import org.dxworks.cobolframe.model.cobol.COBOLProgramAnalysis;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Supplier;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    /**
     * Analyzes the file named by {@code args[0]} and writes exactly one JSON artifact to {@code out}.
     *
     * @return the process exit code: 0 on success, otherwise {@link AnalysisErrorKind#getExitCode()}
     */
    public static int run(String[] args, Map<String, String> environment, PrintStream out, PrintStream err) {
        return run(args, environment, () -> COBOLAnalyzer.fromConfig(CobolframeConfig.load()), out, err);
    }

    static int run(String[] args, Map<String, String> environment, Supplier<COBOLAnalyzer> analyzer,
                   PrintStream out, PrintStream err) {
        if (args.length < 1 || args[0] == null || args[0].isBlank()) {
            err.println("Usage: java -jar cobolframe.jar <cobol-source-file>");
            err.println("  <cobol-source-file>: Path to a single COBOL compilation unit");
            err.println("  " + SourceFormat.ENVIRONMENT_VARIABLE + "=VARIABLE selects variable format (default: FIXED)");
            return writeError(out, err, AnalysisErrorKind.USAGE, "missing input file");
        }

        SourceFormat format = SourceFormat.fromSetting(environment.get(SourceFormat.ENVIRONMENT_VARIABLE));

        Path input;
        try {
            input = Paths.get(args[0]);
        } catch (InvalidPathException e) {
            return writeError(out, err, AnalysisErrorKind.INPUT_NOT_FOUND, "file not found: " + args[0]);
        }

        try {
            COBOLProgramAnalysis analysis = analyzer.get().analyze(input, format);
            out.println(MAPPER.writeValueAsString(analysis));
            return 0;
        } catch (AnalysisException e) {
            return writeError(out, err, e.getKind(), e.getMessage());
        } catch (JsonProcessingException | RuntimeException e) {
            err.println("[App] Analysis of " + input + " failed: " + e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            return writeError(out, err, AnalysisErrorKind.ANALYSIS_FAILED, message);
        }
    }

    private static int writeError(PrintStream out, PrintStream err, AnalysisErrorKind kind, String message) {
        try {
            out.println(MAPPER.writeValueAsString(AnalysisError.of(message)));
        } catch (JsonProcessingException e) {
            err.println("[App] Failed to write error artifact: " + e.getMessage());
        }
        return kind.getExitCode();
    }
}
