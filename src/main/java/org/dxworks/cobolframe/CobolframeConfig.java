package org.dxworks.cobolframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class CobolframeConfig {

    private static final String CONFIG_FILE_NAME = "cobolframe-config.yml";
    private static final int DEFAULT_PARALLEL_THRESHOLD = 64;
    private static final boolean DEFAULT_STRUCTURAL_PARSER_ENABLED = true;

    private final boolean structuralParserEnabled;
    private final int parallelThreshold;

    private CobolframeConfig(boolean structuralParserEnabled, int parallelThreshold) {
        this.structuralParserEnabled = structuralParserEnabled;
        this.parallelThreshold = parallelThreshold;
    }

    /**
     * Whether the external structural parser is consulted ({@code structuralParser: auto}).
     */
    public boolean isStructuralParserEnabled() {
        return structuralParserEnabled;
    }

    /**
     * Number of paragraphs from which fact extraction runs on a parallel stream.
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public static CobolframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CobolframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean structuralParserEnabled = yamlConfig.structuralParser == null
                        ? DEFAULT_STRUCTURAL_PARSER_ENABLED
                        : !"none".equals(yamlConfig.structuralParser.trim().toLowerCase(Locale.ROOT));
                return with(structuralParserEnabled,
                        yamlConfig.parallelThreshold != null ? yamlConfig.parallelThreshold : 0);
            }
        } catch (IOException e) {
            System.err.println("[Config] Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static CobolframeConfig defaults() {
        return new CobolframeConfig(DEFAULT_STRUCTURAL_PARSER_ENABLED, DEFAULT_PARALLEL_THRESHOLD);
    }

    public static CobolframeConfig with(boolean structuralParserEnabled, int parallelThreshold) {
        int effectiveThreshold = parallelThreshold > 0 ? parallelThreshold : DEFAULT_PARALLEL_THRESHOLD;
        return new CobolframeConfig(structuralParserEnabled, effectiveThreshold);
    }

    private static class YamlConfig {
        public String structuralParser;
        public Integer parallelThreshold;
    }
}
