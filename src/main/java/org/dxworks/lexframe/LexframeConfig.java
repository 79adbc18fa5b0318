package org.dxworks.lexframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class LexframeConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(LexframeConfig.class);

    private static final String CONFIG_FILE_NAME = "lexframe-config.yml";
    private static final int DEFAULT_MAX_DEPTH = 10;
    private static final int DEFAULT_LABEL_MAX_LENGTH = 15;
    private static final int DEFAULT_LABEL_COLUMN_MAX_PERCENT = 15;
    private static final int DEFAULT_CONNECTIVE_LOOKBACK = 60;
    private static final boolean DEFAULT_EXTRACT_CITATIONS = true;

    private final int maxDepth;
    private final int listTableMaxLabelLength;
    private final int listTableMaxLabelColumnPercent;
    private final int connectiveLookback;
    private final boolean extractCitations;

    private LexframeConfig(int maxDepth, int listTableMaxLabelLength, int listTableMaxLabelColumnPercent,
                           int connectiveLookback, boolean extractCitations) {
        this.maxDepth = maxDepth;
        this.listTableMaxLabelLength = listTableMaxLabelLength;
        this.listTableMaxLabelColumnPercent = listTableMaxLabelColumnPercent;
        this.connectiveLookback = connectiveLookback;
        this.extractCitations = extractCitations;
    }

    /** Maximum list-table nesting depth; deeper tables are ignored. */
    public int getMaxDepth() {
        return maxDepth;
    }

    public int getListTableMaxLabelLength() {
        return listTableMaxLabelLength;
    }

    public int getListTableMaxLabelColumnPercent() {
        return listTableMaxLabelColumnPercent;
    }

    /** How many characters before a citation are searched for a connective phrase. */
    public int getConnectiveLookback() {
        return connectiveLookback;
    }

    public boolean isExtractCitations() {
        return extractCitations;
    }

    public static LexframeConfig defaults() {
        return new LexframeConfig(DEFAULT_MAX_DEPTH, DEFAULT_LABEL_MAX_LENGTH, DEFAULT_LABEL_COLUMN_MAX_PERCENT,
                DEFAULT_CONNECTIVE_LOOKBACK, DEFAULT_EXTRACT_CITATIONS);
    }

    public static LexframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static LexframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new LexframeConfig(
                        positiveOr(yamlConfig.maxDepth, DEFAULT_MAX_DEPTH),
                        positiveOr(yamlConfig.listTableMaxLabelLength, DEFAULT_LABEL_MAX_LENGTH),
                        positiveOr(yamlConfig.listTableMaxLabelColumnPercent, DEFAULT_LABEL_COLUMN_MAX_PERCENT),
                        positiveOr(yamlConfig.connectiveLookback, DEFAULT_CONNECTIVE_LOOKBACK),
                        yamlConfig.extractCitations != null ? yamlConfig.extractCitations : DEFAULT_EXTRACT_CITATIONS);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static LexframeConfig with(int maxDepth, int connectiveLookback, boolean extractCitations) {
        return new LexframeConfig(
                maxDepth > 0 ? maxDepth : DEFAULT_MAX_DEPTH,
                DEFAULT_LABEL_MAX_LENGTH,
                DEFAULT_LABEL_COLUMN_MAX_PERCENT,
                connectiveLookback > 0 ? connectiveLookback : DEFAULT_CONNECTIVE_LOOKBACK,
                extractCitations);
    }

    private static int positiveOr(Integer value, int fallback) {
        return (value != null && value > 0) ? value : fallback;
    }

    private static class YamlConfig {
        public Integer maxDepth;
        public Integer listTableMaxLabelLength;
        public Integer listTableMaxLabelColumnPercent;
        public Integer connectiveLookback;
        public Boolean extractCitations;
    }
}
