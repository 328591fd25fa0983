package org.dxworks.ommlatex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class OmmlatexConfig {

    private static final long DEFAULT_MAX_FILE_BYTES = 5L * 1024 * 1024;
    private static final String CONFIG_FILE_NAME = "ommlatex-config.yml";
    private static final boolean DEFAULT_PLAIN_TEXT_FALLBACK = true;

    private final long maxFileBytes;
    private final boolean plainTextFallback;

    private OmmlatexConfig(long maxFileBytes, boolean plainTextFallback) {
        this.maxFileBytes = maxFileBytes;
        this.plainTextFallback = plainTextFallback;
    }

    public long getMaxFileBytes() {
        return maxFileBytes;
    }

    /** Whether an expression that fails to convert is reported with its plain text instead. */
    public boolean isPlainTextFallback() {
        return plainTextFallback;
    }

    public static OmmlatexConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    static OmmlatexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Long maxFileBytes = yamlConfig.maxFileBytes;
                Boolean plainTextFallback = yamlConfig.plainTextFallback;

                long effectiveMaxFileBytes = (maxFileBytes != null && maxFileBytes > 0)
                        ? maxFileBytes
                        : DEFAULT_MAX_FILE_BYTES;
                boolean effectivePlainTextFallback = (plainTextFallback != null)
                        ? plainTextFallback
                        : DEFAULT_PLAIN_TEXT_FALLBACK;

                return new OmmlatexConfig(effectiveMaxFileBytes, effectivePlainTextFallback);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static OmmlatexConfig defaults() {
        return new OmmlatexConfig(DEFAULT_MAX_FILE_BYTES, DEFAULT_PLAIN_TEXT_FALLBACK);
    }

    public static OmmlatexConfig with(long maxFileBytes, boolean plainTextFallback) {
        long effectiveMaxFileBytes = maxFileBytes > 0 ? maxFileBytes : DEFAULT_MAX_FILE_BYTES;
        return new OmmlatexConfig(effectiveMaxFileBytes, plainTextFallback);
    }

    private static class YamlConfig {
        public Long maxFileBytes;
        public Boolean plainTextFallback;
    }
}
