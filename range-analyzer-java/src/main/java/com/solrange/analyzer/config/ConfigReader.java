package com.solrange.analyzer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes analyzer.json from the given path.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public AnalyzerConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile())) {
            AnalyzerConfig config = GSON.fromJson(reader, AnalyzerConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            if (config.getMaxForkDepth() < 0) {
                throw new ConfigReadException("max_fork_depth must not be negative: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
