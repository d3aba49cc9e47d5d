package com.statecheck.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.statecheck.model.ConfigurationFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes {@link ConfigurationFile}s as JSON or YAML.
 *
 * <p>Both formats share one object model: YAML is parsed into plain maps and then bound with the
 * same Jackson mapping as JSON, so variant keys and field names are identical.
 */
@Component
public class ConfigurationFileLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationFileLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigurationFileLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .setSerializationInclusion(JsonInclude.Include.NON_EMPTY)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Loads a file, picking the format from its extension ({@code .yaml}/{@code .yml} or JSON otherwise).
     *
     * @param path file path
     * @return parsed configuration file
     */
    public ConfigurationFile load(Path path) {
        String fileName = path.getFileName() != null ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return fromYaml(path);
        }
        return fromJson(path);
    }

    public ConfigurationFile fromJson(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            ConfigurationFile file = objectMapper.readValue(in, ConfigurationFile.class);
            log.debug("Loaded configuration file: path={}, format=json", path);
            return file;
        } catch (IOException e) {
            throw new ConfigurationLoadException(path, "Failed to load configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    public ConfigurationFile fromYaml(Path path) {
        Object raw;
        try (Reader reader = new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8)) {
            raw = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationLoadException(path, "Failed to parse YAML file " + path + ": " + e.getMessage(), e);
        }
        if (!(raw instanceof Map<?, ?>)) {
            throw new ConfigurationLoadException(path, "Configuration file " + path + " is not a mapping", null);
        }

        try {
            ConfigurationFile file = objectMapper.convertValue(raw, ConfigurationFile.class);
            log.debug("Loaded configuration file: path={}, format=yaml", path);
            return file;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationLoadException(path, "Failed to bind configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a configuration file to JSON, omitting null and empty values.
     */
    public String toJson(ConfigurationFile file) {
        try {
            return objectMapper.writeValueAsString(file);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration file", e);
        }
    }

    /**
     * Serializes a configuration file to block-style YAML, omitting null and empty values.
     */
    public String toYaml(ConfigurationFile file) {
        Map<String, Object> tree = objectMapper.convertValue(file, new TypeReference<Map<String, Object>>() {
        });
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options).dump(tree);
    }

    public void write(ConfigurationFile file, Path path) {
        String fileName = path.getFileName() != null ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
        String content = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? toYaml(file) : toJson(file);
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationLoadException(path, "Failed to write configuration file " + path + ": " + e.getMessage(), e);
        }
    }
}
