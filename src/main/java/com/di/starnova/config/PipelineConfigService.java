package com.di.starnova.config;

import com.di.starnova.exception.PipelineConfigurationException;
import com.di.starnova.schema.TableNames;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads the pipeline configuration document from YAML and validates it once.
 * <ul>
 *   <li>Location comes from {@code starnova.pipeline.config-file} (Spring resource syntax: classpath: or file:).</li>
 *   <li>Unknown keys are ignored; missing or malformed required keys are a {@link PipelineConfigurationException}.</li>
 *   <li>{@code data.source_files} keys must name raw tables.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineConfigService {

    /** Loggers whose level follows the document's log_level. */
    static final String APPLICATION_LOGGER = "com.di.starnova";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final Validator validator;
    private final StarNovaProperties properties;

    /** Loads the document configured by {@code starnova.pipeline.config-file}. */
    public PipelineConfig load() {
        return load(properties.getConfigFile());
    }

    public PipelineConfig load(String location) {
        if (location == null || location.isBlank()) {
            throw new PipelineConfigurationException("starnova.pipeline.config-file is not set");
        }
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new PipelineConfigurationException("Pipeline config not found: " + location);
        }
        PipelineConfig config;
        try (InputStream in = resource.getInputStream()) {
            config = YAML_MAPPER.readValue(in, PipelineConfig.class);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Pipeline config " + location + " could not be parsed: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new PipelineConfigurationException("Pipeline config " + location + " is empty");
        }
        validate(config);
        log.info("[CONFIG] Loaded pipeline '{}' from {} (engine={}, failFast={})",
                config.getPipelineName(), location, config.getEngine().getMaster(), config.getDataQuality().isFailFast());
        return config;
    }

    /**
     * Bean-validation plus cross-field checks. All violations are reported in one exception.
     */
    public void validate(PipelineConfig config) {
        Set<ConstraintViolation<PipelineConfig>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining("; "));
            throw new PipelineConfigurationException("Invalid pipeline config: " + detail);
        }
        if (config.getData().getSourceFiles() != null) {
            for (String table : config.getData().getSourceFiles().keySet()) {
                if (!TableNames.RAW_TABLES.contains(table)) {
                    throw new PipelineConfigurationException(
                            "Invalid pipeline config: data.source_files." + table + " is not a raw table " + TableNames.RAW_TABLES);
                }
            }
        }
    }

    /** Applies the document's log_level to the application loggers. */
    public void applyLogLevel(PipelineConfig config) {
        if (config.getLogLevel() == null) {
            return;
        }
        LogLevel level = LogLevel.valueOf(config.getLogLevel().trim().toUpperCase(Locale.ROOT));
        LoggingSystem.get(getClass().getClassLoader()).setLogLevel(APPLICATION_LOGGER, level);
        log.debug("[CONFIG] Log level for {} set to {}", APPLICATION_LOGGER, level);
    }
}
