package com.di.starnova.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Root of the pipeline configuration document (e.g. pipeline_config.yml).
 * <pre>
 * pipeline_name: olist_star_schema
 * log_level: INFO
 * spark:         { master: "local[*]", app_name: StarSchemaBuilder }
 * data:          { source_path: ..., output_path: ..., profiling_path: ... }
 * data_quality:  { accepted_order_status: [...], fail_fast: false }
 * </pre>
 * Loaded and validated once at startup by {@link PipelineConfigService}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineConfig {

    @NotBlank
    private String pipelineName;

    /** Level applied to the application loggers (TRACE, DEBUG, INFO, WARN, ERROR). */
    @Pattern(regexp = "(?i)TRACE|DEBUG|INFO|WARN|ERROR|OFF")
    private String logLevel = "INFO";

    /** Execution-engine targeting. The section keeps its historical name {@code spark}. */
    @Valid
    @NotNull
    @JsonProperty("spark")
    private EngineConfig engine;

    @Valid
    @NotNull
    private DataConfig data;

    @Valid
    @NotNull
    private DataQualityConfig dataQuality;
}
