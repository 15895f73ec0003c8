package com.di.starnova.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filesystem locations ({@code data.*}).
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DataConfig {

    /** Optional zip archive downloaded into {@link #sourcePath} when it holds no CSV files. */
    private String url;

    @NotBlank
    private String sourcePath;

    @NotBlank
    private String outputPath;

    @NotBlank
    private String profilingPath;

    /** Optional raw table name to CSV file name overrides. */
    private Map<String, String> sourceFiles = new LinkedHashMap<>();
}
