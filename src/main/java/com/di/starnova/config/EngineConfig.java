package com.di.starnova.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Engine section ({@code spark.*}). {@code master} selects local parallelism:
 * {@code local} (1 thread), {@code local[N]} or {@code local[*]} (all cores).
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EngineConfig {

    @NotBlank
    @Pattern(regexp = "local(\\[(\\*|[1-9][0-9]*)])?", message = "must be local, local[N] or local[*]")
    private String master = "local[*]";

    @NotBlank
    private String appName;

    /** Parallelism requested by {@link #master}. */
    public int parallelism() {
        if (master == null || "local".equals(master)) {
            return 1;
        }
        String inner = master.substring(master.indexOf('[') + 1, master.length() - 1);
        if ("*".equals(inner)) {
            return Runtime.getRuntime().availableProcessors();
        }
        return Integer.parseInt(inner);
    }
}
