package com.di.starnova.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Data-quality section ({@code data_quality.*}).
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DataQualityConfig {

    /** Allow-list for {@code fact_sales.order_status}, in the order it is reported. */
    @NotEmpty
    private List<@NotBlank String> acceptedOrderStatus = new ArrayList<>();

    /** When true any failing rule aborts the run before profiling and persistence. */
    private boolean failFast = false;

    /** Maximum number of violating values or rows kept per rule result. */
    @Min(1)
    @Max(1000)
    private int sampleSize = 20;
}
