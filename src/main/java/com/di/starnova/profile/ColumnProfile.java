package com.di.starnova.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;

/**
 * Statistics of one column. Absent statistics are left null and omitted from JSON:
 * mean, stddev, min and max without non-null values, stddev with a single value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnProfile implements Serializable {

    public enum Kind { NUMERIC, CATEGORICAL }

    private String column;
    private Kind kind;
    /** Non-null values. */
    private long count;
    private long nullCount;
    private Double mean;
    private Double stddev;
    private Double min;
    private Double max;
    /** Accepted value to occurrences, in accepted-list order; categorical columns only. */
    private LinkedHashMap<String, Long> frequencies;
}
