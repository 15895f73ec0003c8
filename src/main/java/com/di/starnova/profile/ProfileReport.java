package com.di.starnova.profile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileReport {
    private String table;
    private String runId;
    private Instant generatedAt;
    private long rowCount;
    @Builder.Default
    private Map<String, ColumnProfile> columns = new LinkedHashMap<>();
}
