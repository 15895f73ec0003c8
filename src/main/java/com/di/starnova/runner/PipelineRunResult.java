package com.di.starnova.runner;

import com.di.starnova.profile.ProfileReport;
import com.di.starnova.quality.DqReport;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Outcome of a successful run. */
@Value
@Builder
public class PipelineRunResult {
    String runId;
    PipelineState state;
    List<PipelineState> history;
    Map<String, Long> tableRowCounts;
    DqReport dqReport;
    ProfileReport profileReport;
    Path outputPath;
    Path profileReportPath;
    Path dqReportPath;
}
