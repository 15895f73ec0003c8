package com.di.starnova.runner;

import com.di.starnova.config.PipelineConfig;
import com.di.starnova.exception.PersistenceException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.runners.direct.DirectOptions;
import org.apache.beam.runners.direct.DirectRunner;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Engine session of one run: pipeline options derived from the {@code spark} section and the
 * run's staging area under {@code <output_path>/_staging/<runId>}. Closing it removes the
 * staging area.
 */
@Slf4j
@Getter
public class ExecutionContext implements AutoCloseable {

    public static final String STAGING_DIR = "_staging";

    private final String runId;
    private final String jobName;
    private final int parallelism;
    private final Path stagingDir;

    private ExecutionContext(String runId, String jobName, int parallelism, Path stagingDir) {
        this.runId = runId;
        this.jobName = jobName;
        this.parallelism = parallelism;
        this.stagingDir = stagingDir;
    }

    public static ExecutionContext open(PipelineConfig config, String runId, Path outputRoot) {
        Path staging = outputRoot.resolve(STAGING_DIR).resolve(runId);
        try {
            Files.createDirectories(staging.resolve("tables"));
            Files.createDirectories(staging.resolve("work"));
        } catch (IOException e) {
            throw new PersistenceException("Cannot create staging area " + staging, e);
        }
        String jobName = config.getEngine().getAppName().trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
        ExecutionContext ctx = new ExecutionContext(runId, jobName, config.getEngine().parallelism(), staging);
        log.info("[RUNNER] Opened session job={} parallelism={} staging={}", jobName, ctx.parallelism, staging);
        return ctx;
    }

    /** A fresh pipeline on the DirectRunner. */
    public Pipeline newPipeline() {
        DirectOptions options = PipelineOptionsFactory.as(DirectOptions.class);
        options.setRunner(DirectRunner.class);
        options.setTargetParallelism(parallelism);
        options.setJobName(jobName + "-" + runId);
        return Pipeline.create(options);
    }

    /** Staged tables, one directory per table. */
    public Path tablesDir() {
        return stagingDir.resolve("tables");
    }

    /** Intermediate files exchanged between pipelines of this run. */
    public Path workDir() {
        return stagingDir.resolve("work");
    }

    @Override
    public void close() {
        try {
            FileSystemUtils.deleteRecursively(stagingDir);
            Path parent = stagingDir.getParent();
            try (Stream<Path> remaining = Files.list(parent)) {
                if (remaining.findAny().isEmpty()) {
                    Files.delete(parent);
                }
            }
            log.debug("[RUNNER] Removed staging area {}", stagingDir);
        } catch (IOException e) {
            log.warn("[RUNNER] Could not remove staging area {}: {}", stagingDir, e.getMessage());
        }
    }
}
