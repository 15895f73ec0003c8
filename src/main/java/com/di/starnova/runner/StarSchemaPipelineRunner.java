package com.di.starnova.runner;

import com.di.starnova.config.PipelineConfig;
import com.di.starnova.config.PipelineConfigService;
import com.di.starnova.exception.DataQualityViolationException;
import com.di.starnova.exception.ErrorCategory;
import com.di.starnova.exception.PipelineConfigurationException;
import com.di.starnova.handler.SourceDownloader;
import com.di.starnova.handler.SourceHandler;
import com.di.starnova.load.JsonSupport;
import com.di.starnova.load.ParquetTableStore;
import com.di.starnova.load.ReportWriter;
import com.di.starnova.load.TablePublisher;
import com.di.starnova.profile.ColumnProfile;
import com.di.starnova.profile.DataProfiler;
import com.di.starnova.profile.ProfileReport;
import com.di.starnova.quality.DataQualityValidator;
import com.di.starnova.quality.DqReport;
import com.di.starnova.quality.DqRuleResult;
import com.di.starnova.quality.StandardRules;
import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.Tables;
import com.di.starnova.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricQueryResults;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.StreamSupport;

/**
 * Drives one build of the star schema through {@link PipelineState}.
 *
 * <ol>
 *   <li>Build pipeline: extract, dimensions, fact, staged as Parquet. Running it materializes every table.</li>
 *   <li>Validation pipeline over the staged tables. In fail-fast mode a failing rule ends the run here.</li>
 *   <li>Profiling pipeline over the same staged fact table.</li>
 *   <li>Publish: staged tables renamed into {@code output_path}, reports written to {@code profiling_path}.</li>
 * </ol>
 * The staging area is removed whatever the outcome; a failed run publishes nothing.
 */
@Slf4j
@Service
public class StarSchemaPipelineRunner {

    public static final String MDC_RUN_ID = "runId";
    public static final String PROFILE_REPORT_FILE = "fact_sales_profile.json";
    public static final String DQ_REPORT_FILE = "fact_sales_dq_report.json";

    static final String METRICS_NAMESPACE = "starnova.build";

    private final PipelineConfigService configService;
    private final SourceDownloader sourceDownloader;
    private final SourceHandler sourceHandler;
    private final TablePublisher tablePublisher;
    private final ReportWriter reportWriter;
    private final MetricsCollector metricsCollector;

    public StarSchemaPipelineRunner(PipelineConfigService configService,
                                    SourceDownloader sourceDownloader,
                                    List<SourceHandler> sourceHandlers,
                                    TablePublisher tablePublisher,
                                    ReportWriter reportWriter,
                                    MetricsCollector metricsCollector) {
        this.configService = configService;
        this.sourceDownloader = sourceDownloader;
        this.sourceHandler = sourceHandlers.stream()
                .filter(h -> "csv".equals(h.type()))
                .findFirst()
                .orElseThrow(() -> new PipelineConfigurationException("No csv source handler registered"));
        this.tablePublisher = tablePublisher;
        this.reportWriter = reportWriter;
        this.metricsCollector = metricsCollector;
    }

    /** Loads the configured document and runs it. */
    public PipelineRunResult run() {
        PipelineConfig config = configService.load();
        configService.applyLogLevel(config);
        return run(config);
    }

    /**
     * @throws PipelineStageException wrapping the first error, with the stage it occurred in
     */
    public PipelineRunResult run(PipelineConfig config) {
        String runId = "run-" + UUID.randomUUID();
        MDC.put(MDC_RUN_ID, runId);
        PipelineRun run = new PipelineRun(runId);
        long started = System.currentTimeMillis();
        Path outputRoot = Paths.get(config.getData().getOutputPath()).toAbsolutePath().normalize();
        Path profilingRoot = Paths.get(config.getData().getProfilingPath()).toAbsolutePath().normalize();
        log.info("[RUNNER] Starting '{}' run {} → {}", config.getPipelineName(), runId, outputRoot);

        try (ExecutionContext ctx = stage(run, PipelineState.EXTRACTED, () -> ExecutionContext.open(config, runId, outputRoot))) {
            Pipeline build = ctx.newPipeline();
            PCollectionTuple raw = stage(run, PipelineState.EXTRACTED, () -> extract(build, config));
            run.advance(PipelineState.EXTRACTED);

            PCollectionTuple withDimensions = stage(run, PipelineState.DIMENSIONS_BUILT, () -> StarSchemaAssembler.withDimensions(raw));
            run.advance(PipelineState.DIMENSIONS_BUILT);

            Map<String, Long> rowCounts = stage(run, PipelineState.FACT_BUILT, () -> {
                PCollectionTuple tables = StarSchemaAssembler.withFact(withDimensions);
                stageTables(tables, ctx.tablesDir());
                Map<String, Long> counted = execute(build, "build");
                Map<String, Long> all = new LinkedHashMap<>();
                TableNames.OUTPUT_TABLES.forEach(t -> all.put(t, counted.getOrDefault(t, 0L)));
                return all;
            });
            run.advance(PipelineState.FACT_BUILT);

            DqReport dqReport = stage(run, PipelineState.VALIDATED, () -> validate(ctx, config, runId));
            run.advance(PipelineState.VALIDATED);

            ProfileReport profileReport = stage(run, PipelineState.PROFILED, () -> profile(ctx, config, runId));
            run.advance(PipelineState.PROFILED);

            Path profilePath = profilingRoot.resolve(PROFILE_REPORT_FILE);
            Path dqPath = profilingRoot.resolve(DQ_REPORT_FILE);
            stage(run, PipelineState.PERSISTED, () -> {
                Path stagedProfile = reportWriter.write(profileReport, ctx.workDir().resolve(PROFILE_REPORT_FILE));
                Path stagedDq = reportWriter.write(dqReport, ctx.workDir().resolve(DQ_REPORT_FILE));
                TablePublisher.Publication publication =
                        tablePublisher.publish(ctx.tablesDir(), TableNames.OUTPUT_TABLES, outputRoot);
                // reports go last; replace() undoes the tables if either cannot be placed
                publication.replace(stagedProfile, profilePath);
                publication.replace(stagedDq, dqPath);
                publication.commit();
                return dqPath;
            });
            run.advance(PipelineState.PERSISTED);

            long elapsed = System.currentTimeMillis() - started;
            metricsCollector.recordRunSuccess(elapsed);
            log.info("[RUNNER] Run {} finished in {} ms: {} tables published, {} of {} DQ rules failed",
                    runId, elapsed, TableNames.OUTPUT_TABLES.size(), dqReport.getRulesFailed(), dqReport.getRulesEvaluated());
            return PipelineRunResult.builder()
                    .runId(runId)
                    .state(run.getState())
                    .history(run.getHistory())
                    .tableRowCounts(rowCounts)
                    .dqReport(dqReport)
                    .profileReport(profileReport)
                    .outputPath(outputRoot)
                    .profileReportPath(profilePath)
                    .dqReportPath(dqPath)
                    .build();
        } catch (PipelineStageException e) {
            metricsCollector.recordRunFailure(System.currentTimeMillis() - started);
            ErrorCategory category = ErrorCategory.categorize(e.getCause());
            log.error("[RUNNER] Run {} failed in stage {} [{}]: {}",
                    runId, e.getStage(), category.getName(), e.getCause().getMessage(), e.getCause());
            throw e;
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    // ------------------------------------------------------------------ //
    // Stages                                                               //
    // ------------------------------------------------------------------ //

    private PCollectionTuple extract(Pipeline pipeline, PipelineConfig config) {
        sourceDownloader.ensureSources(config.getData());
        Map<String, PCollection<Row>> raw = new LinkedHashMap<>();
        for (String table : SchemaRegistry.rawTables()) {
            raw.put(table, sourceHandler.read(pipeline, table, config.getData()));
        }
        return Tables.of(pipeline, raw);
    }

    private void stageTables(PCollectionTuple tables, Path tablesDir) {
        for (String table : TableNames.OUTPUT_TABLES) {
            PCollection<Row> rows = Tables.get(tables, table);
            rows.apply("CountRows/" + table, ParDo.of(new CountRowsFn(table)));
            ParquetTableStore.write(rows, table, tablesDir);
        }
    }

    private DqReport validate(ExecutionContext ctx, PipelineConfig config, String runId) {
        DataQualityValidator validator = new DataQualityValidator(
                StandardRules.battery(config.getDataQuality()), config.getDataQuality().getSampleSize());
        Pipeline pipeline = ctx.newPipeline();
        PCollectionTuple snapshot = readSnapshot(pipeline, ctx.tablesDir(), TableNames.OUTPUT_TABLES);
        Path resultsFile = ctx.workDir().resolve("dq_results.jsonl");
        validator.evaluate(snapshot)
                .apply("EncodeRuleResults", MapElements.into(TypeDescriptors.strings()).via(JsonSupport.<DqRuleResult>toJsonLine()))
                .apply("WriteRuleResults", TextIO.write().to(resultsFile.toString()).withoutSharding());
        execute(pipeline, "validation");

        DqReport report = validator.report(config.getPipelineName(), runId,
                JsonSupport.readJsonLines(resultsFile, DqRuleResult.class));
        report.getResults().forEach(r -> metricsCollector.recordRuleResult(r.failed(), r.getViolationCount()));
        if (config.getDataQuality().isFailFast() && report.hasFailures()) {
            throw new DataQualityViolationException(report.getFailedRuleIds());
        }
        return report;
    }

    private ProfileReport profile(ExecutionContext ctx, PipelineConfig config, String runId) {
        DataProfiler profiler = DataProfiler.factSales(config.getDataQuality());
        Pipeline pipeline = ctx.newPipeline();
        PCollection<Row> fact = ParquetTableStore.read(pipeline, profiler.table(), ctx.tablesDir());
        Path profilesFile = ctx.workDir().resolve("profiles.jsonl");
        profiler.profile(fact)
                .apply("EncodeProfiles", MapElements.into(TypeDescriptors.strings()).via(JsonSupport.<ColumnProfile>toJsonLine()))
                .apply("WriteProfiles", TextIO.write().to(profilesFile.toString()).withoutSharding());
        execute(pipeline, "profiling");
        return profiler.report(runId, JsonSupport.readJsonLines(profilesFile, ColumnProfile.class));
    }

    static PCollectionTuple readSnapshot(Pipeline pipeline, Path tablesDir, List<String> tables) {
        Map<String, PCollection<Row>> snapshot = new LinkedHashMap<>();
        for (String table : tables) {
            snapshot.put(table, ParquetTableStore.read(pipeline, table, tablesDir));
        }
        return Tables.of(pipeline, snapshot);
    }

    // ------------------------------------------------------------------ //
    // Helpers                                                              //
    // ------------------------------------------------------------------ //

    /** Runs {@code pipeline} to completion and returns the staged row count per table. */
    private Map<String, Long> execute(Pipeline pipeline, String name) {
        long started = System.currentTimeMillis();
        PipelineResult result = pipeline.run();
        PipelineResult.State state = result.waitUntilFinish();
        long elapsed = System.currentTimeMillis() - started;
        metricsCollector.recordStage(name, elapsed);
        log.info("[RUNNER] {} pipeline finished with state {} in {} ms", name, state, elapsed);
        if (state != PipelineResult.State.DONE) {
            throw new IllegalStateException(name + " pipeline ended in state " + state);
        }

        Map<String, Long> counts = new LinkedHashMap<>();
        MetricQueryResults mqr = result.metrics().queryMetrics(
                MetricsFilter.builder()
                        .addNameFilter(MetricNameFilter.inNamespace(METRICS_NAMESPACE))
                        .build());
        StreamSupport.stream(mqr.getCounters().spliterator(), false)
                .filter(m -> m.getAttempted() != null)
                .forEach(m -> counts.merge(m.getName().getName().substring("rows_".length()), m.getAttempted(), Long::sum));
        counts.forEach((table, rows) -> {
            log.info("[RUNNER] {}: {} rows", table, rows);
            metricsCollector.recordTableRows(table, rows);
        });
        return counts;
    }

    /**
     * Runs one unit of work for {@code stage}; any failure marks the run failed and is rethrown as
     * {@link PipelineStageException} carrying the root error.
     */
    private <T> T stage(PipelineRun run, PipelineState stage, Supplier<T> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            if (!run.getState().isTerminal()) {
                run.fail(stage);
            }
            throw new PipelineStageException(stage, cause);
        }
    }

    static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof Pipeline.PipelineExecutionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** Counts rows of one table into the {@value #METRICS_NAMESPACE} namespace. */
    static class CountRowsFn extends DoFn<Row, Void> {
        private final Counter counter;

        CountRowsFn(String table) {
            this.counter = Metrics.counter(METRICS_NAMESPACE, "rows_" + Objects.requireNonNull(table));
        }

        @ProcessElement
        public void process(@Element Row r) {
            counter.inc();
        }
    }
}
