package com.di.starnova.exception;

import org.apache.beam.sdk.Pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for run failures, used in the failure log line and the exit summary.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>The cause chain is walked outermost first, so a {@link Pipeline.PipelineExecutionException}
 * raised by the runner is classified by the exception thrown inside the transform.
 * To add a new category: add the enum constant (before APPLICATION_ERROR) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Pipeline configuration is missing, unreadable or invalid"),
    SCHEMA_ERROR("Schema error", "Unknown table or column declarations differ from the registry"),
    SOURCE_ERROR("Source error", "Raw source file is missing or could not be downloaded"),
    MALFORMED_RECORD("Malformed record", "Source value cannot be parsed to its declared type"),
    KEY_DERIVATION_ERROR("Key derivation error", "Surrogate key could not be derived or collided"),
    DATA_QUALITY_VIOLATION("Data quality violation", "Data quality rule failed in fail-fast mode"),
    PERSISTENCE_ERROR("Persistence error", "Staged tables or reports could not be written or published"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    VALIDATION_ERROR("Validation error", "Illegal argument or state"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private static final int MAX_CAUSE_DEPTH = 16;

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. Domain exceptions come before the generic JDK matchers. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof PipelineConfigurationException, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof UnknownTableException || t instanceof SchemaMismatchException, SCHEMA_ERROR);
        MATCHERS.put(t -> t instanceof SourceNotFoundException, SOURCE_ERROR);
        MATCHERS.put(t -> t instanceof MalformedRecordException, MALFORMED_RECORD);
        MATCHERS.put(t -> t instanceof KeyDerivationException, KEY_DERIVATION_ERROR);
        MATCHERS.put(t -> t instanceof DataQualityViolationException, DATA_QUALITY_VIOLATION);
        MATCHERS.put(t -> t instanceof PersistenceException, PERSISTENCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        Throwable current = exception;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
                if (e.getKey().test(current)) {
                    return e.getValue();
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        if (isResourceError(exception)) {
            return RESOURCE_ERROR;
        }
        if (isValidationError(exception)) {
            return VALIDATION_ERROR;
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || t instanceof java.nio.file.FileSystemException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    @Override
    public String toString() {
        return name();
    }
}
