package com.di.starnova.exception;

import org.apache.beam.sdk.Pipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // Basic Enum Tests
    // ============================================================================

    @Test
    @DisplayName("Should return name and description for every category")
    void testGetNameAndDescription() {
        for (ErrorCategory category : ErrorCategory.values()) {
            assertFalse(category.getName().isEmpty());
            assertFalse(category.getDescription().isEmpty());
            assertEquals(category.name(), category.toString());
        }
    }

    // ============================================================================
    // Categorization Tests
    // ============================================================================

    static Stream<Arguments> domainExceptions() {
        return Stream.of(
                Arguments.of(new PipelineConfigurationException("bad"), ErrorCategory.CONFIGURATION_ERROR),
                Arguments.of(new UnknownTableException("payments"), ErrorCategory.SCHEMA_ERROR),
                Arguments.of(new SchemaMismatchException("orders"), ErrorCategory.SCHEMA_ERROR),
                Arguments.of(new SourceNotFoundException("missing"), ErrorCategory.SOURCE_ERROR),
                Arguments.of(new MalformedRecordException("abc"), ErrorCategory.MALFORMED_RECORD),
                Arguments.of(new KeyDerivationException("null key"), ErrorCategory.KEY_DERIVATION_ERROR),
                Arguments.of(new DataQualityViolationException(List.of("accepted_values.fact_sales.order_status")),
                        ErrorCategory.DATA_QUALITY_VIOLATION),
                Arguments.of(new PersistenceException("rename"), ErrorCategory.PERSISTENCE_ERROR));
    }

    @ParameterizedTest
    @MethodSource("domainExceptions")
    @DisplayName("Should categorize domain exceptions")
    void testCategorize_DomainExceptions(Throwable exception, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(exception));
        assertEquals(expected, ((StarNovaException) exception).getCategory());
    }

    @Test
    @DisplayName("Should classify by the cause inside a Beam execution exception")
    void testCategorize_UnwrapsPipelineExecutionException() {
        Throwable wrapped = new Pipeline.PipelineExecutionException(new MalformedRecordException("orders record 7"));
        assertEquals(ErrorCategory.MALFORMED_RECORD, ErrorCategory.categorize(wrapped));
    }

    @Test
    @DisplayName("Should fall back to resource, validation and application errors")
    void testCategorize_Fallbacks() {
        assertEquals(ErrorCategory.RESOURCE_ERROR, ErrorCategory.categorize(new UncheckedIOException(new IOException("disk"))));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new IllegalStateException("state")));
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new RuntimeException("boom")));
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @Test
    @DisplayName("Should expose failed rule ids on a data quality violation")
    void testDataQualityViolationException() {
        DataQualityViolationException e = new DataQualityViolationException(List.of("a", "b"));
        assertEquals(List.of("a", "b"), e.getFailedRuleIds());
        assertTrue(e.getMessage().contains("a"));
    }
}
