package uk.gegc.checkpointsync.shared.api.advice;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import uk.gegc.checkpointsync.features.benchmark.domain.DuplicateMergeException;
import uk.gegc.checkpointsync.features.checkpoint.domain.CheckpointConversionException;
import uk.gegc.checkpointsync.shared.api.problem.ErrorTypes;
import uk.gegc.checkpointsync.shared.exception.ResourceNotFoundException;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private GlobalExceptionHandler handler;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler(Clock.fixed(NOW, ZoneOffset.UTC));
        request = new MockHttpServletRequest("PUT", "/api/v1/benchmarks/capitals");
    }

    @Test
    @DisplayName("not found maps to 404 with instance and timestamp")
    void handleResourceNotFound_returns404() {
        ResponseEntity<ProblemDetail> response =
                handler.handleResourceNotFound(new ResourceNotFoundException("Benchmark capitals not found"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        ProblemDetail problem = response.getBody();
        assertThat(problem).isNotNull();
        assertThat(problem.getType()).isEqualTo(ErrorTypes.RESOURCE_NOT_FOUND);
        assertThat(problem.getDetail()).isEqualTo("Benchmark capitals not found");
        assertThat(problem.getInstance()).isEqualTo(URI.create("/api/v1/benchmarks/capitals"));
        assertThat(problem.getProperties()).containsEntry("timestamp", NOW);
    }

    @Test
    @DisplayName("conversion failure maps to 422")
    void handleConversionFailed_returns422() {
        ResponseEntity<ProblemDetail> response = handler.handleConversionFailed(
                new CheckpointConversionException("Dataset has no hasPart array"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().getType()).isEqualTo(ErrorTypes.CONVERSION_FAILED);
    }

    @Test
    @DisplayName("merge failure maps to 409")
    void handleMergeConflict_returns409() {
        ResponseEntity<ProblemDetail> response = handler.handleMergeConflict(
                new DuplicateMergeException("Duplicate q1 has no snapshot for keep_old"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getTitle()).isEqualTo("Merge Conflict");
    }

    @Test
    @DisplayName("illegal argument maps to 400")
    void handleIllegalArgument_returns400() {
        ResponseEntity<ProblemDetail> response =
                handler.handleIllegalArgument(new IllegalArgumentException("Unknown resolution: keep_both"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getType()).isEqualTo(ErrorTypes.INVALID_ARGUMENT);
        assertThat(response.getBody().getDetail()).isEqualTo("Unknown resolution: keep_both");
    }

    @Test
    @DisplayName("unexpected exception maps to 500 without leaking the message")
    void handleAllOthers_returns500() {
        ResponseEntity<ProblemDetail> response =
                handler.handleAllOthers(new IllegalStateException("store corrupted"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getDetail()).isEqualTo("An unexpected error occurred");
    }
}
