package com.phillippitts.meetingscribe.presentation.exception;

import com.phillippitts.meetingscribe.exception.JobNotFoundException;
import com.phillippitts.meetingscribe.exception.RetryUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesJobNotFoundReturns404() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleJobNotFound(new JobNotFoundException("job-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("JobNotFoundException");
        assertThat(response.getBody().details()).isEqualTo("Transcription job not found: job-1");
    }

    @Test
    void verifiesRetryUnavailableReturns409WithReason() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleRetryUnavailable(
                new RetryUnavailableException("evt-1", "Audio files are no longer available. Please record again."));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().message()).isEqualTo("Transcription cannot be retried");
        assertThat(response.getBody().details()).contains("Please record again");
    }

    @Test
    void verifiesIllegalArgumentReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalArgument(new IllegalArgumentException("eventId must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().details()).isEqualTo("eventId must not be blank");
    }

    @Test
    void verifiesUnexpectedErrorHidesDetails() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("Transcription queue is shut down"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().details()).doesNotContain("shut down");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
