package com.phillippitts.saleshud.presentation.exception;

import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.exception.CircuitOpenException;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.IllegalMeetingStateException;
import com.phillippitts.saleshud.exception.MeetingNotFoundException;
import com.phillippitts.saleshud.exception.MeetingStartException;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.exception.ServiceExceptionBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapUnknownMeetingTo404() {
        UUID id = UUID.randomUUID();

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleNotFound(new MeetingNotFoundException(id));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("MeetingNotFoundException");
        assertThat(response.getBody().details()).contains(id.toString());
    }

    @Test
    void shouldMapIllegalStateTo409() {
        IllegalMeetingStateException ex =
                new IllegalMeetingStateException(UUID.randomUUID(), MeetingState.PAUSED, "pause");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleIllegalState(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().details()).contains("PAUSED");
    }

    @Test
    void shouldMapStartFailureByKind() {
        ResponseEntity<GlobalExceptionHandler.ApiError> auth = handler.handleStartFailure(
                new MeetingStartException("rejected", ErrorKind.AUTH_FAILED, null));
        ResponseEntity<GlobalExceptionHandler.ApiError> connection = handler.handleStartFailure(
                new MeetingStartException("unreachable", ErrorKind.CONNECTION_FAILED, null));

        assertThat(auth.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(auth.getBody().errorCode()).isEqualTo("AUTH_FAILED");
        assertThat(connection.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void shouldMapOpenCircuitTo503WithRetryTime() {
        Instant retryAt = Instant.parse("2026-01-15T10:01:00Z");

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleCircuitOpen(new CircuitOpenException(Dependency.TRANSCRIPTION, retryAt));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).isEqualTo("Retry after " + retryAt);
    }

    @Test
    void shouldHideDependencyDetailsFromClients() {
        ServiceException ex = ServiceExceptionBuilder.create("backend said no", ErrorKind.QUOTA_EXCEEDED)
                .metadata("status", 402)
                .build();

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleServiceFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().details()).isEqualTo("Contact administrator");
        assertThat(response.getBody().toString()).doesNotContain("backend said no");
    }

    @Test
    void shouldMapInvalidInputTo400AndUnexpectedTo500() {
        ResponseEntity<GlobalExceptionHandler.ApiError> bad =
                handler.handleBadRequest(new IllegalArgumentException("meetingType required"));
        ResponseEntity<GlobalExceptionHandler.ApiError> unexpected =
                handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(bad.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(bad.getBody().details()).isEqualTo("meetingType required");
        assertThat(unexpected.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(unexpected.getBody().details()).doesNotContain("boom");
    }

    @Test
    void shouldStampResponsesWithCurrentTime() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleNotFound(new MeetingNotFoundException(UUID.randomUUID()));

        assertThat(response.getBody().timestamp()).isAfter(before);
    }
}
