package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.exception.ErrorKind;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a meeting-level error is recorded on the session, so the UI can notify the user.
 *
 * @param meetingId affected meeting
 * @param kind      error classification
 * @param message   short, privacy-safe description
 * @param timestamp when the error was recorded
 */
public record MeetingErrorEvent(UUID meetingId, ErrorKind kind, String message, Instant timestamp) {}
