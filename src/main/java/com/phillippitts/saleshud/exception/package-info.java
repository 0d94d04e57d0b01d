/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.saleshud.exception.SalesHudException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.saleshud.exception.ServiceException} - Failure of a remote
 *       dependency or the audio device, classified by {@link com.phillippitts.saleshud.exception.ErrorKind}
 *       and carrying a retryable flag</li>
 *   <li>{@link com.phillippitts.saleshud.exception.CircuitOpenException} - Call short-circuited
 *       by an open circuit breaker</li>
 *   <li>{@link com.phillippitts.saleshud.exception.AudioPipelineException} - Capture device
 *       could not be acquired or was lost</li>
 *   <li>{@link com.phillippitts.saleshud.exception.MeetingNotFoundException},
 *       {@link com.phillippitts.saleshud.exception.IllegalMeetingStateException} and
 *       {@link com.phillippitts.saleshud.exception.MeetingStartException} - Meeting lifecycle
 *       contract violations</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.saleshud.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.saleshud.exception;
