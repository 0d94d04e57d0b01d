/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - unique identifier for each HTTP request</li>
 *   <li>{@code meetingId} - meeting the request or background task belongs to; set by
 *       {@link com.phillippitts.saleshud.config.logging.MdcFilter} and by the orchestrator for
 *       lifecycle calls, then carried to worker threads by the executors' task decorator</li>
 * </ul>
 *
 * <p>Log format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] [meetingId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.saleshud.config.logging;
