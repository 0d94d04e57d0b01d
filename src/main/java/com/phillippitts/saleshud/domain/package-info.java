/**
 * Meeting domain models.
 *
 * <p>Everything here is an immutable record or enum validated on construction. Mutable per-meeting
 * state lives in the orchestrator's session and is exposed only through these snapshots.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.saleshud.domain.MeetingConfig} - caller-supplied meeting settings</li>
 *   <li>{@link com.phillippitts.saleshud.domain.TranscriptEntry} - one attributed utterance</li>
 *   <li>{@link com.phillippitts.saleshud.domain.SpeakerProfile} - per-speaker running aggregate</li>
 *   <li>{@link com.phillippitts.saleshud.domain.Insight} - AI-derived observation</li>
 *   <li>{@link com.phillippitts.saleshud.domain.MeetingSummary} - result of stopping a meeting</li>
 * </ul>
 */
package com.phillippitts.saleshud.domain;
