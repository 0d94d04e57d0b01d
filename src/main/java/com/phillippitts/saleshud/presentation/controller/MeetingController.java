package com.phillippitts.saleshud.presentation.controller;

import com.phillippitts.saleshud.domain.MeetingConfig;
import com.phillippitts.saleshud.domain.MeetingPlatform;
import com.phillippitts.saleshud.domain.MeetingStatusReport;
import com.phillippitts.saleshud.domain.MeetingSummary;
import com.phillippitts.saleshud.domain.MeetingType;
import com.phillippitts.saleshud.domain.Participant;
import com.phillippitts.saleshud.domain.ParticipantRole;
import com.phillippitts.saleshud.service.orchestration.MeetingOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST surface over the meeting lifecycle. Thin: validation and mapping only.
 */
@RestController
@RequestMapping("/api/meetings")
class MeetingController {

    private static final Logger LOG = LogManager.getLogger(MeetingController.class);

    private final MeetingOrchestrator orchestrator;

    MeetingController(MeetingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> start(@Valid @RequestBody StartMeetingRequest request) {
        UUID id = orchestrator.startMeeting(request.toConfig());
        LOG.info("Meeting {} started via API", id);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("meetingId", id.toString()));
    }

    @PostMapping("/{id}/pause")
    ResponseEntity<MeetingStatusReport> pause(@PathVariable UUID id) {
        orchestrator.pauseMeeting(id);
        return ResponseEntity.ok(orchestrator.getStatus(id));
    }

    @PostMapping("/{id}/resume")
    ResponseEntity<MeetingStatusReport> resume(@PathVariable UUID id) {
        orchestrator.resumeMeeting(id);
        return ResponseEntity.ok(orchestrator.getStatus(id));
    }

    @PostMapping("/{id}/stop")
    ResponseEntity<MeetingSummary> stop(@PathVariable UUID id) {
        return ResponseEntity.ok(orchestrator.stopMeeting(id));
    }

    @GetMapping("/{id}")
    ResponseEntity<MeetingStatusReport> status(@PathVariable UUID id) {
        return ResponseEntity.ok(orchestrator.getStatus(id));
    }

    /**
     * Body of {@code POST /api/meetings}. Feature flags default to transcription, insights and
     * summary on, recording off.
     */
    record StartMeetingRequest(
            @NotBlank String title,
            @NotBlank String type,
            String platform,
            List<@Valid ParticipantRequest> participants,
            Instant scheduledStart,
            @PositiveOrZero Long scheduledDurationMinutes,
            Boolean enableTranscription,
            Boolean enableInsights,
            Boolean enableRecording,
            Boolean autoGenerateSummary
    ) {
        MeetingConfig toConfig() {
            List<Participant> mapped = participants == null ? List.of()
                    : participants.stream().map(ParticipantRequest::toParticipant).toList();
            return new MeetingConfig(title, MeetingType.fromValue(type), MeetingPlatform.fromValue(platform),
                    mapped, scheduledStart,
                    scheduledDurationMinutes == null ? null : Duration.ofMinutes(scheduledDurationMinutes),
                    flag(enableTranscription, true), flag(enableInsights, true),
                    flag(enableRecording, false), flag(autoGenerateSummary, true));
        }

        private static boolean flag(Boolean value, boolean defaultValue) {
            return value == null ? defaultValue : value;
        }
    }

    record ParticipantRequest(
            String id,
            @NotBlank String name,
            String email,
            String role,
            String company,
            String title
    ) {
        Participant toParticipant() {
            return new Participant(id, name, email, ParticipantRole.fromValue(role), company, title);
        }
    }
}
