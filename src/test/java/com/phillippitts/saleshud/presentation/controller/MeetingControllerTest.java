package com.phillippitts.saleshud.presentation.controller;

import com.phillippitts.saleshud.domain.MeetingConfig;
import com.phillippitts.saleshud.domain.MeetingPlatform;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.domain.MeetingType;
import com.phillippitts.saleshud.domain.ParticipantRole;
import com.phillippitts.saleshud.exception.IllegalMeetingStateException;
import com.phillippitts.saleshud.exception.MeetingNotFoundException;
import com.phillippitts.saleshud.service.orchestration.MeetingOrchestrator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MeetingController.class)
class MeetingControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private MeetingOrchestrator orchestrator;

    @Test
    void shouldStartMeetingWithDefaultFlags() throws Exception {
        // Arrange
        UUID id = UUID.randomUUID();
        when(orchestrator.startMeeting(any())).thenReturn(id);
        String body = """
                {"title": "Acme discovery", "type": "discovery", "platform": "zoom",
                 "scheduledDurationMinutes": 30,
                 "participants": [{"name": "Dana", "role": "presenter", "company": "Acme"}]}
                """;

        // Act
        mvc.perform(post("/api/meetings").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.meetingId").value(id.toString()));

        // Assert
        ArgumentCaptor<MeetingConfig> config = ArgumentCaptor.forClass(MeetingConfig.class);
        verify(orchestrator).startMeeting(config.capture());
        assertThat(config.getValue().type()).isEqualTo(MeetingType.DISCOVERY);
        assertThat(config.getValue().platform()).isEqualTo(MeetingPlatform.ZOOM);
        assertThat(config.getValue().scheduledDuration()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.getValue().participants()).singleElement()
                .satisfies(p -> assertThat(p.role()).isEqualTo(ParticipantRole.PRESENTER));
        assertThat(config.getValue().enableTranscription()).isTrue();
        assertThat(config.getValue().enableRecording()).isFalse();
    }

    @Test
    void shouldRejectBlankTitleWith400() throws Exception {
        String body = """
                {"title": " ", "type": "sales"}
                """;

        mvc.perform(post("/api/meetings").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

        verify(orchestrator, never()).startMeeting(any());
    }

    @Test
    void shouldRejectUnknownMeetingTypeWith400() throws Exception {
        String body = """
                {"title": "Call", "type": "webinar"}
                """;

        mvc.perform(post("/api/meetings").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturn404ForUnknownMeeting() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.getStatus(id)).thenThrow(new MeetingNotFoundException(id));

        mvc.perform(get("/api/meetings/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("MeetingNotFoundException"));
    }

    @Test
    void shouldReturn409WhenPausingPausedMeeting() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new IllegalMeetingStateException(id, MeetingState.PAUSED, "pause"))
                .when(orchestrator).pauseMeeting(id);

        mvc.perform(post("/api/meetings/{id}/pause", id))
                .andExpect(status().isConflict());
    }
}
