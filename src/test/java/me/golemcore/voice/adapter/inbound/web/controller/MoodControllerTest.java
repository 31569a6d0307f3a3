package me.golemcore.voice.adapter.inbound.web.controller;

import me.golemcore.voice.adapter.inbound.web.dto.MoodEventRequest;
import me.golemcore.voice.domain.model.MoodEvent;
import me.golemcore.voice.domain.model.MoodLabel;
import me.golemcore.voice.domain.model.MoodSnapshot;
import me.golemcore.voice.domain.service.MoodState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

class MoodControllerTest {

    private MoodState moodState;
    private MoodController controller;

    @BeforeEach
    void setUp() {
        moodState = mock(MoodState.class);
        when(moodState.getSnapshot()).thenReturn(MoodSnapshot.builder()
                .happiness(0.2)
                .mood(MoodLabel.HAPPY)
                .build());
        controller = new MoodController(moodState);
    }

    @Test
    void shouldApplyEventWithDefaultIntensity() {
        StepVerifier.create(controller.applyEvent(MoodEventRequest.builder().event("task_completed").build()))
                .assertNext(response -> assertEquals(MoodLabel.HAPPY, response.getBody().getMood()))
                .verifyComplete();

        verify(moodState).applyEvent(MoodEvent.TASK_COMPLETED);
    }

    @Test
    void shouldApplyEventWithExplicitIntensity() {
        StepVerifier.create(controller.applyEvent(MoodEventRequest.builder().event("insult").intensity(0.5).build()))
                .expectNextCount(1)
                .verifyComplete();

        verify(moodState).applyEvent(MoodEvent.INSULT, 0.5);
    }

    @Test
    void shouldRejectUnknownEvent() {
        MoodEventRequest request = MoodEventRequest.builder().event("nap").build();

        assertThrows(IllegalArgumentException.class, () -> controller.applyEvent(request));
        verifyNoMoreInteractions(moodState);
    }

    @Test
    void shouldReturnHistory() {
        when(moodState.getHistory()).thenReturn(List.of());

        StepVerifier.create(controller.getHistory())
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
    }

    @Test
    void shouldResetMood() {
        StepVerifier.create(controller.reset())
                .expectNextCount(1)
                .verifyComplete();

        verify(moodState).reset();
    }
}
