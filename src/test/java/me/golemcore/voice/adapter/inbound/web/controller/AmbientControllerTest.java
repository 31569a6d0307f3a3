package me.golemcore.voice.adapter.inbound.web.controller;

import me.golemcore.voice.adapter.inbound.web.dto.FriendThresholdRequest;
import me.golemcore.voice.adapter.inbound.web.dto.VisualContextRequest;
import me.golemcore.voice.domain.model.AmbientStatus;
import me.golemcore.voice.domain.service.InterjectionResponder;
import me.golemcore.voice.domain.service.InterjectionScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AmbientControllerTest {

    private InterjectionScheduler scheduler;
    private InterjectionResponder responder;
    private AmbientController controller;

    @BeforeEach
    void setUp() {
        scheduler = mock(InterjectionScheduler.class);
        responder = mock(InterjectionResponder.class);
        when(scheduler.getStatus()).thenReturn(AmbientStatus.builder()
                .running(true)
                .friendThreshold(0.5)
                .userActivity("unknown")
                .build());
        when(scheduler.getFriendThreshold()).thenReturn(0.5);
        controller = new AmbientController(scheduler, responder);
    }

    @Test
    void shouldSetFriendThreshold() {
        StepVerifier.create(controller.setThreshold(FriendThresholdRequest.builder().threshold(0.8).build()))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();

        verify(scheduler).setFriendThreshold(0.8);
    }

    @Test
    void shouldRequireThreshold() {
        assertThrows(IllegalArgumentException.class, () -> controller.setThreshold(new FriendThresholdRequest()));
    }

    @Test
    void shouldStartWithResponderAndCurrentThreshold() {
        when(scheduler.start(responder, 0.5)).thenReturn(true);

        StepVerifier.create(controller.start())
                .assertNext(response -> assertEquals(0.5, response.getBody().getFriendThreshold()))
                .verifyComplete();
    }

    @Test
    void shouldFailToStartWhenDisabled() {
        when(scheduler.start(responder, 0.5)).thenReturn(false);

        assertThrows(IllegalStateException.class, () -> controller.start());
    }

    @Test
    void shouldStop() {
        StepVerifier.create(controller.stop())
                .expectNextCount(1)
                .verifyComplete();

        verify(scheduler).stop();
    }

    @Test
    void shouldAcceptVisualContextWhileRunning() {
        when(scheduler.isRunning()).thenReturn(true);
        VisualContextRequest request = VisualContextRequest.builder().camera("person typing").build();

        StepVerifier.create(controller.updateVisualContext(request))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();

        verify(scheduler).updateVisualContext("person typing", null);
    }

    @Test
    void shouldRejectEmptyVisualContext() {
        VisualContextRequest request = VisualContextRequest.builder().camera(" ").build();

        assertThrows(IllegalArgumentException.class, () -> controller.updateVisualContext(request));
    }

    @Test
    void shouldRejectVisualContextWhenStopped() {
        when(scheduler.isRunning()).thenReturn(false);
        VisualContextRequest request = VisualContextRequest.builder().screen("IDE with an error").build();

        assertThrows(IllegalStateException.class, () -> controller.updateVisualContext(request));
        verify(scheduler, never()).updateVisualContext(any(), any());
    }
}
