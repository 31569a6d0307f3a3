package me.golemcore.voice.adapter.outbound.voice;

import me.golemcore.voice.port.outbound.SpeechSynthesisPort.SpeechSynthesisException;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class JavaSoundAudioPlayerTest {

    @Test
    void shouldWriteSamplesAndDrain() throws Exception {
        SourceDataLine line = mock(SourceDataLine.class);
        JavaSoundAudioPlayer player = playerWith(line);
        byte[] pcm = new byte[] { 0, 1, 2, 3 };

        player.playPcm(pcm, 22050);

        InOrder order = inOrder(line);
        order.verify(line).open(any(AudioFormat.class));
        order.verify(line).start();
        order.verify(line).write(pcm, 0, 4);
        order.verify(line).drain();
        order.verify(line).stop();
        order.verify(line).close();
    }

    @Test
    void shouldSkipEmptyAudio() {
        SourceDataLine line = mock(SourceDataLine.class);

        playerWith(line).playPcm(new byte[0], 22050);

        verifyNoInteractions(line);
    }

    @Test
    void shouldWrapUnavailableLine() throws Exception {
        SourceDataLine line = mock(SourceDataLine.class);
        doThrow(new LineUnavailableException("busy")).when(line).open(any(AudioFormat.class));

        assertThrows(SpeechSynthesisException.class, () -> playerWith(line).playPcm(new byte[] { 1, 2 }, 16000));
        verify(line, never()).write(any(), anyInt(),
                anyInt());
        verify(line).close();
    }

    @Test
    void shouldDescribeSigned16BitMonoLittleEndian() {
        AudioFormat format = JavaSoundAudioPlayer.pcmFormat(22050);

        assertEquals(AudioFormat.Encoding.PCM_SIGNED, format.getEncoding());
        assertEquals(22050f, format.getSampleRate());
        assertEquals(16, format.getSampleSizeInBits());
        assertEquals(1, format.getChannels());
        assertEquals(2, format.getFrameSize());
        assertFalse(format.isBigEndian());
    }

    private static JavaSoundAudioPlayer playerWith(SourceDataLine line) {
        return new JavaSoundAudioPlayer() {
            @Override
            protected SourceDataLine openLine(DataLine.Info lineInfo) {
                return line;
            }
        };
    }
}
