package me.golemcore.voice.adapter.outbound.voice;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.voice.port.outbound.AudioPlaybackPort;
import me.golemcore.voice.port.outbound.SpeechSynthesisPort.SpeechSynthesisException;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;

/**
 * Plays 16-bit mono PCM through the default Java Sound output line.
 */
@Component
@Slf4j
public class JavaSoundAudioPlayer implements AudioPlaybackPort {

    private static final int SAMPLE_SIZE_BITS = 16;
    private static final int CHANNELS = 1;

    @Override
    public void playPcm(byte[] pcm, int sampleRate) {
        if (pcm == null || pcm.length == 0) {
            return;
        }
        AudioFormat format = pcmFormat(sampleRate);
        DataLine.Info lineInfo = new DataLine.Info(SourceDataLine.class, format);

        try (SourceDataLine line = openLine(lineInfo)) {
            line.open(format);
            line.start();
            line.write(pcm, 0, pcm.length);
            line.drain();
            line.stop();
            log.debug("[Audio] Played {} bytes at {}Hz", pcm.length, sampleRate);
        } catch (LineUnavailableException | IllegalArgumentException e) {
            throw new SpeechSynthesisException("Audio output unavailable: " + e.getMessage(), e);
        }
    }

    protected SourceDataLine openLine(DataLine.Info lineInfo) throws LineUnavailableException {
        return (SourceDataLine) AudioSystem.getLine(lineInfo);
    }

    static AudioFormat pcmFormat(int sampleRate) {
        return new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, sampleRate, SAMPLE_SIZE_BITS, CHANNELS,
                CHANNELS * SAMPLE_SIZE_BITS / 8, sampleRate, false);
    }
}
