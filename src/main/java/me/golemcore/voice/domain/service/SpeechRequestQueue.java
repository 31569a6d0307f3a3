package me.golemcore.voice.domain.service;

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
import me.golemcore.voice.domain.model.SpeechEmotion;
import me.golemcore.voice.domain.model.SpeechQueueStatus;
import me.golemcore.voice.domain.model.SpeechRequest;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import me.golemcore.voice.port.outbound.SpeechLockPort;
import me.golemcore.voice.port.outbound.SpeechSynthesisPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes every utterance of this process through one worker thread.
 *
 * <p>
 * Requests are served by priority (1 highest) and then in submission order. For
 * each request the worker:
 * <ol>
 * <li>checks user presence unless the request opts out</li>
 * <li>strips stage directions from the text</li>
 * <li>acquires the cross-process speech lock within a bounded wait</li>
 * <li>arms the echo window, then synthesizes and plays the text</li>
 * <li>releases the lock</li>
 * </ol>
 *
 * <p>
 * A request that cannot get the lock in time is dropped, never retried.
 * {@link #speakNow} discards queued requests but cannot cut off audio that is
 * already playing.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SpeechRequestQueue {

    private final SpeechLockPort speechLock;
    private final SpeechSynthesisPort speechSynthesis;
    private final EchoSuppressor echoSuppressor;
    private final PresenceGate presenceGate;
    private final Clock clock;
    private final VoiceProperties.QueueProperties config;

    private final PriorityBlockingQueue<SpeechRequest> queue = new PriorityBlockingQueue<>(16,
            SpeechRequest.QUEUE_ORDER);
    private final ReentrantLock submitLock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong spokenCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    private volatile boolean running;
    private ExecutorService worker;

    public SpeechRequestQueue(SpeechLockPort speechLock, SpeechSynthesisPort speechSynthesis,
            EchoSuppressor echoSuppressor, PresenceGate presenceGate, Clock clock,
            VoiceProperties properties) {
        this.speechLock = speechLock;
        this.speechSynthesis = speechSynthesis;
        this.echoSuppressor = echoSuppressor;
        this.presenceGate = presenceGate;
        this.clock = clock;
        this.config = properties.getQueue();
    }

    public void enqueue(String text) {
        enqueue(text, null, config.getDefaultPriority());
    }

    public void enqueue(String text, SpeechEmotion emotion, int priority) {
        enqueue(text, emotion, priority, false);
    }

    /**
     * Queue an utterance without blocking.
     *
     * @param text
     *            text to speak, blank text is ignored
     * @param emotion
     *            delivery emotion, detected from the text when null
     * @param priority
     *            1 (highest) to 10 (lowest), clamped
     * @param skipPresenceCheck
     *            speak even if the user seems to be away
     */
    public void enqueue(String text, SpeechEmotion emotion, int priority, boolean skipPresenceCheck) {
        if (text == null || text.isBlank()) {
            return;
        }
        submitLock.lock();
        try {
            queue.offer(newRequest(text, emotion, priority, skipPresenceCheck));
        } finally {
            submitLock.unlock();
        }
        log.debug("[SpeechQueue] Enqueued (priority {}): {}", priority, text);
    }

    /**
     * Drop everything still waiting and queue this utterance at the highest
     * priority. Presence is still checked for it.
     */
    public void speakNow(String text, SpeechEmotion emotion) {
        if (text == null || text.isBlank()) {
            return;
        }
        submitLock.lock();
        try {
            int discarded = queue.size();
            queue.clear();
            queue.offer(newRequest(text, emotion, SpeechRequest.HIGHEST_PRIORITY, false));
            if (discarded > 0) {
                log.info("[SpeechQueue] Speak-now discarded {} pending request(s)", discarded);
            }
        } finally {
            submitLock.unlock();
        }
    }

    public void clear() {
        submitLock.lock();
        try {
            queue.clear();
        } finally {
            submitLock.unlock();
        }
    }

    public int pendingCount() {
        return queue.size();
    }

    /**
     * Start the worker thread.
     *
     * @return false when speech synthesis is not configured
     */
    public synchronized boolean start() {
        if (running) {
            return true;
        }
        if (!speechSynthesis.isAvailable()) {
            log.warn("[SpeechQueue] Speech synthesis not configured, queue not started");
            return false;
        }
        running = true;
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "speech-queue-worker");
            t.setDaemon(true);
            return t;
        });
        worker.submit(this::runLoop);
        log.info("[SpeechQueue] Started");
        return true;
    }

    /**
     * Stop the worker. Pending requests stay queued.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        worker = null;
        log.info("[SpeechQueue] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public SpeechQueueStatus getStatus() {
        return SpeechQueueStatus.builder()
                .running(running)
                .pendingCount(queue.size())
                .spokenCount(spokenCount.get())
                .droppedCount(droppedCount.get())
                .failedCount(failedCount.get())
                .lockHolder(speechLock.whoHolds().orElse(null))
                .build();
    }

    private void runLoop() {
        while (running) {
            try {
                processNext(config.getPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) { // NOSONAR - keep the worker alive
                log.error("[SpeechQueue] Unexpected error in worker loop", e);
            }
        }
    }

    /**
     * Take one request, waiting up to {@code wait}, and speak it.
     *
     * @return true if a request was taken from the queue
     */
    boolean processNext(Duration wait) throws InterruptedException {
        SpeechRequest request = queue.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
        if (request == null) {
            return false;
        }
        speak(request);
        return true;
    }

    private void speak(SpeechRequest request) {
        if (!request.isSkipPresenceCheck() && !presenceGate.isUserPresent()) {
            log.debug("[SpeechQueue] User away, dropping: {}", request.getText());
            droppedCount.incrementAndGet();
            return;
        }

        String text = SpeechTextSanitizer.sanitize(request.getText());
        if (text.isEmpty()) {
            droppedCount.incrementAndGet();
            return;
        }

        if (!speechLock.acquire(config.getLockTimeout())) {
            log.warn("[SpeechQueue] Speech lock busy (held by {}), dropping: {}",
                    speechLock.whoHolds().orElse("unknown"), text);
            droppedCount.incrementAndGet();
            return;
        }

        try {
            echoSuppressor.startSpeaking(null, text);
            speechSynthesis.synthesizeAndPlay(text, request.getEmotion());
            spokenCount.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("[SpeechQueue] Failed to speak '{}': {}", text, e.getMessage(), e);
            failedCount.incrementAndGet();
        } finally {
            speechLock.release();
        }
    }

    private SpeechRequest newRequest(String text, SpeechEmotion emotion, int priority,
            boolean skipPresenceCheck) {
        return SpeechRequest.builder()
                .text(text)
                .emotion(emotion != null ? emotion : SpeechEmotion.detect(text))
                .priority(SpeechRequest.clampPriority(priority))
                .enqueuedAt(clock.instant())
                .sequence(sequence.incrementAndGet())
                .skipPresenceCheck(skipPresenceCheck)
                .build();
    }
}
