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
import me.golemcore.voice.domain.model.AmbientStatus;
import me.golemcore.voice.domain.model.InterjectReason;
import me.golemcore.voice.domain.model.InterjectionEvent;
import me.golemcore.voice.domain.model.SensorContext;
import me.golemcore.voice.domain.model.TriggerDecision;
import me.golemcore.voice.domain.model.VisionSource;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import me.golemcore.voice.port.outbound.VisionPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.random.RandomGenerator;

/**
 * Decides when the assistant speaks up without being asked.
 *
 * <p>
 * The scheduler owns a {@link SensorContext} built from what the assistant
 * hears and sees. All reads and writes of that context happen on a single
 * thread ({@code ambient-awareness}) which also runs the once-per-second tick:
 * <ul>
 * <li>Transcripts and vision descriptions are posted to that thread as
 * messages</li>
 * <li>After each transcript the {@link InterjectionRuleTable} picks a reason
 * and a probability roll decides whether to interject</li>
 * <li>The tick accumulates silence and runs periodic screen and camera
 * probes</li>
 * </ul>
 *
 * <p>
 * The friend threshold (0 quiet, 1 very chatty) scales every chance, including
 * the long-silence check-in. At 0 the assistant only answers when addressed.
 * Sensor context, probe timestamps and the interjection count are cleared on
 * stop and on start. A cooldown separates interjections:
 * 30 seconds normally, five minutes while the user seems busy.
 *
 * @since 1.0
 * @see InterjectionRuleTable
 * @see TranscriptService
 */
@Service
@Slf4j
public class InterjectionScheduler {

    private static final int HINT_EVIDENCE_LIMIT = 100;

    private final Clock clock;
    private final RandomGenerator random;
    private final InterjectionRuleTable ruleTable;
    private final TranscriptService transcriptService;
    private final ObjectProvider<VisionPort> visionPortProvider;
    private final VoiceProperties.AmbientProperties config;

    private final SensorContext context;
    private final Consumer<String> transcriptListener = this::updateAudioContext;

    private volatile boolean running;
    private volatile double friendThreshold;
    private volatile InterjectionCallback callback;

    private int interjectionCount;
    private Instant lastScreenProbe;
    private Instant lastCameraProbe;

    private volatile ScheduledExecutorService executor;
    private ScheduledFuture<?> tickTask;

    public InterjectionScheduler(Clock clock, RandomGenerator random, InterjectionRuleTable ruleTable,
            TranscriptService transcriptService, ObjectProvider<VisionPort> visionPortProvider,
            VoiceProperties properties) {
        this.clock = clock;
        this.random = random;
        this.ruleTable = ruleTable;
        this.transcriptService = transcriptService;
        this.visionPortProvider = visionPortProvider;
        this.config = properties.getAmbient();
        this.context = new SensorContext(config.getRecentTranscriptLimit());
        this.friendThreshold = clamp01(config.getFriendThreshold());
    }

    /**
     * Start ambient monitoring.
     *
     * @param onInterject
     *            receives every interjection
     * @param threshold
     *            initial friend threshold, clamped to [0, 1]
     * @return false when ambient awareness is disabled
     */
    public synchronized boolean start(InterjectionCallback onInterject, double threshold) {
        if (!config.isEnabled()) {
            log.info("[Ambient] Ambient awareness disabled");
            return false;
        }
        if (running) {
            return true;
        }
        bind(onInterject, threshold);
        resetRunState();

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ambient-awareness");
            t.setDaemon(true);
            return t;
        });
        long tickMillis = config.getTickInterval().toMillis();
        tickTask = executor.scheduleAtFixedRate(this::safeTick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        running = true;
        transcriptService.registerListener(transcriptListener);

        log.info("[Ambient] Started with friend threshold {}", friendThreshold);
        return true;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        transcriptService.unregisterListener(transcriptListener);
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        tickTask = null;
        resetRunState();
        log.info("[Ambient] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public void setFriendThreshold(double threshold) {
        friendThreshold = clamp01(threshold);
        log.info("[Ambient] Friend threshold set to {}", String.format("%.1f", friendThreshold));
    }

    public double getFriendThreshold() {
        return friendThreshold;
    }

    /**
     * Feed a transcript of what the user said. Ignored while stopped.
     */
    public void updateAudioContext(String transcript) {
        post(() -> onTranscript(transcript));
    }

    /**
     * Feed vision descriptions. Either argument may be null or blank. Ignored while
     * stopped.
     */
    public void updateVisualContext(String cameraDescription, String screenDescription) {
        post(() -> onVisual(cameraDescription, screenDescription));
    }

    public AmbientStatus getStatus() {
        ScheduledExecutorService current = executor;
        if (!running || current == null) {
            return buildStatus();
        }
        try {
            Future<AmbientStatus> status = current.submit(this::buildStatus);
            return status.get(2, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            return buildStatus();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading ambient status", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Ambient status unavailable", e);
        }
    }

    void bind(InterjectionCallback onInterject, double threshold) {
        this.callback = onInterject;
        this.friendThreshold = clamp01(threshold);
    }

    void onTranscript(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return;
        }
        context.addTranscript(transcript);
        context.resetSilence();
        context.setLastInteractionTime(clock.instant());

        String lower = AmbientKeywords.lower(transcript);
        if (AmbientKeywords.containsAny(lower, AmbientKeywords.STRESS_INDICATORS)) {
            context.setSpeechSentiment("stressed");
            context.setUserSeemsStressed(true);
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.POSITIVE_WORDS)) {
            context.setSpeechSentiment("positive");
            context.setUserSeemsStressed(false);
        } else {
            context.setSpeechSentiment(SensorContext.NEUTRAL);
        }

        evaluate(transcript);
    }

    void onVisual(String cameraDescription, String screenDescription) {
        if (cameraDescription != null && !cameraDescription.isBlank()) {
            applyCameraDescription(AmbientKeywords.lower(cameraDescription));
            context.setLastVisualSummary(cameraDescription);
        }
        if (screenDescription != null && !screenDescription.isBlank()) {
            context.setLastScreenSummary(screenDescription);
        }
    }

    /**
     * Decide whether to interject after a transcript.
     */
    void evaluate(String transcript) {
        double threshold = friendThreshold;
        if (threshold <= 0) {
            return;
        }
        Instant now = clock.instant();
        if (!cooldownElapsed(now)) {
            return;
        }

        Optional<TriggerDecision> decision = ruleTable.evaluate(transcript, context, threshold);
        if (decision.isEmpty()) {
            return;
        }
        TriggerDecision winner = decision.get();
        double probability = interjectionProbability(threshold, winner.boost());
        if (random.nextDouble() < probability) {
            fire(winner.reason(), winner.hint(), transcript);
        } else {
            log.debug("[Ambient] {} matched but roll missed (p={})", winner.rule(), probability);
        }
    }

    void tick() {
        Instant now = clock.instant();
        double threshold = friendThreshold;
        context.addSilence(config.getTickInterval());

        VisionPort visionPort = visionPortProvider.getIfAvailable();
        if (visionPort != null) {
            if (threshold >= config.getScreenshotMinThreshold()
                    && probeDue(lastScreenProbe, config.getScreenshotInterval(), now)) {
                lastScreenProbe = now;
                probeScreen(visionPort, threshold);
            }
            if (threshold >= config.getCameraMinThreshold()
                    && probeDue(lastCameraProbe, config.getCameraInterval(), now)) {
                lastCameraProbe = now;
                probeCamera(visionPort, threshold);
            }
        }

        if (context.getSilenceDuration().compareTo(config.getSilenceCheckIn()) > 0
                && threshold >= config.getSilenceMinThreshold()
                && cooldownElapsed(now)
                && random.nextDouble() < config.getSilenceCheckInChance() * threshold) {
            fire(InterjectReason.CHECK_IN, "been quiet for a while", "");
            context.resetSilence();
        }
    }

    int getInterjectionCount() {
        return interjectionCount;
    }

    SensorContext getContext() {
        return context;
    }

    private void resetRunState() {
        context.clear();
        interjectionCount = 0;
        lastScreenProbe = null;
        lastCameraProbe = null;
    }

    private void probeScreen(VisionPort visionPort, double threshold) {
        Optional<String> description = capture(visionPort, VisionSource.SCREEN);
        if (description.isEmpty()) {
            return;
        }
        String screen = description.get();
        onVisual(null, screen);

        if (AmbientKeywords.containsAny(AmbientKeywords.lower(screen), AmbientKeywords.SCREEN_NEEDS_HELP)
                && cooldownElapsed(clock.instant())
                && random.nextDouble() < threshold * 0.3) {
            fire(InterjectReason.HELPFUL_INFO,
                    "noticed on screen: " + AmbientKeywords.truncate(screen, HINT_EVIDENCE_LIMIT), screen);
        }
    }

    private void probeCamera(VisionPort visionPort, double threshold) {
        Optional<String> description = capture(visionPort, VisionSource.CAMERA);
        if (description.isEmpty()) {
            return;
        }
        String camera = description.get();
        onVisual(camera, null);

        String lower = AmbientKeywords.lower(camera);
        if (AmbientKeywords.containsAny(lower, AmbientKeywords.CAMERA_VIBE)) {
            if (cooldownElapsed(clock.instant()) && random.nextDouble() < threshold * 0.4) {
                fire(InterjectReason.VIBE, "saw user: " + AmbientKeywords.truncate(camera, HINT_EVIDENCE_LIMIT),
                        camera);
            }
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.CAMERA_STRESSED)
                && cooldownElapsed(clock.instant())
                && random.nextDouble() < threshold * 0.5) {
            fire(InterjectReason.CHECK_IN,
                    "user looks stressed: " + AmbientKeywords.truncate(camera, HINT_EVIDENCE_LIMIT), camera);
        }
    }

    private Optional<String> capture(VisionPort visionPort, VisionSource source) {
        try {
            return visionPort.captureDescription(source).filter(text -> !text.isBlank());
        } catch (RuntimeException e) {
            log.warn("[Ambient] {} probe failed: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private void applyCameraDescription(String lower) {
        if (AmbientKeywords.containsAny(lower, AmbientKeywords.ACTIVITY_WORKING)) {
            context.setUserActivity("working");
            context.setUserSeemsBusy(true);
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.ACTIVITY_TALKING)) {
            context.setUserActivity("talking");
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.ACTIVITY_RELAXING)) {
            context.setUserActivity("relaxing");
            context.setUserSeemsBusy(false);
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.ACTIVITY_CHILLING)) {
            context.setUserActivity("chilling");
            context.setUserSeemsBusy(false);
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.ACTIVITY_AWAY)) {
            context.setUserActivity("away");
        }

        if (AmbientKeywords.containsAny(lower, AmbientKeywords.EXPRESSION_HAPPY)) {
            context.setUserExpression("happy");
            context.setUserSeemsStressed(false);
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.EXPRESSION_FOCUSED)) {
            context.setUserExpression("focused");
            context.setUserSeemsBusy(true);
        } else if (AmbientKeywords.containsAny(lower, AmbientKeywords.EXPRESSION_STRESSED)) {
            context.setUserExpression("stressed");
            context.setUserSeemsStressed(true);
        }
    }

    private void fire(InterjectReason reason, String hint, String evidence) {
        Instant now = clock.instant();
        context.setLastInterjectionTime(now);
        interjectionCount++;

        InterjectionEvent event = InterjectionEvent.builder()
                .reason(reason)
                .hint(hint)
                .evidence(evidence)
                .timestamp(now)
                .userActivity(context.getUserActivity())
                .userMood(context.getSpeechSentiment())
                .userBusy(context.isUserSeemsBusy())
                .build();
        log.info("[Ambient] Interjecting ({}): {}", reason.getTag(), hint);

        InterjectionCallback target = callback;
        if (target == null) {
            return;
        }
        try {
            target.onInterjection(event);
        } catch (RuntimeException e) {
            log.error("[Ambient] Interjection callback failed", e);
        }
    }

    private boolean cooldownElapsed(Instant now) {
        Instant last = context.getLastInterjectionTime();
        if (last == null) {
            return true;
        }
        Duration cooldown = context.isUserSeemsBusy()
                ? config.getBusyInterjectionInterval()
                : config.getMinInterjectionInterval();
        return Duration.between(last, now).compareTo(cooldown) >= 0;
    }

    private double interjectionProbability(double threshold, double boost) {
        double probability = clamp01(threshold * config.getBaseProbability() + boost);
        if (context.isUserSeemsBusy()) {
            probability *= config.getBusyDampening();
        }
        return probability;
    }

    private AmbientStatus buildStatus() {
        Instant last = context.getLastInterjectionTime();
        return AmbientStatus.builder()
                .running(running)
                .friendThreshold(friendThreshold)
                .userActivity(context.getUserActivity())
                .userExpression(context.getUserExpression())
                .userMood(context.getSpeechSentiment())
                .userBusy(context.isUserSeemsBusy())
                .userStressed(context.isUserSeemsStressed())
                .silenceDuration(context.getSilenceDuration())
                .interjectionCount(interjectionCount)
                .sinceLastInterjection(last != null ? Duration.between(last, clock.instant()) : null)
                .recentTranscripts(context.getRecentTranscripts())
                .lastScreenSummary(context.getLastScreenSummary())
                .build();
    }

    private void post(Runnable message) {
        ScheduledExecutorService current = executor;
        if (!running || current == null) {
            log.debug("[Ambient] Not running, context update ignored");
            return;
        }
        try {
            current.execute(() -> {
                try {
                    message.run();
                } catch (RuntimeException e) {
                    log.error("[Ambient] Failed to apply context update", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[Ambient] Scheduler shutting down, context update ignored");
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) { // NOSONAR - the tick loop never terminates
            log.error("[Ambient] Tick failed", e);
        }
    }

    private static boolean probeDue(Instant lastProbe, Duration interval, Instant now) {
        return lastProbe == null || Duration.between(lastProbe, now).compareTo(interval) > 0;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
