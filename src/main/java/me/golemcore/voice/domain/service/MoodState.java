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
import me.golemcore.voice.domain.model.MoodEvent;
import me.golemcore.voice.domain.model.MoodHistoryEntry;
import me.golemcore.voice.domain.model.MoodLabel;
import me.golemcore.voice.domain.model.MoodSnapshot;
import me.golemcore.voice.domain.model.ResponseModifier;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Decaying four-component mood vector that flavors the assistant's tone.
 *
 * <p>
 * Components are happiness, energy, patience and engagement, each kept in
 * {@code [-1, 1]}. Events push the vector; time pulls it back toward the resting
 * point {@code (0, 0, 0.5, 0)} at {@code decayRate} per second without
 * overshooting.
 *
 * <p>
 * Process-wide and internally synchronized.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MoodState {

    private static final double RESTING_HAPPINESS = 0.0;
    private static final double RESTING_ENERGY = 0.0;
    private static final double RESTING_PATIENCE = 0.5;
    private static final double RESTING_ENGAGEMENT = 0.0;

    private static final Map<MoodEvent.ReactionTone, List<String>> REACTIONS = new EnumMap<>(
            MoodEvent.ReactionTone.class);
    private static final Map<MoodLabel, List<String>> PREFIXES = new EnumMap<>(MoodLabel.class);

    static {
        REACTIONS.put(MoodEvent.ReactionTone.EXCITED, List.of("Hell yes!", "Nailed it!", "Oh nice!", "Done and done!"));
        REACTIONS.put(MoodEvent.ReactionTone.ANNOYED, List.of("Ugh.", "Seriously?", "Again?", "Fine."));
        REACTIONS.put(MoodEvent.ReactionTone.CARING,
                List.of("Hey, you okay?", "I'm here.", "Take it easy.", "Good to hear from you."));
        REACTIONS.put(MoodEvent.ReactionTone.SARCASTIC,
                List.of("Oh, wow. Thanks.", "Don't get used to it.", "Yeah, yeah."));
        REACTIONS.put(MoodEvent.ReactionTone.FRUSTRATED,
                List.of("Come on.", "This is getting old.", "Deep breath."));
        REACTIONS.put(MoodEvent.ReactionTone.NEUTRAL, List.of("Okay.", "Got it.", "Sure."));

        PREFIXES.put(MoodLabel.EXCITED, List.of("Okay so ", "Alright listen, ", "Here's the thing, "));
        PREFIXES.put(MoodLabel.ANNOYED, List.of("Look, ", "Fine. ", "Okay so ", ""));
        PREFIXES.put(MoodLabel.HAPPY, List.of("So ", "Alright, ", ""));
        PREFIXES.put(MoodLabel.FRUSTRATED, List.of("Okay, ", ""));
        PREFIXES.put(MoodLabel.TIRED, List.of("", "Ugh, "));
    }

    private final Clock clock;
    private final RandomGenerator random;
    private final VoiceProperties.MoodProperties config;

    private final List<MoodHistoryEntry> history = new ArrayList<>();

    private double happiness;
    private double energy;
    private double patience;
    private double engagement;
    private Instant lastUpdate;

    public MoodState(Clock clock, RandomGenerator random, VoiceProperties properties) {
        this.clock = clock;
        this.random = random;
        this.config = properties.getMood();
        resetComponents();
    }

    /**
     * Apply an event with the configured default intensity.
     */
    public void applyEvent(MoodEvent event) {
        applyEvent(event, config.getDefaultIntensity());
    }

    /**
     * Apply an event: decay first, then add the event delta scaled by intensity,
     * clamping every component.
     *
     * @param event
     *            the event
     * @param intensity
     *            scale factor, typically between 0 and 1
     */
    public synchronized void applyEvent(MoodEvent event, double intensity) {
        decay();

        MoodEvent.MoodDelta delta = event.delta();
        happiness = clamp(happiness + delta.happiness() * intensity);
        energy = clamp(energy + delta.energy() * intensity);
        patience = clamp(patience + delta.patience() * intensity);
        engagement = clamp(engagement + delta.engagement() * intensity);

        MoodLabel mood = label();
        history.add(new MoodHistoryEntry(lastUpdate, event, intensity, mood));
        if (history.size() > config.getHistoryLimit()) {
            history.subList(0, history.size() - config.getHistoryRetain()).clear();
        }
        log.debug("[Mood] {} x{} -> {}", event.getTag(), intensity, mood.getTag());
    }

    /**
     * Decay toward the resting point for the time elapsed since the last update.
     */
    public synchronized void update() {
        decay();
    }

    public synchronized MoodLabel getMood() {
        decay();
        return label();
    }

    public ResponseModifier getResponseModifier() {
        return getMood().responseModifier();
    }

    public synchronized MoodSnapshot getSnapshot() {
        decay();
        MoodLabel mood = label();
        return MoodSnapshot.builder()
                .happiness(happiness)
                .energy(energy)
                .patience(patience)
                .engagement(engagement)
                .mood(mood)
                .responseModifier(mood.responseModifier())
                .lastUpdate(lastUpdate)
                .build();
    }

    public synchronized List<MoodHistoryEntry> getHistory() {
        return List.copyOf(history);
    }

    public synchronized void reset() {
        resetComponents();
        history.clear();
        log.info("[Mood] Reset to resting state");
    }

    /**
     * Short spoken reaction to an event, picked from the event's reaction tone.
     */
    public String getReaction(MoodEvent event) {
        return pick(REACTIONS.get(event.reactionTone()));
    }

    /**
     * Prefix a response with a phrase matching the current mood.
     */
    public String flavor(String response) {
        List<String> prefixes = PREFIXES.get(getMood());
        if (prefixes == null) {
            return response;
        }
        return pick(prefixes) + response;
    }

    private void decay() {
        Instant now = clock.instant();
        double elapsedSeconds = Duration.between(lastUpdate, now).toMillis() / 1000.0;
        if (elapsedSeconds <= 0) {
            return;
        }
        double step = config.getDecayRate() * elapsedSeconds;
        happiness = approach(happiness, RESTING_HAPPINESS, step);
        energy = approach(energy, RESTING_ENERGY, step);
        patience = approach(patience, RESTING_PATIENCE, step);
        engagement = approach(engagement, RESTING_ENGAGEMENT, step);
        lastUpdate = now;
    }

    private MoodLabel label() {
        if (happiness > 0.5 && energy > 0.3) {
            return MoodLabel.EXCITED;
        }
        if (happiness > 0.3) {
            return MoodLabel.HAPPY;
        }
        if (happiness < -0.3 && patience < 0.2) {
            return MoodLabel.ANNOYED;
        }
        if (patience < 0) {
            return MoodLabel.FRUSTRATED;
        }
        if (energy < -0.3) {
            return MoodLabel.TIRED;
        }
        if (engagement > 0.5) {
            return MoodLabel.ENGAGED;
        }
        if (engagement < -0.3) {
            return MoodLabel.BORED;
        }
        return MoodLabel.NEUTRAL;
    }

    private void resetComponents() {
        happiness = RESTING_HAPPINESS;
        energy = RESTING_ENERGY;
        patience = RESTING_PATIENCE;
        engagement = RESTING_ENGAGEMENT;
        lastUpdate = clock.instant();
    }

    private String pick(List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    static double approach(double value, double target, double step) {
        if (value > target) {
            return Math.max(target, value - step);
        }
        return Math.min(target, value + step);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
