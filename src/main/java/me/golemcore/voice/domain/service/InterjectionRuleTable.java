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

import me.golemcore.voice.domain.model.InterjectReason;
import me.golemcore.voice.domain.model.SensorContext;
import me.golemcore.voice.domain.model.TriggerDecision;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Ordered rules deciding why the assistant might speak up after hearing a
 * transcript.
 *
 * <p>
 * Rules are tried by ascending priority and the first match wins:
 * <ol>
 * <li>STRESS - the user seems stressed, check in</li>
 * <li>HELPFUL_TOPIC - a topic the assistant can help with was mentioned</li>
 * <li>QUESTION - a question was asked and the user is not busy</li>
 * <li>FUN_TOPIC - a casual topic was mentioned and the user is not busy</li>
 * <li>VIBE - rare, only while the user is chilling</li>
 * </ol>
 * The boost of the winning rule feeds the interjection probability.
 */
@Component
public class InterjectionRuleTable {

    static final String STRESS = "STRESS";
    static final String HELPFUL_TOPIC = "HELPFUL_TOPIC";
    static final String QUESTION = "QUESTION";
    static final String FUN_TOPIC = "FUN_TOPIC";
    static final String VIBE = "VIBE";

    private static final double VIBE_CHANCE_FACTOR = 0.02;

    private final RandomGenerator random;
    private final List<Rule> rules;

    public InterjectionRuleTable(RandomGenerator random) {
        this.random = random;
        this.rules = List.of(
                new Rule(1, STRESS, InterjectReason.CHECK_IN, 0.5, this::matchStress),
                new Rule(2, HELPFUL_TOPIC, InterjectReason.HELPFUL_INFO, 0.4, this::matchHelpfulTopic),
                new Rule(3, QUESTION, InterjectReason.HELPFUL_INFO, 0.35, this::matchQuestion),
                new Rule(4, FUN_TOPIC, InterjectReason.COMMENT, 0.3, this::matchFunTopic),
                new Rule(5, VIBE, InterjectReason.VIBE, 0.1, this::matchVibe))
                .stream()
                .sorted(Comparator.comparingInt(Rule::priority))
                .toList();
    }

    /**
     * Find the first rule matching a transcript in the given context.
     *
     * @param transcript
     *            what was just heard
     * @param context
     *            current sensor context, already updated with the transcript
     * @param friendThreshold
     *            current friend threshold
     * @return the winning decision, empty when no rule matches
     */
    public Optional<TriggerDecision> evaluate(String transcript, SensorContext context, double friendThreshold) {
        RuleInput input = new RuleInput(transcript, AmbientKeywords.lower(transcript), context, friendThreshold);
        for (Rule rule : rules) {
            Optional<String> hint = rule.matcher().match(input);
            if (hint.isPresent()) {
                return Optional.of(new TriggerDecision(rule.name(), rule.reason(), rule.boost(), hint.get()));
            }
        }
        return Optional.empty();
    }

    List<String> ruleNames() {
        return rules.stream().map(Rule::name).toList();
    }

    private Optional<String> matchStress(RuleInput input) {
        return input.context().isUserSeemsStressed() ? Optional.of("user seems stressed") : Optional.empty();
    }

    private Optional<String> matchHelpfulTopic(RuleInput input) {
        return AmbientKeywords.firstMatch(input.lower(), AmbientKeywords.HELPFUL_TOPICS)
                .map(topic -> "heard mention of '" + topic + "'");
    }

    private Optional<String> matchQuestion(RuleInput input) {
        if (input.context().isUserSeemsBusy() || !AmbientKeywords.isQuestion(input.transcript())) {
            return Optional.empty();
        }
        return Optional.of("heard a question: " + AmbientKeywords.truncate(input.transcript(), 50));
    }

    private Optional<String> matchFunTopic(RuleInput input) {
        if (input.context().isUserSeemsBusy()) {
            return Optional.empty();
        }
        return AmbientKeywords.firstMatch(input.lower(), AmbientKeywords.FUN_TOPICS)
                .map(topic -> "heard mention of '" + topic + "'");
    }

    private Optional<String> matchVibe(RuleInput input) {
        SensorContext context = input.context();
        if (context.isUserSeemsBusy() || !"chilling".equals(context.getUserActivity())) {
            return Optional.empty();
        }
        if (random.nextDouble() >= VIBE_CHANCE_FACTOR * input.friendThreshold()) {
            return Optional.empty();
        }
        return Optional.of("just vibing");
    }

    @FunctionalInterface
    private interface RuleMatcher {
        Optional<String> match(RuleInput input);
    }

    private record RuleInput(String transcript, String lower, SensorContext context, double friendThreshold) {
    }

    private record Rule(int priority, String name, InterjectReason reason, double boost, RuleMatcher matcher) {
    }
}
