package me.golemcore.voice.domain.service;

import me.golemcore.voice.domain.model.InterjectReason;
import me.golemcore.voice.domain.model.SensorContext;
import me.golemcore.voice.domain.model.TriggerDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InterjectionRuleTableTest {

    private RandomGenerator random;
    private InterjectionRuleTable ruleTable;
    private SensorContext context;

    @BeforeEach
    void setUp() {
        random = mock(RandomGenerator.class);
        when(random.nextDouble()).thenReturn(0.99);
        ruleTable = new InterjectionRuleTable(random);
        context = new SensorContext(10);
    }

    @Test
    void shouldEvaluateRulesInPriorityOrder() {
        assertEquals(List.of("STRESS", "HELPFUL_TOPIC", "QUESTION", "FUN_TOPIC", "VIBE"), ruleTable.ruleNames());
    }

    @Test
    void shouldPreferStressOverTopics() {
        context.setUserSeemsStressed(true);

        TriggerDecision decision = ruleTable.evaluate("ugh the code is broken", context, 1.0).orElseThrow();

        assertEquals(InterjectionRuleTable.STRESS, decision.rule());
        assertEquals(InterjectReason.CHECK_IN, decision.reason());
        assertEquals(0.5, decision.boost());
        assertEquals("user seems stressed", decision.hint());
    }

    @Test
    void shouldMatchHelpfulTopicBeforeQuestion() {
        TriggerDecision decision = ruleTable.evaluate("what's the weather tomorrow?", context, 0.5).orElseThrow();

        assertEquals(InterjectionRuleTable.HELPFUL_TOPIC, decision.rule());
        assertEquals(InterjectReason.HELPFUL_INFO, decision.reason());
        assertEquals(0.4, decision.boost());
        assertEquals("heard mention of 'weather'", decision.hint());
    }

    @Test
    void shouldMatchHelpfulTopicEvenWhenBusy() {
        context.setUserSeemsBusy(true);

        Optional<TriggerDecision> decision = ruleTable.evaluate("remind me about the meeting", context, 0.5);

        assertEquals(InterjectionRuleTable.HELPFUL_TOPIC, decision.orElseThrow().rule());
    }

    @Test
    void shouldMatchQuestionWhenNotBusy() {
        TriggerDecision decision = ruleTable.evaluate("are you there?", context, 0.5).orElseThrow();

        assertEquals(InterjectionRuleTable.QUESTION, decision.rule());
        assertEquals(InterjectReason.HELPFUL_INFO, decision.reason());
        assertEquals(0.35, decision.boost());
        assertEquals("heard a question: are you there?", decision.hint());
    }

    @Test
    void shouldDetectQuestionByLeadingWord() {
        TriggerDecision decision = ruleTable.evaluate("Where did I leave my keys", context, 0.5).orElseThrow();

        assertEquals(InterjectionRuleTable.QUESTION, decision.rule());
    }

    @Test
    void shouldSkipQuestionAndFunTopicWhenBusy() {
        context.setUserSeemsBusy(true);

        assertTrue(ruleTable.evaluate("where are you going?", context, 1.0).isEmpty());
        assertTrue(ruleTable.evaluate("that movie was wild", context, 1.0).isEmpty());
    }

    @Test
    void shouldMatchFunTopic() {
        TriggerDecision decision = ruleTable.evaluate("that movie was wild", context, 0.5).orElseThrow();

        assertEquals(InterjectionRuleTable.FUN_TOPIC, decision.rule());
        assertEquals(InterjectReason.COMMENT, decision.reason());
        assertEquals(0.3, decision.boost());
        assertEquals("heard mention of 'movie'", decision.hint());
    }

    @Test
    void shouldVibeOnlyWhileChillingAndLucky() {
        context.setUserActivity("chilling");
        assertTrue(ruleTable.evaluate("yeah man", context, 1.0).isEmpty());

        when(random.nextDouble()).thenReturn(0.01);
        TriggerDecision decision = ruleTable.evaluate("yeah man", context, 1.0).orElseThrow();

        assertEquals(InterjectionRuleTable.VIBE, decision.rule());
        assertEquals(InterjectReason.VIBE, decision.reason());
        assertEquals("just vibing", decision.hint());
    }

    @Test
    void shouldNotVibeWhenActivityIsOther() {
        when(random.nextDouble()).thenReturn(0.0);
        context.setUserActivity("working");

        assertTrue(ruleTable.evaluate("yeah man", context, 1.0).isEmpty());
    }
}
