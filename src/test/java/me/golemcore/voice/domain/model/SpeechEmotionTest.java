package me.golemcore.voice.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SpeechEmotionTest {

    @Test
    void shouldDetectEmotionByKeyword() {
        assertEquals(SpeechEmotion.EXCITED, SpeechEmotion.detect("You did it!"));
        assertEquals(SpeechEmotion.CONCERNED, SpeechEmotion.detect("Sorry, the build failed"));
        assertEquals(SpeechEmotion.SATISFIED, SpeechEmotion.detect("Task done"));
        assertEquals(SpeechEmotion.URGENT, SpeechEmotion.detect("Don't forget the deadline"));
        assertEquals(SpeechEmotion.QUESTIONING, SpeechEmotion.detect("What time is it"));
        assertEquals(SpeechEmotion.WARM, SpeechEmotion.detect("Hello there"));
        assertEquals(SpeechEmotion.GENTLE, SpeechEmotion.detect("See you later"));
        assertEquals(SpeechEmotion.PLAYFUL, SpeechEmotion.detect("haha"));
    }

    @Test
    void shouldPreferEarlierEmotionWhenSeveralMatch() {
        assertEquals(SpeechEmotion.EXCITED, SpeechEmotion.detect("Great, the build failed"));
        assertEquals(SpeechEmotion.QUESTIONING, SpeechEmotion.detect("whatever"));
    }

    @Test
    void shouldFallBackToNeutral() {
        assertEquals(SpeechEmotion.NEUTRAL, SpeechEmotion.detect("the cat sat"));
        assertEquals(SpeechEmotion.NEUTRAL, SpeechEmotion.detect(null));
        assertEquals(SpeechEmotion.NEUTRAL, SpeechEmotion.detect("  "));
    }

    @Test
    void shouldParseTagsLeniently() {
        assertEquals(SpeechEmotion.EXCITED, SpeechEmotion.fromTag("excited"));
        assertEquals(SpeechEmotion.CARING, SpeechEmotion.fromTag(" Caring "));
        assertEquals(SpeechEmotion.NEUTRAL, SpeechEmotion.fromTag("bogus"));
        assertEquals(SpeechEmotion.NEUTRAL, SpeechEmotion.fromTag(null));
        assertEquals("sarcastic", SpeechEmotion.SARCASTIC.getTag());
    }
}
