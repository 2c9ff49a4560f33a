package ai.wordle.game;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeedbackPatternTest {

    @Test
    void parseAndPrintUseGybSymbols() {
        FeedbackPattern pattern = FeedbackPattern.parse("gybbg");
        assertEquals("GYBBG", pattern.toString());
        assertEquals(Feedback.CORRECT, pattern.get(0));
        assertEquals(Feedback.PRESENT, pattern.get(1));
        assertEquals(Feedback.ABSENT, pattern.get(2));
        assertEquals(Feedback.CORRECT, pattern.get(4));
    }

    @Test
    void equalPatternsAreUsableAsMapKeys() {
        Map<FeedbackPattern, Integer> counts = new HashMap<>();
        counts.merge(FeedbackPattern.parse("BBGBG"), 1, Integer::sum);
        counts.merge(FeedbackPattern.of(Feedback.ABSENT, Feedback.ABSENT, Feedback.CORRECT, Feedback.ABSENT, Feedback.CORRECT),
                1, Integer::sum);
        assertEquals(1, counts.size());
        assertEquals(2, counts.get(FeedbackPattern.parse("BBGBG")));
    }

    @Test
    void allCorrectIsTheOnlySolvedPattern() {
        assertTrue(FeedbackPattern.parse("GGGGG").isSolved());
        assertSame(FeedbackPattern.ALL_CORRECT, FeedbackPattern.parse("GGGGG"));
        assertFalse(FeedbackPattern.parse("GGGGY").isSolved());
    }

    @Test
    void rejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> FeedbackPattern.parse("GGGG"));
        assertThrows(IllegalArgumentException.class, () -> FeedbackPattern.parse("GGGGX"));
        assertThrows(IllegalArgumentException.class, () -> FeedbackPattern.fromCode(243));
    }
}
