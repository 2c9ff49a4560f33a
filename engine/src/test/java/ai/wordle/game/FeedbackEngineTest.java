package ai.wordle.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.wordle.unit.helpers.DictionaryFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Feedback scoring, with emphasis on repeated letters.
 */
class FeedbackEngineTest {

    @Test
    void exactMatchIsAllCorrect() {
        assertEquals("GGGGG", FeedbackEngine.computeFeedback(Word.of("CRANE"), Word.of("CRANE")).toString());
        assertTrue(FeedbackEngine.computeFeedback(Word.of("CRANE"), Word.of("CRANE")).isSolved());
    }

    @Test
    void mixedGreensYellowsAndGreys() {
        // SLATE vs CRANE: A and E in place, S/L/T absent.
        assertEquals("BBGBG", FeedbackEngine.computeFeedback(Word.of("SLATE"), Word.of("CRANE")).toString());
        // TRACE vs CRATE: T and C swapped.
        assertEquals("YGGYG", FeedbackEngine.computeFeedback(Word.of("TRACE"), Word.of("CRATE")).toString());
    }

    @Test
    void speedAgainstEraseConsumesEachTargetLetterOnce() {
        // ERASE holds one S and two E's: S and both E's are yellow, P and D grey.
        FeedbackPattern pattern = FeedbackEngine.computeFeedback(Word.of("SPEED"), Word.of("ERASE"));
        assertEquals("YBYYB", pattern.toString());
        assertEquals(Feedback.PRESENT, pattern.get(0));
        assertEquals(Feedback.ABSENT, pattern.get(1));
        assertEquals(Feedback.PRESENT, pattern.get(2));
        assertEquals(Feedback.PRESENT, pattern.get(3));
        assertEquals(Feedback.ABSENT, pattern.get(4));
    }

    @Test
    void repeatedGuessLetterOnlyMarkedAsOftenAsTargetHasIt() {
        // ABIDE has a single E: only the first unmatched E of SPEED turns yellow.
        assertEquals("BBYBY", FeedbackEngine.computeFeedback(Word.of("SPEED"), Word.of("ABIDE")).toString());
        // The green is claimed first, so the earlier E gets nothing.
        assertEquals("BBBBG", FeedbackEngine.computeFeedback(Word.of("EXXXE"), Word.of("ZZZZE")).toString());
    }

    @Test
    void correctCountMatchesPositionsAndPresentNeverExceedsTargetLetters() {
        List<Word> words = DictionaryFactory.bundled().words().subList(0, 120);
        for (Word guess : words) {
            for (Word target : words) {
                FeedbackPattern pattern = FeedbackEngine.computeFeedback(guess, target);
                int matching = 0;
                for (int i = 0; i < Word.LENGTH; i++) {
                    if (guess.charAt(i) == target.charAt(i)) {
                        matching++;
                    }
                }
                assertEquals(matching, pattern.count(Feedback.CORRECT), guess + " vs " + target);
                assertEquals(guess.equals(target), pattern.isSolved(), guess + " vs " + target);

                for (char c = 'A'; c <= 'Z'; c++) {
                    int marked = 0;
                    int inTarget = 0;
                    for (int i = 0; i < Word.LENGTH; i++) {
                        if (guess.charAt(i) == c && pattern.get(i) != Feedback.ABSENT) {
                            marked++;
                        }
                        if (target.charAt(i) == c) {
                            inTarget++;
                        }
                    }
                    assertTrue(marked <= inTarget, "Letter " + c + " over-counted for " + guess + " vs " + target);
                }
            }
        }
    }

    @Test
    void codeAndPatternAgree() {
        Word guess = Word.of("STARE");
        Word target = Word.of("TEARS");
        assertEquals(FeedbackEngine.computeFeedback(guess, target).code(), FeedbackEngine.computeCode(guess, target));
    }
}
