package ai.wordle.game;

/**
 * Scores a guess against a target the way the game does.
 * <p>
 * Two passes are needed so that repeated letters are handled correctly:
 * <ol>
 *     <li>Exact matches are marked {@link Feedback#CORRECT} and both letters are consumed.</li>
 *     <li>Each remaining guess letter, left to right, is marked {@link Feedback#PRESENT} if an
 *         unconsumed occurrence is left in the target (consuming the first one), otherwise
 *         {@link Feedback#ABSENT}.</li>
 * </ol>
 * So {@code SPEED} against {@code ERASE} gives {@code YBYYB}, while {@code SPEED} against
 * {@code ABIDE} gives {@code BBYBY}: ABIDE has one E, so only the first E of SPEED is yellow.
 */
public final class FeedbackEngine {
    private FeedbackEngine() {}

    /**
     * Computes the feedback pattern for a guess against a target.
     *
     * @param guess  the guessed word
     * @param target the secret word
     * @return the per-position pattern; {@link FeedbackPattern#ALL_CORRECT} iff the words are equal
     */
    public static FeedbackPattern computeFeedback(Word guess, Word target) {
        return FeedbackPattern.fromCode(computeCode(guess, target));
    }

    /**
     * Same as {@link #computeFeedback(Word, Word)} but returns the packed pattern code, for
     * callers that only bucket results and want to skip the object lookup.
     */
    public static int computeCode(Word guess, Word target) {
        // Per-letter counts of target letters not consumed by an exact match.
        int[] unconsumed = new int[26];
        int[] digits = new int[Word.LENGTH];

        for (int i = 0; i < Word.LENGTH; i++) {
            char g = guess.charAt(i);
            char t = target.charAt(i);
            if (g == t) {
                digits[i] = Feedback.CORRECT.getDigit();
            } else {
                digits[i] = -1;
                unconsumed[t - 'A']++;
            }
        }

        int code = 0;
        for (int i = 0; i < Word.LENGTH; i++) {
            if (digits[i] < 0) {
                int letter = guess.charAt(i) - 'A';
                if (unconsumed[letter] > 0) {
                    unconsumed[letter]--;
                    digits[i] = Feedback.PRESENT.getDigit();
                } else {
                    digits[i] = Feedback.ABSENT.getDigit();
                }
            }
            code = code * 3 + digits[i];
        }
        return code;
    }
}
