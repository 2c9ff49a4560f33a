package ai.wordle.game;

import java.util.Objects;

/**
 * Immutable per-position result of comparing a guess with a target, e.g. {@code GYBBB}.
 * <p>
 * The five {@link Feedback} values are packed into a base-3 code in {@code [0, 243)}, with
 * position 0 as the most significant digit. Equality and hashing use the code, so patterns
 * are cheap map keys and can also index plain arrays when counting partitions.
 */
public final class FeedbackPattern {
    /** Number of distinct patterns (3^5). */
    public static final int PATTERN_COUNT = 243;

    private static final FeedbackPattern[] CACHE = new FeedbackPattern[PATTERN_COUNT];

    static {
        for (int code = 0; code < PATTERN_COUNT; code++) {
            CACHE[code] = new FeedbackPattern(code);
        }
    }

    /** The winning pattern {@code GGGGG}. */
    public static final FeedbackPattern ALL_CORRECT = of(
            Feedback.CORRECT, Feedback.CORRECT, Feedback.CORRECT, Feedback.CORRECT, Feedback.CORRECT);

    private final int code;

    private FeedbackPattern(int code) {
        this.code = code;
    }

    /**
     * Returns the pattern with the given packed code.
     *
     * @throws IllegalArgumentException if code is outside {@code [0, 243)}
     */
    public static FeedbackPattern fromCode(int code) {
        if (code < 0 || code >= PATTERN_COUNT) {
            throw new IllegalArgumentException("Pattern code out of range: " + code);
        }
        return CACHE[code];
    }

    /**
     * Builds a pattern from five per-position results.
     */
    public static FeedbackPattern of(Feedback... results) {
        Objects.requireNonNull(results, "results");
        if (results.length != Word.LENGTH) {
            throw new IllegalArgumentException("Expected " + Word.LENGTH + " results but got " + results.length);
        }
        int code = 0;
        for (Feedback result : results) {
            code = code * 3 + Objects.requireNonNull(result, "result").getDigit();
        }
        return CACHE[code];
    }

    /**
     * Parses the compact {@code G}/{@code Y}/{@code B} form, e.g. {@code "GYBBB"}.
     *
     * @throws IllegalArgumentException if the text is not five G/Y/B symbols
     */
    public static FeedbackPattern parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() != Word.LENGTH) {
            throw new IllegalArgumentException("Feedback must have " + Word.LENGTH + " symbols: '" + text + "'");
        }
        Feedback[] results = new Feedback[Word.LENGTH];
        for (int i = 0; i < Word.LENGTH; i++) {
            results[i] = Feedback.fromSymbol(text.charAt(i));
        }
        return of(results);
    }

    public int code() {
        return code;
    }

    /**
     * Returns the result at a position (0-based).
     */
    public Feedback get(int position) {
        if (position < 0 || position >= Word.LENGTH) {
            throw new IndexOutOfBoundsException("position " + position);
        }
        int shifted = code;
        for (int i = Word.LENGTH - 1; i > position; i--) {
            shifted /= 3;
        }
        return Feedback.fromDigit(shifted % 3);
    }

    public boolean isSolved() {
        return this == ALL_CORRECT;
    }

    public int count(Feedback result) {
        int n = 0;
        for (int i = 0; i < Word.LENGTH; i++) {
            if (get(i) == result) {
                n++;
            }
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeedbackPattern)) {
            return false;
        }
        return code == ((FeedbackPattern) o).code;
    }

    @Override
    public int hashCode() {
        return code;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(Word.LENGTH);
        for (int i = 0; i < Word.LENGTH; i++) {
            sb.append(get(i).getSymbol());
        }
        return sb.toString();
    }
}
