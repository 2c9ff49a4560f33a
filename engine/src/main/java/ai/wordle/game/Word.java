package ai.wordle.game;

import java.util.Locale;
import java.util.Objects;

/**
 * Represents a single five-letter word made of the letters {@code A}-{@code Z}.
 * <p>
 * Words are immutable and compared by their letter sequence. Input is upper-cased on
 * construction, so {@code new Word("crane")} equals {@code new Word("CRANE")}. A bit mask of
 * the distinct letters is computed once, which keeps the letter-set arithmetic used by the
 * guess selector cheap.
 */
public final class Word implements Comparable<Word> {
    /** Every word in the game has exactly this many letters. */
    public static final int LENGTH = 5;

    /** Upper-case letters of the word. */
    private final String text;
    /** Bit {@code c - 'A'} is set when letter {@code c} occurs at least once. */
    private final int letterMask;

    /**
     * Constructs a Word from its text.
     *
     * @param text five letters, any case
     * @throws NullPointerException if text is null
     * @throws IllegalArgumentException if text is not exactly five letters A-Z
     */
    public Word(String text) {
        Objects.requireNonNull(text, "text");
        String upper = text.trim().toUpperCase(Locale.ROOT);
        if (!isValid(upper)) {
            throw new IllegalArgumentException("Not a " + LENGTH + "-letter A-Z word: '" + text + "'");
        }
        this.text = upper;
        int mask = 0;
        for (int i = 0; i < LENGTH; i++) {
            mask |= bit(upper.charAt(i));
        }
        this.letterMask = mask;
    }

    /**
     * Shorthand for {@code new Word(text)}.
     */
    public static Word of(String text) {
        return new Word(text);
    }

    /**
     * Checks whether the given (already trimmed) text would make a valid word.
     *
     * @param text candidate text, case-insensitive
     * @return {@code true} if it is five letters A-Z
     */
    public static boolean isValid(String text) {
        if (text == null || text.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            char c = Character.toUpperCase(text.charAt(i));
            if (c < 'A' || c > 'Z') {
                return false;
            }
        }
        return true;
    }

    /**
     * Mask bit for a single upper-case letter.
     */
    public static int bit(char letter) {
        return 1 << (letter - 'A');
    }

    public char charAt(int position) {
        return text.charAt(position);
    }

    public String text() {
        return text;
    }

    /**
     * Returns the distinct letters of this word as a bit mask (bit 0 is 'A').
     */
    public int letterMask() {
        return letterMask;
    }

    public int distinctLetterCount() {
        return Integer.bitCount(letterMask);
    }

    public boolean contains(char letter) {
        return (letterMask & bit(letter)) != 0;
    }

    @Override
    public int compareTo(Word other) {
        return text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Word)) {
            return false;
        }
        return text.equals(((Word) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
