package ai.wordle.game;

/**
 * The three results a single guessed letter can receive.
 * <p>
 * Each constant carries the one-character code used in logs and reports
 * ({@code G}, {@code Y}, {@code B}) and a base-3 digit used to pack a whole
 * {@link FeedbackPattern} into one int.
 */
public enum Feedback {
    /** Right letter in the right position (green). */
    CORRECT('G', 2),
    /** Letter occurs elsewhere in the target (yellow). */
    PRESENT('Y', 1),
    /** Letter does not occur, or all its occurrences are already accounted for (grey). */
    ABSENT('B', 0);

    private final char symbol;
    private final int digit;

    Feedback(char symbol, int digit) {
        this.symbol = symbol;
        this.digit = digit;
    }

    public char getSymbol() {
        return symbol;
    }

    public int getDigit() {
        return digit;
    }

    /**
     * Looks up a result by its symbol (case-insensitive).
     *
     * @throws IllegalArgumentException for anything but G, Y or B
     */
    public static Feedback fromSymbol(char symbol) {
        return switch (Character.toUpperCase(symbol)) {
            case 'G' -> CORRECT;
            case 'Y' -> PRESENT;
            case 'B' -> ABSENT;
            default -> throw new IllegalArgumentException("Unknown feedback symbol: " + symbol);
        };
    }

    static Feedback fromDigit(int digit) {
        return switch (digit) {
            case 2 -> CORRECT;
            case 1 -> PRESENT;
            case 0 -> ABSENT;
            default -> throw new IllegalArgumentException("Unknown feedback digit: " + digit);
        };
    }
}
