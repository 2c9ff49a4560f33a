package ai.wordle.game;

import java.util.Locale;
import java.util.Map;

/**
 * Reads feedback typed by a person copying it from a real game.
 * <p>
 * Accepted forms (case-insensitive, spaces, commas and hyphens ignored):
 * <ul>
 *     <li>{@code GYBBB} - green / yellow / black symbols</li>
 *     <li>{@code 21000} - 2 green, 1 yellow, 0 black</li>
 *     <li>{@code 🟩🟨⬛⬛⬜} - the squares the game shares</li>
 *     <li>{@code green yellow grey grey black} - colour names (GRAY/GREY/BLACK are all absent)</li>
 *     <li>{@code won}, {@code win}, {@code solved} - shorthand for all green</li>
 * </ul>
 */
public final class FeedbackParser {
    private static final Map<String, String> EMOJI = Map.of(
            "🟩", "G",
            "🟨", "Y",
            "⬛", "B",
            "⬜", "B");

    private static final String[][] COLOUR_WORDS = {
            {"GREEN", "G"}, {"YELLOW", "Y"}, {"BLACK", "B"}, {"GRAY", "B"}, {"GREY", "B"}
    };

    private FeedbackParser() {}

    /**
     * Returns true for the words a user types to leave the helper.
     */
    public static boolean isQuit(String input) {
        if (input == null) {
            return false;
        }
        String s = input.trim().toLowerCase(Locale.ROOT);
        return s.equals("quit") || s.equals("exit") || s.equals("q");
    }

    /**
     * Parses one line of typed feedback.
     *
     * @throws IllegalArgumentException if the line is not recognisable as five results
     */
    public static FeedbackPattern parse(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Feedback is missing");
        }
        String s = input.trim().toUpperCase(Locale.ROOT)
                .replace(" ", "")
                .replace(",", "")
                .replace("-", "");

        if (s.equals("WON") || s.equals("WIN") || s.equals("SOLVED")) {
            return FeedbackPattern.ALL_CORRECT;
        }
        if (isSymbols(s, "GYB")) {
            return FeedbackPattern.parse(s);
        }
        if (isSymbols(s, "210")) {
            return FeedbackPattern.parse(s.replace('2', 'G').replace('1', 'Y').replace('0', 'B'));
        }

        String emoji = translateEmoji(s);
        if (emoji != null) {
            return FeedbackPattern.parse(emoji);
        }

        String words = s;
        for (String[] colour : COLOUR_WORDS) {
            words = words.replace(colour[0], colour[1]);
        }
        if (isSymbols(words, "GYB")) {
            return FeedbackPattern.parse(words);
        }
        throw new IllegalArgumentException("Invalid feedback format: " + input);
    }

    private static boolean isSymbols(String s, String alphabet) {
        if (s.length() != Word.LENGTH) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (alphabet.indexOf(s.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    private static String translateEmoji(String s) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        boolean sawEmoji = false;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            String symbol = EMOJI.get(new String(Character.toChars(cp)));
            if (symbol != null) {
                sb.append(symbol);
                sawEmoji = true;
            }
            i += Character.charCount(cp);
        }
        if (!sawEmoji || sb.length() != Word.LENGTH) {
            return null;
        }
        return sb.toString();
    }
}
