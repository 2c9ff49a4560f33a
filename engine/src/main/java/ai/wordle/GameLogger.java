package ai.wordle;

import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.GameResult;
import ai.wordle.game.Word;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs of played games.
 *
 * <p>Enabled with {@code -Dlog.games=true}. Lines are prefixed with {@code GAME_TURN} or
 * {@code GAME_SUMMARY} so they can be filtered out of mixed logs; {@code logback.xml} also routes
 * this logger to its own {@code games.log} file, created on the first logged line.</p>
 */
public final class GameLogger {
    private static final Logger log = LoggerFactory.getLogger(GameLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.games");
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private GameLogger() {}

    /**
     * Return true if game logging is enabled via -Dlog.games=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * One line per answered guess.
     *
     * @param target    the secret word, or {@code null} when it is not known (assist mode)
     * @param remaining candidates left after the guess
     */
    public static void logTurn(Word target, int turn, Word guess, FeedbackPattern feedback, int remaining) {
        if (!ENABLED) {
            return;
        }
        try {
            ObjectNode node = OBJECT_MAPPER.createObjectNode();
            node.put("type", "turn");
            putTarget(node, target);
            node.put("turn", turn);
            node.put("guess", guess.text());
            node.put("feedback", feedback.toString());
            node.put("remaining", remaining);
            if (log.isInfoEnabled()) {
                log.info("GAME_TURN {}", OBJECT_MAPPER.writeValueAsString(node));
            }
        } catch (Exception e) {
            // Logging must never interfere with play.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log game turn", e);
            }
        }
    }

    /**
     * One line per finished game.
     */
    public static void logSummary(Word target, GameResult result) {
        if (!ENABLED) {
            return;
        }
        try {
            ObjectNode node = OBJECT_MAPPER.createObjectNode();
            node.put("type", "summary");
            putTarget(node, target);
            node.put("starter", result.getStarter() == null ? null : result.getStarter().text());
            ArrayNode guesses = node.putArray("guesses");
            for (Word guess : result.getGuesses()) {
                guesses.add(guess.text());
            }
            node.put("outcome", result.getOutcome().name());
            node.put("turns", result.getTurns());
            node.put("duration_nanos", result.getDurationNanos());
            if (log.isInfoEnabled()) {
                log.info("GAME_SUMMARY {}", OBJECT_MAPPER.writeValueAsString(node));
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log game summary", e);
            }
        }
    }

    private static void putTarget(ObjectNode node, Word target) {
        if (target != null) {
            node.put("target", target.text());
        }
    }
}
