package ai.wordle.player;

import ai.wordle.game.FeedbackParser;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Word;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feedback typed by a person who is playing a real game and entering the suggested words.
 * Invalid input is reported and asked for again; {@code quit} or end of input stops the game.
 */
public class ConsoleFeedbackSource implements FeedbackSource {
    private static final Logger log = LoggerFactory.getLogger(ConsoleFeedbackSource.class);

    private final Scanner scanner;
    private final PrintStream out;

    /**
     * @param scanner reader of the user's input; share it with anything else reading the same stream
     * @param out     where prompts go
     */
    public ConsoleFeedbackSource(Scanner scanner, PrintStream out) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public FeedbackPattern feedbackFor(Word guess, int turn) {
        out.println();
        out.println("SUGGESTED WORD (turn " + turn + "): " + guess);
        while (true) {
            out.println("What feedback did you get for '" + guess + "'?");
            out.print("(GYBBB, 21000, 🟩🟨⬛⬛⬛, or 'quit'): ");
            if (!scanner.hasNextLine()) {
                return null;
            }
            String line = scanner.nextLine();
            if (FeedbackParser.isQuit(line)) {
                return null;
            }
            try {
                FeedbackPattern pattern = FeedbackParser.parse(line);
                out.println("Interpreted as: " + pattern);
                return pattern;
            } catch (IllegalArgumentException e) {
                if (log.isDebugEnabled()) {
                    log.debug("Rejected feedback input '{}'", line);
                }
                out.println("Error: " + e.getMessage() + ". Please try again.");
            }
        }
    }
}
