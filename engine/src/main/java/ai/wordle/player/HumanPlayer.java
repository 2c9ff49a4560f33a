package ai.wordle.player;

import ai.wordle.game.Word;
import java.util.Objects;
import java.util.Scanner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Human player that reads guesses from stdin (CLI), through the shared console scanner.
 */
@Component
@Profile("ai-human")
public class HumanPlayer implements Player {
    private final Scanner scanner;

    public HumanPlayer(Scanner consoleScanner) {
        this.scanner = Objects.requireNonNull(consoleScanner, "consoleScanner");
    }

    @Override
    public Word nextGuess(TurnView view) {
        while (true) {
            System.out.printf("Turn %d, pattern %s. Enter a guess (or quit): ",
                    view.turn(), view.knowledge().pattern());
            if (!scanner.hasNextLine()) {
                return null;
            }
            String line = scanner.nextLine().trim();
            if ("quit".equalsIgnoreCase(line)) {
                return null;
            }
            if (!Word.isValid(line)) {
                System.out.println("Guesses must be " + Word.LENGTH + " letters.");
                continue;
            }
            Word guess = Word.of(line);
            if (!view.dictionary().contains(guess)) {
                System.out.println("Not in word list: " + guess);
                continue;
            }
            return guess;
        }
    }
}
