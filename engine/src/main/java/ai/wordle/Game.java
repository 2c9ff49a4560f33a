package ai.wordle;

import ai.wordle.config.RunProperties;
import ai.wordle.config.SweepProperties;
import ai.wordle.game.CandidateSet;
import ai.wordle.game.Dictionary;
import ai.wordle.game.GameResult;
import ai.wordle.game.Word;
import ai.wordle.player.ConsoleFeedbackSource;
import ai.wordle.player.HumanPlayer;
import ai.wordle.player.Player;
import ai.wordle.player.TargetFeedbackSource;
import ai.wordle.sweep.StarterStats;
import ai.wordle.sweep.StarterSweep;
import ai.wordle.sweep.TargetSampler;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point. {@code run.mode} picks what happens:
 * <ul>
 *     <li>{@code SWEEP} - rank opening words by simulated games (default).</li>
 *     <li>{@code SOLVE} - play one game against {@code run.target}.</li>
 *     <li>{@code ASSIST} - suggest guesses for a real game, reading feedback from the console.</li>
 * </ul>
 * The {@code ai-human} profile swaps the AI for a person typing guesses (SOLVE and ASSIST only).
 */
@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final Player player;
    private final DictionaryLoader dictionaryLoader;
    private final RunProperties runProperties;
    private final SweepProperties sweepProperties;
    private final StarterSweep starterSweep;
    private final Scanner consoleScanner;

    public Game(
            Player player,
            DictionaryLoader dictionaryLoader,
            RunProperties runProperties,
            SweepProperties sweepProperties,
            StarterSweep starterSweep,
            Scanner consoleScanner) {
        this.player = player;
        this.dictionaryLoader = dictionaryLoader;
        this.runProperties = runProperties;
        this.sweepProperties = sweepProperties;
        this.starterSweep = starterSweep;
        this.consoleScanner = consoleScanner;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        Dictionary dictionary = dictionaryLoader.load();
        Word starter = optionalWord(runProperties.getStarter(), "run.starter");
        switch (runProperties.getMode()) {
            case SWEEP -> sweep(dictionary);
            case SOLVE -> solve(dictionary, target(dictionary), starter);
            case ASSIST -> assist(dictionary, starter);
        }
    }

    /**
     * Tests every configured starter against the same seeded targets.
     */
    public List<StarterStats> sweep(Dictionary dictionary) {
        if (player instanceof HumanPlayer) {
            throw new IllegalStateException("Sweep mode needs the AI player; run without the ai-human profile");
        }
        List<Word> starters = new ArrayList<>();
        if (sweepProperties.getStarters().isEmpty()) {
            starters.addAll(dictionary.words());
        } else {
            for (String text : sweepProperties.getStarters()) {
                Word starter = Word.of(text);
                if (!dictionary.contains(starter)) {
                    log.warn("Starter {} is not in the word list; testing it anyway", starter);
                }
                starters.add(starter);
            }
        }
        List<Word> targets = TargetSampler.sample(dictionary, sweepProperties.getTargets(), sweepProperties.getSeed());
        log.info("Sweep: {} targets, seed {}", targets.size(), sweepProperties.getSeed());
        return starterSweep.run(player, dictionary, starters, targets);
    }

    /**
     * Plays one game against a known target and logs every turn.
     */
    public GameResult solve(Dictionary dictionary, Word target, Word starter) {
        if (!dictionary.contains(target)) {
            log.warn("Target {} is not in the word list; solving it anyway", target);
        }
        log.info("Solving for {} starting from {} candidates", target, dictionary.size());
        SolveLoop loop = new SolveLoop(player, dictionary);
        loop.setListener((turn, guess, feedback, knowledge, candidates) ->
                log.info("Guess {}: {} -> {} ({} candidates left)", turn, guess, feedback, candidates.size()));
        GameResult result = loop.play(new TargetFeedbackSource(target), starter);
        if (result.isSolved()) {
            log.info("Solved {} in {} tries: {}", target, result.getTurns(), joined(result.getGuesses()));
        } else {
            log.info("Failed to solve {} ({}): {}", target, result.getOutcome(), joined(result.getGuesses()));
        }
        return result;
    }

    /**
     * Interactive helper for a real game: suggests a word, reads back the colours.
     */
    public GameResult assist(Dictionary dictionary, Word starter) {
        System.out.println("Enter each suggested word in the game, then type the colours you got.");
        SolveLoop loop = new SolveLoop(player, dictionary);
        loop.setListener((turn, guess, feedback, knowledge, candidates) -> {
            System.out.println("Known letters:    " + knowledge.getKnownLetters());
            System.out.println("Excluded letters: " + knowledge.getExcludedLetters());
            System.out.println("Pattern:          " + knowledge.pattern());
            if (!feedback.isSolved()) {
                printRemaining(candidates);
            }
        });
        GameResult result = loop.play(new ConsoleFeedbackSource(consoleScanner, System.out), starter);
        switch (result.getOutcome()) {
            case SOLVED -> System.out.println("Solved in " + result.getTurns() + " tries! " + joined(result.getGuesses()));
            case CONTRADICTION -> System.out.println(
                    "No valid words remaining. The feedback may be mistyped, or the word is not in the list.");
            case EXHAUSTED -> System.out.println("Didn't solve it in " + SolveLoop.MAX_TURNS + " tries: " + joined(result.getGuesses()));
            case ABANDONED -> System.out.println("Thanks for playing!");
        }
        return result;
    }

    private Word target(Dictionary dictionary) {
        Word target = optionalWord(runProperties.getTarget(), "run.target");
        if (target != null) {
            return target;
        }
        return TargetSampler.sample(dictionary, 1, sweepProperties.getSeed()).get(0);
    }

    private static Word optionalWord(String text, String property) {
        if (text == null || text.isBlank()) {
            return null;
        }
        if (!Word.isValid(text.trim())) {
            throw new IllegalArgumentException(property + " must be a " + Word.LENGTH + "-letter word but was '" + text + "'");
        }
        return Word.of(text);
    }

    private static void printRemaining(CandidateSet candidates) {
        System.out.println("Possible words remaining: " + candidates.size());
        if (candidates.size() <= 20) {
            System.out.println("  " + candidates.words().stream().map(Word::text).collect(Collectors.joining(", ")));
        }
    }

    private static String joined(List<Word> words) {
        return words.stream().map(Word::text).collect(Collectors.joining(" -> "));
    }
}
