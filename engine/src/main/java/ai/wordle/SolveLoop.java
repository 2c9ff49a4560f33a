package ai.wordle;

import ai.wordle.game.CandidateFilter;
import ai.wordle.game.CandidateSet;
import ai.wordle.game.Dictionary;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.GameResult;
import ai.wordle.game.GameResult.Outcome;
import ai.wordle.game.KnowledgeState;
import ai.wordle.game.KnowledgeTracker;
import ai.wordle.game.Word;
import ai.wordle.player.FeedbackSource;
import ai.wordle.player.Player;
import ai.wordle.player.TargetFeedbackSource;
import ai.wordle.player.TurnListener;
import ai.wordle.player.TurnView;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays one game of up to six turns.
 *
 * <p>Each turn: ask the player for a guess, get feedback for it, record the guess, fold the
 * feedback into the knowledge, then either stop on all-green or filter the candidates. The game
 * ends as:
 * <ul>
 *     <li>{@link Outcome#SOLVED} on all-green feedback,</li>
 *     <li>{@link Outcome#CONTRADICTION} as soon as no candidate fits the feedback,</li>
 *     <li>{@link Outcome#ABANDONED} if the player or the feedback source gives up,</li>
 *     <li>{@link Outcome#EXHAUSTED} after six unsolved turns.</li>
 * </ul>
 * A contradiction cannot happen against a real target from the same dictionary, but it is
 * classified rather than thrown so that one bad game never aborts a batch.
 *
 * <p>Candidate set and knowledge are local to {@link #play}; a loop can be reused for many games
 * and, with a stateless player, from many threads.
 */
public class SolveLoop {
    private static final Logger log = LoggerFactory.getLogger(SolveLoop.class);

    /** Guesses allowed per game. */
    public static final int MAX_TURNS = 6;

    private final Player player;
    private final Dictionary dictionary;
    private TurnListener listener;

    public SolveLoop(Player player, Dictionary dictionary) {
        this.player = Objects.requireNonNull(player, "player");
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    public void setListener(TurnListener listener) {
        this.listener = listener;
    }

    /**
     * Plays one game.
     *
     * @param source  answers each guess
     * @param starter fixed opening word, or {@code null} to let the player choose
     * @return what happened
     */
    public GameResult play(FeedbackSource source, Word starter) {
        long startNanos = System.nanoTime();
        CandidateSet candidates = dictionary.toCandidateSet();
        KnowledgeState knowledge = KnowledgeState.empty();
        List<Word> guesses = new ArrayList<>();
        Word target = source instanceof TargetFeedbackSource ? ((TargetFeedbackSource) source).getTarget() : null;
        Outcome outcome = Outcome.EXHAUSTED;

        for (int turn = 1; turn <= MAX_TURNS; turn++) {
            Word guess = player.nextGuess(new TurnView(candidates, dictionary, turn, knowledge, starter));
            if (guess == null) {
                outcome = Outcome.ABANDONED;
                break;
            }
            FeedbackPattern feedback = source.feedbackFor(guess, turn);
            if (feedback == null) {
                outcome = Outcome.ABANDONED;
                break;
            }
            guesses.add(guess);
            knowledge = KnowledgeTracker.update(knowledge, guess, feedback);

            if (feedback.isSolved()) {
                outcome = Outcome.SOLVED;
                notifyListener(turn, guess, feedback, knowledge, candidates);
                GameLogger.logTurn(target, turn, guess, feedback, candidates.size());
                break;
            }

            candidates = CandidateFilter.filter(candidates, guess, feedback);
            notifyListener(turn, guess, feedback, knowledge, candidates);
            GameLogger.logTurn(target, turn, guess, feedback, candidates.size());
            if (log.isDebugEnabled()) {
                log.debug("Turn {}: {} -> {}, {} candidates left {}", turn, guess, feedback, candidates.size(), candidates);
            }
            if (candidates.isEmpty()) {
                outcome = Outcome.CONTRADICTION;
                if (log.isDebugEnabled()) {
                    log.debug("No candidate fits the feedback after {} (target {})", guesses, target);
                }
                break;
            }
        }

        GameResult result = new GameResult(starter, guesses, outcome, System.nanoTime() - startNanos);
        if (log.isDebugEnabled()) {
            log.debug("Game over for target {}: {}", target, result);
        }
        GameLogger.logSummary(target, result);
        return result;
    }

    private void notifyListener(int turn, Word guess, FeedbackPattern feedback, KnowledgeState knowledge, CandidateSet candidates) {
        if (listener != null) {
            listener.onTurn(turn, guess, feedback, knowledge, candidates);
        }
    }
}
