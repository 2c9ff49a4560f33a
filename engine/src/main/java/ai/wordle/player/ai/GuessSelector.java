package ai.wordle.player.ai;

import ai.wordle.config.SelectorProperties;
import ai.wordle.game.CandidateSet;
import ai.wordle.game.Dictionary;
import ai.wordle.game.FeedbackEngine;
import ai.wordle.game.KnowledgeState;
import ai.wordle.game.Word;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heuristic minimax guess selection.
 *
 * <p>Picks the next guess from the candidate count, the turn number and the letters learned so
 * far. The main objective is the worst-case number of candidates left after the guess (the
 * largest feedback group); bonuses push towards testing new letters while the set is large and
 * towards guessing a possible answer once it is small or turns are running out.
 *
 * <p>Precedence:
 * <ol>
 *     <li>One candidate: return it.</li>
 *     <li>Turn one with a fixed starter: return the starter.</li>
 *     <li>Two candidates: first non-candidate in the disambiguation window that splits them,
 *         else the first candidate.</li>
 *     <li>Otherwise build an evaluation set for the current {@link Regime}, score every word and
 *         return the best.</li>
 * </ol>
 *
 * <p>Only a prefix of the dictionary is ever scanned, so the result depends on dictionary order.
 * The selector holds no per-game state and can be shared between threads.
 */
public class GuessSelector {
    private static final Logger log = LoggerFactory.getLogger(GuessSelector.class);
    private static final int LOGGED_CANDIDATES = 8;

    private final SelectorProperties config;

    public GuessSelector(SelectorProperties config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Chooses the next guess.
     *
     * @param candidates   words still consistent with all feedback; must not be empty
     * @param dictionary   every allowed guess, in its fixed order
     * @param turn         1-based turn number
     * @param knowledge    letters learned so far
     * @param fixedStarter opening word to play on turn one, or {@code null}
     * @return the guess
     * @throws IllegalArgumentException if there are no candidates or the turn is below 1
     */
    public Word selectGuess(CandidateSet candidates, Dictionary dictionary, int turn, KnowledgeState knowledge, Word fixedStarter) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot select a guess from an empty candidate set");
        }
        if (turn < 1) {
            throw new IllegalArgumentException("turn must be >= 1 but was " + turn);
        }

        Regime regime = regimeFor(candidates.size(), turn, fixedStarter);
        switch (regime) {
            case FORCED:
                return candidates.get(0);
            case STARTER:
                return fixedStarter;
            case DISAMBIGUATION:
                return disambiguate(candidates, dictionary);
            default:
                break;
        }

        List<Word> evaluationSet = evaluationSet(regime, candidates, dictionary, knowledge);
        if (evaluationSet.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("Turn {}: {} regime found no probe words; guessing first candidate {}",
                        turn, regime, candidates.get(0));
            }
            return candidates.get(0);
        }

        List<ScoredGuess> ranked = rank(evaluationSet, candidates, turn, knowledge);
        if (log.isDebugEnabled()) {
            log.debug("Turn {}, {} candidates, regime {}, {} probes; known={} excluded={}",
                    turn, candidates.size(), regime, evaluationSet.size(),
                    knowledge.getKnownLetters(), knowledge.getExcludedLetters());
            for (ScoredGuess scored : ranked.subList(0, Math.min(LOGGED_CANDIDATES, ranked.size()))) {
                log.debug("  {}", scored);
            }
        }
        return ranked.get(0).word();
    }

    /**
     * Which strategy applies for a given state.
     */
    public Regime regimeFor(int candidateCount, int turn, Word fixedStarter) {
        if (candidateCount == 1) {
            return Regime.FORCED;
        }
        if (turn == 1 && fixedStarter != null) {
            return Regime.STARTER;
        }
        if (candidateCount == 2) {
            return Regime.DISAMBIGUATION;
        }
        if (candidateCount > config.getEliminationThreshold()) {
            return Regime.ELIMINATION;
        }
        if (candidateCount > config.getAnswerThreshold()) {
            return Regime.EXPLORATION;
        }
        return Regime.ANSWER_FOCUSED;
    }

    /**
     * Builds the words to score for one of the scoring regimes, in the order they were found.
     *
     * @throws IllegalArgumentException for a regime that does not score words
     */
    public List<Word> evaluationSet(Regime regime, CandidateSet candidates, Dictionary dictionary, KnowledgeState knowledge) {
        return switch (regime) {
            case ELIMINATION -> eliminationSet(candidates, dictionary, knowledge);
            case EXPLORATION -> explorationSet(candidates, dictionary, knowledge);
            case ANSWER_FOCUSED -> answerFocusedSet(candidates, dictionary);
            default -> throw new IllegalArgumentException("Regime " + regime + " does not build an evaluation set");
        };
    }

    /**
     * Scores one probe word against the candidates.
     */
    public ScoredGuess score(Word word, CandidateSet candidates, int turn, KnowledgeState knowledge) {
        PartitionStats stats = PartitionEvaluator.evaluate(word, candidates);
        int remaining = candidates.size();
        boolean largeSet = remaining > config.getAnswerThreshold();
        int unknown = knowledge.unknownLetterCount(word);
        int known = knowledge.knownLetterCount(word);

        double explorationBonus = 0.0;
        if (!stats.candidateAnswer() && largeSet) {
            explorationBonus = -0.5 * unknown + 0.3 * known;
        }

        double answerBonus;
        if (stats.candidateAnswer()) {
            boolean commit = remaining <= config.getSmallSetThreshold() || turn >= config.getLateGameTurn();
            answerBonus = commit ? -1.0 : 2.0;
        } else {
            answerBonus = largeSet ? -0.5 : 0.0;
        }

        double finalScore = stats.maxBucket() + stats.avgBucket() / 1000.0 + answerBonus + explorationBonus;
        return new ScoredGuess(word, stats, unknown, known, finalScore);
    }

    List<ScoredGuess> rank(List<Word> evaluationSet, CandidateSet candidates, int turn, KnowledgeState knowledge) {
        List<ScoredGuess> scored = new ArrayList<>(evaluationSet.size());
        for (Word word : evaluationSet) {
            scored.add(score(word, candidates, turn, knowledge));
        }
        scored.sort(ScoredGuess.BEST_FIRST);
        return scored;
    }

    private Word disambiguate(CandidateSet candidates, Dictionary dictionary) {
        Word first = candidates.get(0);
        Word second = candidates.get(1);
        for (Word probe : nonCandidatePrefix(candidates, dictionary, config.getDisambiguationWindow())) {
            if (FeedbackEngine.computeCode(probe, first) != FeedbackEngine.computeCode(probe, second)) {
                if (log.isDebugEnabled()) {
                    log.debug("Two candidates {} / {}: probing with {}", first, second, probe);
                }
                return probe;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Two candidates {} / {}: no splitting probe, guessing {}", first, second, first);
        }
        return first;
    }

    private List<Word> eliminationSet(CandidateSet candidates, Dictionary dictionary, KnowledgeState knowledge) {
        List<Word> window = nonCandidatePrefix(candidates, dictionary, config.getEliminationWindow());
        List<Word> pool = new ArrayList<>();
        for (Word word : window) {
            if (knowledge.unknownLetterCount(word) >= config.getEliminationMinUnknownLetters()) {
                pool.add(word);
            }
        }
        if (pool.size() < config.getEliminationMinPool()) {
            int[] frequencies = letterFrequencies(candidates);
            pool.clear();
            for (Word word : window) {
                if (frequencyScore(word, frequencies) > 0) {
                    pool.add(word);
                }
            }
        }
        return cap(pool, config.getEliminationCap());
    }

    private List<Word> explorationSet(CandidateSet candidates, Dictionary dictionary, KnowledgeState knowledge) {
        List<Word> pool = new ArrayList<>();
        for (Word word : nonCandidatePrefix(candidates, dictionary, config.getExplorationWindow())) {
            if (knowledge.unknownLetterCount(word) >= config.getExplorationMinUnknownLetters()) {
                pool.add(word);
            }
        }
        // List.sort is stable, so equal counts keep dictionary order.
        pool.sort(Comparator.comparingInt(knowledge::unknownLetterCount).reversed());
        return cap(pool, config.getExplorationCap());
    }

    private List<Word> answerFocusedSet(CandidateSet candidates, Dictionary dictionary) {
        Set<Word> pool = new LinkedHashSet<>(candidates.words());
        if (pool.size() < config.getAnswerPoolMin()) {
            int added = 0;
            for (Word word : dictionary.words()) {
                if (added >= config.getAnswerPoolExtension()) {
                    break;
                }
                if (pool.add(word)) {
                    added++;
                }
            }
        }
        return new ArrayList<>(pool);
    }

    /**
     * The first {@code limit} dictionary words that are not candidates, in dictionary order.
     */
    static List<Word> nonCandidatePrefix(CandidateSet candidates, Dictionary dictionary, int limit) {
        List<Word> result = new ArrayList<>(Math.min(limit, dictionary.size()));
        for (Word word : dictionary.words()) {
            if (result.size() >= limit) {
                break;
            }
            if (!candidates.contains(word)) {
                result.add(word);
            }
        }
        return result;
    }

    /**
     * Number of candidates containing each letter, counting a letter once per word.
     */
    static int[] letterFrequencies(CandidateSet candidates) {
        int[] frequencies = new int[26];
        for (Word word : candidates) {
            int mask = word.letterMask();
            while (mask != 0) {
                int letter = Integer.numberOfTrailingZeros(mask);
                frequencies[letter]++;
                mask &= mask - 1;
            }
        }
        return frequencies;
    }

    static int frequencyScore(Word word, int[] frequencies) {
        int score = 0;
        int mask = word.letterMask();
        while (mask != 0) {
            score += frequencies[Integer.numberOfTrailingZeros(mask)];
            mask &= mask - 1;
        }
        return score;
    }

    private static List<Word> cap(List<Word> words, int limit) {
        if (words.size() <= limit) {
            return words;
        }
        return new ArrayList<>(words.subList(0, limit));
    }
}
