package ai.wordle.player.ai;

import static org.junit.jupiter.api.Assertions.*;

import ai.wordle.config.SelectorProperties;
import ai.wordle.game.CandidateSet;
import ai.wordle.game.Dictionary;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.KnowledgeState;
import ai.wordle.game.KnowledgeTracker;
import ai.wordle.game.Word;
import ai.wordle.unit.helpers.DictionaryFactory;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class GuessSelectorTest {
    private static final KnowledgeState NOTHING = KnowledgeState.empty();

    /** A, B, C, D known present; Z excluded. */
    private static final KnowledgeState ABCD_KNOWN =
            KnowledgeTracker.update(KnowledgeState.empty(), Word.of("ABCDZ"), FeedbackPattern.parse("YYYYB"));

    private static List<Word> words(String... text) {
        List<Word> list = new ArrayList<>();
        for (String t : text) {
            list.add(Word.of(t));
        }
        return list;
    }

    private static Dictionary dictionary(String[] candidates, String... probes) {
        List<String> all = new ArrayList<>(Arrays.asList(probes));
        all.addAll(Arrays.asList(candidates));
        return Dictionary.of(all.toArray(new String[0]));
    }

    @Test
    void regimePrecedence() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        Word starter = Word.of("SLATE");

        assertEquals(Regime.FORCED, selector.regimeFor(1, 1, starter));
        assertEquals(Regime.STARTER, selector.regimeFor(500, 1, starter));
        assertEquals(Regime.STARTER, selector.regimeFor(2, 1, starter));
        assertEquals(Regime.DISAMBIGUATION, selector.regimeFor(2, 3, null));
        assertEquals(Regime.ELIMINATION, selector.regimeFor(500, 1, null));
        assertEquals(Regime.ELIMINATION, selector.regimeFor(16, 2, null));
        assertEquals(Regime.EXPLORATION, selector.regimeFor(15, 2, null));
        assertEquals(Regime.EXPLORATION, selector.regimeFor(7, 2, null));
        assertEquals(Regime.ANSWER_FOCUSED, selector.regimeFor(6, 2, null));
        assertEquals(Regime.ANSWER_FOCUSED, selector.regimeFor(3, 2, null));
    }

    @Test
    void singleCandidateIsAlwaysGuessed() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        Dictionary dictionary = DictionaryFactory.bundled();
        Word guess = selector.selectGuess(CandidateSet.of("CRANE"), dictionary, 1, NOTHING, Word.of("SLATE"));
        assertEquals(Word.of("CRANE"), guess);
    }

    @Test
    void starterIsUsedOnTurnOneEvenIfNotInTheDictionary() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        Dictionary dictionary = DictionaryFactory.bundled();
        Word starter = Word.of("XYLYL");
        assertEquals(starter, selector.selectGuess(dictionary.toCandidateSet(), dictionary, 1, NOTHING, starter));
    }

    @Test
    void twoCandidatesProbeWithFirstSplittingWord() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        // PLUMB gives BYBBB against both; THICK separates them.
        Dictionary dictionary = Dictionary.of("STALE", "SHALE", "PLUMB", "THICK");
        Word guess = selector.selectGuess(CandidateSet.of("STALE", "SHALE"), dictionary, 3, NOTHING, null);
        assertEquals(Word.of("THICK"), guess);
    }

    @Test
    void twoCandidatesWithoutSplittingWordGuessFirst() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        Dictionary dictionary = Dictionary.of("STALE", "SHALE", "PLUMB");
        assertEquals(Word.of("STALE"),
                selector.selectGuess(CandidateSet.of("STALE", "SHALE"), dictionary, 3, NOTHING, null));

        SelectorProperties narrow = new SelectorProperties();
        narrow.setDisambiguationWindow(1);
        Dictionary withThick = Dictionary.of("STALE", "SHALE", "PLUMB", "THICK");
        assertEquals(Word.of("STALE"),
                new GuessSelector(narrow).selectGuess(CandidateSet.of("STALE", "SHALE"), withThick, 3, NOTHING, null));
    }

    @Test
    void eliminationKeepsWordsWithManyUnknownLetters() {
        String[] candidates = DictionaryFactory.sixteenSyntheticWords();
        Dictionary dictionary = dictionary(candidates, "FGHIJ", "AFGHB", "ABFCD", "KLMNO");
        SelectorProperties props = new SelectorProperties();
        props.setEliminationMinPool(2);

        List<Word> set = new GuessSelector(props)
                .evaluationSet(Regime.ELIMINATION, CandidateSet.of(candidates), dictionary, ABCD_KNOWN);
        assertEquals(words("FGHIJ", "AFGHB", "KLMNO"), set);
    }

    @Test
    void eliminationFallsBackToLetterFrequencyWhenPoolIsSmall() {
        String[] candidates = DictionaryFactory.sixteenSyntheticWords();
        Dictionary dictionary = dictionary(candidates, "FGHIJ", "AFGHB", "ABFCD", "KLMNO");

        // Default minimum pool of 50 is not reached, so only words sharing a letter with the candidates remain.
        List<Word> set = new GuessSelector(new SelectorProperties())
                .evaluationSet(Regime.ELIMINATION, CandidateSet.of(candidates), dictionary, ABCD_KNOWN);
        assertEquals(words("AFGHB", "ABFCD"), set);
    }

    @Test
    void eliminationHonoursWindowAndCap() {
        String[] candidates = DictionaryFactory.sixteenSyntheticWords();
        Dictionary dictionary = dictionary(candidates, "FGHIJ", "AFGHB", "ABFCD", "KLMNO");

        SelectorProperties capped = new SelectorProperties();
        capped.setEliminationMinPool(2);
        capped.setEliminationCap(1);
        assertEquals(words("FGHIJ"), new GuessSelector(capped)
                .evaluationSet(Regime.ELIMINATION, CandidateSet.of(candidates), dictionary, ABCD_KNOWN));

        SelectorProperties windowed = new SelectorProperties();
        windowed.setEliminationMinPool(1);
        windowed.setEliminationWindow(2);
        assertEquals(words("FGHIJ", "AFGHB"), new GuessSelector(windowed)
                .evaluationSet(Regime.ELIMINATION, CandidateSet.of(candidates), dictionary, ABCD_KNOWN));
    }

    @Test
    void explorationSortsByUnknownLettersAndCaps() {
        String[] candidates = Arrays.copyOf(DictionaryFactory.sixteenSyntheticWords(), 10);
        Dictionary dictionary = dictionary(candidates, "ABFCD", "AFGHB", "FGHIJ", "AFGDB", "KLMNO");
        SelectorProperties props = new SelectorProperties();
        GuessSelector selector = new GuessSelector(props);

        // ABFCD has a single unknown letter and is dropped; the rest are ordered 5, 5, 3, 2.
        assertEquals(words("FGHIJ", "KLMNO", "AFGHB", "AFGDB"),
                selector.evaluationSet(Regime.EXPLORATION, CandidateSet.of(candidates), dictionary, ABCD_KNOWN));

        props.setExplorationCap(3);
        assertEquals(words("FGHIJ", "KLMNO", "AFGHB"),
                selector.evaluationSet(Regime.EXPLORATION, CandidateSet.of(candidates), dictionary, ABCD_KNOWN));
    }

    @Test
    void answerFocusedPadsSmallPoolsFromTheDictionary() {
        CandidateSet candidates = CandidateSet.of("STALE", "SHALE", "SCALE");
        Dictionary dictionary = Dictionary.of("CRANE", "STALE", "SHALE", "SCALE", "THICK", "SLATE");
        SelectorProperties props = new SelectorProperties();
        props.setAnswerPoolExtension(2);
        GuessSelector selector = new GuessSelector(props);

        assertEquals(words("STALE", "SHALE", "SCALE", "CRANE", "THICK"),
                selector.evaluationSet(Regime.ANSWER_FOCUSED, candidates, dictionary, NOTHING));

        props.setAnswerPoolMin(3);
        assertEquals(words("STALE", "SHALE", "SCALE"),
                selector.evaluationSet(Regime.ANSWER_FOCUSED, candidates, dictionary, NOTHING));
    }

    @Test
    void nonScoringRegimesHaveNoEvaluationSet() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        assertThrows(IllegalArgumentException.class, () -> selector.evaluationSet(
                Regime.FORCED, CandidateSet.of("CRANE"), Dictionary.of("CRANE"), NOTHING));
    }

    @Test
    void candidateBonusFlipsLateInTheGame() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        CandidateSet candidates = CandidateSet.of("STALE", "SHALE", "SCALE");

        // max 2, avg 1.5; a candidate earns +2 early and -1 from turn five.
        assertEquals(2 + 0.0015 + 2.0, selector.score(Word.of("STALE"), candidates, 2, NOTHING).finalScore(), 1e-9);
        assertEquals(2 + 0.0015 - 1.0, selector.score(Word.of("STALE"), candidates, 5, NOTHING).finalScore(), 1e-9);
        // A non-candidate in a small set gets no bonus at all.
        assertEquals(1 + 0.001, selector.score(Word.of("THICK"), candidates, 2, NOTHING).finalScore(), 1e-9);
    }

    @Test
    void probesInLargeSetsAreRewardedForNewLetters() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        CandidateSet candidates = CandidateSet.of(Arrays.copyOf(DictionaryFactory.sixteenSyntheticWords(), 10));
        Word probe = Word.of("AFGHB");

        ScoredGuess scored = selector.score(probe, candidates, 2, ABCD_KNOWN);
        PartitionStats stats = PartitionEvaluator.evaluate(probe, candidates);
        assertEquals(3, scored.unknownLetters());
        assertEquals(2, scored.knownLetters());
        double expected = stats.maxBucket() + stats.avgBucket() / 1000.0 - 0.5 - 0.5 * 3 + 0.3 * 2;
        assertEquals(expected, scored.finalScore(), 1e-9);
    }

    @Test
    void answerFocusedPrefersASplittingProbe() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        CandidateSet candidates = CandidateSet.of("STALE", "SHALE", "SCALE");
        Dictionary dictionary = Dictionary.of("STALE", "SHALE", "SCALE", "THICK");

        assertEquals(Word.of("THICK"), selector.selectGuess(candidates, dictionary, 2, NOTHING, null));
        assertEquals(Word.of("THICK"), selector.selectGuess(candidates, dictionary, 5, NOTHING, null));
    }

    @Test
    void equalScoresResolveAlphabetically() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        CandidateSet candidates = CandidateSet.of("STALE", "SHALE", "SCALE");
        Dictionary dictionary = Dictionary.of("STALE", "SHALE", "SCALE");

        assertEquals(Word.of("SCALE"), selector.selectGuess(candidates, dictionary, 2, NOTHING, null));
    }

    @Test
    void rankingComparatorBreaksTiesOnWorstCaseThenMeanThenWord() {
        PartitionStats wide = new PartitionStats(3, 2.0, 4, false, 6.0);
        PartitionStats narrow = new PartitionStats(2, 2.5, 3, false, 5.5);
        List<ScoredGuess> guesses = new ArrayList<>(List.of(
                new ScoredGuess(Word.of("BBBBB"), wide, 0, 0, 5.0),
                new ScoredGuess(Word.of("CCCCC"), narrow, 0, 0, 5.0),
                new ScoredGuess(Word.of("AAAAA"), wide, 0, 0, 5.0),
                new ScoredGuess(Word.of("DDDDD"), wide, 0, 0, 4.0)));
        guesses.sort(ScoredGuess.BEST_FIRST);

        assertEquals(words("DDDDD", "CCCCC", "AAAAA", "BBBBB"),
                guesses.stream().map(ScoredGuess::word).toList());
    }

    @Test
    void probeWindowFallsBackToFirstCandidate() {
        String[] candidates = DictionaryFactory.sixteenSyntheticWords();
        Dictionary dictionary = Dictionary.of(candidates);
        Word guess = new GuessSelector(new SelectorProperties())
                .selectGuess(CandidateSet.of(candidates), dictionary, 2, NOTHING, null);
        assertEquals(Word.of(candidates[0]), guess);
    }

    @Test
    void rejectsEmptyCandidatesAndBadTurns() {
        GuessSelector selector = new GuessSelector(new SelectorProperties());
        Dictionary dictionary = Dictionary.of("CRANE");
        assertThrows(IllegalArgumentException.class,
                () -> selector.selectGuess(CandidateSet.of(), dictionary, 1, NOTHING, null));
        assertThrows(IllegalArgumentException.class,
                () -> selector.selectGuess(CandidateSet.of("CRANE"), dictionary, 0, NOTHING, null));
    }

    @Test
    void helperFrequenciesCountWordsNotLetters() {
        int[] frequencies = GuessSelector.letterFrequencies(CandidateSet.of("SPEED", "ERASE"));
        assertEquals(2, frequencies['E' - 'A']);
        assertEquals(2, frequencies['S' - 'A']);
        assertEquals(1, frequencies['P' - 'A']);
        assertEquals(0, frequencies['Z' - 'A']);
        assertEquals(0, GuessSelector.frequencyScore(Word.of("ZZZZZ"), frequencies));
        assertEquals(4, GuessSelector.frequencyScore(Word.of("SEXXX"), frequencies));
    }
}
