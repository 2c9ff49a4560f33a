package ai.wordle.sweep;

import static org.junit.jupiter.api.Assertions.*;

import ai.wordle.game.GameResult;
import ai.wordle.game.GameResult.Outcome;
import ai.wordle.game.Word;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class StarterStatsTest {
    private static final Word SLATE = Word.of("SLATE");

    static GameResult game(Outcome outcome, int turns) {
        return new GameResult(SLATE, Collections.nCopies(turns, SLATE), outcome, 0L);
    }

    @Test
    void tallySeparatesWinsByTurnAndFailures() {
        StarterStats stats = new StarterStats(SLATE);
        stats.record(game(Outcome.SOLVED, 3));
        stats.record(game(Outcome.SOLVED, 4));
        stats.record(game(Outcome.EXHAUSTED, 6));
        stats.record(game(Outcome.CONTRADICTION, 2));

        assertEquals(4, stats.getGames());
        assertEquals(2, stats.getSolved());
        assertEquals(2, stats.getFailed());
        assertEquals(1, stats.getContradictions());
        assertEquals(1, stats.getSolvedIn(3));
        assertEquals(1, stats.getSolvedIn(4));
        assertEquals(0, stats.getSolvedIn(6));
        assertEquals(50.0, stats.successRate(), 1e-9);
        assertEquals(3.5, stats.avgTries(), 1e-9);
    }

    @Test
    void emptyTallyHasZeroRates() {
        StarterStats stats = new StarterStats(SLATE);
        assertEquals(0, stats.getGames());
        assertEquals(0.0, stats.successRate());
        assertEquals(0.0, stats.avgTries());
    }

    @Test
    void mergeAddsSlicesOfTheSameStarter() {
        StarterStats left = new StarterStats(SLATE);
        left.record(game(Outcome.SOLVED, 2));
        StarterStats right = new StarterStats(SLATE);
        right.record(game(Outcome.SOLVED, 4));
        right.record(game(Outcome.ABANDONED, 1));

        StarterStats merged = left.merge(right);
        assertSame(left, merged);
        assertEquals(3, merged.getGames());
        assertEquals(1, merged.getFailed());
        assertEquals(3.0, merged.avgTries(), 1e-9);

        assertThrows(IllegalArgumentException.class, () -> left.merge(new StarterStats(Word.of("CRANE"))));
    }

    @Test
    void rankingPrefersSuccessThenFewerTriesThenName() {
        StarterStats sure = new StarterStats(Word.of("TRACE"));
        sure.record(game(Outcome.SOLVED, 4));
        StarterStats quick = new StarterStats(Word.of("CRATE"));
        quick.record(game(Outcome.SOLVED, 3));
        StarterStats alsoQuick = new StarterStats(Word.of("CRANE"));
        alsoQuick.record(game(Outcome.SOLVED, 3));
        StarterStats shaky = new StarterStats(Word.of("ADIEU"));
        shaky.record(game(Outcome.SOLVED, 2));
        shaky.record(game(Outcome.EXHAUSTED, 6));

        List<StarterStats> ranked = new ArrayList<>(List.of(shaky, sure, quick, alsoQuick));
        ranked.sort(StarterStats.RANKING);

        assertEquals(List.of(alsoQuick, quick, sure, shaky), ranked);
    }
}
