package ai.wordle.sweep;

import ai.wordle.game.GameResult;
import ai.wordle.game.Word;
import java.util.Comparator;
import java.util.Objects;

/**
 * Tally of the games played with one opening word.
 * <p>
 * Not thread-safe: each worker fills its own instance and the sweep combines them with
 * {@link #merge(StarterStats)} once the workers are done.
 */
public class StarterStats {

    /** Best first: highest success rate, then fewest mean tries, then alphabetical. */
    public static final Comparator<StarterStats> RANKING = Comparator
            .comparingDouble(StarterStats::successRate).reversed()
            .thenComparingDouble(StarterStats::avgTries)
            .thenComparing(StarterStats::getStarter);

    private final Word starter;
    /** {@code solvedIn[n - 1]} counts games solved on turn n. */
    private final int[] solvedIn = new int[6];
    private int failed;
    private int contradictions;
    private int totalSolvedTries;

    public StarterStats(Word starter) {
        this.starter = Objects.requireNonNull(starter, "starter");
    }

    public void record(GameResult result) {
        if (result.isSolved()) {
            int turns = result.getTurns();
            solvedIn[turns - 1]++;
            totalSolvedTries += turns;
        } else {
            failed++;
            if (result.getOutcome() == GameResult.Outcome.CONTRADICTION) {
                contradictions++;
            }
        }
    }

    /**
     * Adds another tally for the same starter into this one.
     *
     * @throws IllegalArgumentException if the starters differ
     */
    public StarterStats merge(StarterStats other) {
        if (!starter.equals(other.starter)) {
            throw new IllegalArgumentException("Cannot merge stats for " + other.starter + " into " + starter);
        }
        for (int i = 0; i < solvedIn.length; i++) {
            solvedIn[i] += other.solvedIn[i];
        }
        failed += other.failed;
        contradictions += other.contradictions;
        totalSolvedTries += other.totalSolvedTries;
        return this;
    }

    public Word getStarter() {
        return starter;
    }

    /**
     * Games solved on exactly the given turn (1-6).
     */
    public int getSolvedIn(int turn) {
        return solvedIn[turn - 1];
    }

    public int getSolved() {
        int solved = 0;
        for (int count : solvedIn) {
            solved += count;
        }
        return solved;
    }

    public int getFailed() {
        return failed;
    }

    /**
     * Failed games that ended because no candidate was left. Should stay zero.
     */
    public int getContradictions() {
        return contradictions;
    }

    public int getGames() {
        return getSolved() + failed;
    }

    /**
     * Percentage of games solved, 0 when nothing was played.
     */
    public double successRate() {
        int games = getGames();
        return games == 0 ? 0.0 : getSolved() * 100.0 / games;
    }

    /**
     * Mean winning turn over solved games only, 0 when nothing was solved.
     */
    public double avgTries() {
        int solved = getSolved();
        return solved == 0 ? 0.0 : totalSolvedTries / (double) solved;
    }

    @Override
    public String toString() {
        return String.format("%s: %.1f%% success, %.2f avg tries (1:%d 2:%d 3:%d 4:%d 5:%d 6:%d failed:%d)",
                starter, successRate(), avgTries(),
                solvedIn[0], solvedIn[1], solvedIn[2], solvedIn[3], solvedIn[4], solvedIn[5], failed);
    }
}
