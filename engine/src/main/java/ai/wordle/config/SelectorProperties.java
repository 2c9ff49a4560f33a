package ai.wordle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the heuristic guess selector.
 *
 * Every threshold and window the selector uses lives here instead of in constants, so a
 * regime can be exercised in isolation (e.g. a tiny elimination window in a unit test) and
 * tuned from the command line:
 * {@code java -jar engine.jar --selector.elimination-cap=200}
 *
 * Windows count words from the front of the dictionary, so results depend on its order.
 */
@Component
@ConfigurationProperties(prefix = "selector")
public class SelectorProperties {
    /** Above this many candidates the selector is in the elimination regime. */
    private int eliminationThreshold = 15;
    /** At or below this many candidates the selector is answer-focused. */
    private int answerThreshold = 6;
    /** At or below this many candidates a candidate guess is rewarded instead of penalised. */
    private int smallSetThreshold = 2;
    /** From this turn on a candidate guess is rewarded regardless of set size. */
    private int lateGameTurn = 5;

    /** Non-candidate words scanned for a probe that splits exactly two candidates. */
    private int disambiguationWindow = 200;

    /** Non-candidate words considered in the elimination regime. */
    private int eliminationWindow = 800;
    /** Minimum unknown letters for an elimination probe. */
    private int eliminationMinUnknownLetters = 3;
    /** Below this many probes the elimination regime falls back to letter frequency. */
    private int eliminationMinPool = 50;
    /** Maximum elimination probes evaluated. */
    private int eliminationCap = 150;

    /** Non-candidate words considered in the exploration regime. */
    private int explorationWindow = 600;
    /** Minimum unknown letters for an exploration probe. */
    private int explorationMinUnknownLetters = 2;
    /** Maximum exploration probes evaluated. */
    private int explorationCap = 100;

    /** Answer-focused sets smaller than this are padded with dictionary words. */
    private int answerPoolMin = 50;
    /** How many dictionary words may be added to pad an answer-focused set. */
    private int answerPoolExtension = 100;

    public int getEliminationThreshold() {
        return eliminationThreshold;
    }

    public void setEliminationThreshold(int eliminationThreshold) {
        this.eliminationThreshold = eliminationThreshold;
    }

    public int getAnswerThreshold() {
        return answerThreshold;
    }

    public void setAnswerThreshold(int answerThreshold) {
        this.answerThreshold = answerThreshold;
    }

    public int getSmallSetThreshold() {
        return smallSetThreshold;
    }

    public void setSmallSetThreshold(int smallSetThreshold) {
        this.smallSetThreshold = smallSetThreshold;
    }

    public int getLateGameTurn() {
        return lateGameTurn;
    }

    public void setLateGameTurn(int lateGameTurn) {
        this.lateGameTurn = lateGameTurn;
    }

    public int getDisambiguationWindow() {
        return disambiguationWindow;
    }

    public void setDisambiguationWindow(int disambiguationWindow) {
        this.disambiguationWindow = disambiguationWindow;
    }

    public int getEliminationWindow() {
        return eliminationWindow;
    }

    public void setEliminationWindow(int eliminationWindow) {
        this.eliminationWindow = eliminationWindow;
    }

    public int getEliminationMinUnknownLetters() {
        return eliminationMinUnknownLetters;
    }

    public void setEliminationMinUnknownLetters(int eliminationMinUnknownLetters) {
        this.eliminationMinUnknownLetters = eliminationMinUnknownLetters;
    }

    public int getEliminationMinPool() {
        return eliminationMinPool;
    }

    public void setEliminationMinPool(int eliminationMinPool) {
        this.eliminationMinPool = eliminationMinPool;
    }

    public int getEliminationCap() {
        return eliminationCap;
    }

    public void setEliminationCap(int eliminationCap) {
        this.eliminationCap = eliminationCap;
    }

    public int getExplorationWindow() {
        return explorationWindow;
    }

    public void setExplorationWindow(int explorationWindow) {
        this.explorationWindow = explorationWindow;
    }

    public int getExplorationMinUnknownLetters() {
        return explorationMinUnknownLetters;
    }

    public void setExplorationMinUnknownLetters(int explorationMinUnknownLetters) {
        this.explorationMinUnknownLetters = explorationMinUnknownLetters;
    }

    public int getExplorationCap() {
        return explorationCap;
    }

    public void setExplorationCap(int explorationCap) {
        this.explorationCap = explorationCap;
    }

    public int getAnswerPoolMin() {
        return answerPoolMin;
    }

    public void setAnswerPoolMin(int answerPoolMin) {
        this.answerPoolMin = answerPoolMin;
    }

    public int getAnswerPoolExtension() {
        return answerPoolExtension;
    }

    public void setAnswerPoolExtension(int answerPoolExtension) {
        this.answerPoolExtension = answerPoolExtension;
    }
}
