package ai.wordle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties choosing what a command-line run does.
 *
 * Usage:
 * {@code java -jar engine.jar --run.mode=SOLVE --run.target=CRANE --run.starter=SLATE}
 */
@Component
@ConfigurationProperties(prefix = "run")
public class RunProperties {

    public enum Mode {
        /** Benchmark starter words against sampled targets. */
        SWEEP,
        /** Play one game against a secret target. */
        SOLVE,
        /** Suggest guesses for a real game; the user types back the feedback. */
        ASSIST
    }

    private Mode mode = Mode.SWEEP;
    private String target = "";
    private String starter = "";

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    /**
     * Secret word for {@link Mode#SOLVE}; blank picks one with the sweep seed.
     */
    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    /**
     * Fixed opening guess for SOLVE and ASSIST; blank lets the selector choose.
     */
    public String getStarter() {
        return starter;
    }

    public void setStarter(String starter) {
        this.starter = starter;
    }
}
