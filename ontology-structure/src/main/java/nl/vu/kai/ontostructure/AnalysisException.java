package nl.vu.kai.ontostructure;

/**
 * An analysis run failed. The phase tells how far it got; mutations applied before the failure are
 * not rolled back.
 */
public class AnalysisException extends Exception {

    private final AnalysisPhase phase;

    public AnalysisException(AnalysisPhase phase, String message) {
        super(phase + ": " + message);
        this.phase = phase;
    }

    public AnalysisException(AnalysisPhase phase, String message, Throwable cause) {
        super(phase + ": " + message, cause);
        this.phase = phase;
    }

    public AnalysisPhase getPhase() {
        return phase;
    }
}
