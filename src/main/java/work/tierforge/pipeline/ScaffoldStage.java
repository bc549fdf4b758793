package work.tierforge.pipeline;

/**
 * Progress of one scaffold. Every run ends in {@link #WRITTEN} (or {@link #RENDERED} when nothing is
 * written) or {@link #FAILED}.
 */
public enum ScaffoldStage {
    START,
    INTROSPECTED,
    CONTEXT_BUILT,
    VALIDATED,
    RENDERED,
    WRITTEN,
    FAILED
}
