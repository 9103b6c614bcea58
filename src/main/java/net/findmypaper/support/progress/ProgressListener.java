package net.findmypaper.support.progress;

/**
 * Observer for the stages of a recommendation run.
 *
 * <p>Passed explicitly into each pipeline call so the engine holds no progress state of its
 * own. Callbacks carry no correctness obligations; {@link #NONE} ignores everything.</p>
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    /**
     * A new pipeline stage started.
     */
    default void onStage(String stage) {
    }

    /**
     * One unit of a multi-step stage completed.
     */
    default void onStep(String stage, int completed, int total) {
    }
}
