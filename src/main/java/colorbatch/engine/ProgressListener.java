package colorbatch.engine;

// Receives completion percentages in [0,100], synchronously, on the colorizing thread.
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = percent -> { };

    void onProgress(float percent);
}
