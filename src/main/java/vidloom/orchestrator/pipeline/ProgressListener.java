package vidloom.orchestrator.pipeline;

/**
 * Receives stage-relative progress: {@code current} out of {@code total} units,
 * where the last unit is {@code total - 1}.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total) -> {
    };

    void onProgress(int current, int total);
}
