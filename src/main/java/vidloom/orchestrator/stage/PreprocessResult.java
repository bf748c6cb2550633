package vidloom.orchestrator.stage;

/**
 * Generation plan: what the core generator renders and how much the optional
 * stages must multiply frame rate and resolution afterwards.
 */
public record PreprocessResult(
        int fpsFactor,
        int scaleFactor,
        int generationWidth,
        int generationHeight,
        int generationLength) {

    public boolean needsInterpolation() {
        return fpsFactor > 1;
    }

    public boolean needsUpscaling() {
        return scaleFactor > 1;
    }
}
