package vidloom.orchestrator.stage;

/**
 * Limits of the core generator that the preprocessor plans around.
 *
 * @param baseFps                frame rate the generator renders at
 * @param maxGenerationDimension largest width or height rendered directly
 * @param dimensionAlignment     generation dimensions are multiples of this
 * @param minDimension           smallest generation dimension
 * @param extraGenerationSeconds seconds added when frames will be interpolated
 */
public record PreprocessorSettings(
        int baseFps,
        int maxGenerationDimension,
        int dimensionAlignment,
        int minDimension,
        int extraGenerationSeconds) {

    public PreprocessorSettings {
        if (baseFps < 1 || maxGenerationDimension < 1 || dimensionAlignment < 1 || minDimension < 1) {
            throw new IllegalArgumentException("Preprocessor settings must be positive");
        }
        if (extraGenerationSeconds < 0) {
            throw new IllegalArgumentException("extraGenerationSeconds must not be negative");
        }
    }

    public static PreprocessorSettings defaults() {
        return new PreprocessorSettings(8, 1024, 8, 8, 1);
    }
}
