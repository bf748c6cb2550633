package vidloom.orchestrator.stage;

import java.util.Objects;

/**
 * @param defaultFormat format used when the requested one has no encoder
 * @param gifLoopCount  loop count written into animated GIFs, 0 loops forever
 */
public record PostprocessorSettings(String defaultFormat, int gifLoopCount) {

    public PostprocessorSettings {
        Objects.requireNonNull(defaultFormat, "defaultFormat is required");
        if (gifLoopCount < 0) {
            throw new IllegalArgumentException("gifLoopCount must not be negative");
        }
    }

    public static PostprocessorSettings defaults() {
        return new PostprocessorSettings("gif", 0);
    }
}
