package vidloom.orchestrator.stage;

import java.awt.image.BufferedImage;

/**
 * Synthesizes an in-between frame.
 */
@FunctionalInterface
public interface FrameBlender {

    /**
     * @param t position between {@code from} (0) and {@code to} (1)
     */
    BufferedImage blend(BufferedImage from, BufferedImage to, double t);
}
