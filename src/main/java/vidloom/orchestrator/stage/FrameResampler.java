package vidloom.orchestrator.stage;

import java.awt.image.BufferedImage;

/**
 * Resizes one frame to an exact size.
 */
@FunctionalInterface
public interface FrameResampler {

    BufferedImage resample(BufferedImage frame, int width, int height);
}
