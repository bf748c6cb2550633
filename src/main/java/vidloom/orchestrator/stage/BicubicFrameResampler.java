package vidloom.orchestrator.stage;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

public class BicubicFrameResampler implements FrameResampler {

    @Override
    public BufferedImage resample(BufferedImage frame, int width, int height) {
        return FrameImages.scale(frame, width, height, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
    }
}
