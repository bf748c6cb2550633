package vidloom.orchestrator.stage;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Per-pixel linear cross-fade. A {@code to} frame of a different size is
 * resized to the {@code from} frame first.
 */
public class LinearFrameBlender implements FrameBlender {

    @Override
    public BufferedImage blend(BufferedImage from, BufferedImage to, double t) {
        int width = from.getWidth();
        int height = from.getHeight();
        if (to.getWidth() != width || to.getHeight() != height) {
            to = FrameImages.scale(to, width, height, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        }

        int[] a = from.getRGB(0, 0, width, height, null, 0, width);
        int[] b = to.getRGB(0, 0, width, height, null, 0, width);
        int[] out = new int[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (mix(a[i] >> 16, b[i] >> 16, t) << 16)
                    | (mix(a[i] >> 8, b[i] >> 8, t) << 8)
                    | mix(a[i], b[i], t);
        }

        BufferedImage blended = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        blended.setRGB(0, 0, width, height, out, 0, width);
        return blended;
    }

    private static int mix(int a, int b, double t) {
        int ca = a & 0xFF;
        int cb = b & 0xFF;
        return (int) Math.round(ca + (cb - ca) * t);
    }
}
