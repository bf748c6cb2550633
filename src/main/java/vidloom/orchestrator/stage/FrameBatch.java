package vidloom.orchestrator.stage;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Ordered, immutable list of video frames.
 */
public record FrameBatch(List<BufferedImage> frames) {

    public FrameBatch {
        frames = List.copyOf(frames);
    }

    public static FrameBatch empty() {
        return new FrameBatch(List.of());
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public BufferedImage get(int index) {
        return frames.get(index);
    }

    /** Width of the first frame, 0 when empty. */
    public int width() {
        return frames.isEmpty() ? 0 : frames.get(0).getWidth();
    }

    /** Height of the first frame, 0 when empty. */
    public int height() {
        return frames.isEmpty() ? 0 : frames.get(0).getHeight();
    }

    @Override
    public String toString() {
        return "FrameBatch{" + size() + " frames, " + width() + "x" + height() + "}";
    }
}
