package vidloom.orchestrator.stage;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes frames to a video file of one container format.
 */
public interface FrameEncoder {

    /** Lower-case format name, also used as the file extension. */
    String format();

    void encode(List<BufferedImage> frames, int fps, Path output) throws IOException;
}
