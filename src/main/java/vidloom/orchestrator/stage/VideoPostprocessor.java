package vidloom.orchestrator.stage;

import vidloom.orchestrator.pipeline.StageContext;
import vidloom.orchestrator.worker.StageWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fits the final frames to the requested duration and size and writes the video file.
 *
 * Frames beyond {@code duration * fps} are dropped. Each frame is centre-cropped
 * to the target size, or centred on a black canvas when it is smaller.
 */
public class VideoPostprocessor implements StageWorker<PostprocessRequest, Path> {

    private static final Logger log = LoggerFactory.getLogger(VideoPostprocessor.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int PROMPT_PREFIX_LENGTH = 30;

    private final PostprocessorSettings settings;
    private final Map<String, FrameEncoder> encoders = new LinkedHashMap<>();
    private final Clock clock;

    public VideoPostprocessor(PostprocessorSettings settings, List<? extends FrameEncoder> encoders) {
        this(settings, encoders, Clock.systemDefaultZone());
    }

    public VideoPostprocessor(PostprocessorSettings settings, List<? extends FrameEncoder> encoders, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        for (FrameEncoder encoder : encoders) {
            this.encoders.put(encoder.format(), encoder);
        }
        if (!this.encoders.containsKey(settings.defaultFormat())) {
            throw new IllegalArgumentException("No encoder for default format '" + settings.defaultFormat() + "'");
        }
    }

    @Override
    public Path process(PostprocessRequest request, StageContext context) throws IOException {
        FrameBatch frames = request.frames();
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("Cannot postprocess: no frames provided");
        }

        log.info("Job {}: postprocessing {} frames", context.jobId(), frames.size());

        List<BufferedImage> trimmed = trim(frames.frames(), request.targetDuration(), request.fps());
        List<BufferedImage> fitted = fit(trimmed, request.targetWidth(), request.targetHeight());

        FrameEncoder encoder = encoders.get(resolveFormat(request.outputFormat()));
        Files.createDirectories(request.outputDir());
        Path output = request.outputDir().resolve(
                fileName(request.prompt(), request.seed(), request.targetDuration(), request.fps(), encoder.format()));

        encoder.encode(fitted, request.fps(), output);

        log.info("Job {}: wrote {} frames to {}", context.jobId(), fitted.size(), output);
        return output;
    }

    List<BufferedImage> trim(List<BufferedImage> frames, int duration, int fps) {
        int target = duration * fps;
        if (frames.size() <= target) {
            return frames;
        }
        log.debug("Trimmed frames from {} to {}", frames.size(), target);
        return frames.subList(0, target);
    }

    List<BufferedImage> fit(List<BufferedImage> frames, int width, int height) {
        List<BufferedImage> out = new ArrayList<>(frames.size());
        for (BufferedImage frame : frames) {
            if (frame.getWidth() == width && frame.getHeight() == height) {
                out.add(frame);
                continue;
            }
            BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = canvas.createGraphics();
            try {
                g.setColor(Color.BLACK);
                g.fillRect(0, 0, width, height);
                g.drawImage(frame, offset(frame.getWidth(), width), offset(frame.getHeight(), height), null);
            } finally {
                g.dispose();
            }
            out.add(canvas);
        }
        return out;
    }

    String resolveFormat(String requested) {
        String normalized = requested == null ? "" : requested.trim().toLowerCase(Locale.ROOT);
        if (!encoders.containsKey(normalized)) {
            log.warn("Unsupported format '{}', using '{}'", normalized, settings.defaultFormat());
            return settings.defaultFormat();
        }
        return normalized;
    }

    String fileName(String prompt, long seed, int videoLength, int fps, String format) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return timestamp + "_" + safePrompt(prompt) + "_seed" + seed
                + "_len" + videoLength + "s_fps" + fps + "." + format;
    }

    static String safePrompt(String prompt) {
        if (prompt == null) {
            return "video";
        }
        String prefix = prompt.length() > PROMPT_PREFIX_LENGTH ? prompt.substring(0, PROMPT_PREFIX_LENGTH) : prompt;
        StringBuilder kept = new StringBuilder();
        for (char c : prefix.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '_') {
                kept.append(c);
            }
        }
        String safe = kept.toString().stripTrailing().replace(' ', '_');
        return safe.isEmpty() ? "video" : safe;
    }

    // Position of a frame dimension on the target canvas: negative crops, positive pads
    private static int offset(int frameSize, int targetSize) {
        return frameSize >= targetSize ? -((frameSize - targetSize) / 2) : (targetSize - frameSize) / 2;
    }
}
