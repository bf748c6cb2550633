package vidloom.orchestrator.stage;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Animated GIF encoder on top of the JDK's ImageIO GIF writer.
 */
public class GifFrameEncoder implements FrameEncoder {

    private static final String IMAGE_METADATA_FORMAT = "javax_imageio_gif_image_1.0";

    private final int loopCount;

    public GifFrameEncoder(int loopCount) {
        this.loopCount = loopCount;
    }

    @Override
    public String format() {
        return "gif";
    }

    @Override
    public void encode(List<BufferedImage> frames, int fps, Path output) throws IOException {
        if (frames.isEmpty()) {
            throw new IOException("No frames to encode");
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("gif");
        if (!writers.hasNext()) {
            throw new IOException("No GIF writer available");
        }
        ImageWriter writer = writers.next();
        int delayCentis = Math.max(1, Math.round(100f / Math.max(1, fps)));

        Files.deleteIfExists(output);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(output.toFile())) {
            writer.setOutput(out);
            writer.prepareWriteSequence(null);

            ImageWriteParam param = writer.getDefaultWriteParam();
            boolean first = true;
            for (BufferedImage frame : frames) {
                BufferedImage rgb = FrameImages.toRgb(frame);
                IIOMetadata metadata = writer.getDefaultImageMetadata(
                        ImageTypeSpecifier.createFromRenderedImage(rgb), param);
                configureFrame(metadata, delayCentis, first);
                writer.writeToSequence(new IIOImage(rgb, null, metadata), param);
                first = false;
            }

            writer.endWriteSequence();
        } finally {
            writer.dispose();
        }
    }

    private void configureFrame(IIOMetadata metadata, int delayCentis, boolean first) throws IOException {
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IMAGE_METADATA_FORMAT);

        IIOMetadataNode control = child(root, "GraphicControlExtension");
        control.setAttribute("disposalMethod", "none");
        control.setAttribute("userInputFlag", "FALSE");
        control.setAttribute("transparentColorFlag", "FALSE");
        control.setAttribute("delayTime", Integer.toString(delayCentis));
        control.setAttribute("transparentColorIndex", "0");

        // Loop count lives in the NETSCAPE2.0 extension of the first frame
        if (first) {
            IIOMetadataNode extensions = child(root, "ApplicationExtensions");
            IIOMetadataNode netscape = new IIOMetadataNode("ApplicationExtension");
            netscape.setAttribute("applicationID", "NETSCAPE");
            netscape.setAttribute("authenticationCode", "2.0");
            netscape.setUserObject(new byte[] {1, (byte) (loopCount & 0xFF), (byte) ((loopCount >> 8) & 0xFF)});
            extensions.appendChild(netscape);
        }

        metadata.setFromTree(IMAGE_METADATA_FORMAT, root);
    }

    private static IIOMetadataNode child(IIOMetadataNode root, String name) {
        for (int i = 0; i < root.getLength(); i++) {
            if (root.item(i).getNodeName().equalsIgnoreCase(name)) {
                return (IIOMetadataNode) root.item(i);
            }
        }
        IIOMetadataNode node = new IIOMetadataNode(name);
        root.appendChild(node);
        return node;
    }
}
