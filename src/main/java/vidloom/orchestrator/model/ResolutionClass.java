package vidloom.orchestrator.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Output resolution classes. The class value is the frame height; the width
 * comes from the standard-width table for the chosen aspect ratio.
 */
public enum ResolutionClass {
    P256(256, widths(456, 384, 256, 170, 144)),
    P512(512, widths(910, 768, 512, 342, 288)),
    P480(480, widths(854, 720, 480, 320, 270)),
    P720(720, widths(1280, 1080, 720, 480, 406));

    private final int height;
    private final Map<AspectRatio, Integer> widths;

    ResolutionClass(int height, Map<AspectRatio, Integer> widths) {
        this.height = height;
        this.widths = widths;
    }

    public int height() {
        return height;
    }

    public int widthFor(AspectRatio ratio) {
        return widths.get(ratio);
    }

    public static ResolutionClass fromHeight(int height) {
        for (ResolutionClass resolution : values()) {
            if (resolution.height == height) {
                return resolution;
            }
        }
        throw new IllegalArgumentException("Unsupported resolution: " + height);
    }

    // order: 16:9, 3:2, 1:1, 2:3, 9:16
    private static Map<AspectRatio, Integer> widths(int w169, int w32, int w11, int w23, int w916) {
        Map<AspectRatio, Integer> map = new EnumMap<>(AspectRatio.class);
        map.put(AspectRatio.LANDSCAPE_16_9, w169);
        map.put(AspectRatio.LANDSCAPE_3_2, w32);
        map.put(AspectRatio.SQUARE, w11);
        map.put(AspectRatio.PORTRAIT_2_3, w23);
        map.put(AspectRatio.PORTRAIT_9_16, w916);
        return map;
    }
}
