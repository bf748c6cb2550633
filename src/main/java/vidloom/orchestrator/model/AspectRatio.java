package vidloom.orchestrator.model;

/**
 * Supported frame aspect ratios, as accepted by the public API ("16:9", ...).
 */
public enum AspectRatio {
    LANDSCAPE_16_9("16:9"),
    LANDSCAPE_3_2("3:2"),
    SQUARE("1:1"),
    PORTRAIT_2_3("2:3"),
    PORTRAIT_9_16("9:16");

    private final String label;

    AspectRatio(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AspectRatio fromLabel(String label) {
        for (AspectRatio ratio : values()) {
            if (ratio.label.equals(label)) {
                return ratio;
            }
        }
        throw new IllegalArgumentException("Unsupported aspect ratio: " + label);
    }
}
