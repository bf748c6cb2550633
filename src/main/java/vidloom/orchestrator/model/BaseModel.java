package vidloom.orchestrator.model;

import java.util.Arrays;
import java.util.List;

/**
 * Diffusion base models the generator knows about.
 */
public enum BaseModel {
    SD15("sd15"),
    SD21("sd21"),
    EPIC_REALISM("epicrealism"),
    REALISTIC_VISION("realistic_vision"),
    DREAMSHAPER("dreamshaper"),
    JUGGERNAUT("juggernaut"),
    REV_ANIMATED("rev_animated");

    public static final double DEFAULT_GUIDANCE_SCALE = 7.5;
    public static final double FALLBACK_GUIDANCE_SCALE = 5.0;

    private final String id;

    BaseModel(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public double defaultGuidanceScale() {
        return DEFAULT_GUIDANCE_SCALE;
    }

    public static boolean isKnown(String id) {
        return Arrays.stream(values()).anyMatch(m -> m.id.equals(id));
    }

    public static BaseModel fromId(String id) {
        for (BaseModel model : values()) {
            if (model.id.equals(id)) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown base model: " + id + ". Available: " + ids());
    }

    public static double guidanceScaleFor(String id) {
        return isKnown(id) ? fromId(id).defaultGuidanceScale() : FALLBACK_GUIDANCE_SCALE;
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(BaseModel::id).toList();
    }
}
