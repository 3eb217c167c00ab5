package rastr.domain.halftone.dto;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import rastr.common.EAnchorStrategy;
import rastr.common.EHalftoneMode;
import rastr.dal.HalftoneConfig;
import rastr.domain.halftone.HalftoneException;
import rastr.domain.halftone.HalftoneSettings;
import rastr.domain.image.RgbColor;

import java.util.ArrayList;
import java.util.List;

/**
 * Halftone conversion request DTO, as posted by the client:
 * <pre>
 * {"mode": "duotone", "dot_size": 10, "dot_resolution": 6, "screen_angle": 45, "anchor": "traditional"}
 * </pre>
 * Deprecated names {@code dot_spacing} and {@code angle} are still accepted; the current names win
 * when both are sent. Unset fields take the configured defaults.
 *
 * @since 19/10/2026
 */
public class HalftoneRequest {
    private static final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private String mode;
    private Double dotSize;
    private Integer dotResolution;
    private Integer dotSpacing;     // legacy name of dotResolution
    private Double screenAngle;
    private Double angle;           // legacy name of screenAngle
    private Boolean invert;
    private String anchor;
    private Boolean traditional;    // legacy flag: true = TRADITIONAL, false = LEGACY
    private List<String> colors;
    private String background;
    private Integer supersample;

    /**
     * Parse a JSON request body
     */
    public static HalftoneRequest fromJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw HalftoneException.invalidParameter("request body is empty");
        }
        try {
            HalftoneRequest request = gson.fromJson(json, HalftoneRequest.class);
            if (request == null) {
                throw HalftoneException.invalidParameter("request body is empty");
            }
            return request;
        } catch (JsonParseException e) {
            throw HalftoneException.invalidParameter("malformed request: " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return gson.toJson(this);
    }

    /**
     * Resolve the request against configured defaults
     */
    public HalftoneSettings toSettings(HalftoneConfig defaults) {
        EHalftoneMode resolvedMode = defaults.mode();
        if (mode != null) {
            try {
                resolvedMode = EHalftoneMode.fromString(mode);
            } catch (IllegalArgumentException e) {
                throw HalftoneException.invalidParameter(e.getMessage(), e);
            }
        }

        EAnchorStrategy resolvedAnchor = defaults.anchor();
        if (anchor != null) {
            try {
                resolvedAnchor = EAnchorStrategy.fromString(anchor);
            } catch (IllegalArgumentException e) {
                throw HalftoneException.invalidParameter(e.getMessage(), e);
            }
        } else if (traditional != null) {
            resolvedAnchor = traditional ? EAnchorStrategy.TRADITIONAL : EAnchorStrategy.LEGACY;
        }

        List<RgbColor> resolvedColors;
        if (colors == null || colors.isEmpty()) {
            resolvedColors = defaults.colorsFor(resolvedMode);
        } else {
            resolvedColors = new ArrayList<>(colors.size());
            for (String color : colors) {
                resolvedColors.add(parseColor(color));
            }
        }

        return new HalftoneSettings(
                resolvedMode,
                dotSize != null ? dotSize : defaults.dotSize(),
                firstNonNull(dotResolution, dotSpacing, defaults.dotResolution()),
                firstNonNull(screenAngle, angle, defaults.screenAngle()),
                invert != null ? invert : defaults.invert(),
                resolvedAnchor,
                resolvedColors,
                background != null ? parseColor(background) : defaults.background(),
                supersample != null ? supersample : defaults.supersample());
    }

    private static RgbColor parseColor(String value) {
        try {
            return RgbColor.fromHex(value);
        } catch (IllegalArgumentException e) {
            throw HalftoneException.invalidParameter(e.getMessage(), e);
        }
    }

    private static <T> T firstNonNull(T current, T legacy, T fallback) {
        if (current != null) {
            return current;
        }
        return legacy != null ? legacy : fallback;
    }

    // Getters and setters
    public String getMode() {
        return mode;
    }
    public void setMode(String mode) {
        this.mode = mode;
    }

    public Double getDotSize() {
        return dotSize;
    }
    public void setDotSize(Double dotSize) {
        this.dotSize = dotSize;
    }

    public Integer getDotResolution() {
        return dotResolution;
    }
    public void setDotResolution(Integer dotResolution) {
        this.dotResolution = dotResolution;
    }

    public Integer getDotSpacing() {
        return dotSpacing;
    }
    public void setDotSpacing(Integer dotSpacing) {
        this.dotSpacing = dotSpacing;
    }

    public Double getScreenAngle() {
        return screenAngle;
    }
    public void setScreenAngle(Double screenAngle) {
        this.screenAngle = screenAngle;
    }

    public Double getAngle() {
        return angle;
    }
    public void setAngle(Double angle) {
        this.angle = angle;
    }

    public Boolean getInvert() {
        return invert;
    }
    public void setInvert(Boolean invert) {
        this.invert = invert;
    }

    public String getAnchor() {
        return anchor;
    }
    public void setAnchor(String anchor) {
        this.anchor = anchor;
    }

    public Boolean getTraditional() {
        return traditional;
    }
    public void setTraditional(Boolean traditional) {
        this.traditional = traditional;
    }

    public List<String> getColors() {
        return colors;
    }
    public void setColors(List<String> colors) {
        this.colors = colors;
    }

    public String getBackground() {
        return background;
    }
    public void setBackground(String background) {
        this.background = background;
    }

    public Integer getSupersample() {
        return supersample;
    }
    public void setSupersample(Integer supersample) {
        this.supersample = supersample;
    }
}
