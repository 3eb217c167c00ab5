package rastr.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rastr.common.EAnchorStrategy;
import rastr.common.EHalftoneMode;
import rastr.common.HalftoneConstants;
import rastr.domain.image.RgbColor;

import java.util.List;

/**
 * Main configuration service - entry point for all configuration needs
 * @since 19/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private final HalftoneConfig halftoneConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        this.halftoneConfig = loadHalftoneConfiguration();
    }

    /**
     * Load halftone defaults; unknown enum names fall back, malformed values fail
     */
    private HalftoneConfig loadHalftoneConfiguration() throws ConfigurationException {
        double dotSize = loader.getDouble("halftone.dot.size", HalftoneConstants.DEFAULT_DOT_SIZE);
        int dotResolution = loader.getInt("halftone.dot.resolution", HalftoneConstants.DEFAULT_DOT_RESOLUTION);
        double angle = loader.getDouble("halftone.screen.angle", 0.0);
        boolean invert = loader.getBoolean("halftone.invert", false);

        String anchorStr = loader.getString("halftone.anchor", EAnchorStrategy.TRADITIONAL.name());
        EAnchorStrategy anchor;
        try {
            anchor = EAnchorStrategy.fromString(anchorStr);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid anchor strategy '{}', defaulting to TRADITIONAL", anchorStr);
            anchor = EAnchorStrategy.TRADITIONAL;
        }

        String modeStr = loader.getString("halftone.mode", EHalftoneMode.BASIC.name());
        EHalftoneMode mode;
        try {
            mode = EHalftoneMode.fromString(modeStr);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid halftone mode '{}', defaulting to BASIC", modeStr);
            mode = EHalftoneMode.BASIC;
        }

        RgbColor color = parseColor("halftone.color", HalftoneConstants.DEFAULT_COLOR);
        RgbColor background = parseColor("halftone.background", HalftoneConstants.DEFAULT_BACKGROUND);
        List<RgbColor> duotone = parseColors("halftone.duotone.colors", HalftoneConstants.DEFAULT_DUOTONE_COLORS);
        List<RgbColor> tritone = parseColors("halftone.tritone.colors", HalftoneConstants.DEFAULT_TRITONE_COLORS);

        int supersample = loader.getInt("halftone.supersample", HalftoneConstants.SUPERSAMPLE_FACTOR);
        boolean downsample = loader.getBoolean("halftone.output.downsample", false);
        long timeoutMs = loader.getLong("halftone.timeout.ms", 0L);

        HalftoneConfig config = new HalftoneConfig(dotSize, dotResolution, angle, invert, anchor, mode,
                color, background, duotone, tritone, supersample, downsample, timeoutMs);
        config.validate();

        if (dotSize > HalftoneConstants.RECOMMENDED_MAX_DOT_SIZE) {
            logger.warn("Dot size {} exceeds the recommended maximum of {}", dotSize, HalftoneConstants.RECOMMENDED_MAX_DOT_SIZE);
        }
        logger.info("Configured halftone engine: {}", config);
        return config;
    }

    private RgbColor parseColor(String key, String defaultValue) throws ConfigurationException {
        String value = loader.getString(key, defaultValue);
        try {
            return RgbColor.fromHex(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid color for '" + key + "': " + value, e);
        }
    }

    private List<RgbColor> parseColors(String key, String defaultValue) throws ConfigurationException {
        String value = loader.getString(key, defaultValue);
        try {
            return RgbColor.parseList(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid color list for '" + key + "': " + value, e);
        }
    }

    public HalftoneConfig getHalftoneConfig() {
        return halftoneConfig;
    }

    public ConfigurationLoader getLoader() {
        return loader;
    }
}
