package model;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Settings read from {@code graphedexcel.properties} on the classpath.
 * Missing or invalid values fall back to the defaults below.
 */
public class AppConfig {

    private static final Logger log = LogManager.getLogger(AppConfig.class);

    public static final String RESOURCE = "graphedexcel.properties";

    static final String DEFAULT_WORKBOOK = "Book1.xlsx";
    static final String DEFAULT_IMAGE_DIR = "images";
    static final int DEFAULT_IMAGE_SIZE = 1000;
    static final int DEFAULT_TOP_NODES = 10;
    public static final long DEFAULT_MAX_EXPANDED_CELLS = 100_000L;
    static final int DEFAULT_LAYOUT_ITERATIONS = 50;
    static final long DEFAULT_LAYOUT_SEED = 42L;

    static final int MAX_IMAGE_SIZE = 10_000;

    private final String defaultWorkbook;
    private final String imageDir;
    private final int imageWidth;
    private final int imageHeight;
    private final int topNodes;
    private final long maxExpandedCells;
    private final int layoutIterations;
    private final long layoutSeed;

    public AppConfig(Properties p) {
        this.defaultWorkbook = p.getProperty("workbook.default", DEFAULT_WORKBOOK).trim();
        this.imageDir = p.getProperty("image.dir", DEFAULT_IMAGE_DIR).trim();
        this.imageWidth = readPositiveInt(p, "image.width", DEFAULT_IMAGE_SIZE, MAX_IMAGE_SIZE);
        this.imageHeight = readPositiveInt(p, "image.height", DEFAULT_IMAGE_SIZE, MAX_IMAGE_SIZE);
        this.topNodes = readPositiveInt(p, "report.top-nodes", DEFAULT_TOP_NODES, Integer.MAX_VALUE);
        this.maxExpandedCells = readPositive(p, "range.max-expanded-cells", DEFAULT_MAX_EXPANDED_CELLS);
        this.layoutIterations = readPositiveInt(p, "layout.iterations", DEFAULT_LAYOUT_ITERATIONS, Integer.MAX_VALUE);
        this.layoutSeed = readLong(p, "layout.seed", DEFAULT_LAYOUT_SEED);
    }

    public static AppConfig defaults() {
        return new AppConfig(new Properties());
    }

    /** Loads {@link #RESOURCE}; a missing resource gives the defaults. */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using defaults", RESOURCE);
            } else {
                p.load(in);
                log.debug("Configuration loaded from {}", RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Cannot read {}, using defaults", RESOURCE, e);
        }
        return new AppConfig(p);
    }

    private static long readPositive(Properties p, String key, long def) {
        long v = readLong(p, key, def);
        if (v <= 0) {
            log.warn("Config {}={} is not positive, using {}", key, v, def);
            return def;
        }
        return v;
    }

    private static int readPositiveInt(Properties p, String key, int def, int max) {
        long v = readPositive(p, key, def);
        if (v > max) {
            log.warn("Config {}={} is above {}, using {}", key, v, max, def);
            return def;
        }
        return (int) v;
    }

    private static long readLong(Properties p, String key, long def) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not a number, using {}", key, raw, def);
            return def;
        }
    }

    public String getDefaultWorkbook() { return defaultWorkbook; }
    public String getImageDir() { return imageDir; }
    public int getImageWidth() { return imageWidth; }
    public int getImageHeight() { return imageHeight; }
    public int getTopNodes() { return topNodes; }
    public long getMaxExpandedCells() { return maxExpandedCells; }
    public int getLayoutIterations() { return layoutIterations; }
    public long getLayoutSeed() { return layoutSeed; }
}
