package com.deliveryhealth.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：ThresholdConfig（class）。
 * 主要职责：保存指标归一化阈值，默认值为进程级常量，覆盖值按键校验后生成新实例。
 * 使用建议：实例不可变，可在多个项目与线程之间共享。
 */
public final class ThresholdConfig {
    private static final Logger LOG = LogManager.getLogger(ThresholdConfig.class);

    public static final String SCHED_VAR_FLOOR = "sched_var_floor";
    public static final String SLIP_DAYS_MAX = "slip_days_max";
    public static final String NET_BACKLOG_MAX = "net_backlog_max";
    public static final String REQ_CHURN_MAX = "req_churn_max";
    public static final String DEFECT_ESCAPE_MAX = "defect_escape_max";
    public static final String CRITICAL_RATIO_MAX = "critical_ratio_max";
    public static final String TEAM_CHURN_RATIO_MAX = "team_churn_ratio_max";
    public static final String BLOCKED_DAYS_MAX = "blocked_days_max";
    public static final String UNPLANNED_RATIO_MAX = "unplanned_ratio_max";
    public static final String DEPENDENCY_MAX = "dependency_max";
    public static final String CPI_FLOOR = "cpi_floor";
    public static final String SPI_FLOOR = "spi_floor";
    public static final String MILESTONE_FLOOR = "milestone_floor";
    public static final String THROUGHPUT_FLOOR = "throughput_floor";
    public static final String CYCLE_TIME_MAX = "cycle_time_max";
    public static final String WIP_OVERAGE_MAX = "wip_overage_max";
    public static final String AGING_WIP_MAX = "aging_wip_max";

    static final String RESOURCE_NAME = "thresholds.properties";

    private static final List<String> RATIO_FLOORS = List.of(CPI_FLOOR, SPI_FLOOR, MILESTONE_FLOOR, THROUGHPUT_FLOOR);
    private static final Map<String, Double> DEFAULTS = buildDefaults();
    private static final ThresholdConfig DEFAULT_CONFIG = new ThresholdConfig(DEFAULTS, Map.of());

    private final Map<String, Double> values;
    private final Map<String, String> sources;

    private ThresholdConfig(Map<String, Double> values, Map<String, String> sources) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public static ThresholdConfig defaultConfig() {
        return DEFAULT_CONFIG;
    }

    /**
     * The documented default thresholds. Read-only; never carries overrides.
     */
    public static Map<String, Double> defaults() {
        return DEFAULTS;
    }

    /**
     * Layers the classpath {@code thresholds.properties} and then the one in {@code workingDir}
     * over the defaults. Each key is validated on its own.
     */
    public static ThresholdConfig load(Path workingDir) {
        ThresholdConfig config = DEFAULT_CONFIG;

        try (InputStream in = ThresholdConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                config = config.merge(toMap(props), "resource");
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath {}: {}", RESOURCE_NAME, e.getMessage());
        }

        if (workingDir != null) {
            Path local = workingDir.resolve(RESOURCE_NAME);
            if (Files.exists(local)) {
                try (InputStream in = Files.newInputStream(local)) {
                    Properties props = new Properties();
                    props.load(in);
                    config = config.merge(toMap(props), "local");
                } catch (IOException e) {
                    LOG.warn("failed to read {}: {}", local, e.getMessage());
                }
            }
        }
        return config;
    }

    /**
     * Returns a new config with the given textual overrides applied. A key that is unknown,
     * non-numeric or out of range keeps its current value.
     */
    public ThresholdConfig withOverrides(Map<String, String> overrides) {
        return merge(overrides, "override");
    }

    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("unknown threshold: " + key);
        }
        return value;
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public String sourceOf(String key) {
        return sources.getOrDefault(key, "default");
    }

    private ThresholdConfig merge(Map<String, String> raw, String source) {
        if (raw == null || raw.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(values);
        Map<String, String> mergedSources = new LinkedHashMap<>(sources);
        boolean changed = false;
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            String key = entry.getKey() == null ? "" : entry.getKey().trim();
            if (!DEFAULTS.containsKey(key)) {
                LOG.warn("threshold ignored key={} source={} reason=unknown", key, source);
                continue;
            }
            Double parsed = parseDouble(entry.getValue());
            if (parsed == null) {
                LOG.warn("threshold ignored key={} value={} source={} reason=not_numeric", key, entry.getValue(), source);
                continue;
            }
            if (!acceptable(key, parsed)) {
                LOG.warn("threshold ignored key={} value={} source={} reason=out_of_range", key, parsed, source);
                continue;
            }
            merged.put(key, parsed);
            mergedSources.put(key, source);
            changed = true;
        }
        return changed ? new ThresholdConfig(merged, mergedSources) : this;
    }

    static boolean acceptable(String key, double value) {
        if (!Double.isFinite(value)) {
            return false;
        }
        if (SCHED_VAR_FLOOR.equals(key)) {
            return value >= -1.0 && value < 0.0;
        }
        if (RATIO_FLOORS.contains(key)) {
            return value >= 0.0 && value < 1.0;
        }
        return value > 0.0;
    }

    private static Double parseDouble(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Map<String, String> toMap(Properties props) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            out.put(name, props.getProperty(name));
        }
        return out;
    }

    private static Map<String, Double> buildDefaults() {
        Map<String, Double> defaults = new LinkedHashMap<>();

        defaults.put(SCHED_VAR_FLOOR, -0.20);
        defaults.put(SLIP_DAYS_MAX, 140.0);
        defaults.put(NET_BACKLOG_MAX, 50.0);
        defaults.put(REQ_CHURN_MAX, 15.0);
        defaults.put(DEFECT_ESCAPE_MAX, 0.15);
        defaults.put(CRITICAL_RATIO_MAX, 2.0);
        defaults.put(TEAM_CHURN_RATIO_MAX, 1.0);
        defaults.put(BLOCKED_DAYS_MAX, 10.0);
        defaults.put(UNPLANNED_RATIO_MAX, 0.6);
        defaults.put(DEPENDENCY_MAX, 15.0);

        defaults.put(CPI_FLOOR, 0.80);
        defaults.put(SPI_FLOOR, 0.80);
        defaults.put(MILESTONE_FLOOR, 0.50);

        defaults.put(THROUGHPUT_FLOOR, 0.50);
        defaults.put(CYCLE_TIME_MAX, 20.0);
        defaults.put(WIP_OVERAGE_MAX, 0.50);
        defaults.put(AGING_WIP_MAX, 5.0);

        return Collections.unmodifiableMap(defaults);
    }
}
