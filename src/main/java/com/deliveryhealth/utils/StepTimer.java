package com.deliveryhealth.utils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class StepTimer {
    public static final String READ = "READ";
    public static final String SCORE = "SCORE";
    public static final String WRITE = "WRITE";
    public static final String TOTAL = "TOTAL";

    private final Map<String, Long> start = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public void start(String step) {
        start.put(step, System.currentTimeMillis());
    }

    public void end(String step) {
        Long s = start.get(step);
        if (s != null) {
            durMs.put(step, System.currentTimeMillis() - s);
        }
    }

    public Map<String, Long> snapshot() {
        return new LinkedHashMap<>(durMs);
    }

    public String summaryText() {
        StringBuilder sb = new StringBuilder("step timings:");
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            sb.append(' ').append(e.getKey().toLowerCase(Locale.ROOT)).append('=').append(e.getValue()).append("ms");
        }
        return sb.toString();
    }
}
