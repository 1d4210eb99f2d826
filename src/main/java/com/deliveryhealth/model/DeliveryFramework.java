package com.deliveryhealth.model;

import java.util.Locale;

public enum DeliveryFramework {
    PLANNED("planned"),
    KANBAN("kanban");

    private final String tag;

    DeliveryFramework(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a raw framework tag. Blank or unknown tags fall back to {@link #PLANNED}.
     */
    public static DeliveryFramework fromTag(String raw) {
        if (raw == null) {
            return PLANNED;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DeliveryFramework framework : values()) {
            if (framework.tag.equals(normalized)) {
                return framework;
            }
        }
        return PLANNED;
    }

    public static DeliveryFramework orDefault(DeliveryFramework framework) {
        return framework == null ? PLANNED : framework;
    }
}
