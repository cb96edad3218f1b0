package model;

import java.util.Locale;

public enum DeviceType {
    DESKTOP("desktop"),
    LAPTOP("laptop"),
    TABLET("tablet"),
    TABLET_LANDSCAPE("tablet-landscape"),
    MOBILE("mobile"),
    MOBILE_LANDSCAPE("mobile-landscape");

    private final String label;

    DeviceType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Resolves a directive value, falling back to DESKTOP for anything unknown. */
    public static DeviceType fromLabel(String s) {
        if (s == null) return DESKTOP;
        String t = s.trim().toLowerCase(Locale.ROOT);
        for (DeviceType d : values()) {
            if (d.label.equals(t)) return d;
        }
        return DESKTOP;
    }
}
