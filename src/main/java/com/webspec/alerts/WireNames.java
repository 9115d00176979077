package com.webspec.alerts;

import java.util.Locale;

/** Lenient enum lookup shared by the alert enums: case and underscores are ignored. */
final class WireNames {

    private WireNames() {}

    static String normalize(String value) {
        return value == null ? "" : value.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
    }

    static <E extends Enum<E>> E lookup(Class<E> type, String value) {
        String wanted = normalize(value);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted)) return constant;
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": '" + value + "'");
    }
}
