package com.questrail.bamboo.style;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps style enum constants to and from their lowerCamelCase wire names.
 *
 * <p>Parsing is lenient on case and separators so that {@code "customTitlebar"},
 * {@code "CustomTitlebar"} and {@code "CUSTOM_TITLEBAR"} all resolve to the same
 * constant.</p>
 */
final class WireNames
{
    private WireNames() {}

    static String of(Enum<?> constant)
    {
        String[] parts = constant.name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder sb = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            if (!parts[i].isEmpty()) {
                sb.append(Character.toUpperCase(parts[i].charAt(0))).append(parts[i].substring(1));
            }
        }
        return sb.toString();
    }

    static <E extends Enum<E>> E parse(Class<E> type, String wire)
    {
        Objects.requireNonNull(wire, "wire");
        String wanted = normalize(wire);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + wire);
    }

    private static String normalize(String s)
    {
        return s.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
