package dev.fumaz.sprout.bind;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives the names under which a registered type can be looked up.
 */
public final class ServiceKeys {

    private static final Pattern FIRST_CAP = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern ALL_CAP = Pattern.compile("([a-z0-9])([A-Z])");

    private ServiceKeys() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Returns the simple name of the type, or {@code null} for types that have no usable one
     * (anonymous classes and arrays).
     */
    public static @Nullable String canonicalName(@NotNull Class<?> type) {
        if (type.isArray() || type.isAnonymousClass()) {
            return null;
        }

        String name = type.getSimpleName();
        return name.isEmpty() ? null : name;
    }

    /**
     * Converts a type name to snake_case, e.g. {@code HTTPResponse} to {@code http_response}.
     * A leading {@code I} interface prefix stays attached to the following word.
     */
    public static @NotNull String toStandardParamName(@NotNull String name) {
        String value = FIRST_CAP.matcher(name).replaceAll("$1_$2");
        value = ALL_CAP.matcher(value).replaceAll("$1_$2").toLowerCase(Locale.ROOT);

        if (value.startsWith("i_")) {
            return "i" + value.substring(2);
        }

        return value;
    }

    /**
     * Converts a type name to the lowerCamelCase form Java parameters use, e.g. {@code CatsController} to
     * {@code catsController}.
     */
    public static @NotNull String toCamelParamName(@NotNull String name) {
        String[] parts = toStandardParamName(name).split("_");
        StringBuilder builder = new StringBuilder(name.length());

        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }

            if (builder.length() == 0) {
                builder.append(part);
            } else {
                builder.append(Character.toUpperCase(part.charAt(0))).append(part, 1, part.length());
            }
        }

        return builder.toString();
    }

    public static @NotNull Set<String> nameVariants(@NotNull Class<?> type) {
        String name = canonicalName(type);

        if (name == null) {
            return Collections.emptySet();
        }

        Set<String> variants = new LinkedHashSet<>();
        variants.add(name);
        variants.add(name.toLowerCase(Locale.ROOT));
        variants.add(toStandardParamName(name));
        variants.add(toCamelParamName(name));

        return variants;
    }

    public static @NotNull String describe(@Nullable Object key) {
        if (key instanceof Class) {
            return ((Class<?>) key).getName();
        }

        return String.valueOf(key);
    }
}
