package io.github.flameyossnowy.datamapper.api.model;

import java.util.Locale;

/**
 * Turns a model or property name into a storage name.
 */
@FunctionalInterface
public interface NamingConvention {
    NamingConvention IDENTITY = name -> name;

    /** {@code numSpots} to {@code num_spots}. */
    NamingConvention UNDERSCORED = NamingConvention::underscore;

    /** {@code LineItem} to {@code line_items}. */
    NamingConvention UNDERSCORED_AND_PLURALIZED = name -> pluralize(underscore(name));

    String apply(String name);

    static String underscore(String name) {
        StringBuilder builder = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && name.charAt(i - 1) != '_'
                    && (Character.isLowerCase(name.charAt(i - 1))
                        || Character.isDigit(name.charAt(i - 1))
                        || (i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1))))) {
                    builder.append('_');
                }
                builder.append(Character.toLowerCase(c));
            } else if (c == '-' || c == ' ' || c == '.') {
                builder.append('_');
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    static String pluralize(String word) {
        if (word.isEmpty()) return word;
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.endsWith("y") && lower.length() > 1 && "aeiou".indexOf(lower.charAt(lower.length() - 2)) < 0) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
            || lower.endsWith("ch") || lower.endsWith("sh")) {
            return word + "es";
        }
        return word + 's';
    }
}
