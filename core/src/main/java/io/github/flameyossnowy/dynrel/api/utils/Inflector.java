package io.github.flameyossnowy.dynrel.api.utils;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * English word inflection and case conversion used to derive entity names and keys.
 * <p>
 * Conversions:
 * <ul>
 *   <li>{@code snake("UserLanguage")} → {@code "user_language"}</li>
 *   <li>{@code studly("user_languages")} → {@code "UserLanguages"}</li>
 *   <li>{@code singular("comments")} → {@code "comment"}</li>
 *   <li>{@code plural("category")} → {@code "categories"}</li>
 * </ul>
 * Singularization is heuristic. Irregular words outside the small built-in table
 * (for example "criteria" or "octopi") are not guaranteed to come out right.
 */
public final class Inflector {
    private static final Map<String, String> snakeCache = new ConcurrentHashMap<>(16);
    private static final Map<String, String> singularCache = new ConcurrentHashMap<>(16);

    private static final Set<String> UNCOUNTABLE = Set.of(
        "equipment", "information", "rice", "money", "species", "series",
        "fish", "sheep", "deer", "news", "data", "metadata", "feedback", "audio", "media"
    );

    // plural -> singular
    private static final Map<String, String> IRREGULAR = Map.of(
        "people", "person",
        "men", "man",
        "women", "woman",
        "children", "child",
        "teeth", "tooth",
        "feet", "foot",
        "mice", "mouse",
        "geese", "goose",
        "oxen", "ox",
        "leaves", "leaf"
    );

    // already singular: "status", "bus", "campus", "analysis", "alias"
    private static final Pattern UNINFLECTED = Pattern.compile("(?i)(alias|us|is)$");

    private static final Object[][] SINGULAR_RULES = {
        {Pattern.compile("(?i)(quiz)zes$"), "$1"},
        {Pattern.compile("(?i)(matr|vert|ind)ices$"), "$1ix"},
        {Pattern.compile("(?i)(alias|status|bus)es$"), "$1"},
        {Pattern.compile("(?i)(octop|vir)i$"), "$1us"},
        {Pattern.compile("(?i)(cris|ax|test)es$"), "$1is"},
        {Pattern.compile("(?i)(shoe)s$"), "$1"},
        {Pattern.compile("(?i)(o)es$"), "$1"},
        {Pattern.compile("(?i)([m|l])ice$"), "$1ouse"},
        {Pattern.compile("(?i)(x|ch|ss|sh)es$"), "$1"},
        {Pattern.compile("(?i)(m)ovies$"), "$1ovie"},
        {Pattern.compile("(?i)([^aeiouy]|qu)ies$"), "$1y"},
        {Pattern.compile("(?i)([lr])ves$"), "$1f"},
        {Pattern.compile("(?i)(tive)s$"), "$1"},
        {Pattern.compile("(?i)(hive)s$"), "$1"},
        {Pattern.compile("(?i)([^f])ves$"), "$1fe"},
        {Pattern.compile("(?i)(^analy)ses$"), "$1sis"},
        {Pattern.compile("(?i)([ti])a$"), "$1um"},
        {Pattern.compile("(?i)(n)ews$"), "$1ews"},
        {Pattern.compile("(?i)(ss)$"), "$1"},
        {Pattern.compile("(?i)s$"), ""},
    };

    private Inflector() {
        throw new AssertionError("No instances");
    }

    /**
     * Converts a camel or studly cased word to snake case.
     * Every capital after the first character starts a new segment, so {@code "HTTPServer"}
     * becomes {@code "h_t_t_p_server"}. Space separated words are joined the same way.
     */
    @Contract("null -> null")
    public static String snake(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return snakeCache.computeIfAbsent(value, Inflector::toSnakeCase);
    }

    private static @NotNull String toSnakeCase(@NotNull String value) {
        StringBuilder result = new StringBuilder(value.length() + 4);
        boolean wordStart = true;

        for (char current : value.toCharArray()) {
            if (Character.isWhitespace(current)) {
                wordStart = true;
                continue;
            }

            if (wordStart) {
                current = Character.toUpperCase(current);
                wordStart = false;
            }

            if (Character.isUpperCase(current)) {
                if (result.length() > 0) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(current));
            } else {
                result.append(current);
            }
        }

        return result.toString();
    }

    /**
     * Converts a snake, kebab or space separated word to studly case.
     */
    @Contract("null -> null")
    public static String studly(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }

        StringBuilder result = new StringBuilder(value.length());
        boolean upperNext = true;
        for (char c : value.toCharArray()) {
            if (c == '_' || c == '-' || Character.isWhitespace(c)) {
                upperNext = true;
                continue;
            }
            result.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return result.toString();
    }

    /**
     * Returns the singular form of an English word.
     * Only the last segment of a snake cased word is inflected.
     */
    @Contract("null -> null")
    public static String singular(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return singularCache.computeIfAbsent(value, Inflector::toSingular);
    }

    private static @NotNull String toSingular(@NotNull String value) {
        int split = value.lastIndexOf('_') + 1;
        String head = value.substring(0, split);
        String word = value.substring(split);
        if (word.isEmpty()) {
            return value;
        }

        String lower = word.toLowerCase(Locale.ROOT);
        if (UNCOUNTABLE.contains(lower)) {
            return value;
        }

        String irregular = IRREGULAR.get(lower);
        if (irregular != null) {
            return head + matchCase(word, irregular);
        }

        if (UNINFLECTED.matcher(word).find()) {
            return value;
        }

        for (Object[] rule : SINGULAR_RULES) {
            Matcher matcher = ((Pattern) rule[0]).matcher(word);
            if (matcher.find()) {
                return head + matcher.replaceFirst((String) rule[1]);
            }
        }
        return value;
    }

    private static String matchCase(String source, String target) {
        if (Character.isUpperCase(source.charAt(0))) {
            return Character.toUpperCase(target.charAt(0)) + target.substring(1);
        }
        return target;
    }
}
