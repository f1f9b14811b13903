package org.pyta.checkers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Naming conventions from PEP 8, with conversion into each style.
 */
public enum NameStyle {
    SNAKE_CASE("snake_case", "^_{0,2}[a-z][a-z0-9_]*$|^_$"),
    PASCAL_CASE("PascalCase", "^_{0,2}[A-Z][a-zA-Z0-9]*$"),
    UPPER_CASE("UPPER_CASE", "^_{0,2}[A-Z][A-Z0-9_]*$");

    private static final Pattern DUNDER = Pattern.compile("^__[a-z][a-z0-9_]*__$");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

    private final String label;
    private final Pattern pattern;

    NameStyle(String label, String regex) {
        this.label = label;
        this.pattern = Pattern.compile(regex);
    }

    public String label() {
        return label;
    }

    public boolean matches(String name) {
        return DUNDER.matcher(name)
                     .matches() || pattern.matcher(name)
                                          .matches();
    }

    /**
     * Rewrite a name in this style, keeping leading underscores.
     */
    public String convert(String name) {
        var prefixLength = 0;
        while (prefixLength < name.length() && name.charAt(prefixLength) == '_') {
            prefixLength++;
        }
        var prefix = name.substring(0, prefixLength);
        var words = words(name.substring(prefixLength));
        if (words.isEmpty()) {
            return name;
        }

        return switch (this) {
            case SNAKE_CASE -> prefix + words.stream()
                                             .map(word -> word.toLowerCase(Locale.ROOT))
                                             .collect(Collectors.joining("_"));
            case UPPER_CASE -> prefix + words.stream()
                                             .map(word -> word.toUpperCase(Locale.ROOT))
                                             .collect(Collectors.joining("_"));
            default -> prefix + words.stream()
                                     .map(NameStyle::capitalize)
                                     .collect(Collectors.joining());
        };
    }

    private static List<String> words(String name) {
        var words = new ArrayList<String>();
        for (var chunk : name.split("_+")) {
            for (var word : WORD_BOUNDARY.split(chunk)) {
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
        }
        return words;
    }

    private static String capitalize(String word) {
        return word.substring(0, 1)
                   .toUpperCase(Locale.ROOT) + word.substring(1)
                                                    .toLowerCase(Locale.ROOT);
    }
}
