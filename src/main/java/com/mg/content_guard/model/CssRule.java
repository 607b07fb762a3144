package com.mg.content_guard.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Value check for a single CSS property. The pattern must match the whole
 * declared value.
 */
public final class CssRule {

    private final String property;
    private final Pattern valuePattern;

    private CssRule(String property, Pattern valuePattern) {
        this.property = property;
        this.valuePattern = valuePattern;
    }

    public static CssRule matching(String property, String regex) {
        return new CssRule(property, Pattern.compile(regex));
    }

    public static CssRule oneOf(String property, String... keywords) {
        String alternatives = Arrays.stream(keywords)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return new CssRule(property, Pattern.compile("(?:" + alternatives + ")"));
    }

    public String getProperty() {
        return property;
    }

    public boolean accepts(String value) {
        return value != null && valuePattern.matcher(value).matches();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CssRule other)) return false;
        return property.equals(other.property) && valuePattern.pattern().equals(other.valuePattern.pattern());
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, valuePattern.pattern());
    }

    @Override
    public String toString() {
        return property + " ~ /" + valuePattern.pattern() + "/";
    }
}
