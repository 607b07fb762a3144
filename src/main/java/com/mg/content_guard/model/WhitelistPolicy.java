package com.mg.content_guard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable allow-list of tags, per-tag attributes and CSS properties.
 *
 * <p>Tag and attribute names are stored lower-cased; lookups are
 * case-insensitive. Event handler attributes ({@code on*}) can never be
 * allowed, and {@code script}/{@code style} can never be allowed as tags.
 */
public final class WhitelistPolicy {

    public static final Pattern EVENT_HANDLER_ATTRIBUTE = Pattern.compile("on[a-z]+");
    public static final Set<String> BODY_STRIPPED_TAGS = Set.of("script", "style");
    public static final String STYLE_ATTRIBUTE = "style";

    private final String name;
    private final Map<String, Set<String>> allowedAttributes;
    private final Map<String, CssRule> cssRules;
    private final Map<String, String> requiredAttributes;

    private WhitelistPolicy(Builder builder) {
        this.name = builder.name;
        Map<String, Set<String>> attributes = new LinkedHashMap<>();
        builder.allowedAttributes.forEach((tag, attrs) ->
                attributes.put(tag, Collections.unmodifiableSet(new LinkedHashSet<>(attrs))));
        this.allowedAttributes = Collections.unmodifiableMap(attributes);
        this.cssRules = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cssRules));
        this.requiredAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.requiredAttributes));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Set<String> getAllowedTags() {
        return allowedAttributes.keySet();
    }

    public Map<String, Set<String>> getAllowedAttributes() {
        return allowedAttributes;
    }

    public Map<String, CssRule> getCssRules() {
        return cssRules;
    }

    public Optional<CssRule> cssRule(String property) {
        if (property == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cssRules.get(property.toLowerCase(Locale.ROOT)));
    }

    public Optional<String> requiredAttribute(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(requiredAttributes.get(tag.toLowerCase(Locale.ROOT)));
    }

    public static boolean isNeverAllowed(String attribute) {
        return attribute != null
                && EVENT_HANDLER_ATTRIBUTE.matcher(attribute.toLowerCase(Locale.ROOT)).matches();
    }

    @Override
    public String toString() {
        return "WhitelistPolicy[" + name + ", tags=" + allowedAttributes.keySet()
                + ", css=" + cssRules.keySet() + "]";
    }

    public static final class Builder {

        private final String name;
        private final Map<String, Set<String>> allowedAttributes = new LinkedHashMap<>();
        private final Map<String, CssRule> cssRules = new LinkedHashMap<>();
        private final Map<String, String> requiredAttributes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder allowTag(String tag, String... attributes) {
            Set<String> attrs = allowedAttributes.computeIfAbsent(
                    tag.toLowerCase(Locale.ROOT), t -> new LinkedHashSet<>());
            for (String attribute : attributes) {
                attrs.add(attribute.toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public Builder allowTags(String... tags) {
            for (String tag : tags) {
                allowTag(tag);
            }
            return this;
        }

        public Builder allowCss(CssRule rule) {
            cssRules.put(rule.getProperty().toLowerCase(Locale.ROOT), rule);
            return this;
        }

        public Builder requireAttribute(String tag, String attribute) {
            requiredAttributes.put(tag.toLowerCase(Locale.ROOT), attribute.toLowerCase(Locale.ROOT));
            return this;
        }

        public WhitelistPolicy build() {
            if (name == null || name.isBlank()) {
                throw new PolicyConfigurationException("Policy name must not be blank");
            }
            if (allowedAttributes.isEmpty()) {
                throw new PolicyConfigurationException("Policy '" + name + "' allows no tags");
            }
            boolean styleAllowed = false;
            for (Map.Entry<String, Set<String>> entry : allowedAttributes.entrySet()) {
                String tag = entry.getKey();
                if (BODY_STRIPPED_TAGS.contains(tag)) {
                    throw new PolicyConfigurationException(
                            "Policy '" + name + "' must not allow <" + tag + ">");
                }
                for (String attribute : entry.getValue()) {
                    if (isNeverAllowed(attribute)) {
                        throw new PolicyConfigurationException(
                                "Policy '" + name + "' allows event handler '" + attribute + "' on <" + tag + ">");
                    }
                    if (STYLE_ATTRIBUTE.equals(attribute)) {
                        styleAllowed = true;
                    }
                }
            }
            if (styleAllowed && cssRules.isEmpty()) {
                throw new PolicyConfigurationException(
                        "Policy '" + name + "' allows style attributes but declares no CSS rules");
            }
            for (Map.Entry<String, String> entry : requiredAttributes.entrySet()) {
                Set<String> attrs = allowedAttributes.get(entry.getKey());
                if (attrs == null || !attrs.contains(entry.getValue())) {
                    throw new PolicyConfigurationException("Policy '" + name + "' requires '"
                            + entry.getValue() + "' on <" + entry.getKey() + "> but does not allow it");
                }
            }
            return new WhitelistPolicy(this);
        }
    }
}
