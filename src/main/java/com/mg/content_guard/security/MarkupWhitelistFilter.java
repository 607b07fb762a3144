package com.mg.content_guard.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.owasp.html.AttributePolicy;
import org.owasp.html.ElementPolicy;
import org.owasp.html.HtmlPolicyBuilder;
import org.owasp.html.PolicyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mg.content_guard.model.CssRule;
import com.mg.content_guard.model.WhitelistPolicy;

/**
 * Enforces a {@link WhitelistPolicy} over arbitrary, possibly malformed
 * markup. Each policy is compiled once into an OWASP {@link PolicyFactory};
 * the factories are immutable and safe to share between threads.
 *
 * <ul>
 *   <li>Tags outside the policy are dropped, their text kept. {@code script}
 *       and {@code style} lose their content too.</li>
 *   <li>{@code href}/{@code src} must survive {@link UriValidator}.</li>
 *   <li>{@code style} keeps only declarations accepted by a {@link CssRule}.</li>
 *   <li>A tag missing its required attribute after filtering is dropped,
 *       text kept.</li>
 * </ul>
 */
public class MarkupWhitelistFilter {

    private static final Logger log = LoggerFactory.getLogger(MarkupWhitelistFilter.class);

    private static final Set<String> URL_ATTRIBUTES = Set.of("href", "src");
    private static final Set<String> DIMENSION_ATTRIBUTES = Set.of("width", "height");
    private static final Pattern DIMENSION_VALUE = Pattern.compile("\\d{1,5}(?:px|%)?");

    private final UriValidator uriValidator;
    private final Map<WhitelistPolicy, PolicyFactory> compiled;

    public MarkupWhitelistFilter(UriValidator uriValidator, List<WhitelistPolicy> policies) {
        this.uriValidator = uriValidator;
        Map<WhitelistPolicy, PolicyFactory> factories = new IdentityHashMap<>();
        for (WhitelistPolicy policy : policies) {
            factories.put(policy, compile(policy));
            log.info("Compiled markup policy '{}' with {} tags", policy.getName(), policy.getAllowedTags().size());
        }
        this.compiled = Collections.unmodifiableMap(factories);
    }

    public String filter(String html, WhitelistPolicy policy) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        PolicyFactory factory = compiled.get(policy);
        if (factory == null) {
            log.debug("Policy '{}' was not registered at startup, compiling on demand", policy.getName());
            factory = compile(policy);
        }
        return factory.sanitize(html);
    }

    PolicyFactory compile(WhitelistPolicy policy) {
        HtmlPolicyBuilder builder = new HtmlPolicyBuilder()
                .allowUrlProtocols("http", "https");

        policy.getAllowedAttributes().forEach((tag, attributes) -> {
            Optional<String> required = policy.requiredAttribute(tag);
            if (required.isPresent()) {
                builder.allowElements(requireAttribute(required.get()), tag);
            } else {
                builder.allowElements(tag);
                builder.allowWithoutAttributes(tag);
            }
            for (String attribute : attributes) {
                builder.allowAttributes(attribute).matching(attributePolicy(attribute, policy)).onElements(tag);
            }
        });
        return builder.toFactory();
    }

    private AttributePolicy attributePolicy(String attribute, WhitelistPolicy policy) {
        if (URL_ATTRIBUTES.contains(attribute)) {
            return (elementName, attributeName, value) -> {
                String validated = uriValidator.validate(value);
                return validated.isEmpty() ? null : validated;
            };
        }
        if (WhitelistPolicy.STYLE_ATTRIBUTE.equals(attribute)) {
            return (elementName, attributeName, value) -> filterStyle(value, policy);
        }
        if (DIMENSION_ATTRIBUTES.contains(attribute)) {
            return (elementName, attributeName, value) ->
                    DIMENSION_VALUE.matcher(value.trim()).matches() ? value.trim() : null;
        }
        return AttributePolicy.IDENTITY_ATTRIBUTE_POLICY;
    }

    private static ElementPolicy requireAttribute(String required) {
        return (elementName, attrs) -> {
            // attrs alternates name, value
            for (int i = 0; i < attrs.size(); i += 2) {
                if (required.equals(attrs.get(i))) {
                    return elementName;
                }
            }
            return null;
        };
    }

    /**
     * Keeps the declarations whose property has a rule and whose value the
     * rule accepts. Returns null when nothing survives so the attribute goes.
     */
    static String filterStyle(String style, WhitelistPolicy policy) {
        if (style == null || style.isBlank()) {
            return null;
        }
        List<String> kept = new ArrayList<>();
        for (String declaration : style.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).trim();
            policy.cssRule(property)
                    .filter(rule -> rule.accepts(value))
                    .ifPresent(rule -> kept.add(property + ":" + value));
        }
        return kept.isEmpty() ? null : String.join(";", kept);
    }
}
