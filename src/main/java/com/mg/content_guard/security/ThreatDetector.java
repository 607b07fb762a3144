package com.mg.content_guard.security;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.mg.content_guard.model.ThreatCategory;

/**
 * Flags raw input that looks like an attack attempt. Used for logging only;
 * a detection never changes what the sanitizers return.
 */
@Component
public class ThreatDetector {

    private static final Map<ThreatCategory, Pattern> SIGNATURES = Map.of(
            ThreatCategory.PATH_TRAVERSAL,
            Pattern.compile("\\.\\./|\\.\\.\\\\|/etc/|/var/|/usr/|/proc/", Pattern.CASE_INSENSITIVE),
            ThreatCategory.MARKUP_INJECTION,
            Pattern.compile("<\\s*(?:script|iframe|object|embed)\\b|\\bon[a-z]+\\s*=", Pattern.CASE_INSENSITIVE),
            ThreatCategory.SQL_INJECTION,
            Pattern.compile("\\b(?:or|and)\\b\\s*\\d+\\s*=\\s*\\d+"
                    + "|\\b(?:or|and)\\b\\s*'\\w+'\\s*=\\s*'\\w+'", Pattern.CASE_INSENSITIVE),
            ThreatCategory.SCRIPT_URI,
            Pattern.compile("(?:javascript|vbscript|data)\\s*:", Pattern.CASE_INSENSITIVE));

    // UNION and SELECT anywhere in the input, in either order
    private static final Pattern UNION_KEYWORD = Pattern.compile("\\bunion\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT_KEYWORD = Pattern.compile("\\bselect\\b", Pattern.CASE_INSENSITIVE);

    public Set<ThreatCategory> detect(String input) {
        Set<ThreatCategory> found = EnumSet.noneOf(ThreatCategory.class);
        if (input == null || input.isEmpty()) {
            return found;
        }
        SIGNATURES.forEach((category, pattern) -> {
            if (pattern.matcher(input).find()) {
                found.add(category);
            }
        });
        if (UNION_KEYWORD.matcher(input).find() && SELECT_KEYWORD.matcher(input).find()) {
            found.add(ThreatCategory.SQL_INJECTION);
        }
        return found;
    }
}
