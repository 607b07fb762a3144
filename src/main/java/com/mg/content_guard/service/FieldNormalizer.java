package com.mg.content_guard.service;

import java.util.Locale;
import java.util.regex.Pattern;

import com.mg.content_guard.security.PatternStripper;

/**
 * Canonicalizes single-value form fields. Every method maps null or empty
 * input to an empty string.
 */
public class FieldNormalizer {

    private static final Pattern EMAIL_DISALLOWED = Pattern.compile("[^a-zA-Z0-9@._-]");
    private static final Pattern PHONE_DISALLOWED = Pattern.compile("[^\\d+]");
    private static final Pattern FILENAME_DISALLOWED = Pattern.compile("[^a-zA-Z0-9.-]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_{2,}");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
    private static final Pattern SEARCH_DISALLOWED = Pattern.compile("[<>'\"&\\\\/]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern USER_INPUT_DISALLOWED = Pattern.compile("[<>'\"&]");
    private static final Pattern SLUG_DISALLOWED = Pattern.compile("[^\\w\\s-]");
    private static final Pattern SLUG_SEPARATORS = Pattern.compile("[\\s_-]+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

    private final PatternStripper patternStripper;
    private final int searchQueryMaxLength;

    public FieldNormalizer(PatternStripper patternStripper, int searchQueryMaxLength) {
        if (searchQueryMaxLength < 1) {
            throw new IllegalArgumentException("searchQueryMaxLength must be positive");
        }
        this.patternStripper = patternStripper;
        this.searchQueryMaxLength = searchQueryMaxLength;
    }

    /**
     * Lower-cases, trims and strips disallowed characters, then checks the
     * {@code local@domain.tld} shape. The shape check runs on the stripped
     * value, so {@code "a@b.c<x>"} is accepted as {@code "a@b.cx"}.
     */
    public String sanitizeEmail(String email) {
        if (email == null || email.isEmpty()) {
            return "";
        }
        String stripped = EMAIL_DISALLOWED.matcher(email.toLowerCase(Locale.ROOT).trim()).replaceAll("");
        return hasEmailShape(stripped) ? stripped : "";
    }

    /** Digits plus one leading {@code +}; any other {@code +} is dropped. */
    public String sanitizePhoneNumber(String phone) {
        if (phone == null || phone.isEmpty()) {
            return "";
        }
        String kept = PHONE_DISALLOWED.matcher(phone).replaceAll("");
        if (kept.isEmpty()) {
            return "";
        }
        String rest = kept.substring(1).replace("+", "");
        return kept.charAt(0) + rest;
    }

    public String sanitizeFilename(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        String replaced = FILENAME_DISALLOWED.matcher(filename).replaceAll("_");
        String collapsed = UNDERSCORE_RUN.matcher(replaced).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(collapsed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    public String sanitizeSearchQuery(String query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        String stripped = SEARCH_DISALLOWED.matcher(query).replaceAll("");
        String normalized = WHITESPACE_RUN.matcher(stripped).replaceAll(" ").trim();
        return truncate(normalized, searchQueryMaxLength);
    }

    /**
     * Plain-text form input: script blocks and handlers go first, then every
     * remaining tag and the characters {@code < > ' " &}.
     */
    public String sanitizeUserInput(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String withoutScripts = patternStripper.stripScripts(input);
        String withoutTags = removeTags(withoutScripts);
        return USER_INPUT_DISALLOWED.matcher(withoutTags).replaceAll("").trim();
    }

    public String toSlug(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT).trim();
        String stripped = SLUG_DISALLOWED.matcher(lowered).replaceAll("");
        String joined = SLUG_SEPARATORS.matcher(stripped).replaceAll("-");
        return EDGE_HYPHENS.matcher(joined).replaceAll("");
    }

    public int getSearchQueryMaxLength() {
        return searchQueryMaxLength;
    }

    /**
     * Cuts {@code text} to at most {@code maxLength} chars without leaving the
     * high half of a surrogate pair at the end.
     */
    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    // exactly one '@', a non-empty local part, and a dot inside the domain
    private static boolean hasEmailShape(String email) {
        int at = email.indexOf('@');
        if (at <= 0 || email.indexOf('@', at + 1) >= 0) {
            return false;
        }
        String domain = email.substring(at + 1);
        int dot = domain.indexOf('.', 1);
        return dot > 0 && dot < domain.length() - 1;
    }

    // each '<' through the next '>'
    private static String removeTags(String text) {
        int open = text.indexOf('<');
        if (open < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int copied = 0;
        while (open >= 0) {
            int close = text.indexOf('>', open + 1);
            if (close < 0) {
                break;
            }
            out.append(text, copied, open);
            copied = close + 1;
            open = text.indexOf('<', copied);
        }
        return out.append(text, copied, text.length()).toString();
    }
}
