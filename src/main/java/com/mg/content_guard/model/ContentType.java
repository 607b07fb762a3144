package com.mg.content_guard.model;

import java.util.Locale;

/**
 * Sink a piece of untrusted text is headed for. The sink decides which
 * sanitization pipeline runs.
 */
public enum ContentType {
    ARTICLE("article"),
    COMMENT("comment"),
    SEARCH("search"),
    USER_INPUT("user_input"),
    SQL("sql"),
    EMAIL("email"),
    PHONE("phone"),
    FILENAME("filename"),
    URL("url"),
    SLUG("slug");

    private final String tag;

    ContentType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Resolves a wire tag such as {@code "comment"} or {@code "user-input"}.
     * Unknown, blank or null tags resolve to {@link #USER_INPUT}.
     */
    public static ContentType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return USER_INPUT;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ContentType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return USER_INPUT;
    }

    public static boolean isKnownTag(String tag) {
        if (tag == null) {
            return false;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ContentType type : values()) {
            if (type.tag.equals(normalized)) {
                return true;
            }
        }
        return false;
    }
}
