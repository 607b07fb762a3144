package com.mg.content_guard.security;

import java.util.Map;

/**
 * The five HTML-significant characters and the entities they map to.
 * Shared by escaping and unescaping so the two directions cannot drift.
 */
public final class EntityTable {

    static final Map<Character, String> CHAR_TO_ENTITY = Map.of(
            '&', "&amp;",
            '<', "&lt;",
            '>', "&gt;",
            '"', "&quot;",
            '\'', "&#39;");

    static final Map<String, Character> ENTITY_TO_CHAR = Map.of(
            "&amp;", '&',
            "&lt;", '<',
            "&gt;", '>',
            "&quot;", '"',
            "&#39;", '\'');

    private EntityTable() {
    }

    public static String entityFor(char c) {
        return CHAR_TO_ENTITY.get(c);
    }

    public static Character charFor(String entity) {
        return ENTITY_TO_CHAR.get(entity);
    }
}
