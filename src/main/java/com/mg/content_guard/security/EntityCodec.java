package com.mg.content_guard.security;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Escapes and unescapes the characters listed in {@link EntityTable}.
 *
 * <p>{@code unescape(escape(x))} gives back {@code x} for plain text. Text
 * that never went through {@link #escape(String)} but already holds entity
 * sequences is decoded by {@link #unescape(String)} as well: the codec cannot
 * tell a typed {@code &lt;} from an escaped {@code <}.
 */
@Component
public class EntityCodec {

    private static final Pattern KNOWN_ENTITY = Pattern.compile("&(?:amp|lt|gt|quot|#39);");

    public String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String entity = EntityTable.entityFor(c);
            if (entity != null) {
                if (out == null) {
                    out = new StringBuilder(text.length() + 16);
                    out.append(text, 0, i);
                }
                out.append(entity);
            } else if (out != null) {
                out.append(c);
            }
        }
        return out == null ? text : out.toString();
    }

    public String unescape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = KNOWN_ENTITY.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            Character c = EntityTable.charFor(matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(c)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
