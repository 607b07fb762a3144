package com.mg.content_guard.security;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Regex passes that cut out well-known script and SQL injection fragments.
 *
 * <p>{@link #stripScripts(String)} is the only markup protection on paths that
 * skip the whitelist filter. {@link #stripSqlPatterns(String)} is a best-effort
 * filter only; queries must still be executed with bound parameters.
 */
@Component
public class PatternStripper {

    private static final Pattern SCRIPT_OPEN = Pattern.compile("<script\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_CLOSE = Pattern.compile("</script\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENT_HANDLER_DOUBLE_QUOTED = Pattern.compile(
            "\\bon\\w+\\s*=\\s*\"[^\"]*\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENT_HANDLER_SINGLE_QUOTED = Pattern.compile(
            "\\bon\\w+\\s*=\\s*'[^']*'", Pattern.CASE_INSENSITIVE);
    private static final Pattern JAVASCRIPT_URI = Pattern.compile(
            "javascript\\s*:", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> SCRIPT_PATTERNS = List.of(
            EVENT_HANDLER_DOUBLE_QUOTED, EVENT_HANDLER_SINGLE_QUOTED, JAVASCRIPT_URI);

    // UNION, SELECT or a line break; a UNION ... SELECT span never crosses a line
    private static final Pattern UNION_SELECT_TOKEN = Pattern.compile(
            "\\b(UNION)\\b|\\b(SELECT)\\b|[\\n\\r\\u0085\\u2028\\u2029]", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> SQL_PATTERNS = List.of(
            Pattern.compile("\\b(?:SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|EXEC|UNION|SCRIPT)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:OR|AND)\\b\\s*\\d+\\s*=\\s*\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:OR|AND)\\b\\s*'\\w+'\\s*=\\s*'\\w+'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:OR|AND)\\b\\s*\"\\w+\"\\s*=\\s*\"\\w+\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--|#|/\\*|\\*/"));

    /**
     * Removes script blocks, quoted {@code on*} handler attributes and
     * {@code javascript:} markers. Passes repeat until nothing changes, so a
     * match spliced out of the middle cannot leave a new match behind.
     */
    public String stripScripts(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String current = html;
        String previous;
        do {
            previous = current;
            current = removeScriptBlocks(current);
            for (Pattern pattern : SCRIPT_PATTERNS) {
                current = pattern.matcher(current).replaceAll("");
            }
        } while (!current.equals(previous));
        return current;
    }

    public String stripSqlPatterns(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        String previous;
        do {
            previous = current;
            current = removeUnionSelect(current);
            for (Pattern pattern : SQL_PATTERNS) {
                current = pattern.matcher(current).replaceAll("");
            }
        } while (!current.equals(previous));
        return current.trim();
    }

    /**
     * Cuts each {@code <script ...>} through the nearest following
     * {@code </script>}. An opening tag with no close after it is left for
     * the tag passes downstream.
     */
    static String removeScriptBlocks(String html) {
        Matcher open = SCRIPT_OPEN.matcher(html);
        Matcher close = SCRIPT_CLOSE.matcher(html);
        StringBuilder out = null;
        int copied = 0;
        int from = 0;
        while (open.find(from)) {
            if (!close.find(open.end())) {
                break;
            }
            if (out == null) {
                out = new StringBuilder(html.length());
            }
            out.append(html, copied, open.start());
            copied = close.end();
            from = close.end();
        }
        if (out == null) {
            return html;
        }
        return out.append(html, copied, html.length()).toString();
    }

    /**
     * Cuts each {@code UNION} through the nearest following {@code SELECT} on
     * the same line, together with the words between them.
     */
    static String removeUnionSelect(String text) {
        Matcher token = UNION_SELECT_TOKEN.matcher(text);
        StringBuilder out = null;
        int copied = 0;
        int unionStart = -1;
        while (token.find()) {
            if (token.group(1) != null) {
                if (unionStart < 0) {
                    unionStart = token.start();
                }
            } else if (token.group(2) != null) {
                if (unionStart >= 0) {
                    if (out == null) {
                        out = new StringBuilder(text.length());
                    }
                    out.append(text, copied, unionStart);
                    copied = token.end();
                    unionStart = -1;
                }
            } else {
                unionStart = -1;
            }
        }
        if (out == null) {
            return text;
        }
        return out.append(text, copied, text.length()).toString();
    }
}
