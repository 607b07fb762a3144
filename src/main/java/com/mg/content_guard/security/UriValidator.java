package com.mg.content_guard.security;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Accepts absolute http/https URIs with a host and returns them in canonical
 * form. Everything else, including relative references and unparseable
 * text, comes back as an empty string.
 */
@Component
public class UriValidator {

    private static final Logger log = LoggerFactory.getLogger(UriValidator.class);
    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    public String validate(String uriText) {
        if (uriText == null) {
            return "";
        }
        String trimmed = trimControlAndSpace(uriText);
        if (trimmed.isEmpty()) {
            return "";
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            log.debug("Rejected malformed URI: {}", e.getReason());
            return "";
        }

        String scheme = uri.getScheme();
        if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            return "";
        }
        // Registry-based authorities (e.g. "http://a b") leave host null
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            return "";
        }
        return canonicalize(uri, scheme.toLowerCase(Locale.ROOT), host.toLowerCase(Locale.ROOT));
    }

    private String canonicalize(URI uri, String scheme, String host) {
        StringBuilder out = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            out.append(uri.getRawUserInfo()).append('@');
        }
        out.append(host);
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            out.append(':').append(port);
        }
        String path = uri.getRawPath();
        out.append(path == null || path.isEmpty() ? "/" : path);
        if (uri.getRawQuery() != null) {
            out.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            out.append('#').append(uri.getRawFragment());
        }
        return out.toString();
    }

    private boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    private String trimControlAndSpace(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) <= ' ') {
            start++;
        }
        while (end > start && text.charAt(end - 1) <= ' ') {
            end--;
        }
        return text.substring(start, end);
    }
}
