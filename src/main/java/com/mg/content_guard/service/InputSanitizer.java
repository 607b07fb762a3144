package com.mg.content_guard.service;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.mg.content_guard.config.SanitizerProperties;
import com.mg.content_guard.dto.SanitizationRequest;
import com.mg.content_guard.dto.SanitizationResult;
import com.mg.content_guard.model.ContentType;
import com.mg.content_guard.model.OversizeAction;
import com.mg.content_guard.model.ThreatCategory;
import com.mg.content_guard.model.WhitelistPolicy;
import com.mg.content_guard.security.EntityCodec;
import com.mg.content_guard.security.MarkupWhitelistFilter;
import com.mg.content_guard.security.PatternStripper;
import com.mg.content_guard.security.ThreatDetector;
import com.mg.content_guard.security.UriValidator;

/**
 * Entry point for callers holding untrusted text. Picks the pipeline for the
 * declared {@link ContentType} and always returns a non-null string.
 */
@Component
public class InputSanitizer {

    private static final Logger log = LoggerFactory.getLogger(InputSanitizer.class);

    private final MarkupWhitelistFilter markupFilter;
    private final WhitelistPolicy articlePolicy;
    private final WhitelistPolicy commentPolicy;
    private final PatternStripper patternStripper;
    private final FieldNormalizer fieldNormalizer;
    private final UriValidator uriValidator;
    private final EntityCodec entityCodec;
    private final ThreatDetector threatDetector;
    private final int maxInputLength;
    private final OversizeAction oversizeAction;
    private final boolean threatLoggingEnabled;

    public InputSanitizer(MarkupWhitelistFilter markupFilter,
                          @Qualifier("articlePolicy") WhitelistPolicy articlePolicy,
                          @Qualifier("commentPolicy") WhitelistPolicy commentPolicy,
                          PatternStripper patternStripper,
                          FieldNormalizer fieldNormalizer,
                          UriValidator uriValidator,
                          EntityCodec entityCodec,
                          ThreatDetector threatDetector,
                          SanitizerProperties properties) {
        this.markupFilter = markupFilter;
        this.articlePolicy = articlePolicy;
        this.commentPolicy = commentPolicy;
        this.patternStripper = patternStripper;
        this.fieldNormalizer = fieldNormalizer;
        this.uriValidator = uriValidator;
        this.entityCodec = entityCodec;
        this.threatDetector = threatDetector;
        this.maxInputLength = properties.getMaxInputLength();
        this.oversizeAction = properties.getOversizeAction();
        this.threatLoggingEnabled = properties.isThreatLoggingEnabled();
    }

    public SanitizationResult sanitize(SanitizationRequest request) {
        if (request == null) {
            return new SanitizationResult("", ContentType.USER_INPUT);
        }
        ContentType type = request.getContentType() == null ? ContentType.USER_INPUT : request.getContentType();
        return new SanitizationResult(sanitize(request.getRawText(), type), type);
    }

    /**
     * Resolves {@code contentType} with {@link ContentType#fromTag(String)};
     * unknown tags go through the user input pipeline.
     */
    public String sanitize(String content, String contentType) {
        if (!ContentType.isKnownTag(contentType)) {
            log.debug("Unknown content type '{}', using user_input pipeline", contentType);
        }
        return sanitize(content, ContentType.fromTag(contentType));
    }

    public String sanitize(String content, ContentType contentType) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        ContentType type = contentType == null ? ContentType.USER_INPUT : contentType;

        String bounded = enforceLengthCap(content, type);
        if (bounded.isEmpty()) {
            return "";
        }
        if (threatLoggingEnabled) {
            logThreats(bounded, type);
        }

        try {
            return route(bounded, type);
        } catch (RuntimeException e) {
            log.error("Sanitization failed for content type {} (length={}), returning empty result",
                    type.getTag(), bounded.length(), e);
            return "";
        }
    }

    public String escapeHtml(String text) {
        return entityCodec.escape(text);
    }

    public String unescapeHtml(String text) {
        return entityCodec.unescape(text);
    }

    public String stripScripts(String html) {
        return patternStripper.stripScripts(html);
    }

    private String route(String content, ContentType type) {
        log.debug("Sanitizing {} chars as {}", content.length(), type.getTag());
        return switch (type) {
            case ARTICLE -> markupFilter.filter(content, articlePolicy);
            case COMMENT -> markupFilter.filter(content, commentPolicy);
            case SEARCH -> fieldNormalizer.sanitizeSearchQuery(content);
            case USER_INPUT -> fieldNormalizer.sanitizeUserInput(content);
            case SQL -> patternStripper.stripSqlPatterns(content);
            case EMAIL -> fieldNormalizer.sanitizeEmail(content);
            case PHONE -> fieldNormalizer.sanitizePhoneNumber(content);
            case FILENAME -> fieldNormalizer.sanitizeFilename(content);
            case URL -> uriValidator.validate(content);
            case SLUG -> fieldNormalizer.toSlug(content);
        };
    }

    private String enforceLengthCap(String content, ContentType type) {
        if (content.length() <= maxInputLength) {
            return content;
        }
        if (oversizeAction == OversizeAction.REJECT) {
            log.warn("Rejected oversized {} input: length={}, limit={}", type.getTag(), content.length(), maxInputLength);
            return "";
        }
        log.warn("Truncated oversized {} input: length={}, limit={}", type.getTag(), content.length(), maxInputLength);
        return FieldNormalizer.truncate(content, maxInputLength);
    }

    private void logThreats(String content, ContentType type) {
        Set<ThreatCategory> threats = threatDetector.detect(content);
        if (!threats.isEmpty()) {
            log.warn("Suspicious {} input: categories={}, length={}", type.getTag(), threats, content.length());
        }
    }
}
