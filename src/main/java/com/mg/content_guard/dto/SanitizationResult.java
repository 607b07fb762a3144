package com.mg.content_guard.dto;

import com.mg.content_guard.model.ContentType;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one sanitization call. {@code content} is never null; an empty
 * string means nothing safe could be extracted.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SanitizationResult {

    private final String content;
    private final ContentType contentType;

    public SanitizationResult(String content, ContentType contentType) {
        this.content = content == null ? "" : content;
        this.contentType = contentType;
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }
}
