package com.mg.content_guard.dto;

import com.mg.content_guard.model.ContentType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SanitizationRequest {

    private String rawText;

    /** Pipeline to run; null is treated as {@link ContentType#USER_INPUT}. */
    private ContentType contentType;
}
