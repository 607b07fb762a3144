package com.mg.content_guard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.mg.content_guard.model.OversizeAction;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "sanitizer")
public class SanitizerProperties {

    /** Inputs longer than this many chars are truncated or rejected before any pipeline runs. */
    @Min(1)
    private int maxInputLength = 1024 * 1024;

    @NotNull
    private OversizeAction oversizeAction = OversizeAction.TRUNCATE;

    @Min(1)
    @Max(10_000)
    private int searchQueryMaxLength = 200;

    private boolean threatLoggingEnabled = true;
}
