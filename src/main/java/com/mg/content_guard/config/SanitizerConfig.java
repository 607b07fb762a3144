package com.mg.content_guard.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.mg.content_guard.model.WhitelistPolicy;
import com.mg.content_guard.security.MarkupWhitelistFilter;
import com.mg.content_guard.security.PatternStripper;
import com.mg.content_guard.security.UriValidator;
import com.mg.content_guard.service.FieldNormalizer;

@Configuration
public class SanitizerConfig {

    @Bean
    public WhitelistPolicy articlePolicy() {
        return WhitelistPolicies.article();
    }

    @Bean
    public WhitelistPolicy commentPolicy() {
        return WhitelistPolicies.comment();
    }

    @Bean
    public MarkupWhitelistFilter markupWhitelistFilter(UriValidator uriValidator,
                                                       @Qualifier("articlePolicy") WhitelistPolicy articlePolicy,
                                                       @Qualifier("commentPolicy") WhitelistPolicy commentPolicy) {
        return new MarkupWhitelistFilter(uriValidator, List.of(articlePolicy, commentPolicy));
    }

    @Bean
    public FieldNormalizer fieldNormalizer(SanitizerProperties properties,
                                           PatternStripper patternStripper) {
        return new FieldNormalizer(patternStripper, properties.getSearchQueryMaxLength());
    }
}
