package com.mg.content_guard.config;

import com.mg.content_guard.model.CssRule;
import com.mg.content_guard.model.WhitelistPolicy;

/**
 * The two built-in markup policies.
 */
public final class WhitelistPolicies {

    public static final String ARTICLE = "article";
    public static final String COMMENT = "comment";

    private static final String HEX_COLOR = "#[0-9a-fA-F]{6}";

    private WhitelistPolicies() {
    }

    public static WhitelistPolicy article() {
        return WhitelistPolicy.builder(ARTICLE)
                .allowTag("p", "class", "style")
                .allowTags("br", "strong", "b", "em", "i", "u", "s", "thead", "tbody", "tr")
                .allowTag("h1", "class")
                .allowTag("h2", "class")
                .allowTag("h3", "class")
                .allowTag("h4", "class")
                .allowTag("h5", "class")
                .allowTag("h6", "class")
                .allowTag("ul", "class")
                .allowTag("ol", "class")
                .allowTag("li", "class")
                .allowTag("a", "href", "title", "target")
                .allowTag("img", "src", "alt", "title", "width", "height", "class")
                .allowTag("blockquote", "class")
                .allowTag("code", "class")
                .allowTag("pre", "class")
                .allowTag("div", "class", "style")
                .allowTag("span", "class", "style")
                .allowTag("table", "class")
                .allowTag("th", "class")
                .allowTag("td", "class")
                .requireAttribute("a", "href")
                .requireAttribute("img", "src")
                .allowCss(CssRule.oneOf("text-align", "left", "right", "center", "justify"))
                .allowCss(CssRule.matching("color", HEX_COLOR))
                .allowCss(CssRule.matching("background-color", HEX_COLOR))
                .allowCss(CssRule.matching("font-size", "\\d+px"))
                .allowCss(CssRule.matching("font-weight", "normal|bold|bolder|lighter|\\d+"))
                .allowCss(CssRule.oneOf("text-decoration", "none", "underline", "overline", "line-through"))
                .allowCss(CssRule.matching("margin", "\\d+px"))
                .allowCss(CssRule.matching("padding", "\\d+px"))
                .allowCss(CssRule.matching("border", "\\d+px\\s+(?:solid|dashed|dotted)\\s+" + HEX_COLOR))
                .build();
    }

    public static WhitelistPolicy comment() {
        return WhitelistPolicy.builder(COMMENT)
                .allowTags("p", "br", "strong", "b", "em", "i", "u")
                .allowTag("a", "href", "title")
                .requireAttribute("a", "href")
                .build();
    }
}
