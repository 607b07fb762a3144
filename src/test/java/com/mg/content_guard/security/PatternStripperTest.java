package com.mg.content_guard.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PatternStripperTest {

    private final PatternStripper stripper = new PatternStripper();

    @Nested
    @DisplayName("stripScripts()")
    class StripScripts {

        @Test
        @DisplayName("Should return empty string for null input")
        void shouldHandleNull() {
            assertThat(stripper.stripScripts(null)).isEmpty();
        }

        @Test
        @DisplayName("Should remove script blocks with their content")
        void shouldRemoveScriptBlocks() {
            assertThat(stripper.stripScripts("<p>Hi</p><script>alert(1)</script><p>there</p>"))
                    .isEqualTo("<p>Hi</p><p>there</p>");
        }

        @Test
        @DisplayName("Should match script tags case-insensitively")
        void shouldIgnoreCase() {
            assertThat(stripper.stripScripts("<SCRIPT type=\"text/javascript\">x()</SCRIPT>ok"))
                    .isEqualTo("ok");
        }

        @Test
        @DisplayName("Should remove double and single quoted event handlers")
        void shouldRemoveEventHandlers() {
            assertThat(stripper.stripScripts("<img src=\"a.png\" onerror=\"alert(1)\">"))
                    .isEqualTo("<img src=\"a.png\" >");
            assertThat(stripper.stripScripts("<div onMouseOver='x()'>t</div>"))
                    .isEqualTo("<div >t</div>");
        }

        @Test
        @DisplayName("Should not touch attributes that merely contain 'on'")
        void shouldKeepLookalikeAttributes() {
            String html = "<div data-condition=\"ready\">t</div>";
            assertThat(stripper.stripScripts(html)).isEqualTo(html);
        }

        @Test
        @DisplayName("Should remove javascript: markers")
        void shouldRemoveJavascriptScheme() {
            assertThat(stripper.stripScripts("<a href=\"JavaScript:alert(1)\">x</a>"))
                    .isEqualTo("<a href=\"alert(1)\">x</a>");
        }

        @Test
        @DisplayName("Should not let a removal reassemble a new match")
        void shouldRepeatUntilStable() {
            assertThat(stripper.stripScripts("javajavascript:script:alert(1)")).isEqualTo("alert(1)");
            assertThat(stripper.stripScripts("<scr<script>x</script>ipt>alert(1)</script>")).isEmpty();
        }

        @Test
        @DisplayName("Should remove a script body full of '<' characters")
        void shouldRemoveScriptWithManyAngleBrackets() {
            String html = "a<script>" + "<a".repeat(50_000) + "</script>b";

            String result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> stripper.stripScripts(html));

            assertThat(result).isEqualTo("ab");
        }

        @Test
        @DisplayName("Should leave an unclosed script tag in place")
        void shouldLeaveUnclosedScript() {
            assertThat(stripper.stripScripts("<script>" + "<b".repeat(3))).isEqualTo("<script><b<b<b");
            assertThat(stripper.stripScripts("<Script>x</script ><script>y")).isEqualTo("<script>y");
        }
    }

    @Nested
    @DisplayName("stripSqlPatterns()")
    class StripSqlPatterns {

        @Test
        @DisplayName("Should return empty string for null input")
        void shouldHandleNull() {
            assertThat(stripper.stripSqlPatterns(null)).isEmpty();
        }

        @Test
        @DisplayName("Should remove boolean idiom and comment marker")
        void shouldRemoveTautologyAndComment() {
            assertThat(stripper.stripSqlPatterns("1 OR 1=1 -- ")).isEqualTo("1");
        }

        @Test
        @DisplayName("Should remove quoted tautologies")
        void shouldRemoveQuotedTautology() {
            assertThat(stripper.stripSqlPatterns("admin' AND 'x'='x'")).isEqualTo("admin'");
            assertThat(stripper.stripSqlPatterns("admin\" or \"a\"=\"a\"")).isEqualTo("admin\"");
        }

        @Test
        @DisplayName("Should remove SQL keywords case-insensitively")
        void shouldRemoveKeywords() {
            String result = stripper.stripSqlPatterns("drop table users; Exec xp_cmdshell");
            assertThat(result).doesNotContainIgnoringCase("drop").doesNotContainIgnoringCase("exec");
            assertThat(result).contains("table users;");
        }

        @Test
        @DisplayName("Should remove UNION ... SELECT sequences")
        void shouldRemoveUnionSelect() {
            String result = stripper.stripSqlPatterns("1 UNION ALL SELECT password FROM users");
            assertThat(result).doesNotContainIgnoringCase("union")
                    .doesNotContainIgnoringCase("select")
                    .doesNotContain("ALL");
            assertThat(result).startsWith("1").endsWith("password FROM users");
        }

        @Test
        @DisplayName("Should cut each UNION only through the nearest SELECT on its line")
        void shouldKeepUnionSelectOnOneLine() {
            assertThat(stripper.stripSqlPatterns("a UNION b UNION c SELECT d SELECT e"))
                    .isEqualTo("a  d  e");
            assertThat(stripper.stripSqlPatterns("a UNION b\nSELECT c")).isEqualTo("a  b\n c");
        }

        @Test
        @DisplayName("Should process a megabyte of repeated UNION in linear time")
        void shouldStayLinearOnRepeatedUnion() {
            String text = "union ".repeat(175_000) + "x";

            String result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> stripper.stripSqlPatterns(text));

            assertThat(result).isEqualTo("x");
        }

        @Test
        @DisplayName("Should remove comment markers")
        void shouldRemoveCommentMarkers() {
            String result = stripper.stripSqlPatterns("a /* x */ b # c -- d");
            assertThat(result).doesNotContain("/*", "*/", "#", "--");
            assertThat(result).contains("a", "x", "b", "c", "d");
        }

        @Test
        @DisplayName("Should leave words that only start with a keyword")
        void shouldKeepLookalikeWords() {
            assertThat(stripper.stripSqlPatterns("selection and updates")).isEqualTo("selection and updates");
        }
    }
}
