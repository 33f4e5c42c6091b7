package org.rostilos.reviewpilot.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BranchPatternMatcher")
class BranchPatternMatcherTest {

    @Nested
    @DisplayName("matches() - empty and catch-all patterns")
    class CatchAllTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "*", " * ", ",", " , ,"})
        @DisplayName("should match every branch for empty or '*' pattern")
        void shouldMatchEverything(String pattern) {
            assertThat(BranchPatternMatcher.matches("main", pattern)).isTrue();
            assertThat(BranchPatternMatcher.matches("feature/deep/nested", pattern)).isTrue();
            assertThat(BranchPatternMatcher.matches("", pattern)).isTrue();
        }

        @Test
        @DisplayName("should not match null branch when a pattern is set")
        void shouldNotMatchNullBranch() {
            assertThat(BranchPatternMatcher.matches(null, "main")).isFalse();
        }

        @Test
        @DisplayName("should match null branch when no pattern is set")
        void shouldMatchNullBranchWithoutPattern() {
            assertThat(BranchPatternMatcher.matches(null, "")).isTrue();
        }
    }

    @Nested
    @DisplayName("matches() - single glob")
    class SingleGlobTests {

        @Test
        @DisplayName("should match exact branch name")
        void shouldMatchExactBranchName() {
            assertThat(BranchPatternMatcher.matches("main", "main")).isTrue();
            assertThat(BranchPatternMatcher.matches("feature/auth", "feature/auth")).isTrue();
        }

        @Test
        @DisplayName("should not match substring of literal pattern")
        void shouldRequireFullMatch() {
            assertThat(BranchPatternMatcher.matches("main-old", "main")).isFalse();
            assertThat(BranchPatternMatcher.matches("old-main", "main")).isFalse();
        }

        @Test
        @DisplayName("should let '*' span slashes")
        void shouldMatchAcrossSlashes() {
            assertThat(BranchPatternMatcher.matches("release/1.0", "release/*")).isTrue();
            assertThat(BranchPatternMatcher.matches("release/1.0/hotfix", "release/*")).isTrue();
            assertThat(BranchPatternMatcher.matches("release/", "release/*")).isTrue();
        }

        @Test
        @DisplayName("should anchor globs at both ends")
        void shouldAnchorGlob() {
            assertThat(BranchPatternMatcher.matches("my-release/1.0", "release/*")).isFalse();
            assertThat(BranchPatternMatcher.matches("feature-main", "*-main")).isTrue();
            assertThat(BranchPatternMatcher.matches("feature-main-2", "*-main")).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "release.1, release.1, true",
                "releaseX1, release.1, false",
                "v1+2, v1+2, true",
                "v11, v1+, false",
                "fix(1), fix(*), true",
                "[x], [*], true"
        })
        @DisplayName("should treat regex metacharacters literally")
        void shouldEscapeRegexCharacters(String branch, String pattern, boolean expected) {
            assertThat(BranchPatternMatcher.matches(branch, pattern)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should not throw on malformed pattern")
        void shouldNotThrowOnMalformedPattern() {
            assertThat(BranchPatternMatcher.matches("feature/[", "feature/[")).isTrue();
            assertThat(BranchPatternMatcher.matches("x", "(*")).isFalse();
            assertThat(BranchPatternMatcher.matches("(abc", "(*")).isTrue();
        }
    }

    @Nested
    @DisplayName("matches() - comma-separated list")
    class ListTests {

        @Test
        @DisplayName("should match if any glob matches")
        void shouldMatchAny() {
            String pattern = "main, develop, release/*";
            assertThat(BranchPatternMatcher.matches("main", pattern)).isTrue();
            assertThat(BranchPatternMatcher.matches("develop", pattern)).isTrue();
            assertThat(BranchPatternMatcher.matches("release/2.0", pattern)).isTrue();
            assertThat(BranchPatternMatcher.matches("feature/x", pattern)).isFalse();
        }

        @Test
        @DisplayName("should ignore empty entries")
        void shouldIgnoreEmptyEntries() {
            assertThat(BranchPatternMatcher.matches("main", ",,main,")).isTrue();
            assertThat(BranchPatternMatcher.matches("dev", ",,main,")).isFalse();
        }
    }

    @Nested
    @DisplayName("split()")
    class SplitTests {

        @Test
        @DisplayName("should trim and drop blanks")
        void shouldTrimAndDropBlanks() {
            assertThat(BranchPatternMatcher.split(" main ,, release/* ")).containsExactly("main", "release/*");
        }

        @Test
        @DisplayName("should return empty list for null")
        void shouldReturnEmptyForNull() {
            assertThat(BranchPatternMatcher.split(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("globToRegex()")
    class GlobToRegexTests {

        @Test
        @DisplayName("should quote literal runs around wildcards")
        void shouldQuoteLiteralRuns() {
            assertThat(BranchPatternMatcher.globToRegex("release/*")).isEqualTo("\\Qrelease/\\E.*");
            assertThat(BranchPatternMatcher.globToRegex("*")).isEqualTo(".*");
        }
    }
}
