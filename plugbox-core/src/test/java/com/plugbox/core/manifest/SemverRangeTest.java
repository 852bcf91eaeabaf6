package com.plugbox.core.manifest;

import com.plugbox.api.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SemverRange 单元测试")
class SemverRangeTest {

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("^ 锁定主版本")
        void caretShouldLockMajor() {
            SemverRange range = SemverRange.parse("^1.2.0");

            assertTrue(range.satisfiedBy("1.2.0"));
            assertTrue(range.satisfiedBy("1.9.3"));
            assertFalse(range.satisfiedBy("2.0.0"));
            assertFalse(range.satisfiedBy("1.1.9"));
        }

        @Test
        @DisplayName("0.x 的 ^ 锁定次版本")
        void caretOnZeroMajorShouldLockMinor() {
            SemverRange range = SemverRange.parse("^0.3.1");

            assertTrue(range.satisfiedBy("0.3.5"));
            assertFalse(range.satisfiedBy("0.4.0"));
        }

        @Test
        @DisplayName("~ 锁定次版本")
        void tildeShouldLockMinor() {
            SemverRange range = SemverRange.parse("~1.2.3");

            assertTrue(range.satisfiedBy("1.2.9"));
            assertFalse(range.satisfiedBy("1.3.0"));
        }

        @Test
        @DisplayName("比较运算符可组合")
        void comparatorsShouldCombine() {
            SemverRange range = SemverRange.parse(">=1.0.0 <2.0.0");

            assertTrue(range.satisfiedBy("1.0.0"));
            assertTrue(range.satisfiedBy("1.99.0"));
            assertFalse(range.satisfiedBy("2.0.0"));
            assertFalse(range.satisfiedBy("0.9.0"));
        }

        @Test
        @DisplayName("运算符后允许空格")
        void spaceAfterOperatorShouldBeAccepted() {
            assertTrue(SemverRange.parse(">= 1.2.0").satisfiedBy("1.2.0"));
        }

        @Test
        @DisplayName("|| 表示或")
        void alternativesShouldMatchEither() {
            SemverRange range = SemverRange.parse("^1.0.0 || ^3.0.0");

            assertTrue(range.satisfiedBy("1.4.0"));
            assertTrue(range.satisfiedBy("3.1.0"));
            assertFalse(range.satisfiedBy("2.0.0"));
        }

        @Test
        @DisplayName("连字符范围包含两端")
        void hyphenRangeShouldBeInclusive() {
            SemverRange range = SemverRange.parse("1.0.0 - 2.0.0");

            assertTrue(range.satisfiedBy("1.0.0"));
            assertTrue(range.satisfiedBy("2.0.0"));
            assertFalse(range.satisfiedBy("2.0.1"));
        }

        @Test
        @DisplayName("x-range 与 * 匹配对应精度")
        void wildcardsShouldMatch() {
            assertTrue(SemverRange.parse("1.x").satisfiedBy("1.7.2"));
            assertFalse(SemverRange.parse("1.x").satisfiedBy("2.0.0"));
            assertTrue(SemverRange.parse("*").satisfiedBy("42.0.0"));
        }

        @Test
        @DisplayName("完整版本无运算符时精确匹配")
        void bareVersionShouldMatchExactly() {
            SemverRange range = SemverRange.parse("1.2.3");

            assertTrue(range.satisfiedBy("1.2.3"));
            assertFalse(range.satisfiedBy("1.2.4"));
        }
    }

    @Nested
    @DisplayName("非法输入")
    class InvalidTests {

        @Test
        @DisplayName("空白或乱码范围应抛出 ValidationException")
        void garbageShouldFail() {
            assertThrows(ValidationException.class, () -> SemverRange.parse(" "));
            assertThrows(ValidationException.class, () -> SemverRange.parse(">=abc"));
            assertThrows(ValidationException.class, () -> SemverRange.parse("^1.2.3.4"));
        }

        @Test
        @DisplayName("非法版本号不满足任何范围")
        void invalidVersionShouldNotSatisfy() {
            assertFalse(SemverRange.parse("*").satisfiedBy("latest"));
        }
    }

    @Nested
    @DisplayName("版本比较")
    class VersionTests {

        @Test
        @DisplayName("预发布版本低于正式版本")
        void prereleaseShouldSortBeforeRelease() {
            SemverVersion beta = SemverVersion.parse("1.0.0-beta.2").orElseThrow();
            SemverVersion beta11 = SemverVersion.parse("1.0.0-beta.11").orElseThrow();
            SemverVersion release = SemverVersion.parse("1.0.0").orElseThrow();

            assertTrue(beta.compareTo(release) < 0);
            assertTrue(beta.compareTo(beta11) < 0);
            assertEquals("1.0.0-beta.2", beta.toString());
        }

        @Test
        @DisplayName("构建元数据与 v 前缀可被解析")
        void prefixAndBuildMetadataShouldParse() {
            assertTrue(SemverVersion.isValid("v2.1.0+build.7"));
            assertFalse(SemverVersion.isValid("2.1"));
        }
    }
}
