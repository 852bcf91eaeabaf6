package com.plugbox.core.manifest;

import com.plugbox.api.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语义化版本范围
 * <p>
 * 支持：精确版本、{@code = > >= < <=}、{@code ^}、{@code ~}、{@code * x X} 通配、
 * 部分版本 (1, 1.2)、连字符范围 (1.0.0 - 2.0.0)、空格连接（与）、{@code ||}（或）。
 * </p>
 */
public final class SemverRange {

    private static final Pattern PARTIAL_PATTERN = Pattern.compile(
            "^v?(\\d+|[xX*])(?:\\.(\\d+|[xX*]))?(?:\\.(\\d+|[xX*]))?(?:-([0-9A-Za-z.-]+))?(?:\\+[0-9A-Za-z.-]+)?$");
    private static final Pattern OPERATOR_PATTERN = Pattern.compile("^(>=|<=|>|<|=|\\^|~)?\\s*(.+)$");

    private final String raw;
    // 外层为或，内层为与
    private final List<List<Comparator>> alternatives;

    private SemverRange(String raw, List<List<Comparator>> alternatives) {
        this.raw = raw;
        this.alternatives = alternatives;
    }

    /**
     * 解析范围表达式
     *
     * @throws ValidationException 表达式不合法
     */
    public static SemverRange parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Version range cannot be blank");
        }
        List<List<Comparator>> alternatives = new ArrayList<>();
        for (String alternative : raw.split("\\|\\|")) {
            alternatives.add(parseConjunction(alternative.trim(), raw));
        }
        return new SemverRange(raw, alternatives);
    }

    public boolean satisfiedBy(SemverVersion version) {
        for (List<Comparator> conjunction : alternatives) {
            if (conjunction.stream().allMatch(c -> c.test(version))) {
                return true;
            }
        }
        return false;
    }

    public boolean satisfiedBy(String version) {
        return SemverVersion.parse(version)
                .map(this::satisfiedBy)
                .orElse(false);
    }

    @Override
    public String toString() {
        return raw;
    }

    // ==================== 解析 ====================

    private static List<Comparator> parseConjunction(String expression, String raw) {
        List<Comparator> comparators = new ArrayList<>();
        if (expression.isEmpty()) {
            // 空分支匹配任意版本
            return comparators;
        }

        // 连字符范围
        String[] hyphen = expression.split("\\s+-\\s+");
        if (hyphen.length == 2) {
            Partial low = parsePartial(hyphen[0], raw);
            Partial high = parsePartial(hyphen[1], raw);
            comparators.add(new Comparator(Op.GTE, low.floor()));
            if (high.isFull()) {
                comparators.add(new Comparator(Op.LTE, high.floor()));
            } else if (high.major != null) {
                comparators.add(new Comparator(Op.LT, high.nextAtPrecision()));
            }
            return comparators;
        }

        // 允许运算符与版本之间有空格，如 ">= 1.2.0"
        String normalized = expression.replaceAll("(>=|<=|>|<|=|\\^|~)\\s+", "$1");
        for (String token : normalized.split("\\s+")) {
            comparators.addAll(parseComparator(token, raw));
        }
        return comparators;
    }

    private static List<Comparator> parseComparator(String token, String raw) {
        Matcher matcher = OPERATOR_PATTERN.matcher(token);
        if (!matcher.matches()) {
            throw new ValidationException("Invalid version range: " + raw);
        }
        String op = matcher.group(1) == null ? "" : matcher.group(1);
        Partial partial = parsePartial(matcher.group(2), raw);

        List<Comparator> result = new ArrayList<>();
        if (partial.major == null) {
            // "*" 或 ">=*" 等匹配任意版本
            if (op.equals("<") || op.equals(">")) {
                result.add(new Comparator(Op.LT, new SemverVersion(0, 0, 0, "0")));
            }
            return result;
        }

        switch (op) {
            case "^" -> {
                result.add(new Comparator(Op.GTE, partial.floor()));
                result.add(new Comparator(Op.LT, partial.caretCeiling()));
            }
            case "~" -> {
                result.add(new Comparator(Op.GTE, partial.floor()));
                result.add(new Comparator(Op.LT, partial.tildeCeiling()));
            }
            case ">=" -> result.add(new Comparator(Op.GTE, partial.floor()));
            case "<" -> result.add(new Comparator(Op.LT, partial.floor()));
            case ">" -> result.add(partial.isFull()
                    ? new Comparator(Op.GT, partial.floor())
                    : new Comparator(Op.GTE, partial.nextAtPrecision()));
            case "<=" -> result.add(partial.isFull()
                    ? new Comparator(Op.LTE, partial.floor())
                    : new Comparator(Op.LT, partial.nextAtPrecision()));
            default -> {
                // "=" 或无运算符：完整版本精确匹配，部分版本按 x-range 处理
                if (partial.isFull()) {
                    result.add(new Comparator(Op.EQ, partial.floor()));
                } else {
                    result.add(new Comparator(Op.GTE, partial.floor()));
                    result.add(new Comparator(Op.LT, partial.nextAtPrecision()));
                }
            }
        }
        return result;
    }

    private static Partial parsePartial(String text, String raw) {
        Matcher matcher = PARTIAL_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new ValidationException("Invalid version range: " + raw);
        }
        try {
            Integer major = number(matcher.group(1));
            Integer minor = major == null ? null : number(matcher.group(2));
            Integer patch = minor == null ? null : number(matcher.group(3));
            return new Partial(major, minor, patch, patch == null ? null : matcher.group(4));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid version range: " + raw, e);
        }
    }

    private static Integer number(String group) {
        if (group == null || group.equalsIgnoreCase("x") || group.equals("*")) {
            return null;
        }
        return Integer.parseInt(group);
    }

    // ==================== 内部类型 ====================

    private enum Op {GTE, GT, LTE, LT, EQ}

    private record Comparator(Op op, SemverVersion version) {
        boolean test(SemverVersion candidate) {
            int cmp = candidate.compareTo(version);
            return switch (op) {
                case GTE -> cmp >= 0;
                case GT -> cmp > 0;
                case LTE -> cmp <= 0;
                case LT -> cmp < 0;
                case EQ -> cmp == 0;
            };
        }
    }

    /**
     * 可能缺失 minor/patch 的版本
     */
    private record Partial(Integer major, Integer minor, Integer patch, String prerelease) {

        boolean isFull() {
            return patch != null;
        }

        SemverVersion floor() {
            return new SemverVersion(major, minor == null ? 0 : minor, patch == null ? 0 : patch, prerelease);
        }

        /**
         * 按已给出的精度进一位：1 -> 2.0.0，1.2 -> 1.3.0，1.2.3 -> 1.2.4
         */
        SemverVersion nextAtPrecision() {
            if (minor == null) {
                return new SemverVersion(major + 1, 0, 0, null);
            }
            if (patch == null) {
                return new SemverVersion(major, minor + 1, 0, null);
            }
            return new SemverVersion(major, minor, patch + 1, null);
        }

        SemverVersion caretCeiling() {
            if (major > 0 || minor == null) {
                return new SemverVersion(major + 1, 0, 0, null);
            }
            if (minor > 0 || patch == null) {
                return new SemverVersion(0, minor + 1, 0, null);
            }
            return new SemverVersion(0, 0, patch + 1, null);
        }

        SemverVersion tildeCeiling() {
            if (minor == null) {
                return new SemverVersion(major + 1, 0, 0, null);
            }
            return new SemverVersion(major, minor + 1, 0, null);
        }
    }
}
