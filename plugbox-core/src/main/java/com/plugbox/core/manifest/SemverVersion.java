package com.plugbox.core.manifest;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语义化版本 major.minor.patch[-prerelease][+build]
 */
public record SemverVersion(int major, int minor, int patch, String prerelease)
        implements Comparable<SemverVersion> {

    private static final Pattern SEMVER_PATTERN =
            Pattern.compile("^v?(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z.-]+))?(?:\\+[0-9A-Za-z.-]+)?$");

    public static Optional<SemverVersion> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = SEMVER_PATTERN.matcher(raw.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SemverVersion(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    matcher.group(4)));
        } catch (NumberFormatException e) {
            // 数字段溢出
            return Optional.empty();
        }
    }

    public static boolean isValid(String raw) {
        return parse(raw).isPresent();
    }

    @Override
    public int compareTo(SemverVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        if (patch != other.patch) {
            return Integer.compare(patch, other.patch);
        }
        // 有预发布标记的版本低于正式版本
        if (prerelease == null && other.prerelease == null) {
            return 0;
        }
        if (prerelease == null) {
            return 1;
        }
        if (other.prerelease == null) {
            return -1;
        }
        return comparePrerelease(prerelease, other.prerelease);
    }

    private static int comparePrerelease(String left, String right) {
        String[] leftParts = left.split("\\.");
        String[] rightParts = right.split("\\.");
        int length = Math.min(leftParts.length, rightParts.length);
        for (int i = 0; i < length; i++) {
            String l = leftParts[i];
            String r = rightParts[i];
            boolean lNumeric = l.chars().allMatch(Character::isDigit);
            boolean rNumeric = r.chars().allMatch(Character::isDigit);
            int cmp;
            if (lNumeric && rNumeric) {
                cmp = Long.compare(Long.parseLong(l), Long.parseLong(r));
            } else if (lNumeric) {
                cmp = -1;
            } else if (rNumeric) {
                cmp = 1;
            } else {
                cmp = l.compareTo(r);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(leftParts.length, rightParts.length);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch + (prerelease != null ? "-" + prerelease : "");
    }
}
