package com.plm.common.config;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version parsing and comparison.
 */
public final class SemanticVersion {

    private SemanticVersion() {
    }

    private static final Pattern VERSION_RE = Pattern.compile(
            "^v?(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z.-]+))?(?:\\+([0-9A-Za-z.-]+))?$");

    // =========================================================================
    // Types
    // =========================================================================

    /**
     * Parsed version. {@code preRelease} and {@code build} are null when absent.
     */
    public record Version(int major, int minor, int patch, String preRelease, String build) {

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder()
                    .append(major).append('.').append(minor).append('.').append(patch);
            if (preRelease != null) {
                sb.append('-').append(preRelease);
            }
            if (build != null) {
                sb.append('+').append(build);
            }
            return sb.toString();
        }
    }

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Parse a version string such as "1.2.3", "v1.2.3" or "1.2.3-rc.1+build.5".
     *
     * @return parsed version or null if the string is not well-formed
     */
    public static Version parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher matcher = VERSION_RE.matcher(raw.trim());
        if (!matcher.matches()) {
            return null;
        }
        try {
            return new Version(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    matcher.group(4),
                    matcher.group(5));
        } catch (NumberFormatException e) {
            // component overflow
            return null;
        }
    }

    public static boolean isValid(String raw) {
        return parse(raw) != null;
    }

    /**
     * Compare two version strings. Build metadata is ignored; a pre-release
     * sorts before the corresponding release.
     *
     * @return negative if a &lt; b, positive if a &gt; b, 0 if equal, null if
     *         either is invalid
     */
    public static Integer compare(String a, String b) {
        Version va = parse(a);
        Version vb = parse(b);
        if (va == null || vb == null) {
            return null;
        }
        if (va.major() != vb.major()) {
            return va.major() < vb.major() ? -1 : 1;
        }
        if (va.minor() != vb.minor()) {
            return va.minor() < vb.minor() ? -1 : 1;
        }
        if (va.patch() != vb.patch()) {
            return va.patch() < vb.patch() ? -1 : 1;
        }
        if (va.preRelease() == null || vb.preRelease() == null) {
            if (va.preRelease() == vb.preRelease()) {
                return 0;
            }
            return va.preRelease() == null ? 1 : -1;
        }
        return Integer.signum(va.preRelease().compareTo(vb.preRelease()));
    }
}
