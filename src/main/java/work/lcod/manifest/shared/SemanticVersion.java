package work.lcod.manifest.shared;

import java.util.Objects;

/**
 * {@code major[.minor[.patch]]} version; missing parts read as zero, so {@code 2.0} equals {@code 2.0.0}.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {
    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version parts must be non-negative");
        }
    }

    /**
     * Parses a version string such as {@code 1}, {@code 1.2} or {@code v1.2.3}. Pre-release and build
     * suffixes ({@code -beta}, {@code +sha}) are ignored.
     *
     * @throws IllegalArgumentException if the string has more than three parts or non-numeric parts
     */
    public static SemanticVersion parse(String raw) {
        Objects.requireNonNull(raw, "Version cannot be null");
        String trimmed = raw.trim();
        if (trimmed.startsWith("v") || trimmed.startsWith("V")) {
            trimmed = trimmed.substring(1);
        }
        int suffix = indexOfAny(trimmed, '-', '+');
        if (suffix >= 0) {
            trimmed = trimmed.substring(0, suffix);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Invalid version format: " + raw);
        }
        String[] parts = trimmed.split("\\.");
        if (parts.length > 3) {
            throw new IllegalArgumentException("Invalid version format: " + raw + " (expected major.minor.patch)");
        }
        int[] numbers = new int[3];
        try {
            for (int i = 0; i < parts.length; i++) {
                numbers[i] = Integer.parseInt(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version numbers in: " + raw, e);
        }
        return new SemanticVersion(numbers[0], numbers[1], numbers[2]);
    }

    @Override
    public int compareTo(SemanticVersion other) {
        Objects.requireNonNull(other, "Other version cannot be null");
        int majorCompare = Integer.compare(major, other.major);
        if (majorCompare != 0) return majorCompare;

        int minorCompare = Integer.compare(minor, other.minor);
        if (minorCompare != 0) return minorCompare;

        return Integer.compare(patch, other.patch);
    }

    public boolean isAtLeast(SemanticVersion minimum) {
        return compareTo(minimum) >= 0;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) return b;
        if (b < 0) return a;
        return Math.min(a, b);
    }
}
