package work.lcod.manifest.resolve;

import java.util.Locale;
import work.lcod.manifest.shared.SemanticVersion;

/**
 * A module version requirement such as {@code ^2.0}, {@code ~1.4.2}, {@code >=1.1} or {@code 2.0.1}.
 * <ul>
 *   <li>absent, {@code latest} or {@code *}: any version</li>
 *   <li>{@code ^X.Y.Z}: same major, at least X.Y.Z</li>
 *   <li>{@code ~X.Y.Z}: same major and minor, at least X.Y.Z</li>
 *   <li>{@code >=X.Y.Z}: at least X.Y.Z</li>
 *   <li>{@code X.Y.Z}: exactly X.Y.Z once missing parts are read as zero</li>
 * </ul>
 */
public final class VersionConstraint {
    private static final VersionConstraint ANY = new VersionConstraint("*", Operator.ANY, null);

    private final String raw;
    private final Operator operator;
    private final SemanticVersion base;

    private VersionConstraint(String raw, Operator operator, SemanticVersion base) {
        this.raw = raw;
        this.operator = operator;
        this.base = base;
    }

    /**
     * @throws IllegalArgumentException when the version part is not a valid version
     */
    public static VersionConstraint parse(String raw) {
        if (raw == null) {
            return ANY;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.equals("*") || trimmed.toLowerCase(Locale.ROOT).equals("latest")) {
            return ANY;
        }
        if (trimmed.startsWith(">=")) {
            return new VersionConstraint(trimmed, Operator.AT_LEAST, SemanticVersion.parse(trimmed.substring(2)));
        }
        if (trimmed.startsWith("^")) {
            return new VersionConstraint(trimmed, Operator.SAME_MAJOR, SemanticVersion.parse(trimmed.substring(1)));
        }
        if (trimmed.startsWith("~")) {
            return new VersionConstraint(trimmed, Operator.SAME_MINOR, SemanticVersion.parse(trimmed.substring(1)));
        }
        return new VersionConstraint(trimmed, Operator.EXACT, SemanticVersion.parse(trimmed));
    }

    public boolean isSatisfiedBy(String version) {
        return isSatisfiedBy(SemanticVersion.parse(version));
    }

    public boolean isSatisfiedBy(SemanticVersion version) {
        return switch (operator) {
            case ANY -> true;
            case AT_LEAST -> version.isAtLeast(base);
            case SAME_MAJOR -> version.major() == base.major() && version.isAtLeast(base);
            case SAME_MINOR -> version.major() == base.major()
                && version.minor() == base.minor()
                && version.isAtLeast(base);
            case EXACT -> version.compareTo(base) == 0;
        };
    }

    @Override
    public String toString() {
        return raw;
    }

    private enum Operator {
        ANY,
        AT_LEAST,
        SAME_MAJOR,
        SAME_MINOR,
        EXACT
    }
}
