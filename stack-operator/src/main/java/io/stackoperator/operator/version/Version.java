/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.version;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Version in the {@code major.minor.patch[-pre][+build]} format. Versions with a pre-release qualifier are lower
 * than the same release without it. Build metadata is kept for printing but ignored when comparing.
 */
public final class Version implements Comparable<Version> {
    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    private final int major;
    private final int minor;
    private final int patch;
    private final String pre;
    private final String build;

    /**
     * Creates a release version without pre-release qualifier
     *
     * @param major     Major version
     * @param minor     Minor version
     * @param patch     Patch version
     */
    public Version(int major, int minor, int patch) {
        this(major, minor, patch, "", "");
    }

    private Version(int major, int minor, int patch, String pre, String build) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.pre = pre;
        this.build = build;
    }

    /**
     * Parses a version string
     *
     * @param version   The version string
     *
     * @return  The parsed version
     *
     * @throws MalformedVersionException when the string is not a valid version
     */
    public static Version parse(String version) {
        if (version == null || version.isBlank()) {
            throw new MalformedVersionException(String.valueOf(version), "version is empty");
        }

        String remaining = version.trim();
        String build = "";
        int plus = remaining.indexOf('+');
        if (plus >= 0) {
            build = remaining.substring(plus + 1);
            remaining = remaining.substring(0, plus);
        }

        String pre = "";
        int dash = remaining.indexOf('-');
        if (dash >= 0) {
            pre = remaining.substring(dash + 1);
            remaining = remaining.substring(0, dash);

            if (pre.isEmpty()) {
                throw new MalformedVersionException(version, "pre-release qualifier is empty");
            }
        }

        String[] segments = remaining.split("\\.", -1);
        if (segments.length != 3) {
            throw new MalformedVersionException(version, "expected major.minor.patch");
        }

        return new Version(segment(version, segments[0], "major"),
                segment(version, segments[1], "minor"),
                segment(version, segments[2], "patch"),
                pre,
                build);
    }

    private static int segment(String version, String segment, String name) {
        if (!NUMERIC.matcher(segment).matches()) {
            throw new MalformedVersionException(version, name + " version '" + segment + "' is not a number");
        }

        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw new MalformedVersionException(version, e);
        }
    }

    /**
     * Finds the lowest of the given versions. Any version which cannot be parsed fails the whole computation.
     *
     * @param versions  Version strings
     *
     * @return  The lowest version or null if there are no versions
     *
     * @throws MalformedVersionException when any of the versions cannot be parsed
     */
    public static Version min(Iterable<String> versions) {
        Version min = null;

        for (String version : versions) {
            Version parsed = parse(version);

            if (min == null || parsed.lt(min)) {
                min = parsed;
            }
        }

        return min;
    }

    public int major() {
        return major;
    }

    public int minor() {
        return minor;
    }

    public int patch() {
        return patch;
    }

    /**
     * @return  The pre-release qualifier or an empty string
     */
    public String pre() {
        return pre;
    }

    /**
     * @return  True if this is a pre-release (snapshot) build
     */
    public boolean isPreRelease() {
        return !pre.isEmpty();
    }

    public boolean gte(Version other) {
        return compareTo(other) >= 0;
    }

    public boolean gt(Version other) {
        return compareTo(other) > 0;
    }

    public boolean lte(Version other) {
        return compareTo(other) <= 0;
    }

    public boolean lt(Version other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Version other) {
        int result = Integer.compare(major, other.major);
        if (result != 0) {
            return result;
        }

        result = Integer.compare(minor, other.minor);
        if (result != 0) {
            return result;
        }

        result = Integer.compare(patch, other.patch);
        if (result != 0) {
            return result;
        }

        return comparePre(pre, other.pre);
    }

    // release > pre-release; pre-releases compare identifier by identifier
    private static int comparePre(String pre, String otherPre) {
        if (pre.equals(otherPre)) {
            return 0;
        } else if (pre.isEmpty()) {
            return 1;
        } else if (otherPre.isEmpty()) {
            return -1;
        }

        String[] identifiers = pre.split("\\.");
        String[] otherIdentifiers = otherPre.split("\\.");

        for (int i = 0; i < Math.min(identifiers.length, otherIdentifiers.length); i++) {
            int result = compareIdentifier(identifiers[i], otherIdentifiers[i]);
            if (result != 0) {
                return result;
            }
        }

        return Integer.compare(identifiers.length, otherIdentifiers.length);
    }

    private static int compareIdentifier(String identifier, String other) {
        boolean numeric = NUMERIC.matcher(identifier).matches();
        boolean otherNumeric = NUMERIC.matcher(other).matches();

        if (numeric && otherNumeric) {
            return new BigInteger(identifier).compareTo(new BigInteger(other));
        } else if (numeric) {
            return -1;
        } else if (otherNumeric) {
            return 1;
        } else {
            return identifier.compareTo(other);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        }

        Version version = (Version) o;
        return major == version.major
                && minor == version.minor
                && patch == version.patch
                && pre.equals(version.pre);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, pre);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append(major).append('.').append(minor).append('.').append(patch);

        if (!pre.isEmpty()) {
            sb.append('-').append(pre);
        }

        if (!build.isEmpty()) {
            sb.append('+').append(build);
        }

        return sb.toString();
    }
}
