/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.version;

/**
 * Rules for moving from one version to another
 */
public class UpgradePath {
    private UpgradePath() {
    }

    /**
     * Checks whether an upgrade between two versions is valid. The major version can stay the same or increase by
     * one, and the target version has to be strictly higher than the source version.
     *
     * @param from  Source version
     * @param to    Target version
     *
     * @return  True if the upgrade is valid
     *
     * @throws MalformedVersionException when any of the versions cannot be parsed
     */
    public static boolean isValidUpgrade(String from, String to) {
        return isValidUpgrade(Version.parse(from), Version.parse(to));
    }

    /**
     * Checks whether an upgrade between two versions is valid.
     *
     * @param from  Source version
     * @param to    Target version
     *
     * @return  True if the upgrade is valid
     */
    public static boolean isValidUpgrade(Version from, Version to) {
        boolean validMajor = to.major() == from.major() || to.major() == from.major() + 1;
        return validMajor && !from.gte(to);
    }

    /**
     * @param version   Version to check
     *
     * @return  True if the version is a snapshot (pre-release) build
     */
    public static boolean isSnapshotVersion(Version version) {
        return version.isPreRelease();
    }
}
