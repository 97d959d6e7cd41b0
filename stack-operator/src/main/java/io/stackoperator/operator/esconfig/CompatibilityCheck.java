/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esconfig;

import io.stackoperator.api.model.esconfig.ElasticsearchConfig;
import io.stackoperator.operator.version.MalformedVersionException;
import io.stackoperator.operator.version.UpgradePath;
import io.stackoperator.operator.version.Version;

/**
 * Decides whether this controller can take over a resource based on the version of the controller which reconciled
 * it last, as recorded in the status of the resource.
 */
public class CompatibilityCheck {
    /**
     * Resources last reconciled by controllers older than this version cannot be taken over
     */
    public static final Version MIN_COMPATIBLE_VERSION = Version.parse("1.0.0-beta1");

    private static final String SNAPSHOT = "SNAPSHOT";

    private final Version controllerVersion;

    /**
     * Constructor
     *
     * @param controllerVersion     Version of this controller
     */
    public CompatibilityCheck(Version controllerVersion) {
        this.controllerVersion = controllerVersion;
    }

    public Version controllerVersion() {
        return controllerVersion;
    }

    /**
     * Checks the compatibility of a resource. A resource without recorded version was never reconciled and is
     * compatible, and so is a resource last reconciled by this very version. Otherwise the recorded version must be
     * at least the minimal compatible version and a valid upgrade to this controller version. Snapshot builds are
     * compared with the minimal compatible version by their release part only.
     *
     * @param esc   The resource
     *
     * @return  True if this controller can reconcile the resource
     *
     * @throws MalformedVersionException when the recorded version cannot be parsed
     */
    public boolean isCompatible(ElasticsearchConfig esc) {
        String recorded = esc.getStatus() != null ? esc.getStatus().getControllerVersion() : null;

        if (recorded == null || recorded.isBlank()) {
            return true;
        }

        Version recordedVersion = Version.parse(recorded);

        if (recordedVersion.equals(controllerVersion)) {
            return true;
        } else if (releaseOfSnapshot(recordedVersion).lt(MIN_COMPATIBLE_VERSION)) {
            return false;
        }

        return UpgradePath.isValidUpgrade(recordedVersion, controllerVersion);
    }

    private static Version releaseOfSnapshot(Version version) {
        if (SNAPSHOT.equalsIgnoreCase(version.pre())) {
            return new Version(version.major(), version.minor(), version.patch());
        }

        return version;
    }
}
