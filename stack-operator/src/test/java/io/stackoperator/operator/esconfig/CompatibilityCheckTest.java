/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esconfig;

import io.stackoperator.api.model.esconfig.ElasticsearchConfig;
import io.stackoperator.operator.ResourceUtils;
import io.stackoperator.operator.version.MalformedVersionException;
import io.stackoperator.operator.version.Version;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CompatibilityCheckTest {
    private static final CompatibilityCheck CHECK = new CompatibilityCheck(Version.parse("1.2.0"));

    private static ElasticsearchConfig reconciledBy(String controllerVersion) {
        return ResourceUtils.withControllerVersion(ResourceUtils.elasticsearchConfig("ns", "my-config", "my-cluster"), controllerVersion);
    }

    @Test
    public void testNeverReconciledIsCompatible() {
        assertThat(CHECK.isCompatible(ResourceUtils.elasticsearchConfig("ns", "my-config", "my-cluster")), is(true));
        assertThat(CHECK.isCompatible(reconciledBy(null)), is(true));
        assertThat(CHECK.isCompatible(reconciledBy("")), is(true));
    }

    @Test
    public void testSameVersionIsCompatible() {
        assertThat(CHECK.isCompatible(reconciledBy("1.2.0")), is(true));
    }

    @Test
    public void testOlderControllerIsCompatible() {
        assertThat(CHECK.isCompatible(reconciledBy("1.0.0")), is(true));
        assertThat(CHECK.isCompatible(reconciledBy("1.1.5")), is(true));
        assertThat(CHECK.isCompatible(reconciledBy("1.0.0-beta1")), is(true));
    }

    @Test
    public void testNewerControllerIsNotCompatible() {
        assertThat(CHECK.isCompatible(reconciledBy("1.3.0")), is(false));
        assertThat(CHECK.isCompatible(reconciledBy("2.0.0")), is(false));
    }

    @Test
    public void testTooOldControllerIsNotCompatible() {
        assertThat(CHECK.isCompatible(reconciledBy("0.9.0")), is(false));
        assertThat(CHECK.isCompatible(reconciledBy("1.0.0-alpha2")), is(false));
    }

    @Test
    public void testNextMajorControllerAcceptsPreviousMajor() {
        CompatibilityCheck check = new CompatibilityCheck(Version.parse("2.0.0"));

        assertThat(check.isCompatible(reconciledBy("1.9.0")), is(true));
        assertThat(check.isCompatible(reconciledBy("1.0.0-beta1")), is(true));
    }

    @Test
    public void testSnapshotControllerAcceptsItsOwnVersion() {
        CompatibilityCheck check = new CompatibilityCheck(Version.parse("1.0.0-SNAPSHOT"));

        assertThat(check.isCompatible(reconciledBy("1.0.0-SNAPSHOT")), is(true));
        assertThat(check.isCompatible(reconciledBy("0.9.0")), is(false));
        assertThat(check.isCompatible(reconciledBy("1.0.0-alpha2")), is(false));
        assertThat(check.isCompatible(reconciledBy("1.0.0")), is(false));
    }

    @Test
    public void testSnapshotOfMinimalVersionIsCompatible() {
        assertThat(CHECK.isCompatible(reconciledBy("1.0.0-SNAPSHOT")), is(true));
        assertThat(CHECK.isCompatible(reconciledBy("1.1.0-SNAPSHOT")), is(true));
        assertThat(CHECK.isCompatible(reconciledBy("0.9.0-SNAPSHOT")), is(false));
    }

    @Test
    public void testMalformedVersionFails() {
        assertThrows(MalformedVersionException.class, () -> CHECK.isCompatible(reconciledBy("one.two")));
    }
}
