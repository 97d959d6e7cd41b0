/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.version;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Computes versions from the version labels of running Pods and declared StatefulSets
 */
public class Versions {
    private Versions() {
    }

    /**
     * Finds the lowest version in the version label of the given Pods. Pods without the label are ignored.
     *
     * @param pods          Pods
     * @param labelName     Name of the version label
     *
     * @return  The lowest version or null when no Pod has the label
     *
     * @throws MalformedVersionException when any of the labels cannot be parsed
     */
    public static Version minInPods(List<Pod> pods, String labelName) {
        return minInLabels(pods, HasMetadata::getMetadata, labelName);
    }

    /**
     * Finds the lowest version in the version label of the Pod templates of the given StatefulSets. StatefulSets
     * without the label are ignored.
     *
     * @param statefulSets  StatefulSets
     * @param labelName     Name of the version label
     *
     * @return  The lowest version or null when no StatefulSet has the label
     *
     * @throws MalformedVersionException when any of the labels cannot be parsed
     */
    public static Version minInStatefulSets(List<StatefulSet> statefulSets, String labelName) {
        return minInLabels(statefulSets, sts -> sts.getSpec() != null && sts.getSpec().getTemplate() != null
                ? sts.getSpec().getTemplate().getMetadata() : null, labelName);
    }

    private static <T> Version minInLabels(List<T> resources, Function<T, ObjectMeta> metadata, String labelName) {
        List<String> versions = new ArrayList<>();

        for (T resource : resources) {
            ObjectMeta meta = metadata.apply(resource);
            Map<String, String> labels = meta != null ? meta.getLabels() : null;

            if (labels != null && labels.containsKey(labelName)) {
                versions.add(labels.get(labelName));
            }
        }

        return Version.min(versions);
    }
}
