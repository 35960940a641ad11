package io.kubecache.k8s.client;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.MoreObjects;

public class ClusterOptions {
    /** Namespace of the default cluster. */
    public String namespace = "default";

    /** Directory of kubeconfig files, one per additional cluster. */
    @Nullable
    public Path kubeConfigDirectory;

    /** When not empty, only in-memory clusters with these ids are used and no live cluster is contacted. */
    public List<String> inMemoryClusters = new ArrayList<>();

    public K8sClientOptions client = new K8sClientOptions();

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("namespace", namespace)
                .add("kubeConfigDirectory", kubeConfigDirectory)
                .add("inMemoryClusters", inMemoryClusters)
                .add("client", client)
                .toString();
    }
}
