package io.kubecache.k8s.watch;

import com.google.common.collect.ImmutableList;
import io.kubecache.k8s.model.GVK;

public final class TrackedKinds {
    private TrackedKinds() {}

    public static final String USER_ID_LABEL = "kubecache.io/user-id";

    public static final GVK SESSION = new GVK("amalthea.dev", "v1alpha1", "AmaltheaSession");
    public static final GVK BUILD_RUN = new GVK("shipwright.io", "v1beta1", "BuildRun");
    public static final GVK TASK_RUN = new GVK("tekton.dev", "v1", "TaskRun");
    public static final GVK RESOURCE_QUOTA = GVK.core("v1", "ResourceQuota");
    public static final GVK PRIORITY_CLASS = new GVK("scheduling.k8s.io", "v1", "PriorityClass");

    /**
     * Sessions and build runs belong to users, task runs, quotas and priority classes to the system.
     */
    public static ImmutableList<TrackedKind> defaults() {
        return ImmutableList.of(
                TrackedKind.userOwned(SESSION, USER_ID_LABEL),
                TrackedKind.userOwned(BUILD_RUN, USER_ID_LABEL),
                TrackedKind.system(TASK_RUN, true),
                TrackedKind.system(RESOURCE_QUOTA, true),
                TrackedKind.system(PRIORITY_CLASS, false)
        );
    }
}
