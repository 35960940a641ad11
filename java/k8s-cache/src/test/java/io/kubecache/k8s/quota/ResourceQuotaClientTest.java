package io.kubecache.k8s.quota;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;

import javax.validation.ValidationException;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import io.kubecache.k8s.K8sTestObjects;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.Manifests;
import org.testng.annotations.Test;

public class ResourceQuotaClientTest {
    private static final ClusterId CLUSTER = ClusterId.of("cluster-a");

    private static K8sObject resourceQuota(final Map<String, String> hard, final Map<String, String> annotations) {
        final JsonObject manifest = K8sTestObjects.manifest(ResourceQuotaClient.RESOURCE_QUOTA, "default", "quota", ImmutableMap.of());
        Manifests.getOrCreateObject(manifest, "spec").add("hard", Manifests.toJsonObject(hard));
        Manifests.getOrCreateObject(manifest, "metadata").add("annotations", Manifests.toJsonObject(annotations));

        return K8sObject.fromManifest(CLUSTER, manifest);
    }

    @Test
    public void testHardLimits() {
        assertEquals(ResourceQuotaClient.hardLimits(new Quota("q", 2.0, 4, 0, GpuKind.NVIDIA)),
                     ImmutableMap.of("requests.cpu", "2.0", "requests.memory", "4000000000"));

        assertEquals(ResourceQuotaClient.hardLimits(new Quota("q", 0.25, 16, 2, GpuKind.AMD)),
                     ImmutableMap.of("requests.cpu", "0.25", "requests.memory", "16000000000", "requests.amd.com/gpu", "2"));
    }

    @Test
    public void testQuantitiesWithSuffixes() {
        final Quota quota = ResourceQuotaClient.toQuota(resourceQuota(
                ImmutableMap.of("requests.cpu", "500m", "requests.memory", "4G", "requests.nvidia.com/gpu", "1"),
                ImmutableMap.of()));

        assertEquals(quota, new Quota("quota", 0.5, 4, 1, GpuKind.NVIDIA));
    }

    @Test
    public void testMemoryIsRoundedToWholeGigabytes() {
        assertEquals(ResourceQuotaClient.toQuota(resourceQuota(ImmutableMap.of("requests.cpu", "1", "requests.memory", "1500M"), ImmutableMap.of())).memory, 2);
        assertEquals(ResourceQuotaClient.toQuota(resourceQuota(ImmutableMap.of("requests.cpu", "1", "requests.memory", "2500M"), ImmutableMap.of())).memory, 2);
        assertEquals(ResourceQuotaClient.toQuota(resourceQuota(ImmutableMap.of("requests.cpu", "1", "requests.memory", "2600M"), ImmutableMap.of())).memory, 3);
    }

    @Test
    public void testGpuKindFallsBackToAnnotationThenNvidia() {
        final Map<String, String> hard = ImmutableMap.of("requests.cpu", "1", "requests.memory", "1000000000");

        assertEquals(ResourceQuotaClient.toQuota(resourceQuota(hard, ImmutableMap.of("kubecache.io/gpu-kind", "amd.com"))).gpuKind, GpuKind.AMD);
        assertEquals(ResourceQuotaClient.toQuota(resourceQuota(hard, ImmutableMap.of("kubecache.io/gpu-kind", "unknown.com"))).gpuKind, GpuKind.NVIDIA);
        assertEquals(ResourceQuotaClient.toQuota(resourceQuota(hard, ImmutableMap.of())).gpuKind, GpuKind.NVIDIA);
    }

    @Test
    public void testMissingOrInvalidLimitsAreInvalid() {
        assertThrows(ValidationException.class, () -> ResourceQuotaClient.toQuota(resourceQuota(ImmutableMap.of("requests.memory", "1G"), ImmutableMap.of())));
        assertThrows(ValidationException.class, () -> ResourceQuotaClient.toQuota(resourceQuota(ImmutableMap.of("requests.cpu", "1"), ImmutableMap.of())));
        assertThrows(ValidationException.class, () -> ResourceQuotaClient.toQuota(resourceQuota(ImmutableMap.of("requests.cpu", "lots", "requests.memory", "1G"), ImmutableMap.of())));
    }

    @Test
    public void testFractionalOrOversizedCountsAreInvalid() {
        assertThrows(ValidationException.class, () -> ResourceQuotaClient.toQuota(resourceQuota(
                ImmutableMap.of("requests.cpu", "1", "requests.memory", "1G", "requests.nvidia.com/gpu", "500m"), ImmutableMap.of())));
        assertThrows(ValidationException.class, () -> ResourceQuotaClient.toQuota(resourceQuota(
                ImmutableMap.of("requests.cpu", "1", "requests.memory", "1G", "requests.amd.com/gpu", "3000000000"), ImmutableMap.of())));
        assertThrows(ValidationException.class, () -> ResourceQuotaClient.toQuota(resourceQuota(
                ImmutableMap.of("requests.cpu", "1", "requests.memory", "5E"), ImmutableMap.of())));
    }
}
