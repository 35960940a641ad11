package io.kubecache.k8s.quota;

import javax.validation.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.kubecache.k8s.client.Cluster;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.K8sObjectMeta;
import io.kubecache.k8s.model.Manifests;
import io.kubecache.k8s.watch.TrackedKinds;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.ApiException;

/**
 * ResourceQuota objects in the namespace of one cluster, and their translation to and from {@link Quota}.
 */
public class ResourceQuotaClient {
    public static final GVK RESOURCE_QUOTA = TrackedKinds.RESOURCE_QUOTA;

    static final String CPU_KEY = "requests.cpu";
    static final String MEMORY_KEY = "requests.memory";
    static final String GPU_KIND_ANNOTATION = "kubecache.io/gpu-kind";

    private static final BigDecimal BYTES_PER_GB = BigDecimal.TEN.pow(9);

    private final Cluster cluster;

    public ResourceQuotaClient(final Cluster cluster) {
        this.cluster = cluster;
    }

    public K8sObjectMeta meta(final String name) {
        return new K8sObjectMeta(name, cluster.namespace, cluster.id, RESOURCE_QUOTA);
    }

    public Optional<K8sObject> get(final String name) throws ApiException {
        return cluster.connection.get(meta(name));
    }

    public Iterable<K8sObject> list(final Map<String, String> labelSelector) throws ApiException {
        return cluster.connection.list(K8sObjectFilter.builder(RESOURCE_QUOTA)
                                               .cluster(cluster.id)
                                               .namespace(cluster.namespace)
                                               .labels(labelSelector)
                                               .build(), true);
    }

    public K8sObject create(final JsonObject manifest) throws ApiException {
        Manifests.getOrCreateObject(manifest, "metadata").addProperty("namespace", cluster.namespace);

        return cluster.connection.create(K8sObject.fromManifest(cluster.id, manifest));
    }

    public K8sObject patch(final String name, final JsonElement patch) throws ApiException {
        return cluster.connection.patch(meta(name), patch);
    }

    /**
     * Hard limits for the quota: CPU in cores, memory in bytes, and the GPU limit only if GPUs are granted.
     */
    public static ImmutableMap<String, String> hardLimits(final Quota quota) {
        final ImmutableMap.Builder<String, String> hard = ImmutableMap.<String, String>builder()
                .put(CPU_KEY, BigDecimal.valueOf(quota.cpu).toPlainString())
                .put(MEMORY_KEY, BigDecimal.valueOf(quota.memory).multiply(BYTES_PER_GB).toPlainString());

        if (quota.gpu > 0) {
            hard.put(quota.gpuKind.hardLimitKey(), Integer.toString(quota.gpu));
        }

        return hard.build();
    }

    /**
     * Reads a quota back from a ResourceQuota manifest.
     *
     * @throws ValidationException if the CPU or memory limit is missing, i.e. the object wasn't created as a quota
     */
    public static Quota toQuota(final K8sObject resourceQuota) {
        final JsonObject manifest = resourceQuota.manifest();
        final Map<String, String> hard = Manifests.stringMap(manifest, "spec", "hard");

        final String cpu = hard.get(CPU_KEY);
        if (cpu == null) {
            throw new ValidationException(String.format("ResourceQuota %s has no hard %s limit.", resourceQuota.meta.name, CPU_KEY));
        }

        final String memory = hard.get(MEMORY_KEY);
        if (memory == null) {
            throw new ValidationException(String.format("ResourceQuota %s has no hard %s limit.", resourceQuota.meta.name, MEMORY_KEY));
        }

        GpuKind gpuKind = Optional.ofNullable(resourceQuota.annotations().get(GPU_KIND_ANNOTATION))
                .flatMap(GpuKind::fromDomain)
                .orElse(GpuKind.NVIDIA);
        int gpu = 0;

        for (final GpuKind kind : GpuKind.values()) {
            final String value = hard.get(kind.hardLimitKey());

            if (value != null) {
                gpu = toInt(parseQuantity(value, kind.hardLimitKey()), value, kind.hardLimitKey());
                gpuKind = kind;
                break;
            }
        }

        final BigDecimal memoryBytes = parseQuantity(memory, MEMORY_KEY);

        return new Quota(resourceQuota.meta.name,
                         parseQuantity(cpu, CPU_KEY).doubleValue(),
                         toInt(memoryBytes.divide(BYTES_PER_GB, 0, RoundingMode.HALF_EVEN), memory, MEMORY_KEY),
                         gpu,
                         gpuKind);
    }

    private static BigDecimal parseQuantity(final String value, final String key) {
        try {
            return Quantity.fromString(value).getNumber();

        } catch (final RuntimeException e) {
            throw new ValidationException(String.format("Invalid quantity %s for %s.", value, key), e);
        }
    }

    private static int toInt(final BigDecimal number, final String value, final String key) {
        try {
            return number.intValueExact();

        } catch (final ArithmeticException e) {
            throw new ValidationException(String.format("Quantity %s for %s is not a whole number in range.", value, key), e);
        }
    }
}
