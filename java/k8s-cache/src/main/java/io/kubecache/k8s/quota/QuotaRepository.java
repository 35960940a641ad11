package io.kubecache.k8s.quota;

import javax.inject.Inject;
import javax.inject.Singleton;
import javax.validation.ValidationException;
import java.net.HttpURLConnection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.kubecache.errors.ConflictException;
import io.kubecache.errors.MissingResourceException;
import io.kubecache.k8s.client.Cluster;
import io.kubecache.k8s.client.ClusterRegistry;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.Manifests;
import io.kubecache.k8s.model.PropagationPolicy;
import io.kubecache.slf4j.MDC;
import io.kubernetes.client.openapi.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quotas stored as a PriorityClass plus a ResourceQuota of the same name, scoped to that priority class.
 * <p>
 * The ResourceQuota is owned by the PriorityClass, so deleting the PriorityClass in the foreground removes both.
 */
@Singleton
public class QuotaRepository {
    private static final Logger logger = LoggerFactory.getLogger(QuotaRepository.class);

    public static final String APP_LABEL = "app";
    public static final String APP_LABEL_VALUE = "kubecache";

    static final int PRIORITY_CLASS_VALUE = 100;
    static final String PRIORITY_CLASS_DESCRIPTION = "Priority class of workloads limited by a kubecache resource quota";

    private static final ImmutableMap<String, String> LABELS = ImmutableMap.of(APP_LABEL, APP_LABEL_VALUE);

    private final ClusterRegistry clusters;

    @Inject
    public QuotaRepository(final ClusterRegistry clusters) {
        this.clusters = clusters;
    }

    /**
     * Creates the quota, generating an id if it has none. An existing PriorityClass of the same name is reused.
     *
     * @return the quota with its id
     * @throws ConflictException if a ResourceQuota of that name already exists with different limits
     */
    public Quota createQuota(final Quota quota, final ClusterId clusterId) throws ApiException {
        final Cluster cluster = clusters.get(clusterId);
        final Quota withId = quota.id == null ? quota.withId(UUID.randomUUID().toString()) : quota;

        try (@SuppressWarnings("unused") final MDC.MDCCloseable _quotaMDC = MDC.put("Cluster", clusterId.toString()).andPut("Object", withId.id)) {
            final K8sObject priorityClass = getOrCreatePriorityClass(new PriorityClassClient(cluster), withId.id);

            final JsonObject manifest = resourceQuotaManifest(withId, priorityClass);

            final ResourceQuotaClient client = new ResourceQuotaClient(cluster);

            final K8sObject created;
            try {
                created = client.create(manifest);

            } catch (final ApiException e) {
                if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
                    throw e;
                }

                // a retried create finds its own quota
                final Optional<Quota> existing = client.get(withId.id).map(ResourceQuotaClient::toQuota);
                if (existing.isPresent() && existing.get().sameLimits(withId)) {
                    logger.info("Quota {} already exists with the same limits.", withId.id);
                    return existing.get();
                }

                throw new ConflictException(String.format("ResourceQuota %s already exists in cluster %s.", withId.id, clusterId), e);
            }

            logger.info("Created quota {}.", withId);

            return ResourceQuotaClient.toQuota(created);
        }
    }

    /**
     * Replaces the limits of an existing quota.
     *
     * @throws ValidationException if the quota has no id
     * @throws MissingResourceException if there is no ResourceQuota with the id of the quota
     */
    public Quota updateQuota(final Quota quota, final ClusterId clusterId) throws ApiException {
        if (quota.id == null) {
            throw new ValidationException("A quota must have an id to be updated.");
        }

        final ResourceQuotaClient client = new ResourceQuotaClient(clusters.get(clusterId));

        final K8sObject existing = client.get(quota.id)
                .orElseThrow(() -> new MissingResourceException(String.format("Quota %s doesn't exist in cluster %s.", quota.id, clusterId)));

        final JsonArray patch = new JsonArray();
        patch.add(addOperation("/spec/hard", Manifests.toJsonObject(ResourceQuotaClient.hardLimits(quota))));
        patch.add(addOperation("/spec/scopeSelector", scopeSelector(quota.id)));

        if (Manifests.getObject(existing.manifest(), "metadata", "annotations").isPresent()) {
            patch.add(addOperation("/metadata/annotations/" + escapePointer(ResourceQuotaClient.GPU_KIND_ANNOTATION), new JsonPrimitive(quota.gpuKind.domain)));

        } else {
            patch.add(addOperation("/metadata/annotations", Manifests.toJsonObject(gpuKindAnnotation(quota))));
        }

        final Quota updated = ResourceQuotaClient.toQuota(client.patch(quota.id, patch));

        logger.info("Updated quota {}.", updated);

        return updated;
    }

    /**
     * Deletes the PriorityClass of the quota in the foreground, which also removes the ResourceQuota it owns.
     * Deleting a quota that doesn't exist does nothing.
     */
    public void deleteQuota(final String name, final ClusterId clusterId) throws ApiException {
        new PriorityClassClient(clusters.get(clusterId)).delete(name, PropagationPolicy.FOREGROUND);

        logger.info("Deleted quota {} in cluster {}.", name, clusterId);
    }

    public Optional<Quota> getQuota(final String name, final ClusterId clusterId) throws ApiException {
        return new ResourceQuotaClient(clusters.get(clusterId)).get(name)
                .map(ResourceQuotaClient::toQuota);
    }

    /**
     * All quotas managed by this repository in the namespace of the cluster.
     */
    public ImmutableList<Quota> getQuotas(final ClusterId clusterId) throws ApiException {
        final ImmutableList.Builder<Quota> quotas = ImmutableList.builder();

        for (final K8sObject resourceQuota : new ResourceQuotaClient(clusters.get(clusterId)).list(LABELS)) {
            quotas.add(ResourceQuotaClient.toQuota(resourceQuota));
        }

        return quotas.build();
    }

    private K8sObject getOrCreatePriorityClass(final PriorityClassClient client, final String name) throws ApiException {
        final Optional<K8sObject> existing = client.get(name);
        if (existing.isPresent()) {
            logger.debug("Reusing existing PriorityClass {}.", name);
            return existing.get();
        }

        try {
            return client.create(priorityClassManifest(name));

        } catch (final ApiException e) {
            // created concurrently
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                return client.get(name).orElseThrow(() -> e);
            }
            throw e;
        }
    }

    static JsonObject priorityClassManifest(final String name) {
        final JsonObject manifest = new JsonObject();
        manifest.addProperty("apiVersion", PriorityClassClient.PRIORITY_CLASS.groupVersion());
        manifest.addProperty("kind", PriorityClassClient.PRIORITY_CLASS.kind);

        final JsonObject metadata = new JsonObject();
        metadata.addProperty("name", name);
        metadata.add("labels", Manifests.toJsonObject(LABELS));
        manifest.add("metadata", metadata);

        manifest.addProperty("value", PRIORITY_CLASS_VALUE);
        manifest.addProperty("globalDefault", false);
        manifest.addProperty("preemptionPolicy", "Never");
        manifest.addProperty("description", PRIORITY_CLASS_DESCRIPTION);

        return manifest;
    }

    static JsonObject resourceQuotaManifest(final Quota quota, final K8sObject priorityClass) {
        final JsonObject manifest = new JsonObject();
        manifest.addProperty("apiVersion", ResourceQuotaClient.RESOURCE_QUOTA.groupVersion());
        manifest.addProperty("kind", ResourceQuotaClient.RESOURCE_QUOTA.kind);

        final JsonObject metadata = new JsonObject();
        metadata.addProperty("name", quota.id);
        metadata.add("labels", Manifests.toJsonObject(LABELS));
        metadata.add("annotations", Manifests.toJsonObject(gpuKindAnnotation(quota)));

        final JsonObject ownerReference = new JsonObject();
        ownerReference.addProperty("apiVersion", priorityClass.meta.gvk.groupVersion());
        ownerReference.addProperty("kind", priorityClass.meta.gvk.kind);
        ownerReference.addProperty("name", priorityClass.meta.name);
        ownerReference.addProperty("uid", priorityClass.uid());
        ownerReference.addProperty("blockOwnerDeletion", true);
        ownerReference.addProperty("controller", false);

        final JsonArray ownerReferences = new JsonArray();
        ownerReferences.add(ownerReference);
        metadata.add("ownerReferences", ownerReferences);
        manifest.add("metadata", metadata);

        final JsonObject spec = new JsonObject();
        spec.add("hard", Manifests.toJsonObject(ResourceQuotaClient.hardLimits(quota)));
        spec.add("scopeSelector", scopeSelector(quota.id));
        manifest.add("spec", spec);

        return manifest;
    }

    private static JsonObject scopeSelector(final String priorityClassName) {
        final JsonArray values = new JsonArray();
        values.add(priorityClassName);

        final JsonObject expression = new JsonObject();
        expression.addProperty("operator", "In");
        expression.addProperty("scopeName", "PriorityClass");
        expression.add("values", values);

        final JsonArray matchExpressions = new JsonArray();
        matchExpressions.add(expression);

        final JsonObject selector = new JsonObject();
        selector.add("matchExpressions", matchExpressions);
        return selector;
    }

    private static Map<String, String> gpuKindAnnotation(final Quota quota) {
        return ImmutableMap.of(ResourceQuotaClient.GPU_KIND_ANNOTATION, quota.gpuKind.domain);
    }

    private static JsonObject addOperation(final String path, final JsonElement value) {
        final JsonObject operation = new JsonObject();
        operation.addProperty("op", "add");
        operation.addProperty("path", path);
        operation.add("value", value);
        return operation;
    }

    private static String escapePointer(final String token) {
        return token.replace("~", "~0").replace("/", "~1");
    }
}
