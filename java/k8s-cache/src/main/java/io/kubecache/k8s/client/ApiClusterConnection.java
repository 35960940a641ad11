package io.kubecache.k8s.client;

import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import com.google.common.base.Strings;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.kubecache.errors.ClusterUnavailableException;
import io.kubecache.errors.MissingResourceException;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.K8sObjectMeta;
import io.kubecache.k8s.model.PropagationPolicy;
import io.kubecache.k8s.model.WatchEvent;
import io.kubernetes.client.custom.V1Patch;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.util.Watch;
import io.kubernetes.client.util.Watchable;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesApi;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesListObject;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesObject;
import io.kubernetes.client.util.generic.options.CreateOptions;
import io.kubernetes.client.util.generic.options.DeleteOptions;
import io.kubernetes.client.util.generic.options.ListOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClusterConnection} to a live cluster, based on the dynamic (GVK parameterised) client-java API.
 * <p>
 * Ordinary calls and watches use separate {@link ApiClient}s, as watches need a much longer read timeout.
 */
public class ApiClusterConnection implements ClusterConnection {
    private static final Logger logger = LoggerFactory.getLogger(ApiClusterConnection.class);

    private static final int HTTP_NOT_FOUND = 404;

    private final ClusterId clusterId;
    private final ApiClient apiClient;
    private final ApiClient watchApiClient;
    private final K8sClientOptions options;

    private final Map<GVK, DynamicKubernetesApi> apis = new ConcurrentHashMap<>();
    private final Map<GVK, DynamicKubernetesApi> watchApis = new ConcurrentHashMap<>();

    public ApiClusterConnection(final ClusterId clusterId,
                                final ApiClient apiClient,
                                final ApiClient watchApiClient,
                                final K8sClientOptions options) {
        this.clusterId = clusterId;
        this.options = options;

        final int requestTimeoutMillis = toMillis(options.requestTimeout);

        this.apiClient = apiClient
                .setConnectTimeout(requestTimeoutMillis)
                .setReadTimeout(requestTimeoutMillis)
                .setWriteTimeout(requestTimeoutMillis);

        this.watchApiClient = watchApiClient
                .setConnectTimeout(requestTimeoutMillis)
                .setReadTimeout(toMillis(options.watchReadTimeout))
                .setWriteTimeout(requestTimeoutMillis);
    }

    private static int toMillis(final Duration duration) {
        return Math.toIntExact(duration.toMillis());
    }

    @Override
    public ClusterId clusterId() {
        return clusterId;
    }

    private DynamicKubernetesApi api(final GVK gvk) {
        return apis.computeIfAbsent(gvk, key -> new DynamicKubernetesApi(key.apiGroup(), key.version, key.plural(), apiClient));
    }

    private DynamicKubernetesApi watchApi(final GVK gvk) {
        return watchApis.computeIfAbsent(gvk, key -> new DynamicKubernetesApi(key.apiGroup(), key.version, key.plural(), watchApiClient));
    }

    // the generic API reports I/O failures as IllegalStateException
    private <T> T execute(final Supplier<T> call) {
        try {
            return call.get();

        } catch (final IllegalStateException e) {
            if (e.getCause() instanceof IOException) {
                throw new ClusterUnavailableException(String.format("Cluster %s is unreachable.", clusterId), e.getCause());
            }

            throw e;
        }
    }

    @Override
    public Iterable<K8sObject> list(final K8sObjectFilter filter, final boolean raiseOnError) throws ApiException {
        if (filter.gvk == null) {
            throw new IllegalArgumentException("Listing objects requires a kind.");
        }

        final DynamicKubernetesApi api = api(filter.gvk);

        class DynamicObjectPage implements ResourceListIterable.Page<DynamicKubernetesObject> {
            private final DynamicKubernetesListObject list;

            private DynamicObjectPage(@Nullable final String continueToken) throws ApiException {
                final ListOptions listOptions = new ListOptions();
                listOptions.setLimit(options.pageSize);
                listOptions.setContinue(continueToken);
                listOptions.setLabelSelector(LabelSelectors.equalitySelector(filter.labelSelector));

                if (filter.name != null) {
                    listOptions.setFieldSelector("metadata.name=" + filter.name);
                }

                list = execute(() -> filter.namespace == null ? api.list(listOptions) : api.list(filter.namespace, listOptions))
                        .throwsApiException()
                        .getObject();
            }

            @Override
            public Collection<DynamicKubernetesObject> items() {
                return list.getItems();
            }

            @Override
            public DynamicObjectPage nextPage() throws ApiException {
                final String continueToken = list.getMetadata() == null ? null : list.getMetadata().getContinue();

                if (Strings.isNullOrEmpty(continueToken))
                    return null;

                return new DynamicObjectPage(continueToken);
            }
        }

        final Iterable<DynamicKubernetesObject> items = new ResourceListIterable<>(new DynamicObjectPage(null));

        return FluentIterable.from(items)
                .transform(item -> toObject(item, raiseOnError))
                .filter(Objects::nonNull);
    }

    @Nullable
    private K8sObject toObject(final DynamicKubernetesObject item, final boolean raiseOnError) {
        try {
            return K8sObject.fromManifest(clusterId, item.getRaw());

        } catch (final RuntimeException e) {
            if (raiseOnError) {
                throw e;
            }

            logger.warn("Skipping malformed object in cluster {}: {}", clusterId, e.getMessage());
            return null;
        }
    }

    @Override
    public Optional<K8sObject> get(final K8sObjectMeta meta) throws ApiException {
        final DynamicKubernetesApi api = api(meta.gvk);

        final KubernetesApiResponse<DynamicKubernetesObject> response = execute(() ->
                meta.namespace == null ? api.get(meta.name) : api.get(meta.namespace, meta.name));

        if (response.getHttpStatusCode() == HTTP_NOT_FOUND) {
            return Optional.empty();
        }

        return Optional.of(K8sObject.fromManifest(clusterId, response.throwsApiException().getObject().getRaw()));
    }

    @Override
    public K8sObject create(final K8sObject object) throws ApiException {
        final DynamicKubernetesApi api = api(object.meta.gvk);
        final DynamicKubernetesObject body = new DynamicKubernetesObject(object.manifest());

        final KubernetesApiResponse<DynamicKubernetesObject> response = execute(() ->
                object.meta.namespace == null
                        ? api.create(body, new CreateOptions())
                        : api.create(object.meta.namespace, body, new CreateOptions()));

        return K8sObject.fromManifest(clusterId, response.throwsApiException().getObject().getRaw());
    }

    @Override
    public K8sObject patch(final K8sObjectMeta meta, final JsonElement patch) throws ApiException {
        final DynamicKubernetesApi api = api(meta.gvk);

        final String patchType = patch.isJsonArray() ? V1Patch.PATCH_FORMAT_JSON_PATCH : V1Patch.PATCH_FORMAT_JSON_MERGE_PATCH;
        final V1Patch body = new V1Patch(patch.toString());

        final KubernetesApiResponse<DynamicKubernetesObject> response = execute(() ->
                meta.namespace == null
                        ? api.patch(meta.name, patchType, body)
                        : api.patch(meta.namespace, meta.name, patchType, body));

        if (response.getHttpStatusCode() == HTTP_NOT_FOUND) {
            throw new MissingResourceException(String.format("Cannot patch %s, it does not exist.", meta));
        }

        return K8sObject.fromManifest(clusterId, response.throwsApiException().getObject().getRaw());
    }

    @Override
    public void delete(final K8sObjectMeta meta, final PropagationPolicy propagationPolicy) throws ApiException {
        final DynamicKubernetesApi api = api(meta.gvk);

        final DeleteOptions deleteOptions = new DeleteOptions();
        deleteOptions.setPropagationPolicy(propagationPolicy.wireValue);

        final KubernetesApiResponse<DynamicKubernetesObject> response = execute(() ->
                meta.namespace == null
                        ? api.delete(meta.name, deleteOptions)
                        : api.delete(meta.namespace, meta.name, deleteOptions));

        if (response.getHttpStatusCode() == HTTP_NOT_FOUND) {
            logger.debug("{} was already gone.", meta);
            return;
        }

        response.throwsApiException();
    }

    @Override
    public WatchStream watch(final GVK gvk, @Nullable final String namespace) throws ApiException {
        final DynamicKubernetesApi api = watchApi(gvk);

        final ListOptions listOptions = new ListOptions();
        listOptions.setTimeoutSeconds(Math.toIntExact(options.watchServerTimeout.getSeconds()));

        final Watchable<DynamicKubernetesObject> watchable;

        try {
            watchable = namespace == null ? api.watch(listOptions) : api.watch(namespace, listOptions);

        } catch (final ApiException e) {
            if (e.getCause() instanceof IOException) {
                throw new ClusterUnavailableException(String.format("Cluster %s is unreachable.", clusterId), e.getCause());
            }

            throw e;
        }

        return new ApiWatchStream(watchable);
    }

    private class ApiWatchStream implements WatchStream {
        private final Watchable<DynamicKubernetesObject> watchable;

        private ApiWatchStream(final Watchable<DynamicKubernetesObject> watchable) {
            this.watchable = watchable;
        }

        @Override
        public Iterator<WatchEvent> iterator() {
            return new AbstractIterator<WatchEvent>() {
                @Override
                protected WatchEvent computeNext() {
                    while (watchable.hasNext()) {
                        final Watch.Response<DynamicKubernetesObject> response = watchable.next();

                        switch (response.type) {
                            case "ADDED":
                            case "MODIFIED":
                            case "DELETED":
                                final JsonObject manifest = response.object.getRaw();
                                return new WatchEvent(EventType.valueOf(response.type), K8sObject.fromManifest(clusterId, manifest));

                            case "ERROR":
                                logger.warn("Watch of cluster {} reported an error: {}.", clusterId, response.status);
                                return endOfData();

                            default:
                                // BOOKMARK
                                logger.trace("Ignoring {} watch event.", response.type);
                        }
                    }

                    return endOfData();
                }
            };
        }

        @Override
        public void close() {
            try {
                watchable.close();

            } catch (final IOException e) {
                logger.debug("Failed to close watch of cluster {}.", clusterId, e);
            }
        }
    }
}
