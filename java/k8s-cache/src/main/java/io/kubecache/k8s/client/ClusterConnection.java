package io.kubecache.k8s.client;

import javax.annotation.Nullable;
import java.util.Optional;

import com.google.gson.JsonElement;
import io.kubecache.errors.ClusterUnavailableException;
import io.kubecache.errors.MissingResourceException;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.K8sObjectMeta;
import io.kubecache.k8s.model.PropagationPolicy;
import io.kubernetes.client.openapi.ApiException;

/**
 * Verbs against the API of a single cluster, for any kind.
 * <p>
 * Every method may throw {@link ClusterUnavailableException} when the endpoint can't be reached.
 * Objects returned carry the id of this cluster but no user id.
 */
public interface ClusterConnection {

    ClusterId clusterId();

    default Iterable<K8sObject> list(final K8sObjectFilter filter) throws ApiException {
        return list(filter, false);
    }

    /**
     * Lists the objects matching the kind, namespace, name and labels of {@code filter}. The user id of the filter is ignored.
     * <p>
     * Pages are fetched lazily while iterating. Failures fetching later pages surface as {@link UncheckedApiException}.
     *
     * @param raiseOnError fail on items that can't be read as objects, instead of skipping them
     */
    Iterable<K8sObject> list(K8sObjectFilter filter, boolean raiseOnError) throws ApiException;

    Optional<K8sObject> get(K8sObjectMeta meta) throws ApiException;

    /**
     * @param namespace the namespace to watch, or {@code null} for cluster-scoped kinds
     */
    WatchStream watch(GVK gvk, @Nullable String namespace) throws ApiException;

    /**
     * @throws ApiException with code 409 if the object already exists
     */
    K8sObject create(K8sObject object) throws ApiException;

    /**
     * Patches the object. A JSON array is applied as a JSON patch, a JSON object as a merge patch.
     *
     * @throws MissingResourceException if the object doesn't exist
     */
    K8sObject patch(K8sObjectMeta meta, JsonElement patch) throws ApiException;

    /**
     * Deletes the object. Deleting an object that doesn't exist does nothing.
     */
    void delete(K8sObjectMeta meta, PropagationPolicy propagationPolicy) throws ApiException;
}
