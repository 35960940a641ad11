package io.kubecache.k8s.model;

import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Navigation helpers for JSON object manifests.
 */
public final class Manifests {
    private Manifests() {}

    public static Optional<JsonElement> get(final JsonObject root, final String... path) {
        JsonElement current = root;

        for (final String segment : path) {
            if (current == null || !current.isJsonObject()) {
                return Optional.empty();
            }

            current = current.getAsJsonObject().get(segment);
        }

        if (current == null || current.isJsonNull()) {
            return Optional.empty();
        }

        return Optional.of(current);
    }

    public static Optional<JsonObject> getObject(final JsonObject root, final String... path) {
        return get(root, path).filter(JsonElement::isJsonObject).map(JsonElement::getAsJsonObject);
    }

    public static Optional<String> getString(final JsonObject root, final String... path) {
        return get(root, path).filter(JsonElement::isJsonPrimitive).map(JsonElement::getAsString);
    }

    /**
     * Returns the object at {@code path}, creating missing intermediate objects.
     */
    public static JsonObject getOrCreateObject(final JsonObject root, final String... path) {
        JsonObject current = root;

        for (final String segment : path) {
            final JsonElement child = current.get(segment);

            if (child == null || !child.isJsonObject()) {
                final JsonObject created = new JsonObject();
                current.add(segment, created);
                current = created;
            } else {
                current = child.getAsJsonObject();
            }
        }

        return current;
    }

    /**
     * String-valued members of the object at {@code path}, e.g. labels or annotations. Non-string values are skipped.
     */
    public static ImmutableMap<String, String> stringMap(final JsonObject root, final String... path) {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();

        getObject(root, path).ifPresent(object -> {
            for (final Map.Entry<String, JsonElement> entry : object.entrySet()) {
                if (entry.getValue().isJsonPrimitive()) {
                    builder.put(entry.getKey(), entry.getValue().getAsString());
                }
            }
        });

        return builder.build();
    }

    public static JsonObject toJsonObject(final Map<String, String> map) {
        final JsonObject object = new JsonObject();
        map.forEach((key, value) -> object.add(key, new JsonPrimitive(value)));
        return object;
    }
}
