package io.kubecache.k8s.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Applies JSON patches (RFC 6902, {@code add}, {@code replace} and {@code remove} operations) and
 * JSON merge patches (RFC 7386) to manifests.
 */
public final class JsonPatches {
    private JsonPatches() {}

    /**
     * @param patch a JSON patch (array of operations) or a merge patch (object)
     * @return the patched copy of {@code target}
     * @throws IllegalArgumentException if the patch can't be applied
     */
    public static JsonObject apply(final JsonObject target, final JsonElement patch) {
        if (patch.isJsonArray()) {
            return applyJsonPatch(target, patch.getAsJsonArray());
        }

        if (patch.isJsonObject()) {
            return mergePatch(target.deepCopy(), patch).getAsJsonObject();
        }

        throw new IllegalArgumentException("Patch must be a JSON array or object, got " + patch);
    }

    public static JsonObject applyJsonPatch(final JsonObject target, final JsonArray operations) {
        final JsonObject result = target.deepCopy();

        for (final JsonElement element : operations) {
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Patch operation must be an object, got " + element);
            }

            final JsonObject operation = element.getAsJsonObject();
            final String op = requiredString(operation, "op");
            final List<String> path = parsePointer(requiredString(operation, "path"));

            final JsonElement parent = resolve(result, path.subList(0, path.size() - 1));
            final String last = path.get(path.size() - 1);

            switch (op) {
                case "add":
                    add(parent, last, requiredValue(operation));
                    break;

                case "replace":
                    remove(parent, last);
                    add(parent, last, requiredValue(operation));
                    break;

                case "remove":
                    remove(parent, last);
                    break;

                default:
                    throw new IllegalArgumentException("Unsupported patch operation " + op);
            }
        }

        return result;
    }

    /**
     * Merges {@code patch} into {@code target}, {@code null} members of the patch remove members of the target.
     */
    public static JsonElement mergePatch(final JsonElement target, final JsonElement patch) {
        if (!patch.isJsonObject()) {
            return patch.deepCopy();
        }

        final JsonObject result = target != null && target.isJsonObject() ? target.getAsJsonObject() : new JsonObject();

        for (final Map.Entry<String, JsonElement> member : patch.getAsJsonObject().entrySet()) {
            if (member.getValue().isJsonNull()) {
                result.remove(member.getKey());
            } else {
                result.add(member.getKey(), mergePatch(result.get(member.getKey()), member.getValue()));
            }
        }

        return result;
    }

    private static String requiredString(final JsonObject operation, final String member) {
        final JsonElement value = operation.get(member);

        if (value == null || !value.isJsonPrimitive()) {
            throw new IllegalArgumentException(String.format("Patch operation %s has no %s.", operation, member));
        }

        return value.getAsString();
    }

    private static JsonElement requiredValue(final JsonObject operation) {
        final JsonElement value = operation.get("value");

        if (value == null) {
            throw new IllegalArgumentException(String.format("Patch operation %s has no value.", operation));
        }

        return value.deepCopy();
    }

    private static List<String> parsePointer(final String pointer) {
        if (!pointer.startsWith("/")) {
            throw new IllegalArgumentException("Unsupported JSON pointer " + pointer);
        }

        final List<String> segments = new ArrayList<>();

        for (final String segment : Splitter.on('/').split(pointer.substring(1))) {
            segments.add(segment.replace("~1", "/").replace("~0", "~"));
        }

        return segments;
    }

    private static JsonElement resolve(final JsonElement root, final List<String> path) {
        JsonElement current = root;

        for (final String segment : path) {
            if (current.isJsonObject()) {
                current = current.getAsJsonObject().get(segment);
            } else if (current.isJsonArray()) {
                current = current.getAsJsonArray().get(arrayIndex(current.getAsJsonArray(), segment, false));
            } else {
                current = null;
            }

            if (current == null) {
                throw new IllegalArgumentException("Path " + path + " does not exist.");
            }
        }

        return current;
    }

    private static int arrayIndex(final JsonArray array, final String segment, final boolean allowEnd) {
        final int index;

        try {
            index = segment.equals("-") ? array.size() : Integer.parseInt(segment);

        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid array index " + segment, e);
        }

        final int max = allowEnd ? array.size() : array.size() - 1;

        if (index < 0 || index > max) {
            throw new IllegalArgumentException("Array index " + segment + " out of bounds.");
        }

        return index;
    }

    private static void add(final JsonElement parent, final String name, final JsonElement value) {
        if (parent.isJsonObject()) {
            parent.getAsJsonObject().add(name, value);
            return;
        }

        if (parent.isJsonArray()) {
            final JsonArray array = parent.getAsJsonArray();
            final int index = arrayIndex(array, name, true);

            // JsonArray has no insert, shift the tail by hand
            array.add(value);
            for (int i = array.size() - 1; i > index; i--) {
                array.set(i, array.get(i - 1));
            }
            array.set(index, value);
            return;
        }

        throw new IllegalArgumentException("Cannot add " + name + " to " + parent);
    }

    private static void remove(final JsonElement parent, final String name) {
        if (parent.isJsonObject()) {
            if (parent.getAsJsonObject().remove(name) == null) {
                throw new IllegalArgumentException("Member " + name + " does not exist.");
            }
            return;
        }

        if (parent.isJsonArray()) {
            parent.getAsJsonArray().remove(arrayIndex(parent.getAsJsonArray(), name, false));
            return;
        }

        throw new IllegalArgumentException("Cannot remove " + name + " from " + parent);
    }
}
