package io.kubecache.k8s.client;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.testng.annotations.Test;

public class JsonPatchesTest {

    private static JsonObject json(final String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

    private final JsonObject target = json("{\"metadata\":{\"name\":\"quota\",\"annotations\":{\"a\":\"1\"}},\"spec\":{\"hard\":{\"requests.cpu\":\"2.0\"},\"list\":[1,2,3]}}");

    @Test
    public void testJsonPatchAddReplacesExistingMember() {
        final JsonObject patched = JsonPatches.apply(target, JsonParser.parseString(
                "[{\"op\":\"add\",\"path\":\"/spec/hard\",\"value\":{\"requests.cpu\":\"4.0\"}}]"));

        assertEquals(patched.getAsJsonObject("spec").getAsJsonObject("hard"), json("{\"requests.cpu\":\"4.0\"}"));
    }

    @Test
    public void testJsonPatchEscapedPointerAndArrays() {
        final JsonObject patched = JsonPatches.apply(target, JsonParser.parseString(
                "[{\"op\":\"add\",\"path\":\"/metadata/annotations/kubecache.io~1gpu-kind\",\"value\":\"amd.com\"}," +
                        "{\"op\":\"add\",\"path\":\"/spec/list/1\",\"value\":9}," +
                        "{\"op\":\"remove\",\"path\":\"/spec/list/3\"}," +
                        "{\"op\":\"replace\",\"path\":\"/metadata/name\",\"value\":\"renamed\"}]"));

        assertEquals(patched.getAsJsonObject("metadata").getAsJsonObject("annotations"), json("{\"a\":\"1\",\"kubecache.io/gpu-kind\":\"amd.com\"}"));
        assertEquals(patched.getAsJsonObject("spec").getAsJsonArray("list").toString(), "[1,9,2]");
        assertEquals(patched.getAsJsonObject("metadata").get("name").getAsString(), "renamed");
    }

    @Test
    public void testTargetIsNotModified() {
        final JsonObject before = target.deepCopy();

        JsonPatches.apply(target, JsonParser.parseString("[{\"op\":\"remove\",\"path\":\"/spec\"}]"));
        JsonPatches.apply(target, json("{\"spec\":null}"));

        assertEquals(target, before);
    }

    @Test
    public void testMergePatch() {
        final JsonObject patched = JsonPatches.apply(target, json("{\"metadata\":{\"annotations\":{\"a\":null,\"b\":\"2\"}},\"spec\":{\"list\":[4]}}"));

        assertEquals(patched.getAsJsonObject("metadata").getAsJsonObject("annotations"), json("{\"b\":\"2\"}"));
        assertEquals(patched.getAsJsonObject("spec").getAsJsonArray("list").toString(), "[4]");
        assertEquals(patched.getAsJsonObject("spec").getAsJsonObject("hard"), json("{\"requests.cpu\":\"2.0\"}"));
        assertFalse(patched.getAsJsonObject("metadata").getAsJsonObject("annotations").has("a"));
    }

    @Test
    public void testInvalidPatches() {
        assertThrows(IllegalArgumentException.class, () -> JsonPatches.apply(target, JsonParser.parseString("\"text\"")));
        assertThrows(IllegalArgumentException.class, () -> JsonPatches.apply(target, JsonParser.parseString("[{\"op\":\"move\",\"path\":\"/spec\"}]")));
        assertThrows(IllegalArgumentException.class, () -> JsonPatches.apply(target, JsonParser.parseString("[{\"op\":\"add\",\"path\":\"/missing/member\",\"value\":1}]")));
        assertThrows(IllegalArgumentException.class, () -> JsonPatches.apply(target, JsonParser.parseString("[{\"op\":\"remove\",\"path\":\"/spec/absent\"}]")));
        assertThrows(IllegalArgumentException.class, () -> JsonPatches.apply(target, JsonParser.parseString("[{\"op\":\"add\",\"path\":\"/spec\"}]")));
    }
}
