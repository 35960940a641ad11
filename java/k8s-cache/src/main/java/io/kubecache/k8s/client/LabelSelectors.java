package io.kubecache.k8s.client;

import javax.annotation.Nullable;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

public final class LabelSelectors {

    public static String equalitySelector(final String label, final String value) {
        return equalitySelector(ImmutableMap.of(label, value));
    }

    /**
     * @return the selector string, or {@code null} for an empty map (no selection)
     */
    @Nullable
    public static String equalitySelector(final Map<String, String> labelsAndValues) {
        if (labelsAndValues.isEmpty()) {
            return null;
        }

        return Joiner.on(',').withKeyValueSeparator('=').join(labelsAndValues);
    }


    private LabelSelectors() {}
}
