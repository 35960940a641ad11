package io.kubecache.picocli;

import io.kubecache.k8s.watch.TrackedKind;
import picocli.CommandLine;

public class TrackedKindTypeConverter implements CommandLine.ITypeConverter<TrackedKind> {
    @Override
    public TrackedKind convert(final String value) {
        try {
            return TrackedKind.parse(value);

        } catch (final IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(String.format("\"%s\" is not a valid kind: %s", value, e.getMessage()));
        }
    }
}
