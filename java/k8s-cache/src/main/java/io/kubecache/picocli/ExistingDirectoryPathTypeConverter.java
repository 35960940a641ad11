package io.kubecache.picocli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import picocli.CommandLine;

/**
 * A {@link CommandLine.ITypeConverter} for {@link Path}s that must exist and must be directories. An empty value means no directory.
 */
public class ExistingDirectoryPathTypeConverter implements CommandLine.ITypeConverter<Path> {
    @Override
    public Path convert(final String value) {
        if ("".equals(value))
            return null;

        final Path path = Paths.get(value);

        if (!Files.exists(path))
            throw new CommandLine.TypeConversionException(String.format("Directory \"%s\" does not exist", path));

        if (!Files.isDirectory(path))
            throw new CommandLine.TypeConversionException(String.format("\"%s\" is not a directory", path));

        return path;
    }
}
