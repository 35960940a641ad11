package io.kubecache.picocli;

import java.util.Optional;

import com.google.common.base.Joiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Reports the implementation version from the jar manifest of the command class.
 */
public class PackageVersionProvider implements CommandLine.IVersionProvider {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec commandSpec;

    @Override
    public String[] getVersion() {
        final Package commandPackage = commandSpec.userObject().getClass().getPackage();

        final String title = Optional.ofNullable(commandPackage.getImplementationTitle()).orElse(commandSpec.name());
        final String version = Optional.ofNullable(commandPackage.getImplementationVersion()).orElse("development build");

        return new String[]{String.format("%s %s", title, version)};
    }

    public static void logCommandVersionInformation(final CommandLine.Model.CommandSpec commandSpec) {
        final Logger logger = LoggerFactory.getLogger(commandSpec.userObject().getClass());
        logger.info("{} version: {}", commandSpec.name(), Joiner.on(", ").join(commandSpec.version()));
    }
}
