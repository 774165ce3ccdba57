package org.coregstack.toolkit;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.typesafe.config.Config;

/**
 * Settings of the external toolkit, read from {@code coregstack.toolkit}.
 *
 * @param installDirectory toolkit installation searched for programs, empty to use the {@code PATH}
 * @param packages         package directories searched below the installation, in order
 * @param timeout          ceiling for a single program run
 */
public record ToolkitSettings(Optional<Path> installDirectory, List<String> packages, Duration timeout) {

    public ToolkitSettings {
        packages = List.copyOf(packages);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Toolkit timeout must be positive, got " + timeout);
        }
    }

    public static ToolkitSettings fromConfig(Config toolkit) {
        String install = toolkit.hasPath("install-dir") ? toolkit.getString("install-dir") : "";
        return new ToolkitSettings(
                install.isBlank() ? Optional.empty() : Optional.of(Path.of(install)),
                toolkit.getStringList("packages"),
                toolkit.getDuration("timeout"));
    }
}
