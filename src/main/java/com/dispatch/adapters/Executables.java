package com.dispatch.adapters;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves a command name the way a shell would: paths are checked directly, bare names are
 * looked up on {@code PATH}.
 */
public final class Executables {

    private Executables() {}

    public static Optional<Path> resolve(String command) {
        if (command == null || command.isBlank()) return Optional.empty();
        if (command.contains(File.separator)) {
            var path = Path.of(command);
            return Files.isRegularFile(path) && Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        var pathEnv = System.getenv("PATH");
        if (pathEnv == null) return Optional.empty();
        for (var dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            var candidate = Path.of(dir, command);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
