package com.dispatch.workspace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

public class FileSystemSessionDirectory implements SessionDirectory {

    private final Path root;

    public FileSystemSessionDirectory(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    @Override
    public Path validateWorkspace(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("workspacePath is required");
        }
        var candidate = Path.of(path);
        var resolved = (candidate.isAbsolute() ? candidate : root.resolve(candidate)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Workspace is outside " + root + ": " + path);
        }
        if (!Files.isDirectory(resolved)) {
            throw new IllegalArgumentException("Workspace is not a directory: " + path);
        }
        return resolved;
    }

    @Override
    public WorkspaceInfo describe(Path workspace) {
        var name = workspace.getFileName() != null ? workspace.getFileName().toString() : workspace.toString();
        if (!Files.isDirectory(workspace)) {
            return new WorkspaceInfo(workspace.toString(), name, false, null);
        }
        Instant modified;
        try {
            modified = Files.getLastModifiedTime(workspace).toInstant();
        } catch (IOException e) {
            modified = null;
        }
        return new WorkspaceInfo(workspace.toString(), name, true, modified);
    }
}
