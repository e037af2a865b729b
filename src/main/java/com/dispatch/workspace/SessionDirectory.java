package com.dispatch.workspace;

import java.nio.file.Path;

/**
 * Workspace lookup used when sessions are created. Project metadata lives elsewhere; this is the
 * narrow view the runtime needs.
 */
public interface SessionDirectory {

    /**
     * Resolves a client-supplied workspace path.
     *
     * @throws IllegalArgumentException if the path is blank, outside the workspaces root, or not a directory
     */
    Path validateWorkspace(String path);

    WorkspaceInfo describe(Path workspace);
}
