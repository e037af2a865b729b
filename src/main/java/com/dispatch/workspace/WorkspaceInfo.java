package com.dispatch.workspace;

import java.time.Instant;

public record WorkspaceInfo(String path, String name, boolean exists, Instant lastModified) {}
