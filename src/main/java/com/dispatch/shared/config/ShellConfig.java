package com.dispatch.shared.config;

import java.util.List;

public record ShellConfig(
    String defaultShell,
    List<String> args,
    int cols,
    int rows
) {
    public static ShellConfig defaults() {
        var shell = System.getenv("SHELL");
        return new ShellConfig(shell != null && !shell.isBlank() ? shell : "/bin/bash", List.of(), 80, 24);
    }
}
