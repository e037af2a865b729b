package com.dispatch.adapters;

import com.dispatch.shared.config.ShellConfig;
import com.dispatch.shared.model.SessionKind;
import com.pty4j.PtyProcessBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs an interactive shell inside a pseudo-terminal rooted at the session workspace.
 * Options: {@code shell}, {@code cols}, {@code rows}.
 */
public class ShellAdapter implements ProcessAdapter {

    static final int MIN_COLS = 10;
    static final int MAX_COLS = 500;
    static final int MIN_ROWS = 5;
    static final int MAX_ROWS = 200;

    private final ShellConfig config;
    private final ExecutorService readers;

    public ShellAdapter(ShellConfig config, ExecutorService readers) {
        this.config = config;
        this.readers = readers;
    }

    @Override
    public SessionKind kind() {
        return SessionKind.SHELL;
    }

    @Override
    public RunningProcess start(StartRequest request, EventSink sink) throws IOException {
        var shell = request.stringOption("shell", config.defaultShell());
        var executable = Executables.resolve(shell)
                .orElseThrow(() -> new IOException("Shell not found: " + shell));
        int cols = clamp(request.intOption("cols", config.cols()), MIN_COLS, MAX_COLS);
        int rows = clamp(request.intOption("rows", config.rows()), MIN_ROWS, MAX_ROWS);

        var command = new ArrayList<String>();
        command.add(executable.toString());
        command.addAll(config.args());

        var env = new HashMap<>(System.getenv());
        env.put("TERM", "xterm-256color");
        env.put("COLORTERM", "truecolor");
        env.putIfAbsent("LANG", "en_US.UTF-8");

        var process = new PtyProcessBuilder()
                .setCommand(command.toArray(new String[0]))
                .setEnvironment(env)
                .setDirectory(request.workspace().toString())
                .setConsole(false)
                .setInitialColumns(cols)
                .setInitialRows(rows)
                .start();

        var running = new PtyShellProcess(request.sessionId(), process, sink);
        running.startReading(readers);
        return running;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
