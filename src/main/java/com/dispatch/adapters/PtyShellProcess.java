package com.dispatch.adapters;

import com.pty4j.PtyProcess;
import com.pty4j.WinSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

class PtyShellProcess implements RunningProcess {

    private static final Logger log = LoggerFactory.getLogger(PtyShellProcess.class);
    private static final int READ_BUFFER = 4096;
    private static final long KILL_GRACE_MS = 1000;

    private final String sessionId;
    private final PtyProcess process;
    private final EventSink sink;
    private volatile boolean stopping;
    private volatile CompletableFuture<Void> exitReported = CompletableFuture.completedFuture(null);

    PtyShellProcess(String sessionId, PtyProcess process, EventSink sink) {
        this.sessionId = sessionId;
        this.process = process;
        this.sink = sink;
    }

    void startReading(ExecutorService readers) {
        var drained = CompletableFuture.runAsync(this::readLoop, readers);
        // exit is reported after the last output chunk so no data event follows it
        exitReported = drained.thenCombine(process.onExit(), (ignored, p) -> p.exitValue())
                .thenAccept(code -> {
                    log.debug("[shell:{}] exited with code {}", sessionId, code);
                    sink.emit(AdapterEvent.exited(code));
                });
    }

    private void readLoop() {
        // the reader keeps partial UTF-8 sequences between reads
        try (var reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            var buffer = new char[READ_BUFFER];
            int len;
            while ((len = reader.read(buffer)) != -1) {
                if (len > 0) sink.emit(AdapterEvent.stdoutData(new String(buffer, 0, len)));
            }
        } catch (IOException e) {
            // the pty master reports EIO once the slave side is gone
            if (!stopping && process.isAlive()) {
                log.warn("[shell:{}] read failed: {}", sessionId, e.getMessage());
            }
        }
    }

    @Override
    public synchronized void write(byte[] data) throws IOException {
        var out = process.getOutputStream();
        out.write(data);
        out.flush();
    }

    @Override
    public boolean supportsResize() {
        return true;
    }

    @Override
    public void resize(int cols, int rows) {
        process.setWinSize(new WinSize(
                ShellAdapter.clamp(cols, ShellAdapter.MIN_COLS, ShellAdapter.MAX_COLS),
                ShellAdapter.clamp(rows, ShellAdapter.MIN_ROWS, ShellAdapter.MAX_ROWS)));
    }

    @Override
    public void stop(Duration timeout) {
        stopping = true;
        process.destroy();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[shell:{}] did not exit within {}ms, killing", sessionId, timeout.toMillis());
                process.destroyForcibly();
                process.waitFor(KILL_GRACE_MS, TimeUnit.MILLISECONDS);
            }
            exitReported.get(KILL_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            log.warn("[shell:{}] exit not reported after kill", sessionId);
        } catch (ExecutionException e) {
            log.warn("[shell:{}] exit reporting failed", sessionId, e.getCause());
        }
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }
}
