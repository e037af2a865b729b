package com.dispatch.observability;

import com.dispatch.adapters.Executables;
import com.dispatch.shared.config.DispatchConfig;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

public class DoctorCommand {

    private final DataSource dataSource;
    private final DispatchConfig config;

    public DoctorCommand(DataSource dataSource, DispatchConfig config) {
        this.dataSource = dataSource;
        this.config = config;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkDatabase());
        results.add(checkWorkspacesRoot());
        results.add(checkShell());
        results.add(checkAgent());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkDatabase() {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT 1");
             var rs = ps.executeQuery()) {
            return "[OK] Database connection";
        } catch (Exception e) {
            return "[FAIL] Database: " + e.getMessage();
        }
    }

    private String checkWorkspacesRoot() {
        var root = Path.of(config.workspacesRoot());
        return Files.isDirectory(root)
                ? "[OK] Workspaces root " + root
                : "[FAIL] Workspaces root not found: " + root;
    }

    private String checkShell() {
        var shell = config.shell().defaultShell();
        return Executables.resolve(shell)
                .map(p -> "[OK] Shell " + p)
                .orElse("[FAIL] Shell not found: " + shell);
    }

    private String checkAgent() {
        var command = config.agent().command();
        if (command.isEmpty()) return "[WARN] Agent command not configured";
        return Executables.resolve(command.get(0))
                .map(p -> "[OK] Agent CLI " + p)
                .orElse("[WARN] Agent CLI not found: " + command.get(0) + " (agent sessions will fail to start)");
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
