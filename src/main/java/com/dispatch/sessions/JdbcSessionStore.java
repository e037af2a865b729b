package com.dispatch.sessions;

import com.dispatch.shared.model.RunSession;
import com.dispatch.shared.model.SessionKind;
import com.dispatch.shared.model.SessionStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JdbcSessionStore implements SessionStore {

    private static final TypeReference<Map<String, Object>> OPTIONS = new TypeReference<>() {};
    private static final String COLUMNS = "id, kind, workspace_path, status, options_json, created_at, updated_at";

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public JdbcSessionStore(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    @Override
    public void insert(RunSession session) {
        var sql = "INSERT INTO sessions (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, session.id());
            ps.setString(2, session.kind().wireName());
            ps.setString(3, session.workspacePath());
            ps.setString(4, session.status().wireName());
            ps.setString(5, mapper.writeValueAsString(session.options()));
            ps.setLong(6, session.createdAt().toEpochMilli());
            ps.setLong(7, session.updatedAt().toEpochMilli());
            ps.executeUpdate();
        } catch (Exception e) {
            throw new RuntimeException("Failed to insert session: " + session.id(), e);
        }
    }

    @Override
    public void updateStatus(String sessionId, SessionStatus status, Instant updatedAt) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("UPDATE sessions SET status = ?, updated_at = ? WHERE id = ?")) {
            ps.setString(1, status.wireName());
            ps.setLong(2, updatedAt.toEpochMilli());
            ps.setString(3, sessionId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update session status: " + sessionId, e);
        }
    }

    @Override
    public Optional<RunSession> find(String sessionId) {
        var rows = query("SELECT " + COLUMNS + " FROM sessions WHERE id = ?", ps -> ps.setString(1, sessionId));
        return rows.stream().findFirst();
    }

    @Override
    public List<RunSession> list(SessionKind kind) {
        if (kind == null) {
            return query("SELECT " + COLUMNS + " FROM sessions ORDER BY created_at DESC", ps -> {});
        }
        return query("SELECT " + COLUMNS + " FROM sessions WHERE kind = ? ORDER BY created_at DESC",
                ps -> ps.setString(1, kind.wireName()));
    }

    @Override
    public List<RunSession> findByStatus(Collection<SessionStatus> statuses) {
        if (statuses.isEmpty()) return List.of();
        var statusList = new ArrayList<>(statuses);
        var placeholders = String.join(", ", Collections.nCopies(statusList.size(), "?"));
        return query("SELECT " + COLUMNS + " FROM sessions WHERE status IN (" + placeholders + ") ORDER BY created_at",
                ps -> {
                    for (int i = 0; i < statusList.size(); i++) {
                        ps.setString(i + 1, statusList.get(i).wireName());
                    }
                });
    }

    @Override
    public List<RunSession> findTerminalBefore(Instant cutoff) {
        return query("SELECT " + COLUMNS + " FROM sessions WHERE status IN (?, ?) AND updated_at < ? ORDER BY updated_at",
                ps -> {
                    ps.setString(1, SessionStatus.STOPPED.wireName());
                    ps.setString(2, SessionStatus.ERRORED.wireName());
                    ps.setLong(3, cutoff.toEpochMilli());
                });
    }

    @Override
    public void delete(String sessionId) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("DELETE FROM sessions WHERE id = ?")) {
            ps.setString(1, sessionId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete session: " + sessionId, e);
        }
    }

    private List<RunSession> query(String sql, Binder binder) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (var rs = ps.executeQuery()) {
                var sessions = new ArrayList<RunSession>();
                while (rs.next()) {
                    sessions.add(toSession(rs));
                }
                return sessions;
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to query sessions", e);
        }
    }

    private RunSession toSession(ResultSet rs) throws Exception {
        var options = rs.getString("options_json");
        return new RunSession(
                rs.getString("id"),
                SessionKind.fromWire(rs.getString("kind")),
                rs.getString("workspace_path"),
                SessionStatus.fromWire(rs.getString("status")),
                options != null && !options.isBlank() ? mapper.readValue(options, OPTIONS) : Map.of(),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
