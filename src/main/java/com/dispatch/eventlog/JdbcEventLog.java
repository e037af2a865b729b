package com.dispatch.eventlog;

import com.dispatch.shared.model.EventType;
import com.dispatch.shared.model.SessionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event log over the {@code session_events} table. Inserts run in auto-commit mode, so an
 * event is committed before {@link #append} returns.
 */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

    private final DataSource dataSource;
    private final ObjectMapper mapper;
    private final int pageSize;
    private final Clock clock;
    private final Map<String, SequenceCounter> counters = new ConcurrentHashMap<>();

    public JdbcEventLog(DataSource dataSource, ObjectMapper mapper, int pageSize) {
        this(dataSource, mapper, pageSize, Clock.systemUTC());
    }

    public JdbcEventLog(DataSource dataSource, ObjectMapper mapper, int pageSize, Clock clock) {
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        this.dataSource = dataSource;
        this.mapper = mapper;
        this.pageSize = pageSize;
        this.clock = clock;
    }

    @Override
    public SessionEvent append(String sessionId, EventType type, JsonNode payload) {
        var counter = counters.computeIfAbsent(sessionId, id -> new SequenceCounter());
        counter.lock.lock();
        try {
            if (counter.next < 1) counter.next = latestSeq(sessionId) + 1;
            long seq = counter.next;
            var timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            insert(sessionId, seq, type, payload, timestamp);
            counter.next = seq + 1;
            return new SessionEvent(sessionId, seq, type, payload, timestamp);
        } catch (EventLogException e) {
            // re-seed from storage on the next attempt in case another writer took this seq
            counter.next = 0;
            throw e;
        } finally {
            counter.lock.unlock();
        }
    }

    private void insert(String sessionId, long seq, EventType type, JsonNode payload, Instant timestamp) {
        var sql = "INSERT INTO session_events (session_id, seq, type, payload, ts) VALUES (?, ?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setLong(2, seq);
            ps.setString(3, type.wireName());
            ps.setString(4, mapper.writeValueAsString(payload));
            ps.setLong(5, timestamp.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new EventLogException("Failed to append " + type.wireName() + " event #" + seq
                    + " for session: " + sessionId, e);
        }
    }

    @Override
    public Iterable<SessionEvent> readFrom(String sessionId, long afterSeq) {
        return readRange(sessionId, afterSeq, Long.MAX_VALUE);
    }

    @Override
    public Iterable<SessionEvent> readRange(String sessionId, long afterSeq, long throughSeq) {
        return () -> new PagingIterator(sessionId, afterSeq, throughSeq);
    }

    @Override
    public long latestSeq(String sessionId) {
        return queryLong("SELECT COALESCE(MAX(seq), 0) FROM session_events WHERE session_id = ?", sessionId);
    }

    @Override
    public long count(String sessionId) {
        return queryLong("SELECT COUNT(*) FROM session_events WHERE session_id = ?", sessionId);
    }

    @Override
    public int deleteSession(String sessionId) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("DELETE FROM session_events WHERE session_id = ?")) {
            ps.setString(1, sessionId);
            int deleted = ps.executeUpdate();
            counters.remove(sessionId);
            return deleted;
        } catch (SQLException e) {
            throw new EventLogException("Failed to delete events for session: " + sessionId, e);
        }
    }

    @Override
    public void forget(String sessionId) {
        counters.remove(sessionId);
    }

    private long queryLong(String sql, String sessionId) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new EventLogException("Failed to query event log for session: " + sessionId, e);
        }
    }

    private List<SessionEvent> readPage(String sessionId, long afterSeq, long throughSeq) {
        var sql = "SELECT seq, type, payload, ts FROM session_events"
                + " WHERE session_id = ? AND seq > ? AND seq <= ? ORDER BY seq LIMIT ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setLong(2, afterSeq);
            ps.setLong(3, throughSeq);
            ps.setInt(4, pageSize);
            try (var rs = ps.executeQuery()) {
                var page = new ArrayList<SessionEvent>(pageSize);
                while (rs.next()) {
                    page.add(toEvent(sessionId, rs));
                }
                return page;
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new EventLogException("Failed to read events after #" + afterSeq + " for session: " + sessionId, e);
        }
    }

    private SessionEvent toEvent(String sessionId, ResultSet rs) throws SQLException, JsonProcessingException {
        return new SessionEvent(
                sessionId,
                rs.getLong("seq"),
                EventType.fromWire(rs.getString("type")),
                mapper.readTree(rs.getString("payload")),
                Instant.ofEpochMilli(rs.getLong("ts")));
    }

    private static final class SequenceCounter {
        final ReentrantLock lock = new ReentrantLock();
        long next;
    }

    private final class PagingIterator implements Iterator<SessionEvent> {
        private final String sessionId;
        private final long throughSeq;
        private long cursor;
        private Iterator<SessionEvent> page = List.<SessionEvent>of().iterator();
        private boolean exhausted;

        PagingIterator(String sessionId, long afterSeq, long throughSeq) {
            this.sessionId = sessionId;
            this.cursor = afterSeq;
            this.throughSeq = throughSeq;
        }

        @Override
        public boolean hasNext() {
            if (page.hasNext()) return true;
            if (exhausted || cursor >= throughSeq) return false;
            var next = readPage(sessionId, cursor, throughSeq);
            if (next.size() < pageSize) exhausted = true;
            if (next.isEmpty()) return false;
            log.trace("Read {} events after #{} for session {}", next.size(), cursor, sessionId);
            page = next.iterator();
            return true;
        }

        @Override
        public SessionEvent next() {
            if (!hasNext()) throw new NoSuchElementException();
            var event = page.next();
            cursor = event.seq();
            return event;
        }
    }
}
