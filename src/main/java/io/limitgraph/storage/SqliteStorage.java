package io.limitgraph.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.limitgraph.error.StorageException;
import io.limitgraph.model.GovernanceCheckpoint;
import io.limitgraph.model.Provenance;
import io.limitgraph.model.RDSeries;
import io.limitgraph.model.SessionId;
import io.limitgraph.model.Trace;
import io.limitgraph.model.TraceId;
import io.limitgraph.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteStorage implements Storage {
    private static final String SESSION_SERIES_KEY = "_session";

    private final Database database;

    public SqliteStorage(Database database) {
        this.database = database;
    }

    @Override
    public void persistTrace(Trace trace) {
        String sql = "INSERT OR IGNORE INTO traces(trace_id,session_id,payload,created_at) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, trace.id().toString());
            ps.setString(2, trace.sessionId().toString());
            ps.setString(3, Jsons.toCompactJson(trace.payload()));
            ps.setString(4, trace.createdAt().toString());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("persist_trace", e);
        }
    }

    @Override
    public void persistRdSeries(SessionId sessionId, RDSeries series) {
        String sql = "INSERT OR REPLACE INTO rd_series(session_id,series_key,data,point_count,updated_at_ms) VALUES(?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId.toString());
            ps.setString(2, seriesKey(series.traceId()));
            ps.setString(3, Jsons.toCompactJson(series));
            ps.setInt(4, series.size());
            ps.setLong(5, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("persist_rd_series", e);
        }
    }

    @Override
    public void persistProvenance(Provenance record) {
        String sql = "INSERT OR IGNORE INTO provenance(prov_id,session_id,trace_id,kind,hash,data,created_at_ms) VALUES(?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, record.id());
            ps.setString(2, record.sessionId().toString());
            ps.setString(3, record.traceId().toString());
            ps.setString(4, record.kind().name());
            ps.setString(5, record.hash());
            ps.setString(6, Jsons.toCompactJson(record));
            ps.setLong(7, record.timestamp().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("persist_provenance", e);
        }
    }

    @Override
    public void persistCheckpoint(GovernanceCheckpoint checkpoint) {
        String sql = "INSERT OR IGNORE INTO checkpoints(checkpoint_id,session_id,trace_id,outcome,data,created_at_ms) VALUES(?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, checkpoint.id());
            ps.setString(2, checkpoint.sessionId().toString());
            ps.setString(3, checkpoint.traceId().toString());
            ps.setString(4, checkpoint.outcome().name());
            ps.setString(5, Jsons.toCompactJson(checkpoint));
            ps.setLong(6, checkpoint.timestamp().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("persist_checkpoint", e);
        }
    }

    @Override
    public Optional<Trace> loadTrace(SessionId sessionId, TraceId traceId) {
        String sql = "SELECT payload,created_at FROM traces WHERE trace_id=? AND session_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, traceId.toString());
            ps.setString(2, sessionId.toString());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Trace(
                        traceId,
                        sessionId,
                        Jsons.compactMapper().readTree(rs.getString("payload")),
                        Instant.parse(rs.getString("created_at"))
                ));
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("load_trace", e);
        }
    }

    @Override
    public Optional<RDSeries> loadRdSeries(SessionId sessionId, TraceId traceId) {
        String sql = "SELECT data FROM rd_series WHERE session_id=? AND series_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId.toString());
            ps.setString(2, seriesKey(traceId));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.compactMapper().readValue(rs.getString("data"), RDSeries.class));
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("load_rd_series", e);
        }
    }

    @Override
    public List<Provenance> listProvenance(SessionId sessionId, TraceId traceId) {
        String sql = "SELECT data FROM provenance WHERE session_id=? AND trace_id=? ORDER BY seq ASC";
        List<Provenance> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId.toString());
            ps.setString(2, traceId.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Jsons.compactMapper().readValue(rs.getString("data"), Provenance.class));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("list_provenance", e);
        }
        return out;
    }

    @Override
    public List<GovernanceCheckpoint> listCheckpoints(SessionId sessionId) {
        String sql = "SELECT data FROM checkpoints WHERE session_id=? ORDER BY seq ASC";
        List<GovernanceCheckpoint> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Jsons.compactMapper().readValue(rs.getString("data"), GovernanceCheckpoint.class));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("list_checkpoints", e);
        }
        return out;
    }

    private static String seriesKey(TraceId traceId) {
        return traceId == null ? SESSION_SERIES_KEY : traceId.toString();
    }
}
