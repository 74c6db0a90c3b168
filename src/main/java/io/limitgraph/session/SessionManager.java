package io.limitgraph.session;

import io.limitgraph.model.Session;
import io.limitgraph.model.SessionConfig;
import io.limitgraph.model.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of live sessions and their admission gates. Sessions end only when archived.
 */
public final class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final Clock clock;
    private final ConcurrentMap<SessionId, Entry> sessions = new ConcurrentHashMap<>();

    public SessionManager() {
        this(Clock.systemUTC());
    }

    public SessionManager(Clock clock) {
        this.clock = clock;
    }

    public Session open(SessionConfig config) {
        Session session = Session.open(config, clock.instant());
        sessions.put(session.id(), new Entry(session, new AdmissionGate(config.maxConcurrency())));
        log.info("session opened id={} name={} maxConcurrency={} allowNetwork={}",
                session.id(), config.name(), config.maxConcurrency(), config.allowNetwork());
        return session;
    }

    /**
     * Registers a session created elsewhere. Re-registering the same id keeps the existing gate.
     */
    public Session attach(Session session) {
        sessions.putIfAbsent(session.id(), new Entry(session, new AdmissionGate(session.config().maxConcurrency())));
        return session;
    }

    public Optional<Session> find(SessionId id) {
        Entry entry = sessions.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.session());
    }

    public AdmissionGate gate(Session session) {
        return sessions.computeIfAbsent(
                session.id(),
                id -> new Entry(session, new AdmissionGate(session.config().maxConcurrency()))
        ).gate();
    }

    public boolean archive(SessionId id) {
        Entry removed = sessions.remove(id);
        if (removed != null) {
            log.info("session archived id={} name={}", id, removed.session().name());
        }
        return removed != null;
    }

    public Collection<Session> live() {
        return sessions.values().stream().map(Entry::session).toList();
    }


    private record Entry(Session session, AdmissionGate gate) {
    }
}
