package com.codescout.core.session;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of review sessions, scoped by {@code (name, projectRoot)}.
 */
public interface SessionStore {

    /**
     * @throws SessionExistsException if the session already exists
     */
    Session create(String name, String projectRoot);

    /**
     * @throws IncompatibleSessionException if the stored record has an unsupported format version
     */
    Optional<Session> load(String name, String projectRoot);

    void save(Session session);

    /**
     * @param projectFilter only sessions of this project root, or {@code null} for all
     * @param limit         maximum number of summaries; zero or less means no limit
     */
    List<SessionSummary> list(String projectFilter, int limit, SessionSort sort);

    /**
     * @return whether a record existed
     * @throws SessionBusyException if a review currently holds the session
     */
    boolean delete(String name, String projectRoot);

    /**
     * @throws SessionBusyException if another review holds the session beyond {@code wait}
     */
    SessionLease lease(String name, String projectRoot, Duration wait);

    /** Number of sessions currently leased in this process. */
    int activeLeases();
}
