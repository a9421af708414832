package com.codescout.core.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SessionStore} that keeps one JSON file per session.
 * <p>
 * Each record is wrapped in a versioned envelope
 * {@code {"format_version": 1, "session": {...}}} and written through a temp
 * file and an atomic rename. Output is deterministic (sorted properties and map
 * keys, ISO-8601 instants) so that re-saving an unchanged session produces the
 * same bytes.
 */
public class FileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);

    public static final int FORMAT_VERSION = 1;

    private final Path directory;
    private final SessionLockRegistry lockRegistry;
    private final ObjectMapper mapper;

    record SessionRecord(@JsonProperty("format_version") int formatVersion,
                         @JsonProperty("session") Session session) {}

    public FileSessionStore(Path directory, SessionLockRegistry lockRegistry) {
        this.directory = directory;
        this.lockRegistry = lockRegistry;
        this.mapper = createMapper();
    }

    static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Override
    public Session create(String name, String projectRoot) {
        SessionKey key = new SessionKey(name, projectRoot);
        if (Files.exists(recordPath(key))) {
            throw new SessionExistsException("Session '" + name + "' already exists for " + projectRoot);
        }
        Session session = Session.create(name, projectRoot, Instant.now());
        save(session);
        log.info("Created session {} for {}", name, projectRoot);
        return session;
    }

    @Override
    public Optional<Session> load(String name, String projectRoot) {
        Path path = recordPath(new SessionKey(name, projectRoot));
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(readRecord(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read session '" + name + "'", e);
        }
    }

    @Override
    public void save(Session session) {
        Path target = recordPath(session.key());
        try {
            Files.createDirectories(directory);
            byte[] bytes = mapper.writeValueAsBytes(new SessionRecord(FORMAT_VERSION, session));
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, bytes);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save session '" + session.name() + "'", e);
        }
    }

    @Override
    public List<SessionSummary> list(String projectFilter, int limit, SessionSort sort) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<SessionSummary> summaries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
            for (Path path : stream) {
                try {
                    Session session = readRecord(path);
                    if (projectFilter == null || projectFilter.equals(session.projectRoot())) {
                        summaries.add(SessionSummary.of(session));
                    }
                } catch (IncompatibleSessionException e) {
                    log.warn("Skipping session record {}: {}", path.getFileName(), e.getMessage());
                } catch (IOException e) {
                    log.warn("Skipping unreadable session record {}: {}", path.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list sessions in " + directory, e);
        }
        summaries.sort(sort.order());
        return limit > 0 && summaries.size() > limit ? List.copyOf(summaries.subList(0, limit)) : summaries;
    }

    /**
     * Deletes a session that no review holds.
     *
     * @throws SessionBusyException if a review currently leases the session
     */
    @Override
    public boolean delete(String name, String projectRoot) {
        SessionKey key = new SessionKey(name, projectRoot);
        try (SessionLease lease = lockRegistry.acquire(key, Duration.ZERO)) {
            boolean deleted = Files.deleteIfExists(recordPath(key));
            if (deleted) {
                log.info("Deleted session {} for {}", name, projectRoot);
            }
            lease.discardLockFileOnRelease();
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete session '" + name + "'", e);
        }
    }

    @Override
    public SessionLease lease(String name, String projectRoot, Duration wait) {
        return lockRegistry.acquire(new SessionKey(name, projectRoot), wait);
    }

    @Override
    public int activeLeases() {
        return lockRegistry.activeCount();
    }

    public Path directory() {
        return directory;
    }

    Path recordPath(SessionKey key) {
        return directory.resolve(key.digest() + ".json");
    }

    private Session readRecord(Path path) throws IOException {
        JsonNode root = mapper.readTree(path.toFile());
        int version = root == null ? 0 : root.path("format_version").asInt(0);
        if (version > FORMAT_VERSION) {
            throw new IncompatibleSessionException(
                    "Session record format " + version + " is newer than supported version " + FORMAT_VERSION);
        }
        if (version < 1 || !root.hasNonNull("session")) {
            throw new IncompatibleSessionException("Session record has no supported format_version");
        }
        return mapper.treeToValue(root.get("session"), Session.class);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, falling back to replace", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
