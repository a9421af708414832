package com.codescout.dispatch.api;

import com.codescout.core.session.Session;
import com.codescout.core.session.SessionSort;
import com.codescout.core.session.SessionStore;
import com.codescout.core.session.SessionSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for listing, inspecting and deleting review sessions.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final SessionStore sessionStore;

    public SessionController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /**
     * GET /api/v1/sessions: Session summaries, optionally filtered by project.
     */
    @GetMapping
    public List<SessionSummary> listSessions(
            @RequestParam(name = "project_root", required = false) String projectRoot,
            @RequestParam(name = "limit", defaultValue = "50") int limit,
            @RequestParam(name = "sort", defaultValue = "last_updated") String sort) {
        String filter = projectRoot != null ? canonical(projectRoot) : null;
        return sessionStore.list(filter, limit, SessionSort.parse(sort));
    }

    /**
     * GET /api/v1/sessions/{name}: Session detail, or 404.
     */
    @GetMapping("/{name}")
    public ResponseEntity<Map<String, Object>> getSession(
            @PathVariable String name,
            @RequestParam(name = "project_root") String projectRoot) {
        Optional<Session> session = sessionStore.load(name, canonical(projectRoot));
        if (session.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Session found = session.get();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("summary", SessionSummary.of(found));
        detail.put("message_count", found.messageHistory().size());
        detail.put("trace_size", found.navigationState().size());
        detail.put("cumulative_token_estimate", found.cumulativeTokenEstimate());
        return ResponseEntity.ok(detail);
    }

    /**
     * DELETE /api/v1/sessions/{name}: Remove a session record.
     */
    @DeleteMapping("/{name}")
    public ResponseEntity<Map<String, String>> deleteSession(
            @PathVariable String name,
            @RequestParam(name = "project_root") String projectRoot) {
        if (!sessionStore.delete(name, canonical(projectRoot))) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("message", "Session '" + name + "' deleted"));
    }

    /** Sessions are keyed by the canonical root; fall back to the normalized path when it is gone. */
    static String canonical(String projectRoot) {
        Path path = Path.of(projectRoot).toAbsolutePath().normalize();
        try {
            return path.toRealPath().toString();
        } catch (IOException e) {
            return path.toString();
        }
    }
}
