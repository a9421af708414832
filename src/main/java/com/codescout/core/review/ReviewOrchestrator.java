package com.codescout.core.review;

import com.codescout.core.CodescoutException;
import com.codescout.core.index.CodebaseIndex;
import com.codescout.core.index.CodebaseIndexer;
import com.codescout.core.llm.ConversationMessage;
import com.codescout.core.llm.EngineProperties;
import com.codescout.core.llm.EngineRequest;
import com.codescout.core.llm.EngineResponse;
import com.codescout.core.llm.ReasoningEngine;
import com.codescout.core.llm.TokenUsage;
import com.codescout.core.llm.ToolCallRequest;
import com.codescout.core.llm.ToolSpec;
import com.codescout.core.logging.MdcContext;
import com.codescout.core.metrics.ReviewMetrics;
import com.codescout.core.navigation.NavigationOperation;
import com.codescout.core.navigation.NavigationProperties;
import com.codescout.core.navigation.NavigationTools;
import com.codescout.core.navigation.ToolOutcome;
import com.codescout.core.navigation.ToolResult;
import com.codescout.core.ratelimit.RateLimiterRegistry;
import com.codescout.core.sandbox.SandboxedFileAccessor;
import com.codescout.core.session.Session;
import com.codescout.core.session.SessionLease;
import com.codescout.core.session.SessionProperties;
import com.codescout.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one review as an explicit state machine:
 * {@code INIT -> SEEDED -> EXPLORING -> TERMINATED_*}.
 * <p>
 * The engine is stateless, so the whole conversation is resubmitted on every
 * turn. Whatever terminal state is reached, a named session is persisted before
 * its lease is released and a {@link ReviewResult} is returned. Reviews without
 * a session name run on a throwaway session.
 */
@Service
public class ReviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    static final String BOUND_REACHED_MESSAGE =
            "{\"error\":\"bound_reached\",\"message\":\"exploration limit reached; no further tool calls will be executed\"}";

    private static final List<ToolSpec> TOOL_SPECS = Arrays.stream(NavigationOperation.values())
            .map(NavigationOperation::toToolSpec)
            .toList();

    private final CodebaseIndexer indexer;
    private final ReasoningEngine engine;
    private final SessionStore sessionStore;
    private final RateLimiterRegistry rateLimiter;
    private final ReviewPromptBuilder promptBuilder;
    private final ReviewMetrics metrics;
    private final ReviewProperties reviewProperties;
    private final SessionProperties sessionProperties;
    private final NavigationProperties navigationProperties;
    private final EngineProperties engineProperties;
    private final Clock clock;

    private final Map<Path, CachedIndex> indexCache = new ConcurrentHashMap<>();
    private final AtomicLong indexUses = new AtomicLong();

    private record CachedIndex(CodebaseIndex index, long lastUse) {
    }

    public ReviewOrchestrator(CodebaseIndexer indexer,
                              ReasoningEngine engine,
                              SessionStore sessionStore,
                              RateLimiterRegistry rateLimiter,
                              ReviewPromptBuilder promptBuilder,
                              ReviewMetrics metrics,
                              ReviewProperties reviewProperties,
                              SessionProperties sessionProperties,
                              NavigationProperties navigationProperties,
                              EngineProperties engineProperties) {
        this(indexer, engine, sessionStore, rateLimiter, promptBuilder, metrics,
                reviewProperties, sessionProperties, navigationProperties, engineProperties, Clock.systemUTC());
    }

    ReviewOrchestrator(CodebaseIndexer indexer,
                       ReasoningEngine engine,
                       SessionStore sessionStore,
                       RateLimiterRegistry rateLimiter,
                       ReviewPromptBuilder promptBuilder,
                       ReviewMetrics metrics,
                       ReviewProperties reviewProperties,
                       SessionProperties sessionProperties,
                       NavigationProperties navigationProperties,
                       EngineProperties engineProperties,
                       Clock clock) {
        this.indexer = indexer;
        this.engine = engine;
        this.sessionStore = sessionStore;
        this.rateLimiter = rateLimiter;
        this.promptBuilder = promptBuilder;
        this.metrics = metrics;
        this.reviewProperties = reviewProperties;
        this.sessionProperties = sessionProperties;
        this.navigationProperties = navigationProperties;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    public ReviewResult review(ReviewRequest request) {
        return review(request, new ReviewCancellation());
    }

    /**
     * Runs a review to completion.
     *
     * @throws InvalidProjectRootException if the root is missing or not allowed
     * @throws com.codescout.core.session.SessionBusyException if another review holds the session
     */
    public ReviewResult review(ReviewRequest request, ReviewCancellation cancellation) {
        String reviewId = UUID.randomUUID().toString();
        Path root = validateRoot(request.projectRoot());
        ExplorationBounds bounds = boundsFor(request);
        boolean oneOff = request.sessionName() == null || request.sessionName().isBlank();
        String sessionName = oneOff ? "REV-" + reviewId.substring(0, 8) : request.sessionName().strip();

        MdcContext.setReview(reviewId, sessionName, root.toString());
        try {
            if (oneOff) {
                // nobody can resume an unnamed review, so it is neither leased nor stored
                return run(reviewId, Session.create(sessionName, root.toString(), clock.instant()),
                        false, false, root, request, bounds, cancellation);
            }
            try (SessionLease lease = sessionStore.lease(sessionName, root.toString(), sessionProperties.getLockTimeout())) {
                log.debug("Acquired lease on session {}", lease.key().name());
                Session prior = sessionStore.load(sessionName, root.toString()).orElse(null);
                boolean continued = prior != null && prior.iterationCount() > 0;
                Session session = prior != null ? prior : sessionStore.create(sessionName, root.toString());
                return run(reviewId, session, continued, true, root, request, bounds, cancellation);
            }
        } finally {
            MdcContext.clear();
        }
    }

    int cachedIndexCount() {
        return indexCache.size();
    }

    private ReviewResult run(String reviewId, Session session, boolean continued, boolean persistent, Path root,
                             ReviewRequest request, ExplorationBounds bounds, ReviewCancellation cancellation) {
        Instant start = clock.instant();
        ReviewRun run = new ReviewRun(request.model() != null && !request.model().isBlank()
                ? request.model() : engineProperties.getModel());
        log.info("Review {} started on session {} (iteration {}, bounds {})",
                reviewId, session.name(), session.iterationCount() + 1, bounds);

        CodebaseIndex index = null;
        NavigationTools tools = null;
        String answer = null;
        ReviewError error = null;
        try {
            index = indexFor(root, request);
            tools = new NavigationTools(index, new SandboxedFileAccessor(root), navigationProperties);
            String system = promptBuilder.systemPrompt(request.showAll());
            run.conversation.add(ConversationMessage.user(
                    promptBuilder.seedContext(request, index, continued ? session : null, start)));
            run.state = ReviewState.SEEDED;

            answer = explore(run, system, tools, bounds, start, cancellation);
        } catch (CodescoutException e) {
            error = new ReviewError(e.kind(), e.getMessage());
            log.warn("Review {} failed ({}): {}", reviewId, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            error = new ReviewError("internal_error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("Review {} failed unexpectedly", reviewId, e);
        }
        if (error != null) {
            run.state = ReviewState.TERMINATED_ERROR;
        }

        Instant end = clock.instant();
        Integer issueCount = answer != null ? ReviewPromptBuilder.countIssues(answer) : null;
        Session updated = session.afterReview(run.conversation,
                tools != null ? tools.trace().entries() : List.of(),
                run.tokenEstimate(), issueCount, end, sessionProperties.getMaxStoredMessages());
        if (persistent) {
            sessionStore.save(updated);
        }

        Duration elapsed = Duration.between(start, end);
        metrics.recordReviewResult(run.state.name());
        metrics.recordReviewDuration(elapsed);
        log.info("Review {} ended {} after {} tool call(s) in {} ms",
                reviewId, run.state, run.toolCalls, elapsed.toMillis());

        SessionInfo info = new SessionInfo(updated.name(), continued ? "continued" : "new",
                updated.iterationCount(), updated.createdAt(), updated.lastUpdated(),
                updated.messageHistory().size(), continued ? session.lastIssueCount() : null);
        return new ReviewResult(reviewId, run.state, answer, error,
                tools != null ? tools.trace().entries() : List.of(),
                tools != null ? tools.trace().summary() : null,
                run.usage, info,
                index != null ? index.stats() : null,
                elapsed.toMillis());
    }

    private String explore(ReviewRun run, String system, NavigationTools tools, ExplorationBounds bounds,
                           Instant start, ReviewCancellation cancellation) {
        EngineResponse response = callEngine(run, system, TOOL_SPECS, cancellation);
        run.state = ReviewState.EXPLORING;

        while (response.hasToolCalls()) {
            run.conversation.add(ConversationMessage.assistant(response.text(), response.toolCalls()));
            boolean boundReached = false;
            for (ToolCallRequest call : response.toolCalls()) {
                if (boundReached || crossesBound(call, tools, bounds, run, start)) {
                    boundReached = true;
                    metrics.recordToolCall(call.name(), ToolOutcome.BOUND_REACHED.tag());
                    run.conversation.add(ConversationMessage.tool(call, BOUND_REACHED_MESSAGE));
                    continue;
                }
                ToolResult result = tools.execute(call.name(), call.arguments());
                run.toolCalls++;
                log.debug("Tool {} -> {} ({} chars)", call.name(), result.outcome().tag(), result.size());
                metrics.recordToolCall(call.name(), result.outcome().tag());
                run.conversation.add(ConversationMessage.tool(call, result.content()));
            }

            if (boundReached) {
                run.state = ReviewState.TERMINATED_BOUND;
                log.info("Exploration bound reached after {} tool call(s), requesting summary", run.toolCalls);
                run.conversation.add(ConversationMessage.user(ReviewPromptBuilder.FINAL_SUMMARY_INSTRUCTION));
                EngineResponse summary = callEngine(run, system, List.of(), cancellation);
                run.conversation.add(ConversationMessage.assistant(summary.text(), List.of()));
                return summary.text();
            }
            response = callEngine(run, system, TOOL_SPECS, cancellation);
        }

        run.conversation.add(ConversationMessage.assistant(response.text(), List.of()));
        run.state = ReviewState.TERMINATED_NORMAL;
        return response.text();
    }

    private boolean crossesBound(ToolCallRequest call, NavigationTools tools, ExplorationBounds bounds,
                                 ReviewRun run, Instant start) {
        if (run.toolCalls >= bounds.maxToolCalls()) {
            return true;
        }
        if (Duration.between(start, clock.instant()).compareTo(bounds.maxDuration()) >= 0) {
            return true;
        }
        return tools.wouldReadNewFile(call.name(), call.arguments())
                && tools.filesRead().size() >= bounds.maxDistinctFiles();
    }

    private EngineResponse callEngine(ReviewRun run, String system, List<ToolSpec> toolSpecs,
                                      ReviewCancellation cancellation) {
        if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new ReviewCancelledException("Review cancelled by caller");
        }
        try {
            rateLimiter.acquire(run.model);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReviewCancelledException("Review interrupted while waiting for the rate limiter");
        }
        EngineResponse response = engine.respond(new EngineRequest(run.model, system, run.conversation, toolSpecs));
        run.usage = run.usage.plus(response.usage());
        return response;
    }

    /**
     * Builds or refreshes the root's index atomically, so concurrent reviews of
     * one root apply their changed files one after the other.
     */
    private CodebaseIndex indexFor(Path root, ReviewRequest request) {
        CachedIndex entry = indexCache.compute(root, (key, cached) -> new CachedIndex(
                cached == null ? indexer.build(key) : indexer.update(cached.index(), request.allChangedPaths()),
                indexUses.incrementAndGet()));
        evictLeastRecentlyUsed(root);
        return entry.index();
    }

    private void evictLeastRecentlyUsed(Path keep) {
        int capacity = Math.max(1, reviewProperties.getIndexCacheSize());
        while (indexCache.size() > capacity) {
            Path oldest = null;
            long oldestUse = Long.MAX_VALUE;
            for (Map.Entry<Path, CachedIndex> entry : indexCache.entrySet()) {
                if (!entry.getKey().equals(keep) && entry.getValue().lastUse() < oldestUse) {
                    oldest = entry.getKey();
                    oldestUse = entry.getValue().lastUse();
                }
            }
            if (oldest == null) {
                return;
            }
            indexCache.remove(oldest);
            log.debug("Evicted cached index of {}", oldest);
        }
    }

    private ExplorationBounds boundsFor(ReviewRequest request) {
        ExplorationBounds defaults = reviewProperties.defaultBounds();
        ReviewRequest.BoundsOverride override = request.bounds();
        if (override == null) {
            return defaults;
        }
        return defaults.withOverrides(override.maxToolCalls(),
                override.maxDurationSeconds() != null ? Duration.ofSeconds(override.maxDurationSeconds()) : null,
                override.maxDistinctFiles());
    }

    Path validateRoot(Path projectRoot) {
        if (projectRoot == null || !Files.isDirectory(projectRoot)) {
            throw new InvalidProjectRootException("Project root is not a directory: " + projectRoot);
        }
        Path canonical;
        try {
            canonical = projectRoot.toRealPath();
        } catch (IOException e) {
            throw new InvalidProjectRootException("Cannot resolve project root " + projectRoot + ": " + e.getMessage());
        }
        List<String> allowed = reviewProperties.getAllowedRoots();
        if (allowed.isEmpty()) {
            return canonical;
        }
        for (String candidate : allowed) {
            Path allowedRoot = Paths.get(candidate).toAbsolutePath().normalize();
            try {
                if (Files.exists(allowedRoot)) {
                    allowedRoot = allowedRoot.toRealPath();
                }
            } catch (IOException e) {
                log.debug("Cannot canonicalize allowed root {}: {}", candidate, e.getMessage());
            }
            if (canonical.startsWith(allowedRoot)) {
                return canonical;
            }
        }
        throw new InvalidProjectRootException("Project root " + canonical + " is outside the allowed roots");
    }

    /**
     * Mutable bookkeeping of a single review.
     */
    private static final class ReviewRun {
        final String model;
        final List<ConversationMessage> conversation = new ArrayList<>();
        ReviewState state = ReviewState.INIT;
        TokenUsage usage = TokenUsage.ZERO;
        int toolCalls;

        ReviewRun(String model) {
            this.model = model;
        }

        long tokenEstimate() {
            if (usage.totalTokens() > 0) {
                return usage.totalTokens();
            }
            long chars = 0;
            for (ConversationMessage message : conversation) {
                chars += message.content() != null ? message.content().length() : 0;
            }
            return chars / 4;
        }
    }
}
