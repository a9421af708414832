package com.codescout.dispatch.api;

import com.codescout.core.review.InvalidProjectRootException;
import com.codescout.core.review.ReviewOrchestrator;
import com.codescout.core.review.ReviewRequest;
import com.codescout.core.review.ReviewResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

/**
 * REST controller that runs reviews synchronously.
 */
@RestController
@RequestMapping("/api/v1/reviews")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewOrchestrator orchestrator;

    public ReviewController(ReviewOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * POST /api/v1/reviews: Run a review and return its result.
     * A review that ends in an error state is still a 200: the failure is in the body.
     */
    @PostMapping
    public ResponseEntity<ReviewResult> submitReview(@RequestBody SubmitReviewRequest request) {
        if (request.projectRoot() == null || request.projectRoot().isBlank()) {
            throw new InvalidProjectRootException("project_root is required");
        }
        ReviewRequest.BoundsOverride bounds = null;
        if (request.maxToolCalls() != null || request.maxDurationSeconds() != null
                || request.maxDistinctFiles() != null) {
            bounds = new ReviewRequest.BoundsOverride(
                    request.maxToolCalls(), request.maxDurationSeconds(), request.maxDistinctFiles());
        }
        var reviewRequest = new ReviewRequest(
                Path.of(request.projectRoot()),
                request.sessionName(),
                request.changedFiles(),
                request.diffs(),
                request.showAll(),
                request.designDoc(),
                request.story(),
                request.model(),
                bounds);

        log.info("Review requested for {} (session {})", request.projectRoot(), request.sessionName());
        ReviewResult result = orchestrator.review(reviewRequest);
        return ResponseEntity.ok(result);
    }
}
