package com.codescout.dispatch.cli;

import com.codescout.core.CodescoutException;
import com.codescout.core.review.ReviewOrchestrator;
import com.codescout.core.review.ReviewRequest;
import com.codescout.core.review.ReviewResult;
import com.codescout.core.review.ReviewState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: codescout review &lt;project-root&gt;
 * <p>
 * Runs a review in-process and prints the verdict, navigation summary and
 * token usage. Exits with 1 when the review ends in {@code TERMINATED_ERROR}
 * and with 2 when it cannot start.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Review changed files in a project")
@Component
public class ReviewCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project root directory")
    Path projectRoot;

    @Option(names = {"--session", "-s"}, description = "Session to start or continue")
    String session;

    @Option(names = {"--changed", "-c"}, arity = "1..*", description = "Changed file paths, relative to the root")
    List<String> changed = new ArrayList<>();

    @Option(names = "--added", arity = "1..*", description = "Added file paths, relative to the root")
    List<String> added = new ArrayList<>();

    @Option(names = "--show-all", description = "Report MEDIUM and DEFER findings too")
    boolean showAll;

    @Option(names = "--design-doc", description = "Design document the change must comply with")
    Path designDoc;

    @Option(names = "--story", description = "Story or requirements text for the change")
    String story;

    @Option(names = "--model", description = "Reasoning engine model")
    String model;

    @Option(names = "--max-tool-calls", description = "Maximum tool calls for this review")
    Integer maxToolCalls;

    @Option(names = "--max-duration", description = "Maximum review duration in seconds")
    Integer maxDuration;

    @Option(names = "--max-files", description = "Maximum distinct files read")
    Integer maxFiles;

    private final ReviewOrchestrator orchestrator;

    public ReviewCommand(ReviewOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String designText = null;
        if (designDoc != null) {
            try {
                designText = Files.readString(designDoc);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read design document " + designDoc + ": " + e.getMessage());
                return 2;
            }
        }

        ReviewResult result;
        try {
            result = orchestrator.review(toRequest(designText));
        } catch (CodescoutException e) {
            ConsoleOutput.error("Review could not start (" + e.kind() + "): " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid review options: " + e.getMessage());
            return 2;
        }

        printResult(result);
        return result.state() == ReviewState.TERMINATED_ERROR ? 1 : 0;
    }

    ReviewRequest toRequest(String designText) {
        Map<String, List<String>> changedFiles = new LinkedHashMap<>();
        if (!changed.isEmpty()) {
            changedFiles.put("modified", List.copyOf(changed));
        }
        if (!added.isEmpty()) {
            changedFiles.put("added", List.copyOf(added));
        }
        ReviewRequest.BoundsOverride bounds = maxToolCalls == null && maxDuration == null && maxFiles == null
                ? null
                : new ReviewRequest.BoundsOverride(maxToolCalls, maxDuration, maxFiles);
        return new ReviewRequest(projectRoot, session, changedFiles, Map.of(), showAll,
                designText, story, model, bounds);
    }

    private static void printResult(ReviewResult result) {
        var info = result.session();
        ConsoleOutput.info("Session " + info.name() + " (" + info.status() + ", iteration " + info.iteration() + ")");
        if (info.previousIssueCount() != null) {
            ConsoleOutput.info("Previous review reported " + info.previousIssueCount() + " issue(s)");
        }
        System.out.println();

        if (result.answer() != null) {
            System.out.println(result.answer());
            System.out.println();
        }

        switch (result.state()) {
            case TERMINATED_NORMAL -> ConsoleOutput.success("Review complete");
            case TERMINATED_BOUND -> ConsoleOutput.warn("Exploration limit reached; verdict is a summary");
            case TERMINATED_ERROR -> ConsoleOutput.error("Review failed (" + result.error().kind() + "): "
                    + result.error().message());
            default -> ConsoleOutput.info("Review ended in state " + result.state());
        }

        ConsoleOutput.navigation(result.navigationSummary());
        ConsoleOutput.tokens(result.tokenUsage());
        System.out.println("  Duration: " + ConsoleOutput.formatDuration(result.durationMs()));
    }
}
