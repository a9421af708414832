package com.codescout.dispatch.cli;

import com.codescout.core.session.SessionBusyException;
import com.codescout.core.session.SessionSort;
import com.codescout.core.session.SessionStore;
import com.codescout.core.session.SessionSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: codescout sessions
 * <p>
 * Lists stored review sessions as a table, or deletes one with {@code --delete}.
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List or delete review sessions")
@Component
public class SessionsCommand implements Callable<Integer> {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());

    @Option(names = {"--project", "-p"}, description = "Only sessions of this project root")
    Path project;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    int limit;

    @Option(names = "--sort", description = "last_updated, created, name or iterations", defaultValue = "last_updated")
    String sort;

    @Option(names = "--delete", description = "Delete the named session (requires --project)")
    String delete;

    private final SessionStore sessionStore;

    public SessionsCommand(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String root = project != null ? canonical(project) : null;

        if (delete != null) {
            if (root == null) {
                ConsoleOutput.error("--delete requires --project");
                return 2;
            }
            try {
                if (sessionStore.delete(delete, root)) {
                    ConsoleOutput.success("Deleted session " + delete);
                    return 0;
                }
            } catch (SessionBusyException e) {
                ConsoleOutput.error("Cannot delete session " + delete + ": " + e.getMessage());
                return 1;
            }
            ConsoleOutput.error("No session " + delete + " for " + root);
            return 1;
        }

        SessionSort order;
        try {
            order = SessionSort.parse(sort);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid sort key: " + sort + ". Valid keys: last_updated, created, name, iterations");
            return 2;
        }

        List<SessionSummary> sessions = sessionStore.list(root, limit, order);
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return 0;
        }

        ConsoleOutput.info("Sessions (" + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-5s %-7s %-17s %s%n", "NAME", "ITER", "ISSUES", "LAST UPDATED", "PROJECT");
        System.out.println("  " + "-".repeat(84));
        for (SessionSummary s : sessions) {
            System.out.printf("  %-24s %-5d %-7s %-17s %s%n",
                    truncate(s.name(), 24), s.iterationCount(),
                    s.lastIssueCount() != null ? s.lastIssueCount().toString() : "-",
                    TIMESTAMP.format(s.lastUpdated()), s.projectRoot());
        }
        return 0;
    }

    private static String canonical(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath().toString();
        } catch (IOException e) {
            return absolute.toString();
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
