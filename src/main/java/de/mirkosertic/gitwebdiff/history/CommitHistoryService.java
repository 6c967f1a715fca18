package de.mirkosertic.gitwebdiff.history;

import de.mirkosertic.gitwebdiff.difftool.GitHistoryCommands;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Pages through the commit history of a repository so the client can pick revisions to compare.
 */
public class CommitHistoryService {

    private static final Logger logger = LoggerFactory.getLogger(CommitHistoryService.class);

    public static final int DEFAULT_LIMIT = 50;

    private final GitHistoryCommands commands;
    private final Duration timeout;
    private final Clock clock;

    public CommitHistoryService(final GitHistoryCommands commands, final Duration timeout) {
        this(commands, timeout, Clock.systemUTC());
    }

    CommitHistoryService(final GitHistoryCommands commands, final Duration timeout, final Clock clock) {
        this.commands = commands;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Read up to {@code limit} commits after skipping the newest {@code offset}.
     *
     * @throws IllegalArgumentException if limit or offset is negative
     * @throws IOException if git log fails or times out
     */
    public CommitPage readPage(final Path repo, final int limit, final int offset)
            throws IOException, InterruptedException {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }

        final @Nullable String branch;
        final List<String> lines;
        try {
            branch = commands.currentBranch(repo, timeout);
            // One extra line tells whether there is another page
            lines = commands.log(repo, limit + 1, offset, timeout);
        } catch (final TimeoutException e) {
            logger.warn("Reading history of {} timed out: {}", repo, e.getMessage());
            throw new IOException("git log timed out", e);
        }

        final List<Commit> commits = new ArrayList<>();
        for (final String line : lines.subList(0, Math.min(limit, lines.size()))) {
            final Commit commit = parse(line);
            if (commit != null) {
                commits.add(commit);
            }
        }
        return new CommitPage(commits, lines.size() > limit, branch);
    }

    private @Nullable Commit parse(final String line) {
        final String[] parts = line.split("\\|", 5);
        if (parts.length < 5) {
            logger.debug("Skipping malformed log line: {}", line);
            return null;
        }
        // The subject may contain '|', so it is everything between short hash and the last two fields
        final int authorEnd = line.lastIndexOf('|');
        final int subjectEnd = line.lastIndexOf('|', authorEnd - 1);
        final int subjectStart = parts[0].length() + parts[1].length() + 2;
        if (subjectEnd < subjectStart) {
            return null;
        }
        final String message = line.substring(subjectStart, subjectEnd);
        final String author = line.substring(subjectEnd + 1, authorEnd);
        final String date = line.substring(authorEnd + 1);
        return new Commit(parts[0], parts[1], message, author, date, relativeAge(date));
    }

    /**
     * Coarse age of an ISO 8601 timestamp, e.g. {@code 2y ago}, {@code 5h ago} or {@code just now}.
     * Unparsable dates fall back to their date part.
     */
    String relativeAge(final String isoDate) {
        final OffsetDateTime date;
        try {
            date = OffsetDateTime.parse(isoDate);
        } catch (final DateTimeParseException e) {
            return isoDate.length() > 10 ? isoDate.substring(0, 10) : isoDate;
        }
        final Duration age = Duration.between(date.toInstant(), clock.instant());
        if (age.isNegative()) {
            return "just now";
        }
        final long days = age.toDays();
        final long secondsOfDay = age.minusDays(days).getSeconds();
        if (days > 365) {
            return days / 365 + "y ago";
        }
        if (days > 30) {
            return days / 30 + "mo ago";
        }
        if (days > 0) {
            return days + "d ago";
        }
        if (secondsOfDay > 3600) {
            return secondsOfDay / 3600 + "h ago";
        }
        if (secondsOfDay > 60) {
            return secondsOfDay / 60 + "m ago";
        }
        return "just now";
    }
}
