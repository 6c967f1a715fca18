package de.mirkosertic.gitwebdiff.diff;

import de.mirkosertic.gitwebdiff.difftool.GitDiffCommands;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fingerprints the raw {@code git diff} output of a comparison with SHA-256.
 * Two equal checksums mean git reports the same textual diff.
 */
public class DiffChecksumCalculator {

    private static final Logger logger = LoggerFactory.getLogger(DiffChecksumCalculator.class);

    private final GitDiffCommands commands;
    private final Duration timeout;

    public DiffChecksumCalculator(final GitDiffCommands commands, final Duration timeout) {
        this.commands = commands;
        this.timeout = timeout;
    }

    /**
     * @return hex encoded SHA-256 of the diff output, or {@code null} if git failed or timed out
     */
    public @Nullable String compute(final Path repoPath, final List<String> gitArgs) {
        try {
            final byte[] output = commands.rawDiff(gitArgs, repoPath, timeout);
            return sha256(output);
        } catch (final TimeoutException e) {
            logger.error("git diff command timed out for {}", repoPath);
            return null;
        } catch (final IOException e) {
            logger.warn("Error computing diff checksum for {}: {}", repoPath, e.getMessage());
            return null;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while computing diff checksum for {}", repoPath);
            return null;
        }
    }

    static String sha256(final byte[] content) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Short form for log messages.
     */
    public static String abbreviate(final @Nullable String checksum) {
        if (checksum == null) {
            return "none";
        }
        return checksum.length() > 8 ? checksum.substring(0, 8) : checksum;
    }
}
