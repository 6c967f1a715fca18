package de.mirkosertic.gitwebdiff.diff;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads both sides of a file pair from the difftool directories.
 */
public class FileContentReader {

    private static final Logger logger = LoggerFactory.getLogger(FileContentReader.class);

    public static final int MAX_LINE_LENGTH = 500;

    private static final int BINARY_SNIFF_BYTES = 8000;

    /**
     * @param allowTruncation if true, pairs with lines longer than {@link #MAX_LINE_LENGTH}
     *                        are reported as truncated instead of returning their content
     */
    public FileContents read(final FilePair pair, final boolean allowTruncation) {
        if (allowTruncation) {
            final LongLines longA = longLines(textOrNull(pair.aPath()));
            final LongLines longB = longLines(textOrNull(pair.bPath()));
            if (longA.lines() > 0 || longB.lines() > 0) {
                return FileContents.withLongLines(longA.lines() + longB.lines(), longA.bytesOver() + longB.bytesOver());
            }
        }
        return FileContents.of(describe(pair.aPath()), describe(pair.bPath()));
    }

    /**
     * Text of the file, a placeholder for binary files, or the read error.
     */
    private static @Nullable String describe(final @Nullable Path file) {
        if (file == null) {
            return null;
        }
        try {
            if (isBinary(file)) {
                return "Binary file (" + Files.size(file) + " bytes)";
            }
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            logger.warn("Cannot read {}: {}", file, e.toString());
            return "Error reading file: " + e.getMessage();
        }
    }

    private static @Nullable String textOrNull(final @Nullable Path file) {
        if (file == null) {
            return null;
        }
        try {
            return isBinary(file) ? null : Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            // Reported by describe() when the content is read
            logger.debug("Skipping line length check for {}: {}", file, e.toString());
            return null;
        }
    }

    /**
     * A NUL byte near the start marks a file as binary, the same heuristic git uses.
     */
    static boolean isBinary(final Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            final byte[] head = in.readNBytes(BINARY_SNIFF_BYTES);
            for (final byte b : head) {
                if (b == 0) {
                    return true;
                }
            }
            return false;
        }
    }

    static LongLines longLines(final @Nullable String content) {
        if (content == null || content.isEmpty()) {
            return new LongLines(0, 0);
        }
        int lines = 0;
        long bytesOver = 0;
        for (final String line : content.split("\n", -1)) {
            if (line.length() > MAX_LINE_LENGTH) {
                lines++;
                bytesOver += line.length() - MAX_LINE_LENGTH;
            }
        }
        return new LongLines(lines, bytesOver);
    }

    record LongLines(int lines, long bytesOver) {
    }
}
