package de.mirkosertic.gitwebdiff.difftool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Extracts the difftool wrapper script from the classpath into an executable file.
 * git needs a real path for {@code difftool -x}.
 */
public final class DifftoolWrapperScript {

    private static final Logger logger = LoggerFactory.getLogger(DifftoolWrapperScript.class);

    static final String RESOURCE = "difftool-wrapper.sh";

    private DifftoolWrapperScript() {
    }

    /**
     * Write the wrapper into {@code directory} and mark it executable.
     *
     * @return path of the installed script
     */
    public static Path install(final Path directory) throws IOException {
        Files.createDirectories(directory);
        final Path target = directory.resolve(RESOURCE);

        try (final InputStream in = DifftoolWrapperScript.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException(RESOURCE + " not found on classpath");
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }

        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rwxr-xr-x"));
        } else if (!target.toFile().setExecutable(true)) {
            logger.warn("Could not mark {} as executable", target);
        }

        logger.debug("Installed difftool wrapper at {}", target);
        return target;
    }

    /**
     * Install into a fresh temporary directory that is removed when the JVM exits.
     */
    public static Path installTemporary() throws IOException {
        final Path directory = Files.createTempDirectory("gitwebdiff-");
        final Path script = install(directory);
        script.toFile().deleteOnExit();
        directory.toFile().deleteOnExit();
        return script;
    }
}
