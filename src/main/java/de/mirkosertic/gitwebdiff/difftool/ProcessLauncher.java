package de.mirkosertic.gitwebdiff.difftool;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts operating system processes. Every git invocation of the server goes through this seam.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(List<String> command, Path workingDirectory) throws IOException;

    static ProcessLauncher system() {
        return (command, workingDirectory) -> new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .start();
    }
}
