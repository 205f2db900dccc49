package com.affiliation.linkage.io;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stage outputs are written under a {@code .partial} name and renamed once complete,
 * so an aborted stage never leaves a file that looks finished.
 */
public final class PartialFile {

    public static final String SUFFIX = ".partial";

    private PartialFile() {
        // Utility class
    }

    public static Path partialOf(Path target) {
        return target.resolveSibling(target.getFileName() + SUFFIX);
    }

    public static boolean isPartial(Path path) {
        return path.getFileName().toString().endsWith(SUFFIX);
    }

    /**
     * Renames a completed partial file to its final name, replacing any previous output.
     */
    public static void commit(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
