package com.phillippitts.parlcorpus.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Whole-file replacement through a staged temporary file.
 *
 * <p>Readers of the target see either the previous content or the complete new content, never
 * a partly written file. The temporary file lives next to the target so the final move stays on
 * one file system.
 */
public final class AtomicFiles {

    private AtomicFiles() {
        // Utility class - prevent instantiation
    }

    /**
     * Writes {@code lines} (UTF-8, one per line) to a temporary file beside {@code file} and moves
     * it over {@code file}. The temporary file is removed when writing fails.
     *
     * @param file  target file; its directory is created if needed
     * @param lines content
     * @throws IOException if staging or the move fails
     */
    public static void writeLines(Path file, Iterable<? extends CharSequence> lines) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = stage(dir, file.getFileName().toString(), lines);
        moveReplacing(tmp, file);
    }

    /**
     * Writes {@code lines} to a new temporary file in {@code dir} named after {@code name}.
     *
     * @return the staged file, to be moved into place with {@link #moveReplacing(Path, Path)}
     */
    public static Path stage(Path dir, String name, Iterable<? extends CharSequence> lines) throws IOException {
        Path tmp = Files.createTempFile(dir, "." + name + "-", ".tmp");
        try {
            Files.write(tmp, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw e;
        }
        return tmp;
    }

    /**
     * Moves {@code from} over {@code to}, atomically where the file system supports it.
     */
    public static void moveReplacing(Path from, Path to) throws IOException {
        try {
            try {
                Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(from, e);
            throw e;
        }
    }

    /**
     * Deletes a staged file; a failure is attached to {@code cause} as suppressed.
     */
    public static void deleteQuietly(Path staged, IOException cause) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
        }
    }
}
