package com.di.starnova.load;

import com.di.starnova.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Moves staged table directories to {@code <output>/<table>}, replacing the previous version.
 *
 * <p>Each table is swapped with renames: the previous version is parked, the staged one
 * renamed into place. The swaps stay open in the returned {@link Publication} until it is
 * committed, which drops the parked versions, or rolled back, which restores them. A failure
 * inside {@link #publish} rolls back the tables already swapped before it is rethrown.
 */
@Slf4j
@Component
public class TablePublisher {

    private static final String PREVIOUS_SUFFIX = ".previous";

    private record Swap(Path target, Path parked) {}

    public Publication publish(Path stagingRoot, List<String> tables, Path outputRoot) {
        Publication publication = new Publication();
        try {
            Files.createDirectories(outputRoot);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create output directory " + outputRoot, e);
        }
        for (String table : tables) {
            Path staged = stagingRoot.resolve(table);
            if (!Files.isDirectory(staged)) {
                publication.rollback();
                throw new PersistenceException("Staged table " + table + " is missing at " + staged);
            }
            publication.replace(staged, outputRoot.resolve(table));
        }
        return publication;
    }

    /** Swaps made by one publish, open until {@link #commit()} or {@link #rollback()}. */
    public static final class Publication {

        private final Deque<Swap> done = new ArrayDeque<>();
        private boolean closed;

        private Publication() {}

        /**
         * Renames {@code staged} (a table directory or a single file) to {@code target},
         * parking any previous version. On failure every swap of this publication is undone.
         */
        public void replace(Path staged, Path target) {
            if (closed) {
                throw new IllegalStateException("Publication already closed");
            }
            try {
                Files.createDirectories(target.toAbsolutePath().getParent());
                Path parked = null;
                if (Files.exists(target)) {
                    parked = target.resolveSibling("." + target.getFileName() + PREVIOUS_SUFFIX);
                    FileSystemUtils.deleteRecursively(parked);
                    move(target, parked);
                }
                done.push(new Swap(target, parked));
                move(staged, target);
                log.info("[PUBLISH] {} → {}", staged.getFileName(), target);
            } catch (IOException | RuntimeException e) {
                rollback();
                throw new PersistenceException("Publishing " + target + " failed: " + e.getMessage(), e);
            }
        }

        /** Makes the swaps final by removing the parked previous versions. */
        public void commit() {
            closed = true;
            while (!done.isEmpty()) {
                Swap swap = done.pop();
                if (swap.parked() != null) {
                    try {
                        FileSystemUtils.deleteRecursively(swap.parked());
                    } catch (IOException e) {
                        log.warn("[PUBLISH] Could not remove previous version {}: {}", swap.parked(), e.getMessage());
                    }
                }
            }
        }

        /** Restores every swapped target to its previous version, newest first. */
        public void rollback() {
            closed = true;
            while (!done.isEmpty()) {
                Swap swap = done.pop();
                try {
                    FileSystemUtils.deleteRecursively(swap.target());
                    if (swap.parked() != null) {
                        move(swap.parked(), swap.target());
                    }
                    log.warn("[PUBLISH] Rolled back {}", swap.target());
                } catch (IOException e) {
                    log.error("[PUBLISH] Rollback of {} failed: {}", swap.target(), e.getMessage(), e);
                }
            }
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }
}
