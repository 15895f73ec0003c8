package com.di.starnova.load;

import com.di.starnova.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes reports as pretty-printed JSON. The file is written next to its target and moved
 * into place, so readers never see a half-written report.
 */
@Slf4j
@Component
public class ReportWriter {

    public Path write(Object report, Path target) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            JsonSupport.MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), report);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("[PUBLISH] Report written → {}", target);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write report " + target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("[PUBLISH] Could not delete temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }
}
