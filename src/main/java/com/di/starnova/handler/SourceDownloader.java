package com.di.starnova.handler;

import com.di.starnova.config.DataConfig;
import com.di.starnova.exception.SourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Fetches the raw dataset archive when {@code data.url} is set and {@code data.source_path}
 * holds no CSV file yet. Existing files are never re-downloaded.
 */
@Slf4j
@Component
public class SourceDownloader {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    /**
     * @return true when an archive was downloaded and extracted
     * @throws SourceNotFoundException if the download or extraction fails
     */
    public boolean ensureSources(DataConfig config) {
        Path sourceDir = Paths.get(config.getSourcePath()).toAbsolutePath().normalize();
        if (containsCsv(sourceDir)) {
            log.info("[DOWNLOAD] CSV files already present in {}; skipping download", sourceDir);
            return false;
        }
        String url = config.getUrl();
        if (url == null || url.isBlank()) {
            log.debug("[DOWNLOAD] No data.url configured; sources are expected in {}", sourceDir);
            return false;
        }
        Path archive = sourceDir.resolve("dataset.zip");
        try {
            Files.createDirectories(sourceDir);
            log.info("[DOWNLOAD] Downloading {} ...", url);
            HttpRequest request = HttpRequest.newBuilder(URI.create(url.trim())).timeout(TIMEOUT).GET().build();
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(archive));
            if (response.statusCode() / 100 != 2) {
                throw new SourceNotFoundException("Download of " + url + " failed with HTTP " + response.statusCode());
            }
            int extracted = extract(archive, sourceDir);
            log.info("[DOWNLOAD] Extracted {} files into {}", extracted, sourceDir);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceNotFoundException("Download of " + url + " interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceNotFoundException("Download of " + url + " failed: " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(archive);
            } catch (IOException e) {
                log.warn("[DOWNLOAD] Could not delete archive {}: {}", archive, e.getMessage());
            }
        }
    }

    /** Extracts a zip archive into {@code targetDir}; entries escaping the directory are rejected. */
    int extract(Path archive, Path targetDir) throws IOException {
        int count = 0;
        try (InputStream in = Files.newInputStream(archive); ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path target = targetDir.resolve(entry.getName()).normalize();
                if (!target.startsWith(targetDir)) {
                    throw new IOException("Archive entry outside target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                    count++;
                }
            }
        }
        return count;
    }

    static boolean containsCsv(Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.anyMatch(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"));
        } catch (IOException e) {
            throw new SourceNotFoundException("Cannot list source directory " + dir, e);
        }
    }
}
