package com.testconductor.core;

import com.testconductor.browser.BrowserException;
import com.testconductor.browser.BrowserPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes screenshots under the configured screenshots directory.
 *
 * Evidence only: a capture or write failure is logged at WARN and reported as an
 * empty result, never as an exception, so it cannot change a step's outcome.
 */
public class ScreenshotStore {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotStore.class);

    private final Path          directory;
    private final AtomicInteger sequence = new AtomicInteger();

    public ScreenshotStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() { return directory; }

    /**
     * Captures {@code page} and writes it as {@code name} (".png" appended when
     * missing). A null or blank name gets a generated one.
     *
     * @return the file written, or empty if nothing was saved
     */
    public Optional<Path> capture(BrowserPage page, String name, boolean fullPage) {
        byte[] png;
        try {
            png = page.screenshot(fullPage);
        } catch (BrowserException e) {
            log.warn("ScreenshotStore: Could not capture screenshot '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
        return save(name, png);
    }

    public Optional<Path> save(String name, byte[] png) {
        Path target = directory.resolve(fileName(name));
        try {
            Files.createDirectories(directory);
            Files.write(target, png);
            log.debug("ScreenshotStore: saved {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("ScreenshotStore: Could not write {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }

    String fileName(String name) {
        String base = (name == null || name.isBlank())
            ? "screenshot-" + System.currentTimeMillis() + "-" + sequence.incrementAndGet()
            : name.trim().replaceAll("[\\\\/:*?\"<>|]", "_");
        return base.endsWith(".png") ? base : base + ".png";
    }
}
