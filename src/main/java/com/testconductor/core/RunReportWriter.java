package com.testconductor.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testconductor.scheduler.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a {@link RunReport} as pretty-printed JSON. Timestamps are ISO-8601
 * strings. The file is written to a temporary sibling and moved into place, so a
 * reader never sees a half-written report.
 */
public class RunReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    private final ObjectMapper mapper;

    public RunReportWriter() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(RunReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(report);
    }

    public void write(RunReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), report);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("RunReportWriter: report written to {}", path);
    }
}
