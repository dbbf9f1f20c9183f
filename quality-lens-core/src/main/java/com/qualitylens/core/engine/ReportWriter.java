package com.qualitylens.core.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.qualitylens.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes analysis results to JSON for report renderers and other consumers.
 *
 * <p>Field names follow the record annotations ({@code rule}, {@code class},
 * {@code method}); absent optional fields are omitted.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Serializes a project result.
     *
     * @param result project result
     * @return pretty-printed JSON
     */
    public String toJson(ProjectAnalysisResult result) {
        return write(result);
    }

    /**
     * Serializes the findings of one file.
     *
     * @param findings findings
     * @return pretty-printed JSON array
     */
    public String toJson(List<Finding> findings) {
        return write(findings);
    }

    /**
     * Writes a project result to a file, creating parent directories.
     *
     * @param result project result
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    public void write(ProjectAnalysisResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(result));
        log.info("Wrote report with {} violations and {} findings", result.violations().size(), result.totalFindings());
    }

    private static String write(Object value) {
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize analysis result", e);
        }
    }
}
