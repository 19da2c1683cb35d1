package io.foreman.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.foreman.api.metrics.WorkflowRecord;
import io.foreman.api.report.StatusReport;
import io.foreman.api.report.StatusWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes the latest status report to a JSON file and appends finished workflow records
 * to a JSON-lines file next to it ({@code status.json} gives {@code status-stream.jsonl}).
 * <p>
 * I/O failures are logged, not thrown.
 */
public class JsonStatusWriter implements StatusWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonStatusWriter.class);

    private final Path statusFile;
    private final Path streamFile;
    private final ObjectMapper objectMapper;
    private BufferedWriter streamWriter;

    public JsonStatusWriter(String statusFile) {
        this(Path.of(statusFile));
    }

    public JsonStatusWriter(Path statusFile) {
        this.statusFile = statusFile;
        this.streamFile = streamPathFor(statusFile);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path statusFile() {
        return statusFile;
    }

    public Path streamFile() {
        return streamFile;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    @Override
    public synchronized void writeStatus(StatusReport report) {
        try {
            objectMapper.writeValue(statusFile.toFile(), report);
            log.debug("Status written to: {}", statusFile.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to write status to {}", statusFile, e);
        }
    }

    @Override
    public synchronized void writeRecord(WorkflowRecord record) {
        try {
            if (streamWriter == null) {
                streamWriter = Files.newBufferedWriter(streamFile,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
            // one record per line, so no indentation here
            streamWriter.write(objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(record));
            streamWriter.newLine();
            streamWriter.flush();
        } catch (IOException e) {
            log.error("Failed to append workflow record {}", record.workflowId(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (streamWriter != null) {
            try {
                streamWriter.close();
            } catch (IOException e) {
                log.error("Failed to close stream writer", e);
            }
            streamWriter = null;
        }
    }

    static Path streamPathFor(Path statusFile) {
        String name = statusFile.getFileName().toString();
        String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return statusFile.resolveSibling(base + "-stream.jsonl");
    }
}
