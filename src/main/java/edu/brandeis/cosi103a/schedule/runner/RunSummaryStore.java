package edu.brandeis.cosi103a.schedule.runner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes the JSON run summary next to a result file. The file is written
 * atomically to prevent partial writes.
 */
public class RunSummaryStore {

    private final ObjectMapper objectMapper;

    public RunSummaryStore() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Writes {@code <result>.json} and returns its path. */
    public Path write(Path resultFile, RunSummary summary) throws IOException {
        Path target = ResultFiles.summaryFile(resultFile);
        Path temp = ResultFiles.temporaryFile(target);
        objectMapper.writeValue(temp.toFile(), summary);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    /** The summary stored next to {@code resultFile}, if there is one. */
    public Optional<RunSummary> read(Path resultFile) throws IOException {
        Path file = ResultFiles.summaryFile(resultFile);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), RunSummary.class));
    }
}
