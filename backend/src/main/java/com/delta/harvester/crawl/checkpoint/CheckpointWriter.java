package com.delta.harvester.crawl.checkpoint;

import com.delta.harvester.crawl.model.RunContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * Writes the full record set as a CSV table and a JSON document.
 *
 * <p>Every write replaces the previous file through a temp file and a move, so readers
 * always see a complete snapshot. Progress snapshots carry a {@code _progress} marker;
 * the final artifact has none.
 */
@Component
public class CheckpointWriter {
    private static final Logger log = LoggerFactory.getLogger(CheckpointWriter.class);

    static final String PROGRESS_MARKER = "_progress";
    static final String DATA_DIRECTORY = "data";
    static final String[] HEADERS = {
        "name", "description", "url", "categories", "founders", "summary", "scraped_at", "enriched_at", "status", "error"
    };

    private final ObjectMapper objectMapper;

    public CheckpointWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<CheckpointFiles> snapshot(RunContext context) {
        return write(context, true);
    }

    public Optional<CheckpointFiles> writeFinal(RunContext context) {
        return write(context, false);
    }

    private Optional<CheckpointFiles> write(RunContext context, boolean progress) {
        List<CompanyRecordRow> rows = context.records().snapshot().stream().map(CompanyRecordRow::from).toList();
        if (rows.isEmpty()) {
            log.info("No records to write for run {}", context.runId());
            return Optional.empty();
        }
        Path dataDirectory = context.outputDirectory().resolve(DATA_DIRECTORY);
        String baseName = context.properties().getOutput().getFilePrefix() + "_" + context.runId()
            + (progress ? PROGRESS_MARKER : "");
        Path csvFile = dataDirectory.resolve(baseName + ".csv");
        Path jsonFile = dataDirectory.resolve(baseName + ".json");
        try {
            Files.createDirectories(dataDirectory);
            writeAtomically(csvFile, writer -> writeCsv(rows, writer));
            writeAtomically(jsonFile, writer -> objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, rows));
        } catch (IOException e) {
            throw new CheckpointException("Failed to write " + baseName + " under " + dataDirectory, e);
        }
        if (progress) {
            log.info("Progress saved: {} records", rows.size());
        } else {
            log.info("Saved {} records to {} and {}", rows.size(), csvFile, jsonFile);
        }
        return Optional.of(new CheckpointFiles(csvFile, jsonFile, rows.size()));
    }

    private void writeCsv(List<CompanyRecordRow> rows, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADERS).build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (CompanyRecordRow row : rows) {
            printer.printRecord(
                row.name(),
                row.description(),
                row.url(),
                String.join(", ", row.categories()),
                objectMapper.writeValueAsString(row.founders()),
                row.summary(),
                row.scrapedAt(),
                row.enrichedAt() == null ? "" : row.enrichedAt(),
                row.status().code(),
                row.error()
            );
        }
        printer.flush();
    }

    private void writeAtomically(Path target, WriterBody body) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                body.write(writer);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @FunctionalInterface
    private interface WriterBody {
        void write(Writer writer) throws IOException;
    }
}
