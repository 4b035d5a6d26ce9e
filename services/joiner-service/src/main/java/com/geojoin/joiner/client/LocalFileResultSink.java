package com.geojoin.joiner.client;

import com.geojoin.joiner.domain.OutputRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

public class LocalFileResultSink implements ResultSink {

    private final Path outputFile;

    public LocalFileResultSink(Path outputFile) {
        this.outputFile = outputFile;
    }

    @Override
    public void flush(List<OutputRecord> records) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                outputFile,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND
            )) {
                for (OutputRecord record : records) {
                    writer.write(record.toLine());
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to append " + records.size() + " records to " + outputFile, e);
        }
    }

    public Path getOutputFile() {
        return outputFile;
    }
}
