package com.archivedata.partition;

import com.archivedata.model.PartitionFile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes partition files as pretty-printed JSON.
 */
@Slf4j
public class PartitionFileStore {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public void write(PartitionFile partitionFile, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), partitionFile);
        log.info("Wrote {} partitions to {}", partitionFile.getPartitions().size(), path);
    }

    public PartitionFile read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Partition file not found: " + path);
        }
        PartitionFile partitionFile = objectMapper.readValue(path.toFile(), PartitionFile.class);
        log.info("Read {} partitions of {} from {}", partitionFile.getPartitions().size(),
                partitionFile.getIndexName(), path);
        return partitionFile;
    }
}
