package com.archivedata.exporter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveCommandTest {

    @Test
    void resolvesCommandNames() {
        assertEquals(ArchiveCommand.GET_BOUNDS, ArchiveCommand.fromName("get-bounds"));
        assertEquals(ArchiveCommand.PARTITION_INDEX, ArchiveCommand.fromName("partition-index"));
        assertEquals(ArchiveCommand.EXPORT_PARTITIONS, ArchiveCommand.fromName("export-partitions"));
    }

    @Test
    void rejectsUnknownCommands() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ArchiveCommand.fromName("export"));
        assertTrue(e.getMessage().contains("get-bounds, partition-index, export-partitions"));
    }
}
