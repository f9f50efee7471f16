package com.archivedata.export;

import com.archivedata.exception.ConflictingSelectionException;
import com.archivedata.model.Partition;
import com.archivedata.model.PartitionFile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartitionSelectionTest {

    private static PartitionFile planWith(int partitions) {
        List<Partition> list = new ArrayList<>();
        for (int i = 0; i < partitions; i++) {
            list.add(new Partition(i, String.valueOf(i * 10), String.valueOf(i * 10 + 10), 10));
        }
        return PartitionFile.builder().indexName("idx").fieldName("seq").partitions(list).build();
    }

    private static List<Integer> indices(List<Partition> partitions) {
        return partitions.stream().map(Partition::getIndex).toList();
    }

    @Test
    void selectsEverythingByDefault() {
        assertEquals(List.of(0, 1, 2, 3, 4), indices(PartitionSelection.resolve(planWith(5), null, List.of())));
    }

    @Test
    void inclusionListKeepsOnlyListedPartitions() {
        assertEquals(List.of(0, 1), indices(PartitionSelection.resolve(planWith(5), List.of(1, 0), null)));
    }

    @Test
    void exclusionListDropsListedPartitions() {
        assertEquals(List.of(2, 3, 4), indices(PartitionSelection.resolve(planWith(5), List.of(), List.of(0, 1))));
    }

    @Test
    void bothListsConflict() {
        assertThrows(ConflictingSelectionException.class,
                () -> PartitionSelection.resolve(planWith(5), List.of(0), List.of(1)));
    }

    @Test
    void unknownIndicesAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PartitionSelection.resolve(planWith(3), List.of(2, 7), null));
        assertTrue(e.getMessage().contains("7"));
    }
}
