package com.archivedata.export;

import com.archivedata.exception.ConflictingSelectionException;
import com.archivedata.model.Partition;
import com.archivedata.model.PartitionFile;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Resolves which partitions of a plan to export: the inclusion list if given, otherwise all
 * partitions minus the exclusion list.
 */
public final class PartitionSelection {

    private PartitionSelection() {
        // utility class
    }

    /**
     * @throws ConflictingSelectionException if both lists are non-empty
     * @throws IllegalArgumentException      if a listed index does not exist in the plan
     */
    public static List<Partition> resolve(PartitionFile partitionFile,
                                          Collection<Integer> include,
                                          Collection<Integer> exclude) {
        boolean hasInclude = include != null && !include.isEmpty();
        boolean hasExclude = exclude != null && !exclude.isEmpty();
        if (hasInclude && hasExclude) {
            throw new ConflictingSelectionException();
        }

        List<Partition> partitions = partitionFile.getPartitions();
        Set<Integer> known = partitions.stream().map(Partition::getIndex).collect(Collectors.toSet());

        if (hasInclude) {
            Set<Integer> wanted = new HashSet<>(include);
            requireKnown(wanted, known);
            return partitions.stream().filter(p -> wanted.contains(p.getIndex())).toList();
        }
        if (hasExclude) {
            Set<Integer> unwanted = new HashSet<>(exclude);
            requireKnown(unwanted, known);
            return partitions.stream().filter(p -> !unwanted.contains(p.getIndex())).toList();
        }
        return List.copyOf(partitions);
    }

    private static void requireKnown(Set<Integer> requested, Set<Integer> known) {
        Set<Integer> unknown = new TreeSet<>(requested);
        unknown.removeAll(known);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown partition indices: " + unknown);
        }
    }
}
