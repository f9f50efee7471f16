package com.archivedata.exporter;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The commands of the archive job.
 */
public enum ArchiveCommand {

    /** Find and print the smallest and largest value of the ordering field. */
    GET_BOUNDS("get-bounds"),

    /** Partition the index between its bounds and write the partition file. */
    PARTITION_INDEX("partition-index"),

    /** Export the documents of a previously written partition file. */
    EXPORT_PARTITIONS("export-partitions");

    private final String commandName;

    ArchiveCommand(String commandName) {
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    /**
     * @throws IllegalArgumentException for an unknown command name
     */
    public static ArchiveCommand fromName(String name) {
        for (ArchiveCommand command : values()) {
            if (command.commandName.equals(name)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unknown command '" + name + "', expected one of " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(ArchiveCommand::getCommandName).collect(Collectors.joining(", "));
    }
}
