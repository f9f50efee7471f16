package com.archivedata.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised once every selected partition has finished, when at least one of them failed.
 * Each partition failure is also attached as a suppressed exception.
 */
@Getter
public class ExportFailedException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    private final transient List<PartitionExportException> failures;

    public ExportFailedException(List<PartitionExportException> failures) {
        super(failures.size() + " partition(s) failed to export: "
                + failures.stream()
                        .map(f -> String.valueOf(f.getPartitionIndex()))
                        .collect(Collectors.joining(", ")));
        this.failures = List.copyOf(failures);
        failures.forEach(this::addSuppressed);
    }
}
