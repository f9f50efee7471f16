package com.archivedata.bound;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Smallest and largest value of the ordering field, in canonical text form.
 */
@Data
@AllArgsConstructor
public class Bounds {

    private final String lowerBound;
    private final String upperBound;
}
