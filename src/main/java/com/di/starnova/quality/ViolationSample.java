package com.di.starnova.quality;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Comparator;

/** One offending value and the number of rows carrying it. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ViolationSample implements Serializable {

    /** Most frequent first, ties by value. */
    public static final Comparator<ViolationSample> ORDER =
            Comparator.comparingLong(ViolationSample::getCount).reversed()
                    .thenComparing(ViolationSample::getValue);

    private String value;
    private long count;
}
