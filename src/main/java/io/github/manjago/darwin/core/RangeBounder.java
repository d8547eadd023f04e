package io.github.manjago.darwin.core;

import java.util.List;

/**
 * Bounder over real-valued vectors that knows the legal range of each allele.
 * Operators such as non-uniform mutation and uniform generation read the range.
 */
public interface RangeBounder extends Bounder<List<Double>> {

    double lowerBound(int index);

    double upperBound(int index);
}
