package org.symforge.ranges;

import org.symforge.model.functions.LiveRange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of building parameter ranges for one function.
 *
 * @param functionId The function.
 * @param rangesByParameter The live ranges written to each parameter, keyed by parameter id in declaration order.
 * @param blocks The number of basic blocks the disassembler returned.
 * @param walks The number of block walks performed until the fixed point.
 * @param deferredSplits How often the merge pass had to split conflicting overlaps.
 */
public record RangeBuildReport(long functionId, Map<Long, List<LiveRange>> rangesByParameter, int blocks, int walks,
                               int deferredSplits) {

    public RangeBuildReport {
        rangesByParameter = Collections.unmodifiableMap(new LinkedHashMap<>(rangesByParameter));
    }

    static RangeBuildReport empty(long functionId) {
        return new RangeBuildReport(functionId, Map.of(), 0, 0, 0);
    }

    public List<LiveRange> rangesOf(long parameterId) {
        return rangesByParameter.getOrDefault(parameterId, List.of());
    }
}
