package org.symforge.api;

import org.symforge.model.functions.AddressRange;

import java.util.List;

/**
 * A function with its address ranges and variables.
 *
 * @param ranges The module-relative ranges, primary range first.
 */
public record FunctionInfo(long id, String name, String qualifiedName, long returnTypeId, List<AddressRange> ranges,
                           List<Long> parameterIds, List<Long> localIds) {

    public FunctionInfo {
        ranges = List.copyOf(ranges);
        parameterIds = List.copyOf(parameterIds);
        localIds = List.copyOf(localIds);
    }
}
