package org.pcfgstego.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Theoretical payload capacity of a grammar.
 *
 * @param maxBits Sum of {@code floor(log2(k))} over every symbol with {@code k >= 2} alternatives.
 * @param bitsPerSymbol The contribution of each counted symbol, in declaration order.
 */
public record CapacityReport(int maxBits, Map<String, Integer> bitsPerSymbol) {
    public CapacityReport {
        bitsPerSymbol = Collections.unmodifiableMap(new LinkedHashMap<>(bitsPerSymbol));
    }
}
