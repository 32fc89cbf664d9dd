package ai.rtlparser.analyzer.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts over the registers returned by a register query.
 *
 * @param flipFlopBits summed width of the flip-flops
 * @param latchBits summed width of the latches
 * @param byModule register count per module, in corpus order
 */
public record RegisterStats(int total,
                            int flipFlops,
                            int latches,
                            long flipFlopBits,
                            long latchBits,
                            Map<String, Integer> byModule) {

    public RegisterStats {
        byModule = byModule == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byModule));
    }
}
