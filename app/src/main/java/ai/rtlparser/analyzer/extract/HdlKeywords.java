package ai.rtlparser.analyzer.extract;

import java.util.Set;

final class HdlKeywords {

    static final String MODULE = "module";
    static final String MACROMODULE = "macromodule";
    static final String LOCALPARAM = "localparam";
    static final String POSEDGE = "posedge";
    static final String NEGEDGE = "negedge";
    static final String ALWAYS = "always";
    static final String ALWAYS_FF = "always_ff";

    static final Set<String> DIRECTIONS = Set.of("input", "output", "inout");
    static final Set<String> NET_TYPES = Set.of("wire", "reg", "logic");
    static final Set<String> ALWAYS_KEYWORDS = Set.of(ALWAYS, ALWAYS_FF, "always_comb", "always_latch");
    static final Set<String> CLOCK_EDGES = Set.of(POSEDGE, NEGEDGE);
    static final Set<String> PARAMETER_TYPES = Set.of(
            "integer", "int", "logic", "bit", "reg", "real", "realtime", "string", "byte", "shortint", "longint", "time");

    private HdlKeywords() {
    }
}
