package ai.rtlparser.analyzer.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HdlModuleTest {

    @Test
    void rejectsUnclassifiedRegister() {
        Throwable thrown = catchThrowable(() -> new HdlModule("m", "m.v", 1, List.of(), List.of(), List.of(),
                List.of(Register.provisional("q", 1, 2)), List.of(), List.of(), List.of()));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("q")
                .hasMessageContaining("not classified");
    }

    @Test
    void nullCollectionsBecomeEmpty() {
        HdlModule module = new HdlModule("m", "m.v", 1, null, null, null, null, null, null, null);

        assertThat(module.ports()).isEmpty();
        assertThat(module.registers()).isEmpty();
        assertThat(module.continuousAssignments()).isEmpty();
    }

    @Test
    void serializesEnumsAsLowercaseLabels() {
        HdlModule module = new HdlModule("m", "m.v", 1,
                List.of(new Port("clk", PortDirection.INPUT, NetType.WIRE, 1, 1)),
                List.of(new Parameter("W", null, "8", 2, true)),
                List.of(),
                List.of(new Register("q", 4, 3, RegisterKind.FLIP_FLOP)),
                List.of(new Instance("sub", "u_sub", 5, Map.of("a", "q"), Map.of())),
                List.of(new ProceduralBlock("always_ff", BlockKind.SEQUENTIAL, true, List.of("posedge clk"), 4,
                        List.of(new AssignmentTarget("q", 4)))),
                List.of());
        ObjectMapper mapper = ModelJson.newObjectMapper();

        JsonNode json = mapper.valueToTree(module);

        assertThat(json.at("/ports/0/direction").asText()).isEqualTo("input");
        assertThat(json.at("/ports/0/type").asText()).isEqualTo("wire");
        assertThat(json.at("/registers/0/kind").asText()).isEqualTo("flip_flop");
        assertThat(json.at("/proceduralBlocks/0/kind").asText()).isEqualTo("sequential");
        assertThat(json.at("/parameters/0/type").asText()).isEqualTo(Parameter.DEFAULT_TYPE);
        assertThat(json.at("/parameters/0/local").asBoolean()).isTrue();
        assertThat(json.at("/instances/0/connections/a").asText()).isEqualTo("q");
    }

    @Test
    void enumFactoriesAcceptLabelsCaseInsensitively() {
        assertThat(RegisterKind.from("Flip-Flop")).isEqualTo(RegisterKind.FLIP_FLOP);
        assertThat(PortDirection.from(" INOUT ")).isEqualTo(PortDirection.INOUT);
        assertThat(NetType.from("")).isEqualTo(NetType.WIRE);
        assertThat(catchThrowable(() -> BlockKind.from("clocked"))).isInstanceOf(IllegalArgumentException.class);
    }
}
