package ai.rtlparser.analyzer.model;

import java.util.List;
import java.util.Objects;

/**
 * Structural record of one module declaration. Every register must already be classified.
 */
public record HdlModule(String name,
                        String file,
                        int line,
                        List<Port> ports,
                        List<Parameter> parameters,
                        List<Signal> signals,
                        List<Register> registers,
                        List<Instance> instances,
                        List<ProceduralBlock> proceduralBlocks,
                        List<AssignmentTarget> continuousAssignments) {

    public HdlModule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(file, "file");
        ports = copy(ports);
        parameters = copy(parameters);
        signals = copy(signals);
        registers = copy(registers);
        instances = copy(instances);
        proceduralBlocks = copy(proceduralBlocks);
        continuousAssignments = copy(continuousAssignments);
        for (Register register : registers) {
            if (!register.kind().isResolved()) {
                throw new IllegalArgumentException("Register " + register.name() + " in module " + name + " is not classified");
            }
        }
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
