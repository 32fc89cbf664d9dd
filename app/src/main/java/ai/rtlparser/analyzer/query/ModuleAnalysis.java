package ai.rtlparser.analyzer.query;

import ai.rtlparser.analyzer.model.Instance;
import ai.rtlparser.analyzer.model.Parameter;
import ai.rtlparser.analyzer.model.Port;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Facets of one module. Identity fields are always present; the rest are empty unless their facet
 * was requested.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record ModuleAnalysis(String name,
                             String file,
                             int line,
                             Optional<List<Port>> ports,
                             Optional<PortSummary> portSummary,
                             Optional<List<Parameter>> parameters,
                             Optional<List<Instance>> instances,
                             Optional<List<String>> instantiates,
                             Optional<List<String>> instantiatedIn) {

    public ModuleAnalysis {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(file, "file");
        ports = ports == null ? Optional.empty() : ports.map(List::copyOf);
        portSummary = portSummary == null ? Optional.empty() : portSummary;
        parameters = parameters == null ? Optional.empty() : parameters.map(List::copyOf);
        instances = instances == null ? Optional.empty() : instances.map(List::copyOf);
        instantiates = instantiates == null ? Optional.empty() : instantiates.map(List::copyOf);
        instantiatedIn = instantiatedIn == null ? Optional.empty() : instantiatedIn.map(List::copyOf);
    }
}
