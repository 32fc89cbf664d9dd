package ai.rtlparser.analyzer.query;

/**
 * Aggregate counts over the whole corpus.
 *
 * @param files number of distinct files that declare at least one module
 */
public record ProjectStats(int modules,
                           int files,
                           int registers,
                           int flipFlops,
                           int latches,
                           int ports,
                           int inputPorts,
                           int outputPorts,
                           int inoutPorts,
                           int instances,
                           int signals,
                           int parameters) {

    public static ProjectStats empty() {
        return new ProjectStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
