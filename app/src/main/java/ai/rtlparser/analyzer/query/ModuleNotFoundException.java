package ai.rtlparser.analyzer.query;

public class ModuleNotFoundException extends QueryException {

    private final String moduleName;

    public ModuleNotFoundException(String moduleName) {
        super("Module not found: " + moduleName);
        this.moduleName = moduleName;
    }

    public String moduleName() {
        return moduleName;
    }
}
