package ai.rtlparser.analyzer.cli;

import ai.rtlparser.analyzer.query.RegisterKindFilter;
import picocli.CommandLine;

public class RegisterKindFilterConverter implements CommandLine.ITypeConverter<RegisterKindFilter> {
    @Override
    public RegisterKindFilter convert(String value) {
        return RegisterKindFilter.from(value);
    }
}
