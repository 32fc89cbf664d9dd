package ai.rtlparser.analyzer.cli;

import ai.rtlparser.analyzer.cst.DecodeMode;
import picocli.CommandLine;

/**
 * Parses CST decode mode CLI options.
 */
public class DecodeModeConverter implements CommandLine.ITypeConverter<DecodeMode> {
    @Override
    public DecodeMode convert(String value) {
        return DecodeMode.from(value);
    }
}
