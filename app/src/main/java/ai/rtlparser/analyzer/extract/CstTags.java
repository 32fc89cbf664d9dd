package ai.rtlparser.analyzer.extract;

import java.util.Set;

/**
 * Verible CST tags the extractor walks by.
 */
final class CstTags {

    static final String MODULE_DECLARATION = "kModuleDeclaration";
    static final String MODULE_HEADER = "kModuleHeader";
    static final String PARAM_DECLARATION = "kParamDeclaration";
    static final String PORT_DECLARATION = "kPortDeclaration";
    static final String PACKED_DIMENSIONS = "kPackedDimensions";
    static final String UNPACKED_DIMENSIONS = "kUnpackedDimensions";
    static final String DATA_DECLARATION = "kDataDeclaration";
    static final String NET_DECLARATION = "kNetDeclaration";
    static final String REGISTER_VARIABLE = "kRegisterVariable";
    static final String NET_VARIABLE = "kNetVariable";
    static final String GATE_INSTANCE = "kGateInstance";
    static final String MODULE_INSTANTIATION = "kModuleInstantiation";
    static final String ACTUAL_NAMED_PORT = "kActualNamedPort";
    static final String PARAM_BY_NAME = "kParamByName";
    static final String ALWAYS_STATEMENT = "kAlwaysStatement";
    static final String EVENT_CONTROL = "kEventControl";
    static final String EVENT_EXPRESSION = "kEventExpression";
    static final String CONTINUOUS_ASSIGNMENT = "kContinuousAssignmentStatement";
    static final String NET_VARIABLE_ASSIGNMENT = "kNetVariableAssignment";
    static final String BLOCKING_ASSIGNMENT = "kBlockingAssignmentStatement";
    static final String NONBLOCKING_ASSIGNMENT = "kNonblockingAssignmentStatement";
    static final String LP_VALUE = "kLPValue";

    static final String SYMBOL_IDENTIFIER = "SymbolIdentifier";
    static final String ESCAPED_IDENTIFIER = "EscapedIdentifier";

    static final Set<String> DIMENSIONS = Set.of(PACKED_DIMENSIONS, UNPACKED_DIMENSIONS);
    static final Set<String> ASSIGNMENTS = Set.of(NET_VARIABLE_ASSIGNMENT, BLOCKING_ASSIGNMENT, NONBLOCKING_ASSIGNMENT);
    static final Set<String> DECLARED_VARIABLES = Set.of(REGISTER_VARIABLE, NET_VARIABLE);

    private CstTags() {
    }

    static boolean isIdentifier(String tag) {
        return SYMBOL_IDENTIFIER.equals(tag) || ESCAPED_IDENTIFIER.equals(tag);
    }
}
