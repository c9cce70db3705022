package ai.algovision.analyzer.csharp;

import ai.algovision.analyzer.CommonTreeSitterNodeTypes;

/** Constants for C# tree-sitter node type names. */
public final class CSharpTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String BLOCK = CommonTreeSitterNodeTypes.BLOCK;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String IF_STATEMENT = CommonTreeSitterNodeTypes.IF_STATEMENT;
    public static final String WHILE_STATEMENT = CommonTreeSitterNodeTypes.WHILE_STATEMENT;
    public static final String FOR_STATEMENT = CommonTreeSitterNodeTypes.FOR_STATEMENT;
    public static final String TRY_STATEMENT = CommonTreeSitterNodeTypes.TRY_STATEMENT;
    public static final String RETURN_STATEMENT = CommonTreeSitterNodeTypes.RETURN_STATEMENT;
    public static final String BREAK_STATEMENT = CommonTreeSitterNodeTypes.BREAK_STATEMENT;
    public static final String CONTINUE_STATEMENT = CommonTreeSitterNodeTypes.CONTINUE_STATEMENT;
    public static final String FINALLY_CLAUSE = CommonTreeSitterNodeTypes.FINALLY_CLAUSE;

    // ===== C#-SPECIFIC TYPES =====
    // Declarations
    public static final String NAMESPACE_DECLARATION = "namespace_declaration";
    public static final String FILE_SCOPED_NAMESPACE_DECLARATION = "file_scoped_namespace_declaration";
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String RECORD_DECLARATION = "record_declaration";
    public static final String STRUCT_DECLARATION = "struct_declaration";
    public static final String RECORD_STRUCT_DECLARATION = "record_struct_declaration";
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String CONSTRUCTOR_DECLARATION = "constructor_declaration";
    public static final String LOCAL_FUNCTION_STATEMENT = "local_function_statement";

    // Declaration parts
    public static final String MODIFIER = "modifier";
    public static final String BASE_LIST = "base_list";
    public static final String QUALIFIED_NAME = "qualified_name";
    public static final String GENERIC_NAME = "generic_name";
    public static final String TYPE_PARAMETER_LIST = "type_parameter_list";
    public static final String TYPE_PARAMETER = "type_parameter";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER = "parameter";
    public static final String ARROW_EXPRESSION_CLAUSE = "arrow_expression_clause";

    // Control flow
    public static final String DO_STATEMENT = "do_statement";
    public static final String FOREACH_STATEMENT = "foreach_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String SWITCH_BODY = "switch_body";
    public static final String SWITCH_SECTION = "switch_section";
    public static final String CASE_SWITCH_LABEL = "case_switch_label";
    public static final String CASE_PATTERN_SWITCH_LABEL = "case_pattern_switch_label";
    public static final String DEFAULT_SWITCH_LABEL = "default_switch_label";
    public static final String WHEN_CLAUSE = "when_clause";
    public static final String GOTO_STATEMENT = "goto_statement";
    public static final String LABELED_STATEMENT = "labeled_statement";
    public static final String THROW_STATEMENT = "throw_statement";
    public static final String YIELD_STATEMENT = "yield_statement";
    public static final String CATCH_CLAUSE = "catch_clause";
    public static final String USING_STATEMENT = "using_statement";
    public static final String LOCK_STATEMENT = "lock_statement";
    public static final String FIXED_STATEMENT = "fixed_statement";
    public static final String CHECKED_STATEMENT = "checked_statement";
    public static final String UNSAFE_STATEMENT = "unsafe_statement";
    public static final String SWITCH_EXPRESSION = "switch_expression";

    // Imports and calls
    public static final String USING_DIRECTIVE = "using_directive";
    public static final String INVOCATION_EXPRESSION = "invocation_expression";

    // Field names
    public static final String FIELD_INITIALIZER = "initializer";
    public static final String FIELD_UPDATE = "update";
    public static final String FIELD_TYPE_PARAMETERS = "type_parameters";

    private CSharpTreeSitterNodeTypes() {}
}
