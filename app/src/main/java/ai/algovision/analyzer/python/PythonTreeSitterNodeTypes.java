package ai.algovision.analyzer.python;

import ai.algovision.analyzer.CommonTreeSitterNodeTypes;

/** Constants for Python tree-sitter node type names. */
public final class PythonTreeSitterNodeTypes {

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

    // ===== PYTHON-SPECIFIC TYPES =====
    // Declarations
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";

    // Parameters
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";

    // Base classes
    public static final String ATTRIBUTE = "attribute";
    public static final String DOTTED_NAME = "dotted_name";

    // Control flow
    public static final String ELIF_CLAUSE = "elif_clause";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String EXCEPT_GROUP_CLAUSE = "except_group_clause";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String RAISE_STATEMENT = "raise_statement";
    public static final String MATCH_STATEMENT = "match_statement";

    // Imports and calls
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String CALL = "call";

    // Field names
    public static final String FIELD_SUPERCLASSES = "superclasses";
    public static final String FIELD_DEFINITION = "definition";

    private PythonTreeSitterNodeTypes() {}
}
