package ai.algovision.analyzer;

/** Tree-sitter node type names shared by the Python and C# grammars. */
public final class CommonTreeSitterNodeTypes {

    // ===== STRUCTURE =====
    public static final String BLOCK = "block";
    public static final String COMMENT = "comment";
    public static final String IDENTIFIER = "identifier";

    // ===== STATEMENTS =====
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String FINALLY_CLAUSE = "finally_clause";

    // ===== FIELD NAMES =====
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_CONDITION = "condition";
    public static final String FIELD_CONSEQUENCE = "consequence";
    public static final String FIELD_ALTERNATIVE = "alternative";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_FUNCTION = "function";

    private CommonTreeSitterNodeTypes() {}
}
