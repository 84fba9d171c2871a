package ai.pyperf.analyzer;

import java.util.Set;

/** Node type and field names of the tree-sitter Python grammar used by the extractor and resolver. */
public final class PythonNodeTypes {

    public static final String MODULE = "module";
    public static final String BLOCK = "block";
    public static final String ERROR = "ERROR";
    public static final String COMMENT = "comment";

    // Definitions
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String LAMBDA = "lambda";
    public static final String ASYNC_KEYWORD = "async";

    // Parameters
    public static final String PARAMETERS = "parameters";
    public static final String LAMBDA_PARAMETERS = "lambda_parameters";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";

    // Loops
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String FOR_IN_CLAUSE = "for_in_clause";
    public static final String IF_CLAUSE = "if_clause";
    public static final String LIST_COMPREHENSION = "list_comprehension";
    public static final String SET_COMPREHENSION = "set_comprehension";
    public static final String DICTIONARY_COMPREHENSION = "dictionary_comprehension";
    public static final String GENERATOR_EXPRESSION = "generator_expression";

    public static final Set<String> COMPREHENSIONS =
            Set.of(LIST_COMPREHENSION, SET_COMPREHENSION, DICTIONARY_COMPREHENSION, GENERATOR_EXPRESSION);

    // Statements
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String WILDCARD_IMPORT = "wildcard_import";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String NAMED_EXPRESSION = "named_expression";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String GLOBAL_STATEMENT = "global_statement";
    public static final String NONLOCAL_STATEMENT = "nonlocal_statement";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String AS_PATTERN = "as_pattern";
    public static final String AS_PATTERN_TARGET = "as_pattern_target";
    public static final String PRINT_STATEMENT = "print_statement";
    public static final String EXEC_STATEMENT = "exec_statement";
    public static final Set<String> PYTHON2_STATEMENTS = Set.of(PRINT_STATEMENT, EXEC_STATEMENT);

    // Expressions
    public static final String CALL = "call";
    public static final String IDENTIFIER = "identifier";
    public static final String ATTRIBUTE = "attribute";
    public static final String STRING = "string";
    public static final String STRING_CONTENT = "string_content";
    public static final String CONCATENATED_STRING = "concatenated_string";
    public static final String INTERPOLATION = "interpolation";
    public static final String BINARY_OPERATOR = "binary_operator";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String INTEGER = "integer";
    public static final String FLOAT = "float";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NONE = "none";
    public static final String LIST = "list";
    public static final String DICTIONARY = "dictionary";
    public static final String SET = "set";
    public static final String TUPLE = "tuple";
    public static final String PATTERN_LIST = "pattern_list";
    public static final String TUPLE_PATTERN = "tuple_pattern";
    public static final String LIST_PATTERN = "list_pattern";
    public static final String TYPE = "type";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_RETURN_TYPE = "return_type";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_OPERATOR = "operator";
    public static final String FIELD_CONDITION = "condition";
    public static final String FIELD_ALTERNATIVE = "alternative";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ATTRIBUTE = "attribute";
    public static final String FIELD_MODULE_NAME = "module_name";
    public static final String FIELD_ALIAS = "alias";
    public static final String FIELD_DEFINITION = "definition";
    public static final String FIELD_SUPERCLASSES = "superclasses";

    private PythonNodeTypes() {}
}
