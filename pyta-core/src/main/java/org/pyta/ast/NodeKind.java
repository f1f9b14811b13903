package org.pyta.ast;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed vocabulary of Python {@code ast} node classes understood by the engine.
 *
 * Each kind carries the Python class name used by the parse adapter, its category and
 * whether Python attaches a source position to nodes of this kind.
 */
public enum NodeKind {
    MODULE("Module", Category.MODULE, false),

    // Statements
    FUNCTION_DEF("FunctionDef", Category.STATEMENT, true),
    ASYNC_FUNCTION_DEF("AsyncFunctionDef", Category.STATEMENT, true),
    CLASS_DEF("ClassDef", Category.STATEMENT, true),
    RETURN("Return", Category.STATEMENT, true),
    DELETE("Delete", Category.STATEMENT, true),
    ASSIGN("Assign", Category.STATEMENT, true),
    TYPE_ALIAS("TypeAlias", Category.STATEMENT, true),
    AUG_ASSIGN("AugAssign", Category.STATEMENT, true),
    ANN_ASSIGN("AnnAssign", Category.STATEMENT, true),
    FOR("For", Category.STATEMENT, true),
    ASYNC_FOR("AsyncFor", Category.STATEMENT, true),
    WHILE("While", Category.STATEMENT, true),
    IF("If", Category.STATEMENT, true),
    WITH("With", Category.STATEMENT, true),
    ASYNC_WITH("AsyncWith", Category.STATEMENT, true),
    MATCH("Match", Category.STATEMENT, true),
    RAISE("Raise", Category.STATEMENT, true),
    TRY("Try", Category.STATEMENT, true),
    TRY_STAR("TryStar", Category.STATEMENT, true),
    ASSERT("Assert", Category.STATEMENT, true),
    IMPORT("Import", Category.STATEMENT, true),
    IMPORT_FROM("ImportFrom", Category.STATEMENT, true),
    GLOBAL("Global", Category.STATEMENT, true),
    NONLOCAL("Nonlocal", Category.STATEMENT, true),
    EXPR("Expr", Category.STATEMENT, true),
    PASS("Pass", Category.STATEMENT, true),
    BREAK("Break", Category.STATEMENT, true),
    CONTINUE("Continue", Category.STATEMENT, true),

    // Expressions
    BOOL_OP("BoolOp", Category.EXPRESSION, true),
    NAMED_EXPR("NamedExpr", Category.EXPRESSION, true),
    BIN_OP("BinOp", Category.EXPRESSION, true),
    UNARY_OP("UnaryOp", Category.EXPRESSION, true),
    LAMBDA("Lambda", Category.EXPRESSION, true),
    IF_EXP("IfExp", Category.EXPRESSION, true),
    DICT("Dict", Category.EXPRESSION, true),
    SET("Set", Category.EXPRESSION, true),
    LIST_COMP("ListComp", Category.EXPRESSION, true),
    SET_COMP("SetComp", Category.EXPRESSION, true),
    DICT_COMP("DictComp", Category.EXPRESSION, true),
    GENERATOR_EXP("GeneratorExp", Category.EXPRESSION, true),
    AWAIT("Await", Category.EXPRESSION, true),
    YIELD("Yield", Category.EXPRESSION, true),
    YIELD_FROM("YieldFrom", Category.EXPRESSION, true),
    COMPARE("Compare", Category.EXPRESSION, true),
    CALL("Call", Category.EXPRESSION, true),
    FORMATTED_VALUE("FormattedValue", Category.EXPRESSION, true),
    JOINED_STR("JoinedStr", Category.EXPRESSION, true),
    CONSTANT("Constant", Category.EXPRESSION, true),
    ATTRIBUTE("Attribute", Category.EXPRESSION, true),
    SUBSCRIPT("Subscript", Category.EXPRESSION, true),
    STARRED("Starred", Category.EXPRESSION, true),
    NAME("Name", Category.EXPRESSION, true),
    LIST("List", Category.EXPRESSION, true),
    TUPLE("Tuple", Category.EXPRESSION, true),
    SLICE("Slice", Category.EXPRESSION, true),

    // Helper nodes
    COMPREHENSION("comprehension", Category.HELPER, false),
    EXCEPT_HANDLER("ExceptHandler", Category.HELPER, true),
    ARGUMENTS("arguments", Category.HELPER, false),
    ARG("arg", Category.HELPER, true),
    KEYWORD("keyword", Category.HELPER, false),
    ALIAS("alias", Category.HELPER, false),
    WITH_ITEM("withitem", Category.HELPER, false),
    MATCH_CASE("match_case", Category.HELPER, false),

    // Match patterns
    MATCH_VALUE("MatchValue", Category.PATTERN, true),
    MATCH_SINGLETON("MatchSingleton", Category.PATTERN, true),
    MATCH_SEQUENCE("MatchSequence", Category.PATTERN, true),
    MATCH_MAPPING("MatchMapping", Category.PATTERN, true),
    MATCH_CLASS("MatchClass", Category.PATTERN, true),
    MATCH_STAR("MatchStar", Category.PATTERN, true),
    MATCH_AS("MatchAs", Category.PATTERN, true),
    MATCH_OR("MatchOr", Category.PATTERN, true);

    /** Node category, following the grouping of the Python grammar. */
    public enum Category {
        MODULE,
        STATEMENT,
        EXPRESSION,
        HELPER,
        PATTERN
    }

    private static final Map<String, NodeKind> BY_PYTHON_NAME = Arrays.stream(values())
                                                                       .collect(Collectors.toUnmodifiableMap(NodeKind::pythonName,
                                                                                                             Function.identity()));

    private static final Set<NodeKind> FUNCTIONS = EnumSet.of(FUNCTION_DEF, ASYNC_FUNCTION_DEF);
    private static final Set<NodeKind> LOOPS = EnumSet.of(FOR, ASYNC_FOR, WHILE);
    private static final Set<NodeKind> SCOPES = EnumSet.of(MODULE, FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF, LAMBDA);

    private final String pythonName;
    private final Category category;
    private final boolean positioned;

    NodeKind(String pythonName, Category category, boolean positioned) {
        this.pythonName = pythonName;
        this.category = category;
        this.positioned = positioned;
    }

    public String pythonName() {
        return pythonName;
    }

    public Category category() {
        return category;
    }

    /// Whether Python records a source position for nodes of this kind.
    public boolean positioned() {
        return positioned;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isFunction() {
        return FUNCTIONS.contains(this);
    }

    public boolean isLoop() {
        return LOOPS.contains(this);
    }

    /// Kinds that open a new name scope.
    public boolean isScope() {
        return SCOPES.contains(this);
    }

    /**
     * Look up a kind by its Python class name.
     *
     * @param pythonName class name as reported by Python's {@code ast} module
     * @return the kind, or empty if the name is not part of the vocabulary
     */
    public static Optional<NodeKind> fromPythonName(String pythonName) {
        return Optional.ofNullable(BY_PYTHON_NAME.get(pythonName));
    }
}
