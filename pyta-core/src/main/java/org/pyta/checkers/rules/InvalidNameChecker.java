package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.NameStyle;
import org.pyta.checkers.NodeChecker;
import org.pyta.checkers.Scopes;
import org.pyta.lint.Diagnostic;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * C0103: Names must follow PEP 8 naming conventions.
 *
 * <ul>
 *     <li>functions, methods, arguments and local variables: {@code snake_case}</li>
 *     <li>classes: {@code PascalCase}</li>
 *     <li>module-level variables are constants: {@code UPPER_CASE}, except inside the main block</li>
 *     <li>names a function declares {@code global} or {@code nonlocal} are left to the scope that owns them</li>
 *     <li>class attributes: {@code snake_case} or {@code UPPER_CASE}</li>
 * </ul>
 */
public class InvalidNameChecker implements NodeChecker {

    private static final String RULE_ID = "C0103";
    private static final String SYMBOL = "invalid-name";
    private static final Set<String> IMPLICIT_ARGUMENTS = Set.of("self", "cls");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String symbol() {
        return SYMBOL;
    }

    @Override
    public String description() {
        return "Names follow the PEP 8 naming conventions";
    }

    @Override
    public Set<NodeKind> kinds() {
        return EnumSet.of(NodeKind.FUNCTION_DEF,
                          NodeKind.ASYNC_FUNCTION_DEF,
                          NodeKind.CLASS_DEF,
                          NodeKind.ARG,
                          NodeKind.NAME);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode node, CheckContext ctx) {
        return switch (node.kind()) {
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> checkName(node, "Function", NameStyle.SNAKE_CASE, ctx);
            case CLASS_DEF -> checkName(node, "Class", NameStyle.PASCAL_CASE, ctx);
            case ARG -> node.identifier()
                            .filter(IMPLICIT_ARGUMENTS::contains)
                            .isPresent()
                        ? Stream.empty()
                        : checkName(node, "Argument", NameStyle.SNAKE_CASE, ctx);
            default -> node.hasAttribute("ctx", "Store")
                       ? checkVariable(node, ctx)
                       : Stream.empty();
        };
    }

    private Stream<Diagnostic> checkVariable(SyntaxNode name, CheckContext ctx) {
        var tree = ctx.tree();
        var scope = tree.enclosingScope(name);

        if (scope.is(NodeKind.CLASS_DEF)) {
            return NameStyle.UPPER_CASE.matches(identifier(name))
                   ? Stream.empty()
                   : checkName(name, "Class attribute", NameStyle.SNAKE_CASE, ctx);
        }
        if (scope.kind()
                 .isFunction() && isDeclaredOutside(identifier(name), scope, ctx)) {
            // Named in a global or nonlocal statement: the binding belongs to another scope
            return Stream.empty();
        }
        if (scope.is(NodeKind.MODULE) && isAssignmentTarget(name, ctx) && !Scopes.isInsideMainBlock(tree, name)) {
            return checkName(name, "Constant", NameStyle.UPPER_CASE, ctx);
        }
        return checkName(name, "Variable", NameStyle.SNAKE_CASE, ctx);
    }

    private static boolean isDeclaredOutside(String identifier, SyntaxNode function, CheckContext ctx) {
        var tree = ctx.tree();
        return tree.descendants(function)
                   .filter(node -> node.is(NodeKind.GLOBAL) || node.is(NodeKind.NONLOCAL))
                   .filter(node -> tree.enclosingScope(node)
                                       .index() == function.index())
                   .flatMap(node -> Arrays.stream(node.attribute("names")
                                                      .orElse("")
                                                      .split(",")))
                   .anyMatch(identifier::equals);
    }

    private static boolean isAssignmentTarget(SyntaxNode name, CheckContext ctx) {
        var current = name;
        var parent = ctx.tree()
                        .parent(current);
        while (parent.isPresent() && (parent.get()
                                            .is(NodeKind.TUPLE) || parent.get()
                                                                         .is(NodeKind.LIST))) {
            current = parent.get();
            parent = ctx.tree()
                        .parent(current);
        }
        if (parent.isEmpty()) {
            return false;
        }
        var field = current.field();
        return switch (parent.get()
                             .kind()) {
            case ASSIGN -> field.equals("targets");
            case ANN_ASSIGN, AUG_ASSIGN -> field.equals("target");
            default -> false;
        };
    }

    private Stream<Diagnostic> checkName(SyntaxNode node, String role, NameStyle style, CheckContext ctx) {
        var name = identifier(node);
        if (name.isEmpty() || style.matches(name)) {
            return Stream.empty();
        }
        var message = role + " name \"" + name + "\" should be in " + style.label() + " format. " + explanation(style);
        return Stream.of(ctx.diagnostic(RULE_ID, SYMBOL, node.span(), message)
                            .withFix("Rename \"" + name + "\" to \"" + style.convert(name) + "\""));
    }

    private static String identifier(SyntaxNode node) {
        return node.identifier()
                   .orElse("");
    }

    private static String explanation(NameStyle style) {
        return switch (style) {
            case SNAKE_CASE -> "Use only lowercase letters, digits and underscores, with words separated by underscores.";
            case PASCAL_CASE -> "Start each word with a capital letter and do not separate words with underscores.";
            default -> "Module-level variables are treated as constants: use only uppercase letters, digits and "
                       + "underscores.";
        };
    }
}
