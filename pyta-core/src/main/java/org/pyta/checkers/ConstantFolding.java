package org.pyta.checkers;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;

import java.util.Optional;

/**
 * Decides whether an expression has a truth value known without running the program.
 *
 * Handles literal constants, literal containers, {@code not}, {@code and}/{@code or} and
 * unary sign operators on numbers. Anything else is unknown.
 */
public final class ConstantFolding {
    private final SyntaxTree tree;

    private ConstantFolding(SyntaxTree tree) {
        this.tree = tree;
    }

    public static ConstantFolding constantFolding(SyntaxTree tree) {
        return new ConstantFolding(tree);
    }

    /**
     * Static truth value of an expression.
     *
     * @return {@code true}/{@code false} when the value is known, empty otherwise
     */
    public Optional<Boolean> truthiness(SyntaxNode expression) {
        return switch (expression.kind()) {
            case CONSTANT -> constantTruthiness(expression);
            case LIST, TUPLE, SET -> containerTruthiness(expression, "elts");
            case DICT -> dictTruthiness(expression);
            case UNARY_OP -> unaryTruthiness(expression);
            case BOOL_OP -> boolOpTruthiness(expression);
            default -> Optional.empty();
        };
    }

    /// Whether an expression is a literal {@code True} or non-zero integer, as in {@code while True:}.
    public boolean isLiteralTrue(SyntaxNode expression) {
        return expression.is(NodeKind.CONSTANT)
               && constantTruthiness(expression).orElse(false)
               && expression.attribute("type")
                            .filter(type -> type.equals("bool") || type.equals("int"))
                            .isPresent();
    }

    private Optional<Boolean> constantTruthiness(SyntaxNode constant) {
        var type = constant.attribute("type")
                           .orElse("");
        var value = constant.attribute("value")
                            .orElse("");
        return switch (type) {
            case "bool" -> Optional.of(value.equals("True"));
            case "NoneType" -> Optional.of(false);
            case "int", "float", "complex" -> numericTruthiness(value);
            case "str", "bytes" -> Optional.of(!value.isEmpty());
            case "ellipsis" -> Optional.of(true);
            default -> Optional.empty();
        };
    }

    private static Optional<Boolean> numericTruthiness(String literal) {
        var digits = literal.replace("_", "")
                            .toLowerCase();
        if (digits.endsWith("j")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        try {
            return Optional.of(Double.parseDouble(digits) != 0.0);
        } catch (NumberFormatException e) {
            // Hexadecimal, octal and binary literals: zero only if every digit is zero
            return Optional.of(!digits.replaceFirst("^0[xob]", "")
                                      .chars()
                                      .allMatch(c -> c == '0'));
        }
    }

    private Optional<Boolean> containerTruthiness(SyntaxNode container, String field) {
        var elements = tree.children(container, field);
        if (elements.isEmpty()) {
            return Optional.of(false);
        }
        // An unpacked iterable may be empty
        return elements.stream()
                       .anyMatch(element -> !element.is(NodeKind.STARRED))
               ? Optional.of(true)
               : Optional.empty();
    }

    private Optional<Boolean> dictTruthiness(SyntaxNode dict) {
        var keys = tree.children(dict, "keys");
        var values = tree.children(dict, "values");
        if (values.isEmpty()) {
            return Optional.of(false);
        }
        // {**other} has no key node and may be empty
        return keys.size() == values.size()
               ? Optional.of(true)
               : Optional.empty();
    }

    private Optional<Boolean> unaryTruthiness(SyntaxNode unary) {
        var operand = tree.child(unary, "operand");
        var op = unary.attribute("op")
                      .orElse("");
        return switch (op) {
            case "Not" -> operand.flatMap(this::truthiness)
                                 .map(value -> !value);
            case "USub", "UAdd" -> operand.filter(node -> node.is(NodeKind.CONSTANT))
                                          .flatMap(this::constantTruthiness);
            default -> Optional.empty();
        };
    }

    private Optional<Boolean> boolOpTruthiness(SyntaxNode boolOp) {
        var isAnd = boolOp.hasAttribute("op", "And");
        var operands = tree.children(boolOp, "values");
        var allKnown = true;

        for (var operand : operands) {
            var value = truthiness(operand);
            if (value.isEmpty()) {
                allKnown = false;
            } else if (value.get() != isAnd) {
                // a false operand decides an `and`, a true operand decides an `or`
                return value;
            }
        }
        return allKnown && !operands.isEmpty()
               ? Optional.of(isAnd)
               : Optional.empty();
    }
}
