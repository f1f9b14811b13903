package org.pyta.checkers;

import org.pyta.ast.NodeKind;
import org.pyta.ast.PySyntax.Node;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.checkers.ConstantFolding.constantFolding;

class ConstantFoldingTest {

    @Test
    void truthiness_foldsLiteralConstants() {
        assertThat(fold(bool(true))).contains(true);
        assertThat(fold(bool(false))).contains(false);
        assertThat(fold(none())).contains(false);
        assertThat(fold(num(0))).contains(false);
        assertThat(fold(num(42))).contains(true);
        assertThat(fold(real("0.0"))).contains(false);
        assertThat(fold(str(""))).contains(false);
        assertThat(fold(str("yes"))).contains(true);
    }

    @Test
    void truthiness_foldsNonDecimalIntegerLiterals() {
        assertThat(fold(constant("0x0", "int"))).contains(false);
        assertThat(fold(constant("0b101", "int"))).contains(true);
    }

    @Test
    void truthiness_foldsLiteralContainers() {
        assertThat(fold(list())).contains(false);
        assertThat(fold(tuple(name("a")))).contains(true);
        assertThat(fold(dict())).contains(false);
    }

    @Test
    void truthiness_isUnknown_forContainerOfUnpackedValues() {
        assertThat(fold(list(starred(name("items"))))).isEmpty();
    }

    @Test
    void truthiness_foldsNegationAndSign() {
        assertThat(fold(not(bool(true)))).contains(false);
        assertThat(fold(not(name("x")))).isEmpty();
        assertThat(fold(unary("USub", num(1)))).contains(true);
    }

    @Test
    void truthiness_foldsBooleanOperators_whenOneOperandDecides() {
        assertThat(fold(boolOp("And", name("x"), bool(false)))).contains(false);
        assertThat(fold(boolOp("Or", name("x"), num(1)))).contains(true);
        assertThat(fold(boolOp("And", name("x"), bool(true)))).isEmpty();
        assertThat(fold(boolOp("And", num(1), str("a")))).contains(true);
    }

    @Test
    void truthiness_isUnknown_forNamesAndCalls() {
        assertThat(fold(name("True_ish"))).isEmpty();
        assertThat(fold(call("f"))).isEmpty();
        assertThat(fold(compare(num(1), "Lt", num(2)))).isEmpty();
    }

    @Test
    void isLiteralTrue_acceptsTrueAndOne_only() {
        assertThat(literalTrue(bool(true))).isTrue();
        assertThat(literalTrue(num(1))).isTrue();
        assertThat(literalTrue(str("x"))).isFalse();
        assertThat(literalTrue(bool(false))).isFalse();
    }

    private static Optional<Boolean> fold(Node expression) {
        var tree = treeOf(expression);
        return constantFolding(tree).truthiness(tested(tree));
    }

    private static boolean literalTrue(Node expression) {
        var tree = treeOf(expression);
        return constantFolding(tree).isLiteralTrue(tested(tree));
    }

    private static SyntaxTree treeOf(Node expression) {
        return tree(module(ifStmt(expression, pass())));
    }

    private static SyntaxNode tested(SyntaxTree tree) {
        return tree.child(find(tree, NodeKind.IF), "test")
                   .orElseThrow();
    }
}
