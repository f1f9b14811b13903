package org.pyta.ast;

import org.pyta.lint.MalformedInputException;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pyta.ast.PySyntax.*;

class SyntaxTreeTest {

    @Test
    void navigation_followsFieldsAndParents() {
        var tree = tree(module(ifStmt(name("a"), pass()).orElse(ret())));
        var ifNode = find(tree, NodeKind.IF);

        assertThat(tree.child(ifNode, "test")).hasValueSatisfying(test -> assertThat(test.identifier()).contains("a"));
        assertThat(tree.children(ifNode, "body")).extracting(SyntaxNode::kind)
                                                 .containsExactly(NodeKind.PASS);
        assertThat(tree.children(ifNode, "orelse")).extracting(SyntaxNode::kind)
                                                   .containsExactly(NodeKind.RETURN);
        assertThat(tree.parent(ifNode)).contains(tree.root());
        assertThat(tree.parent(tree.root())).isEmpty();
    }

    @Test
    void siblings_areStatementsOfTheSameField() {
        var tree = tree(module(assign("a", num(1)), assign("b", num(2)), pass()));
        var middle = statementAt(tree, 2);

        assertThat(tree.previousSibling(middle)).contains(statementAt(tree, 1));
        assertThat(tree.nextSibling(middle)).contains(statementAt(tree, 3));
        assertThat(tree.nextSibling(statementAt(tree, 3))).isEmpty();
    }

    @Test
    void enclosingScope_isNearestScopeNode() {
        var tree = tree(module(def("f", ret(lambda(name("x"), "x")))));
        var body = find(tree, NodeKind.NAME);

        assertThat(tree.enclosingScope(body)
                       .kind()).isEqualTo(NodeKind.LAMBDA);
        assertThat(tree.enclosingScope(find(tree, NodeKind.FUNCTION_DEF))
                       .kind()).isEqualTo(NodeKind.MODULE);
    }

    @Test
    void unpositionedNodes_takeSpanOfTheirChildren() {
        var tree = tree(module(assign("a", num(1)), pass()));

        assertThat(tree.root()
                       .span()).isEqualTo(statementAt(tree, 1).span()
                                                              .union(statementAt(tree, 2).span()));
    }

    @Test
    void builder_rejectsPositionedNodeWithoutSpan() {
        var builder = SyntaxTree.builder("bad.py");
        var root = builder.add(SyntaxNode.NO_PARENT, "", NodeKind.MODULE, null);

        assertThatThrownBy(() -> builder.add(root, "body", NodeKind.PASS, null)).isInstanceOf(MalformedInputException.class)
                                                                                 .hasMessageContaining("Pass");
    }

    @Test
    void builder_rejectsSecondRootAndEmptyTree() {
        var builder = SyntaxTree.builder("bad.py");
        builder.add(SyntaxNode.NO_PARENT, "", NodeKind.MODULE, null);

        assertThatThrownBy(() -> builder.add(SyntaxNode.NO_PARENT, "", NodeKind.MODULE, null, Map.of()))
                .isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(() -> SyntaxTree.builder("empty.py")
                                           .build()).isInstanceOf(MalformedInputException.class);
    }

    @Test
    void sourceSpan_rejectsInvertedRange() {
        assertThatThrownBy(() -> SourceSpan.sourceSpan(3, 0, 2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(SourceSpan.line(2, 4, 8)
                             .contains(SourceSpan.line(2, 5, 6))).isTrue();
    }
}
