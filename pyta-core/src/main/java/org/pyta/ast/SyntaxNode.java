package org.pyta.ast;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable node of a parsed Python program.
 *
 * Nodes live in the arena of their {@link SyntaxTree}; {@code parent} and {@code children}
 * are arena indices, not references. Navigation goes through the owning tree.
 *
 * @param index      position of this node in the arena
 * @param kind       node kind
 * @param span       source region
 * @param field      name of the parent field holding this node ({@code body}, {@code test}, ...), empty for the root
 * @param parent     arena index of the parent, {@link #NO_PARENT} for the root
 * @param children   arena indices of the children in source order
 * @param attributes scalar fields ({@code id}, {@code name}, {@code ctx}, {@code value}, {@code op}, ...)
 */
public record SyntaxNode(int index,
                         NodeKind kind,
                         SourceSpan span,
                         String field,
                         int parent,
                         List<Integer> children,
                         Map<String, String> attributes) {
    public static final int NO_PARENT = -1;

    public SyntaxNode {
        children = List.copyOf(children);
        attributes = Map.copyOf(attributes);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean hasAttribute(String name, String value) {
        return value.equals(attributes.get(name));
    }

    public boolean is(NodeKind candidate) {
        return kind == candidate;
    }

    public boolean isRoot() {
        return parent == NO_PARENT;
    }

    /// Identifier carried by the node: {@code id} for names, {@code name} for definitions, {@code arg} for arguments.
    public Optional<String> identifier() {
        return attribute("id").or(() -> attribute("name"))
                              .or(() -> attribute("arg"));
    }

    @Override
    public String toString() {
        return kind.pythonName() + "#" + index + "@" + span;
    }
}
