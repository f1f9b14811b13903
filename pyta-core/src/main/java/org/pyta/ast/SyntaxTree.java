package org.pyta.ast;

import org.pyta.lint.AnalysisError;
import org.pyta.lint.MalformedInputException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Arena holding every node of one parsed source file.
 *
 * The tree is owned top-down through this arena; nodes refer to their parent and children by
 * index. Instances are immutable and safe to share between threads.
 */
public final class SyntaxTree {
    private final String fileName;
    private final List<SyntaxNode> nodes;

    private SyntaxTree(String fileName, List<SyntaxNode> nodes) {
        this.fileName = fileName;
        this.nodes = List.copyOf(nodes);
    }

    public static Builder builder(String fileName) {
        return new Builder(fileName);
    }

    public String fileName() {
        return fileName;
    }

    public SyntaxNode root() {
        return nodes.get(0);
    }

    public SyntaxNode node(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    /// All nodes in arena order, which is pre-order.
    public Stream<SyntaxNode> nodes() {
        return nodes.stream();
    }

    public Optional<SyntaxNode> parent(SyntaxNode node) {
        return node.isRoot()
               ? Optional.empty()
               : Optional.of(nodes.get(node.parent()));
    }

    public List<SyntaxNode> children(SyntaxNode node) {
        return node.children()
                   .stream()
                   .map(nodes::get)
                   .toList();
    }

    /// Children stored under the given parent field, in source order.
    public List<SyntaxNode> children(SyntaxNode node, String field) {
        return node.children()
                   .stream()
                   .map(nodes::get)
                   .filter(child -> child.field()
                                         .equals(field))
                   .toList();
    }

    /// First child stored under the given field.
    public Optional<SyntaxNode> child(SyntaxNode node, String field) {
        return node.children()
                   .stream()
                   .map(nodes::get)
                   .filter(child -> child.field()
                                         .equals(field))
                   .findFirst();
    }

    /// Ancestors, nearest first.
    public Stream<SyntaxNode> ancestors(SyntaxNode node) {
        return Stream.iterate(parent(node),
                              Optional::isPresent,
                              current -> parent(current.get()))
                     .map(Optional::get);
    }

    /// Nearest ancestor of the given kind.
    public Optional<SyntaxNode> enclosing(SyntaxNode node, NodeKind kind) {
        return ancestors(node).filter(ancestor -> ancestor.is(kind))
                              .findFirst();
    }

    /// Nearest ancestor that opens a name scope (module, function, class or lambda).
    public SyntaxNode enclosingScope(SyntaxNode node) {
        return ancestors(node).filter(ancestor -> ancestor.kind()
                                                          .isScope())
                              .findFirst()
                              .orElse(root());
    }

    /// Siblings in the same parent field, in source order, the node itself excluded.
    public List<SyntaxNode> siblings(SyntaxNode node) {
        return parent(node).map(parent -> children(parent, node.field()))
                           .orElse(List.of())
                           .stream()
                           .filter(sibling -> sibling.index() != node.index())
                           .toList();
    }

    public Optional<SyntaxNode> nextSibling(SyntaxNode node) {
        return parent(node).flatMap(parent -> {
            var peers = children(parent, node.field());
            var position = peers.indexOf(node);
            return position >= 0 && position + 1 < peers.size()
                   ? Optional.of(peers.get(position + 1))
                   : Optional.empty();
        });
    }

    public Optional<SyntaxNode> previousSibling(SyntaxNode node) {
        return parent(node).flatMap(parent -> {
            var peers = children(parent, node.field());
            var position = peers.indexOf(node);
            return position > 0
                   ? Optional.of(peers.get(position - 1))
                   : Optional.empty();
        });
    }

    /// The node and all its descendants, pre-order.
    public Stream<SyntaxNode> subtree(SyntaxNode node) {
        var result = new ArrayList<SyntaxNode>();
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(node);

        while (!stack.isEmpty()) {
            var current = stack.pop();
            result.add(current);
            var kids = current.children();
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(nodes.get(kids.get(i)));
            }
        }
        return result.stream();
    }

    /// Strict descendants, pre-order.
    public Stream<SyntaxNode> descendants(SyntaxNode node) {
        return subtree(node).skip(1);
    }

    /// Whether {@code node} lies inside the subtree rooted at {@code ancestor}.
    public boolean isWithin(SyntaxNode node, SyntaxNode ancestor) {
        return node.index() == ancestor.index() || ancestors(node).anyMatch(candidate -> candidate.index() == ancestor.index());
    }

    /**
     * Collects nodes top-down and freezes them into a {@link SyntaxTree}.
     *
     * The root must be added first. Nodes of kinds Python does not position may be added
     * without a span; their span is derived from their children, or from their parent when
     * they have none.
     */
    public static final class Builder {
        private final String fileName;
        private final List<Draft> drafts = new ArrayList<>();

        private Builder(String fileName) {
            this.fileName = fileName;
        }

        /**
         * Add a node.
         *
         * @param parent     arena index of the parent, or {@link SyntaxNode#NO_PARENT} for the root
         * @param field      parent field holding the node
         * @param kind       node kind
         * @param span       source span, may be null for kinds Python does not position
         * @param attributes scalar attributes; null values are dropped
         * @return arena index of the new node
         */
        public int add(int parent, String field, NodeKind kind, SourceSpan span, Map<String, String> attributes) {
            if (parent == SyntaxNode.NO_PARENT && !drafts.isEmpty()) {
                throw new MalformedInputException(new AnalysisError.MalformedInput(span == null
                                                                                   ? SourceSpan.FILE_START
                                                                                   : span,
                                                                                   "Second root node " + kind.pythonName()));
            }
            if (parent != SyntaxNode.NO_PARENT && (parent < 0 || parent >= drafts.size())) {
                throw new IllegalArgumentException("Unknown parent index " + parent);
            }
            if (span == null && kind.positioned()) {
                throw new MalformedInputException(new AnalysisError.MalformedInput(parentSpan(parent),
                                                                                   "Missing source position on "
                                                                                   + kind.pythonName() + " node"));
            }

            var index = drafts.size();
            var values = new HashMap<String, String>();
            attributes.forEach((key, value) -> {
                if (value != null) {
                    values.put(key, value);
                }
            });
            drafts.add(new Draft(kind, span, field, parent, values));

            if (parent != SyntaxNode.NO_PARENT) {
                drafts.get(parent).children.add(index);
            }
            return index;
        }

        public int add(int parent, String field, NodeKind kind, SourceSpan span) {
            return add(parent, field, kind, span, Map.of());
        }

        public SyntaxTree build() {
            if (drafts.isEmpty()) {
                throw new MalformedInputException(new AnalysisError.MalformedInput(SourceSpan.FILE_START,
                                                                                   "Empty syntax tree"));
            }

            // Children always follow their parent in the arena, so a reverse sweep sees children first.
            for (int i = drafts.size() - 1; i >= 0; i--) {
                var draft = drafts.get(i);
                if (draft.span == null) {
                    draft.span = draft.children
                                      .stream()
                                      .map(child -> drafts.get(child).span)
                                      .filter(span -> span != null)
                                      .reduce(SourceSpan::union)
                                      .orElse(null);
                }
            }
            for (var draft : drafts) {
                if (draft.span == null) {
                    draft.span = draft.parent == SyntaxNode.NO_PARENT
                                 ? SourceSpan.FILE_START
                                 : drafts.get(draft.parent).span;
                }
            }

            var nodes = new ArrayList<SyntaxNode>(drafts.size());
            for (int i = 0; i < drafts.size(); i++) {
                var draft = drafts.get(i);
                nodes.add(new SyntaxNode(i,
                                         draft.kind,
                                         draft.span,
                                         draft.field,
                                         draft.parent,
                                         draft.children,
                                         draft.attributes));
            }
            return new SyntaxTree(fileName, nodes);
        }

        private SourceSpan parentSpan(int parent) {
            return parent == SyntaxNode.NO_PARENT || drafts.get(parent).span == null
                   ? SourceSpan.FILE_START
                   : drafts.get(parent).span;
        }

        private static final class Draft {
            private final NodeKind kind;
            private final String field;
            private final int parent;
            private final List<Integer> children = new ArrayList<>();
            private final Map<String, String> attributes;
            private SourceSpan span;

            private Draft(NodeKind kind, SourceSpan span, String field, int parent, Map<String, String> attributes) {
                this.kind = kind;
                this.span = span;
                this.field = field;
                this.parent = parent;
                this.attributes = attributes;
            }
        }
    }
}
