package org.pyta.cfg;

/// Directed edge between two blocks of the same graph.
public record Edge(BasicBlock source,
                   BasicBlock target,
                   EdgeKind kind) {
    public boolean isNormalFlow() {
        return kind != EdgeKind.EXCEPTION;
    }

    @Override
    public String toString() {
        return source + " -" + kind + "-> " + target;
    }
}
