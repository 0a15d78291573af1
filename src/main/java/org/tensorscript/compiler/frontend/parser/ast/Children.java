package org.tensorscript.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Helper for building child lists that skip absent (null) parts.
 */
final class Children {

    private final List<AstNode> nodes = new ArrayList<>();

    private Children() {}

    static Children of() {
        return new Children();
    }

    Children add(AstNode node) {
        if (node != null) nodes.add(node);
        return this;
    }

    Children addAll(Collection<? extends AstNode> more) {
        more.forEach(this::add);
        return this;
    }

    List<AstNode> build() {
        return List.copyOf(nodes);
    }
}
