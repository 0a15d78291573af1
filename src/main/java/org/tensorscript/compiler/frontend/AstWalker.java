package org.tensorscript.compiler.frontend;

import org.tensorscript.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Pre-order traversal of a script syntax tree with handlers keyed by node type.
 * <p>
 * A handler registered for a type also receives nodes of its subtypes. Handlers for the same node
 * run in registration order, before the node's children are visited.
 */
public final class AstWalker {

    private final Map<Class<? extends AstNode>, List<Consumer<AstNode>>> handlers = new LinkedHashMap<>();

    /**
     * Registers a handler for nodes of the given type.
     * @param type The node type.
     * @param handler The handler.
     * @return This walker.
     */
    public <T extends AstNode> AstWalker on(Class<T> type, Consumer<? super T> handler) {
        handlers.computeIfAbsent(type, k -> new ArrayList<>()).add(node -> handler.accept(type.cast(node)));
        return this;
    }

    /**
     * Walks the nodes in order.
     * @param nodes The roots.
     */
    public void walk(List<? extends AstNode> nodes) {
        nodes.forEach(this::walk);
    }

    /**
     * Walks one node and its descendants.
     * @param node The root, may be {@code null}.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }
        handlers.forEach((type, list) -> {
            if (type.isInstance(node)) {
                list.forEach(h -> h.accept(node));
            }
        });
        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Finds the first node of a type, in pre-order, for which the mapper yields a value.
     * Descendants after the match are not visited.
     * @param root The root.
     * @param type The node type.
     * @param mapper Maps a candidate to the result, or to empty to keep searching.
     * @return The first mapped value.
     */
    public static <T extends AstNode, R> Optional<R> findFirst(AstNode root, Class<T> type,
                                                               Function<? super T, Optional<R>> mapper) {
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            AstNode node = pending.pop();
            if (type.isInstance(node)) {
                Optional<R> result = mapper.apply(type.cast(node));
                if (result.isPresent()) {
                    return result;
                }
            }
            List<AstNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i) != null) {
                    pending.push(children.get(i));
                }
            }
        }
        return Optional.empty();
    }
}
