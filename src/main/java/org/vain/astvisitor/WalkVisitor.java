package org.vain.astvisitor;

import org.vain.astnode.Node;

/**
 * A function applied to every node of a {@link TreeWalker} walk, in pre-order.
 */
@FunctionalInterface
public interface WalkVisitor {
    /**
     * Visits one node.
     *
     * @param control controls descent below this node and exposes its route
     * @param node    the node in its slot; may be a typed wrapper
     * @return the node to keep in the slot, possibly a replacement. Returning
     * null keeps the visited node
     */
    Node visit(WalkControl control, Node node);
}
