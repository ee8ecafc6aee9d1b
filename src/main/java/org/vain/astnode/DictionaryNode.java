package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

/**
 * A dictionary literal. Entries keep their source order.
 */
public class DictionaryNode extends AbstractNode {
    public final List<Entry> entries;

    public DictionaryNode(List<Entry> entries, Position position) {
        this.entries = entries;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }

    /**
     * One {@code key: value} pair. A bare identifier key such as {@code {name: 1}}
     * is stored as a {@link StringNode} with {@code bareKey} set.
     */
    public static final class Entry {
        public Node key;
        public Node value;
        public final boolean bareKey;

        public Entry(Node key, Node value, boolean bareKey) {
            this.key = key;
            this.value = value;
            this.bareKey = bareKey;
        }
    }
}
