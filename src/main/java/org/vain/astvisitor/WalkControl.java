package org.vain.astvisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-visit handle given to a {@link WalkVisitor}.
 * <p>
 * The route is the list of child-slot indices from the root to the node being
 * visited. Every slot counts, including empty ones, so a route stays the same
 * between walks of trees with the same shape.
 */
public final class WalkControl {
    private final List<Integer> route;
    private boolean skip;

    WalkControl(List<Integer> route) {
        this.route = route;
    }

    void reset() {
        skip = false;
    }

    boolean skipped() {
        return skip;
    }

    /**
     * Do not visit the children of the current node, for this visitor only.
     */
    public void skipChildren() {
        skip = true;
    }

    public List<Integer> route() {
        return Collections.unmodifiableList(new ArrayList<>(route));
    }

    public int depth() {
        return route.size();
    }

    /**
     * Returns true if the current node is {@code prefix} itself or lies below it.
     */
    public boolean isInside(List<Integer> prefix) {
        if (prefix.size() > route.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!prefix.get(i).equals(route.get(i))) {
                return false;
            }
        }
        return true;
    }
}
