package org.vain.analysis;

import org.vain.astnode.Position;

import java.util.Comparator;

/**
 * A problem found by an analyzer rule.
 *
 * @param rule     the rule that reported it
 * @param position where it was found, or null
 * @param message  the message, without location
 */
public record Diagnostic(String rule, Position position, String message) {

    public static final Comparator<Diagnostic> BY_POSITION = (a, b) -> {
        if (a.position == null || b.position == null) {
            return a.position == null ? (b.position == null ? 0 : 1) : -1;
        }
        return a.position.compareTo(b.position);
    };
}
