package org.vain.analysis;

import org.vain.astnode.FunctionNode;
import org.vain.astnode.Node;
import org.vain.astnode.ReturnNode;
import org.vain.astvisitor.WalkControl;
import org.vain.astvisitor.WalkVisitor;

import java.util.List;

/**
 * Reports {@code return} outside of any function.
 * Function bodies are not entered, and neither are expressions since a
 * return cannot occur inside one.
 */
public class ToplevelReturnChecker implements WalkVisitor {
    private final List<Diagnostic> diagnostics;

    public ToplevelReturnChecker(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    @Override
    public Node visit(WalkControl control, Node node) {
        Node terminal = node.terminalNode();
        if (terminal instanceof FunctionNode || terminal.isExpression()) {
            control.skipChildren();
        } else if (terminal instanceof ReturnNode) {
            diagnostics.add(new Diagnostic(Rule.TOPLEVEL_RETURN, terminal.getPosition(),
                    "return statement at top level"));
            control.skipChildren();
        }
        return node;
    }
}
