package org.vain.analysis;

import org.vain.astnode.ErrorNode;
import org.vain.astnode.Node;
import org.vain.astnode.TopLevelNode;
import org.vain.astvisitor.CloneVisitor;
import org.vain.astvisitor.TreeWalker;
import org.vain.astvisitor.WalkVisitor;
import org.vain.codegen.EmitterContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the semantic passes over one top-level unit:
 * check, then infer types, then rewrite, then unwrap.
 * <p>
 * The parser's tree is never modified; the passes work on a clone. When any
 * check reports a problem, the unit is not rewritten and one {@link ErrorNode}
 * per diagnostic is returned instead, ordered by position.
 */
public class Analyzer {
    private final EmitterContext ctx;
    private final AnalyzerConfiguration config;

    public Analyzer(EmitterContext ctx, AnalyzerConfiguration config) {
        this.ctx = ctx;
        this.config = config;
    }

    /**
     * Analyzes one unit.
     *
     * @param unit a {@link TopLevelNode}, or an {@link ErrorNode} which is passed through
     * @return the rewritten tree, or the error nodes
     */
    public List<Node> analyze(Node unit) {
        List<Node> result = new ArrayList<>();
        if (!(unit.terminalNode() instanceof TopLevelNode)) {
            result.add(unit);
            return result;
        }
        Node tree = CloneVisitor.clone(unit);

        List<Diagnostic> diagnostics = check(tree);
        if (!diagnostics.isEmpty()) {
            diagnostics.sort(Diagnostic.BY_POSITION);
            for (Diagnostic diagnostic : diagnostics) {
                String message = ctx.errorUtil.errorMessage(diagnostic.position(), diagnostic.message())
                        + " (" + diagnostic.rule() + ")";
                ctx.logDebug("analyze: " + message);
                result.add(new ErrorNode(message, diagnostic.position()));
            }
            return result;
        }

        tree = TypeInference.infer(tree);
        if (config.isEnabled(Rule.CONVERT_UNDERSCORE_VARIABLE)) {
            tree = UnderscoreConverter.convert(tree);
        }
        tree = TypeInference.unwrap(tree);
        ctx.logDebug("analyze: " + ctx.fileName + " ok");
        result.add(tree);
        return result;
    }

    /**
     * Numbers the tree and runs every enabled check.
     * The top-level return check shares the numbering traversal.
     */
    List<Diagnostic> check(Node tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<WalkVisitor> visitors = new ArrayList<>();
        visitors.add((control, node) -> node);
        if (config.isEnabled(Rule.TOPLEVEL_RETURN)) {
            visitors.add(new ToplevelReturnChecker(diagnostics));
        }
        new TreeWalker(visitors).withNumbering().walk(tree);

        if (config.isEnabled(Rule.UNDECLARED_VARIABLE)
                || config.isEnabled(Rule.DUPLICATE_DECLARATION)
                || config.isEnabled(Rule.UNDERSCORE_VARIABLE_REFERENCE)
                || config.isEnabled(Rule.ASSIGNMENT_TO_CONST_VARIABLE)) {
            new ScopeChecker(config, diagnostics).check((TopLevelNode) tree.terminalNode());
        }
        return diagnostics;
    }
}
