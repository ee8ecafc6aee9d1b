package org.vain.codegen;

import org.vain.astnode.*;
import org.vain.astvisitor.Visitor;
import org.vain.runtime.VainCompilerException;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Common machinery of the text generators.
 * <p>
 * Statement visits append whole indented lines to {@link #sb}; expression
 * visits append their text without a line break. {@link #expr(Node, int)}
 * renders a child into a detached buffer and parenthesizes it when its
 * precedence is lower than what the slot requires.
 * <p>
 * A top-level unit is rendered one statement at a time. A
 * {@link VainCompilerException} thrown while rendering a statement becomes an
 * error chunk and ends the sequence.
 */
public abstract class AbstractGenerator implements Generator, Visitor {

    protected final EmitterContext ctx;
    protected StringBuilder sb = new StringBuilder();
    protected int indentLevel = 0;

    protected AbstractGenerator(EmitterContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public Iterator<TextChunk> render(Node unit) {
        Node terminal = unit.terminalNode();
        if (terminal instanceof ErrorNode errorNode) {
            return List.of(TextChunk.error(errorNode.message)).iterator();
        }
        List<Node> statements = terminal instanceof TopLevelNode topLevel ? topLevel.body : List.of(terminal);
        return new StatementIterator(statements.iterator());
    }

    /**
     * Renders one top-level statement, including its trailing newline.
     * Returns the empty string for statements with no output.
     */
    protected String renderStatement(Node node) {
        sb = new StringBuilder();
        indentLevel = 0;
        statement(node);
        return sb.toString();
    }

    protected void statement(Node node) {
        Node terminal = node.terminalNode();
        if (terminal.isExpression()) {
            expressionStatement(terminal);
        } else {
            terminal.accept(this);
        }
    }

    /**
     * Emits an expression that stands alone as a statement.
     */
    protected abstract void expressionStatement(Node node);

    protected void block(List<Node> body) {
        indentLevel++;
        for (Node node : body) {
            statement(node);
        }
        indentLevel--;
    }

    protected void line(String text) {
        sb.append("  ".repeat(indentLevel)).append(text).append('\n');
    }

    protected String expr(Node node) {
        return expr(node, Precedence.FUNCTION);
    }

    protected String expr(Node node, int required) {
        StringBuilder saved = sb;
        sb = new StringBuilder();
        try {
            node.accept(this);
            String text = sb.toString();
            return precedenceOf(node) < required ? "(" + text + ")" : text;
        } finally {
            sb = saved;
        }
    }

    protected String join(List<Node> nodes, String separator) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                joined.append(separator);
            }
            joined.append(expr(nodes.get(i)));
        }
        return joined.toString();
    }

    /**
     * The binding strength of a node when spliced into a parent expression.
     */
    protected int precedenceOf(Node node) {
        Node terminal = node.terminalNode();
        if (terminal instanceof TernaryNode) {
            return Precedence.TERNARY;
        }
        if (terminal instanceof BinaryOperatorNode binary) {
            return binary.operator.precedence;
        }
        if (terminal instanceof UnaryOperatorNode) {
            return Precedence.UNARY;
        }
        if (terminal instanceof SliceNode || terminal instanceof CallNode
                || terminal instanceof SubscriptNode || terminal instanceof DotNode) {
            return Precedence.POSTFIX;
        }
        if (terminal instanceof FunctionNode) {
            return Precedence.FUNCTION;
        }
        return Precedence.ATOM;
    }

    protected String binary(BinaryOperatorNode node) {
        int precedence = node.operator.precedence;
        // comparisons do not associate
        int leftRequired = node.operator.isComparison() ? precedence + 1 : precedence;
        return expr(node.left, leftRequired) + " " + node.operator.text + " " + expr(node.right, precedence + 1);
    }

    protected String ternary(TernaryNode node) {
        return expr(node.condition, Precedence.OR) + " ? "
                + expr(node.trueExpr, Precedence.TERNARY) + " : "
                + expr(node.falseExpr, Precedence.TERNARY);
    }

    protected String unary(UnaryOperatorNode node) {
        return node.operator.text + expr(node.operand, Precedence.UNARY);
    }

    protected VainCompilerException fatal(Node node, String message) {
        return new VainCompilerException(node.getPosition(), "fatal: " + message, ctx.errorUtil);
    }

    @Override
    public void visit(TopLevelNode node) {
        for (Node statement : node.body) {
            statement(statement);
        }
    }

    @Override
    public void visit(ErrorNode node) {
        throw new VainCompilerException(node.message, node.getPosition());
    }

    @Override
    public void visit(TernaryNode node) {
        sb.append(ternary(node));
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        sb.append(binary(node));
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        sb.append(unary(node));
    }

    @Override
    public void visit(IntNode node) {
        sb.append(node.value);
    }

    @Override
    public void visit(FloatNode node) {
        sb.append(node.value);
    }

    @Override
    public void visit(OptionNode node) {
        sb.append(OptionNode.SIGIL).append(node.name);
    }

    @Override
    public void visit(EnvNode node) {
        sb.append(EnvNode.SIGIL).append(node.name);
    }

    @Override
    public void visit(ArgumentNode node) {
        throw fatal(node, "argument outside of a function");
    }

    private class StatementIterator implements Iterator<TextChunk> {
        private final Iterator<Node> statements;
        private TextChunk pending;
        private boolean done;

        StatementIterator(Iterator<Node> statements) {
            this.statements = statements;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && !done) {
                if (!statements.hasNext()) {
                    done = true;
                    break;
                }
                Node statement = statements.next();
                try {
                    String text = renderStatement(statement);
                    if (!text.isEmpty()) {
                        pending = TextChunk.text(text);
                    }
                } catch (VainCompilerException e) {
                    ctx.logDebug("render failed: " + e.getMessage());
                    pending = TextChunk.error(e.getMessage());
                    done = true;
                }
            }
            return pending != null;
        }

        @Override
        public TextChunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TextChunk chunk = pending;
            pending = null;
            return chunk;
        }
    }
}
