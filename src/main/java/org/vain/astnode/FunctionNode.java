package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

/**
 * The FunctionNode class represents a function statement or a function literal.
 * <p>
 * The same node covers both positions; {@link #isExpression()} tells them apart.
 * A nameless function with an expression body is a lambda.
 */
public class FunctionNode extends AbstractNode {
    /**
     * Modifiers from {@code func <autoload,closure>}: autoload, global, range,
     * dict, closure, noabort.
     */
    public final List<String> modifiers;

    /**
     * The function name, or null for anonymous functions.
     */
    public String name;

    /**
     * The arguments, each an {@link ArgumentNode} (possibly wrapped).
     */
    public final List<Node> arguments;

    /**
     * The declared return type, or null.
     */
    public final String returnType;

    /**
     * True for a {@code { ... }} body, false for a single expression body.
     */
    public final boolean bodyIsBlock;

    /**
     * The statements of a block body, or the single expression of an expression body.
     */
    public final List<Node> body;

    private final boolean expression;

    public FunctionNode(List<String> modifiers, String name, List<Node> arguments, String returnType,
                        boolean bodyIsBlock, List<Node> body, boolean expression, Position position) {
        this.modifiers = modifiers;
        this.name = name;
        this.arguments = arguments;
        this.returnType = returnType;
        this.bodyIsBlock = bodyIsBlock;
        this.body = body;
        this.expression = expression;
        this.position = position;
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }

    /**
     * A lambda is a nameless function whose body is a single expression.
     */
    public boolean isLambda() {
        return name == null && !bodyIsBlock;
    }

    @Override
    public boolean isExpression() {
        return expression;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
