package org.vain.astvisitor;

import org.vain.astnode.*;

/**
 * Visitor over the closed set of AST node variants.
 * Adding a node class means adding a method here, which every visitor must
 * then implement.
 */
public interface Visitor {
    void visit(TopLevelNode node);

    void visit(CommentNode node);

    void visit(ImportNode node);

    void visit(FunctionNode node);

    void visit(ArgumentNode node);

    void visit(ReturnNode node);

    void visit(DeclarationNode node);

    void visit(AssignNode node);

    void visit(IfNode node);

    void visit(WhileNode node);

    void visit(ForNode node);

    void visit(TernaryNode node);

    void visit(BinaryOperatorNode node);

    void visit(UnaryOperatorNode node);

    void visit(SliceNode node);

    void visit(CallNode node);

    void visit(SubscriptNode node);

    void visit(DotNode node);

    void visit(IdentifierNode node);

    void visit(IntNode node);

    void visit(FloatNode node);

    void visit(StringNode node);

    void visit(ListNode node);

    void visit(DictionaryNode node);

    void visit(OptionNode node);

    void visit(EnvNode node);

    void visit(RegisterNode node);

    void visit(SpecialLiteralNode node);

    void visit(ErrorNode node);

    /**
     * Typed wrappers are transparent unless a visitor asks to see them.
     */
    default void visit(TypedNode node) {
        node.inner.accept(this);
    }
}
