package org.vain.analysis;

import org.vain.astnode.*;
import org.vain.astvisitor.TreeWalker;
import org.vain.symbols.ScopedSymbolTable;
import org.vain.symbols.SymbolTable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.vain.runtime.ErrorMessageUtil.errorMessageQuote;

/**
 * Variable scope checking: undeclared variables, duplicate declarations,
 * references to {@code _} and assignments to constants.
 * <p>
 * Blocks are checked statement by statement with a frame per block. The
 * right side of a declaration is checked before its names come into scope, so
 * {@code const x = x} reports {@code x} as undeclared. A named function
 * statement declares its name before its body is checked, which allows recursion.
 * <p>
 * Identifier nodes are recognised by their walker-assigned ids, so the tree
 * must have been numbered before {@link #check(TopLevelNode)} is called.
 */
public class ScopeChecker {
    private final AnalyzerConfiguration config;
    private final List<Diagnostic> diagnostics;

    // Ids of identifiers that are declaration targets, not references
    private final Set<Integer> declaredIds = new HashSet<>();
    // Ids of identifiers being assigned to
    private final Set<Integer> assignedIds = new HashSet<>();
    // Ids of identifiers that are member names or callees
    private final Set<Integer> exemptIds = new HashSet<>();

    public ScopeChecker(AnalyzerConfiguration config, List<Diagnostic> diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public void check(TopLevelNode root) {
        checkBlock(root.body, new ScopedSymbolTable());
    }

    private void report(String rule, Node node, String message) {
        if (config.isEnabled(rule)) {
            diagnostics.add(new Diagnostic(rule, node.getPosition(), message));
        }
    }

    private void checkBlock(List<Node> statements, ScopedSymbolTable table) {
        for (Node statement : statements) {
            checkStatement(statement.terminalNode(), table);
        }
    }

    private void checkNestedBlock(List<Node> statements, ScopedSymbolTable table) {
        int scope = table.enterScope();
        checkBlock(statements, table);
        table.exitScope(scope);
    }

    private void checkStatement(Node statement, ScopedSymbolTable table) {
        if (statement instanceof DeclarationNode) {
            DeclarationNode declaration = (DeclarationNode) statement;
            List<IdentifierNode> names = declaration.declaredIdentifiers();
            for (IdentifierNode id : names) {
                declaredIds.add(id.getId());
            }
            checkReferences(declaration, table);
            for (IdentifierNode id : names) {
                declare(table, id, declaration, declaration.isConst);
            }
        } else if (statement instanceof FunctionNode) {
            FunctionNode function = (FunctionNode) statement;
            if (function.name != null && !function.isExpression()) {
                declareName(table, function.name, function, true);
            }
            checkFunction(function, table);
        } else if (statement instanceof IfNode) {
            IfNode ifNode = (IfNode) statement;
            checkReferences(ifNode.condition, table);
            checkNestedBlock(ifNode.body, table);
            if (ifNode.elseBody != null) {
                checkNestedBlock(ifNode.elseBody, table);
            }
        } else if (statement instanceof WhileNode) {
            WhileNode whileNode = (WhileNode) statement;
            checkReferences(whileNode.condition, table);
            checkNestedBlock(whileNode.body, table);
        } else if (statement instanceof ForNode) {
            ForNode forNode = (ForNode) statement;
            checkReferences(forNode.right, table);
            int scope = table.enterScope();
            for (IdentifierNode id : DeclarationNode.identifiersOf(forNode.left)) {
                declaredIds.add(id.getId());
                declare(table, id, forNode, false);
            }
            checkBlock(forNode.body, table);
            table.exitScope(scope);
        } else if (statement instanceof AssignNode) {
            AssignNode assign = (AssignNode) statement;
            for (IdentifierNode id : DeclarationNode.identifiersOf(assign.left)) {
                assignedIds.add(id.getId());
            }
            checkReferences(assign, table);
        } else if (statement instanceof ReturnNode) {
            checkReferences(((ReturnNode) statement).value, table);
        } else if (!(statement instanceof CommentNode) && !(statement instanceof ImportNode)) {
            checkReferences(statement, table);
        }
    }

    private void declare(ScopedSymbolTable table, IdentifierNode id, Node declaration, boolean isConst) {
        if (id.name.equals("_")) {
            return;
        }
        if (!table.addVariable(id.name, declaration, isConst)) {
            report(Rule.DUPLICATE_DECLARATION, id, "duplicate declaration of variable " + errorMessageQuote(id.name));
        }
    }

    private void declareName(ScopedSymbolTable table, String name, Node declaration, boolean isConst) {
        if (!table.addVariable(name, declaration, isConst)) {
            report(Rule.DUPLICATE_DECLARATION, declaration, "duplicate declaration of function " + errorMessageQuote(name));
        }
    }

    private void checkFunction(FunctionNode function, ScopedSymbolTable table) {
        boolean captures = function.hasModifier("closure") || function.isLambda();
        ScopedSymbolTable inner = new ScopedSymbolTable(captures ? table : null, table.topLevelFrame());
        for (Node node : function.arguments) {
            Node terminal = node.terminalNode();
            if (!(terminal instanceof ArgumentNode)) {
                continue;
            }
            ArgumentNode argument = (ArgumentNode) terminal;
            checkReferences(argument.defaultValue, inner);
            if (!argument.name.equals("_") && !inner.addVariable(argument.name, argument, false)) {
                report(Rule.DUPLICATE_DECLARATION, argument, "duplicate argument " + errorMessageQuote(argument.name));
            }
        }
        if (function.bodyIsBlock) {
            checkBlock(function.body, inner);
        } else {
            for (Node expr : function.body) {
                checkReferences(expr, inner);
            }
        }
    }

    /**
     * Checks every identifier reference below {@code root}, stopping at nested functions.
     */
    private void checkReferences(Node root, ScopedSymbolTable table) {
        if (root == null) {
            return;
        }
        TreeWalker.walk(root, (control, node) -> {
            Node terminal = node.terminalNode();
            if (terminal instanceof FunctionNode) {
                checkFunction((FunctionNode) terminal, table);
                control.skipChildren();
            } else if (terminal instanceof DotNode) {
                exemptIds.add(((DotNode) terminal).right.getId());
            } else if (terminal instanceof CallNode) {
                Node callee = ((CallNode) terminal).callee.terminalNode();
                if (callee instanceof IdentifierNode) {
                    exemptIds.add(callee.getId());
                }
            } else if (terminal instanceof IdentifierNode) {
                checkReference((IdentifierNode) terminal, table);
            }
            return node;
        });
    }

    private void checkReference(IdentifierNode id, ScopedSymbolTable table) {
        if (declaredIds.contains(id.getId()) || exemptIds.contains(id.getId())) {
            return;
        }
        if (id.name.equals("_")) {
            report(Rule.UNDERSCORE_VARIABLE_REFERENCE, id, "cannot reference underscore variable " + errorMessageQuote("_"));
            return;
        }
        SymbolTable.SymbolEntry entry = table.lookup(id.name);
        if (entry == null) {
            report(Rule.UNDECLARED_VARIABLE, id, "undeclared variable " + errorMessageQuote(id.name));
        } else if (entry.isConst() && assignedIds.contains(id.getId())) {
            report(Rule.ASSIGNMENT_TO_CONST_VARIABLE, id, "cannot assign to const variable " + errorMessageQuote(id.name));
        }
    }
}
