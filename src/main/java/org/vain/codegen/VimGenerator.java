package org.vain.codegen;

import org.vain.astnode.*;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lowers an analyzed tree to Vim script.
 * <p>
 * Names declared at the top level of the file render with the {@code s:}
 * prefix, argument references inside named functions with {@code a:}.
 * Function literals whose body is a block, and named function literals, have
 * no Vim expression form: they are hoisted into script-local definitions which
 * are printed once, ahead of the body, and referenced through
 * {@code function('name')}. Because of that the whole unit is rendered before
 * the first chunk is handed out.
 */
public class VimGenerator extends AbstractGenerator {

    public static final String EXTENSION = ".vim";
    public static final String BEGIN_HOISTED = "\" vain: begin named expression functions";
    public static final String END_HOISTED = "\" vain: end named expression functions";
    static final String ANONYMOUS_PREFIX = "s:_anonymous_func";

    // single-letter slice starts that Vim would read as a scope prefix
    private static final String SCOPE_LETTERS = "gwtslav";

    private final List<String> hoisted = new ArrayList<>();
    private final Map<String, String> scriptNames = new HashMap<>();
    private Deque<Map<String, String>> frames = new ArrayDeque<>();
    private int anonymousCount = 0;

    public VimGenerator(EmitterContext ctx) {
        super(ctx);
    }

    @Override
    public Path outputPath(Path source) {
        String name = source.getFileName().toString();
        if (name.endsWith(".vain")) {
            name = name.substring(0, name.length() - ".vain".length());
        }
        return source.resolveSibling(name + EXTENSION);
    }

    @Override
    public Iterator<TextChunk> render(Node unit) {
        hoisted.clear();
        scriptNames.clear();
        frames = new ArrayDeque<>();
        anonymousCount = 0;
        if (unit.terminalNode() instanceof TopLevelNode topLevel) {
            collectScriptNames(topLevel.body);
        }

        List<TextChunk> body = new ArrayList<>();
        super.render(unit).forEachRemaining(body::add);
        if (hoisted.isEmpty()) {
            return body.iterator();
        }
        ctx.logDebug("hoisted " + hoisted.size() + " function(s)");
        List<TextChunk> chunks = new ArrayList<>();
        chunks.add(TextChunk.text(BEGIN_HOISTED + "\n"));
        for (int i = 0; i < hoisted.size(); i++) {
            if (i > 0) {
                chunks.add(TextChunk.text("\n"));
            }
            chunks.add(TextChunk.text(hoisted.get(i)));
        }
        chunks.add(TextChunk.text(END_HOISTED + "\n\n"));
        chunks.addAll(body);
        return chunks.iterator();
    }

    private void collectScriptNames(List<Node> body) {
        for (Node node : body) {
            Node statement = node.terminalNode();
            if (statement instanceof DeclarationNode declaration) {
                for (IdentifierNode id : declaration.declaredIdentifiers()) {
                    scriptNames.put(id.name, "s:");
                }
            } else if (statement instanceof ForNode forNode) {
                for (IdentifierNode id : DeclarationNode.identifiersOf(forNode.left)) {
                    scriptNames.put(id.name, "s:");
                }
                collectScriptNames(forNode.body);
            } else if (statement instanceof WhileNode whileNode) {
                collectScriptNames(whileNode.body);
            } else if (statement instanceof IfNode ifNode) {
                collectScriptNames(ifNode.body);
                if (ifNode.elseBody != null) {
                    collectScriptNames(ifNode.elseBody);
                }
            } else if (statement instanceof FunctionNode function && !function.isExpression() && function.name != null) {
                scriptNames.put(function.name, namePrefix(function));
            }
        }
    }

    private String resolve(String name) {
        if (name.indexOf('#') >= 0) {
            return name;
        }
        for (Map<String, String> frame : frames) {
            String prefix = frame.get(name);
            if (prefix != null) {
                return prefix + name;
            }
        }
        String prefix = scriptNames.get(name);
        return prefix == null ? name : prefix + name;
    }

    private void declareLocal(Node target) {
        Map<String, String> frame = frames.peek();
        if (frame == null) {
            return;
        }
        for (IdentifierNode id : DeclarationNode.identifiersOf(target)) {
            frame.put(id.name, "");
        }
    }

    private static boolean isScriptLocal(FunctionNode node) {
        return !node.hasModifier("autoload") && !node.hasModifier("global");
    }

    private static String namePrefix(FunctionNode node) {
        return isScriptLocal(node) ? "s:" : "";
    }

    private static String functionName(FunctionNode node) {
        return namePrefix(node) + node.name;
    }

    static String zeroValue(String type) {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "int" -> "0";
            case "float" -> "0.0";
            case "string" -> "''";
            case "list" -> "[]";
            case "dict" -> "{}";
            case "bool" -> "v:false";
            default -> "v:null";
        };
    }

    @Override
    protected int precedenceOf(Node node) {
        if (node.terminalNode() instanceof FunctionNode) {
            // {args->expr} and function('name') are both atoms in Vim
            return Precedence.ATOM;
        }
        return super.precedenceOf(node);
    }

    @Override
    protected void expressionStatement(Node node) {
        if (node instanceof CallNode) {
            line("call " + expr(node));
        } else {
            line("\" " + expr(node));
        }
    }

    @Override
    public void visit(CommentNode node) {
        line("\"" + node.content());
    }

    @Override
    public void visit(ImportNode node) {
        // resolved by the editor at load time
    }

    @Override
    public void visit(FunctionNode node) {
        if (!node.isExpression()) {
            if (node.name != null) {
                // nested definitions are visible to the rest of the enclosing body
                Map<String, String> frame = frames.peek();
                if (frame != null) {
                    frame.put(node.name, namePrefix(node));
                }
                define(node, functionName(node));
            } else if (!node.bodyIsBlock) {
                line("\" " + lambda(node));
            }
            return;
        }
        if (node.isLambda()) {
            sb.append(lambda(node));
            return;
        }
        String name = node.name != null ? functionName(node) : ANONYMOUS_PREFIX + anonymousCount++;
        StringBuilder saved = sb;
        int savedIndent = indentLevel;
        sb = new StringBuilder();
        indentLevel = 0;
        try {
            define(node, name);
            hoisted.add(sb.toString());
        } finally {
            sb = saved;
            indentLevel = savedIndent;
        }
        sb.append("function('").append(name).append("')");
    }

    private void define(FunctionNode node, String name) {
        List<String> modifiers = new ArrayList<>();
        boolean abort = true;
        for (String modifier : node.modifiers) {
            switch (modifier) {
                case "noabort" -> abort = false;
                case "range", "dict", "closure" -> modifiers.add(modifier);
                default -> {
                }
            }
        }
        if (abort) {
            modifiers.add("abort");
        }

        Map<String, String> frame = new HashMap<>();
        Deque<Map<String, String>> saved = frames;
        if (!node.hasModifier("closure")) {
            frames = new ArrayDeque<>();
        }
        frames.push(frame);
        if (node.name != null) {
            frame.put(node.name, namePrefix(node));
        }
        try {
            StringBuilder header = new StringBuilder("function! ").append(name).append("(");
            for (int i = 0; i < node.arguments.size(); i++) {
                ArgumentNode argument = (ArgumentNode) node.arguments.get(i).terminalNode();
                if (i > 0) {
                    header.append(",");
                }
                header.append(argument.name);
                if (argument.defaultValue != null) {
                    header.append(" = ").append(expr(argument.defaultValue));
                }
                frame.put(argument.name, "a:");
            }
            header.append(")");
            if (!modifiers.isEmpty()) {
                header.append(" ").append(String.join(" ", modifiers));
            }
            line(header.toString());
            if (node.bodyIsBlock) {
                block(node.body);
            } else {
                indentLevel++;
                line("return " + expr(node.body.get(0)));
                indentLevel--;
            }
            line("endfunction");
        } finally {
            frames.pop();
            frames = saved;
        }
    }

    private String lambda(FunctionNode node) {
        Map<String, String> frame = new HashMap<>();
        StringBuilder text = new StringBuilder("{");
        for (int i = 0; i < node.arguments.size(); i++) {
            ArgumentNode argument = (ArgumentNode) node.arguments.get(i).terminalNode();
            if (i > 0) {
                text.append(",");
            }
            text.append(argument.name);
            frame.put(argument.name, "");
        }
        frames.push(frame);
        try {
            text.append("->").append(expr(node.body.get(0)));
        } finally {
            frames.pop();
        }
        return text.append("}").toString();
    }

    @Override
    public void visit(ReturnNode node) {
        line(node.value == null ? "return" : "return " + expr(node.value));
    }

    @Override
    public void visit(DeclarationNode node) {
        String right = node.right == null ? zeroValue(node.type) : expr(node.right);
        declareLocal(node.left);
        line((node.isConst ? "const " : "let ") + target(node.left) + " = " + right);
    }

    private String target(Node node) {
        Node terminal = node.terminalNode();
        if (terminal instanceof IdentifierNode id) {
            return resolve(id.name);
        }
        if (terminal instanceof ListNode list) {
            List<String> names = new ArrayList<>();
            for (Node element : list.elements) {
                if (!(element.terminalNode() instanceof IdentifierNode id)) {
                    throw fatal(element, "identifier expected in destructuring target");
                }
                names.add(resolve(id.name));
            }
            return "[" + String.join(",", names) + "]";
        }
        throw fatal(node, "invalid declaration target");
    }

    @Override
    public void visit(AssignNode node) {
        line("let " + expr(node.left) + " = " + expr(node.right));
    }

    @Override
    public void visit(IfNode node) {
        branch(node, "if ");
        line("endif");
    }

    private void branch(IfNode node, String keyword) {
        line(keyword + expr(node.condition));
        block(node.body);
        if (node.elseBody == null) {
            return;
        }
        if (node.elseIf && node.elseBody.get(0).terminalNode() instanceof IfNode elseIf) {
            branch(elseIf, "elseif ");
        } else {
            line("else");
            block(node.elseBody);
        }
    }

    @Override
    public void visit(WhileNode node) {
        line("while " + expr(node.condition));
        block(node.body);
        line("endwhile");
    }

    @Override
    public void visit(ForNode node) {
        String right = expr(node.right);
        declareLocal(node.left);
        line("for " + target(node.left) + " in " + right);
        block(node.body);
        line("endfor");
    }

    @Override
    public void visit(SliceNode node) {
        String from = node.from == null ? "" : expr(node.from);
        if (from.length() == 1 && SCOPE_LETTERS.contains(from)) {
            from = from + " ";
        }
        String to = node.to == null ? "" : expr(node.to);
        sb.append(expr(node.left, Precedence.POSTFIX)).append("[").append(from).append(":").append(to).append("]");
    }

    @Override
    public void visit(CallNode node) {
        sb.append(expr(node.callee, Precedence.POSTFIX)).append("(").append(join(node.arguments, ",")).append(")");
    }

    @Override
    public void visit(SubscriptNode node) {
        sb.append(expr(node.left, Precedence.POSTFIX)).append("[").append(expr(node.index)).append("]");
    }

    @Override
    public void visit(DotNode node) {
        if (!(node.right.terminalNode() instanceof IdentifierNode member)) {
            throw fatal(node.right, "identifier expected after '.'");
        }
        sb.append(expr(node.left, Precedence.POSTFIX)).append(".").append(member.name);
    }

    @Override
    public void visit(IdentifierNode node) {
        sb.append(resolve(node.name));
    }

    @Override
    public void visit(StringNode node) {
        sb.append(node.literal);
    }

    @Override
    public void visit(ListNode node) {
        sb.append("[").append(join(node.elements, ",")).append("]");
    }

    @Override
    public void visit(DictionaryNode node) {
        sb.append("{");
        for (int i = 0; i < node.entries.size(); i++) {
            DictionaryNode.Entry entry = node.entries.get(i);
            if (i > 0) {
                sb.append(",");
            }
            sb.append(expr(entry.key)).append(":").append(expr(entry.value));
        }
        sb.append("}");
    }

    @Override
    public void visit(RegisterNode node) {
        sb.append(RegisterNode.SIGIL).append(node.name.isEmpty() ? "\"" : node.name);
    }

    @Override
    public void visit(SpecialLiteralNode node) {
        sb.append(node.literal.vimText);
    }
}
