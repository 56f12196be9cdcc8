package com.raditha.pyrefactor.parser;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Stmt;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.Set;

/**
 * Parses Python 3 source with tree-sitter-python and converts the syntax tree
 * into the {@link Stmt} and {@link Expr} model.
 * <p>
 * A tree containing an {@code ERROR} or missing node is rejected with the
 * position of the first such node. The conversion adds the checks that the
 * grammar leaves to the compiler, see {@link SyntaxTreeBuilder}.
 */
public class PythonParser {

    private static final Logger logger = LoggerFactory.getLogger(PythonParser.class);

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    // TSParser is not thread safe
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("Failed to load the tree-sitter Python grammar");
        }
        return parser;
    });

    private PythonParser() {
    }

    /**
     * Parses a whole file.
     */
    public static Module parse(String source) throws PythonSyntaxException {
        SourcePositions positions = new SourcePositions(source);
        TSTree tree = PARSER.get().parseString(null, source);
        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            TSNode broken = firstError(root);
            if (broken == null) {
                throw new PythonSyntaxException("invalid syntax", 1, 1);
            }
            int start = positions.startChar(broken);
            String reason = broken.isMissing() ? "expected '" + broken.getType() + "'" : "invalid syntax";
            logger.debug("Syntax error at line {}: {}", positions.line(start), reason);
            throw new PythonSyntaxException(reason, positions.line(start), positions.column(start));
        }
        return new SyntaxTreeBuilder(positions).module(root);
    }

    /**
     * Parses a single expression (a bare tuple is allowed). Newlines inside the
     * text are insignificant, as they are inside brackets; an expression that
     * only parses once bracketed has its first line shifted by one column.
     */
    public static Expr parseExpression(String source) throws PythonSyntaxException {
        try {
            return singleExpression(source);
        } catch (PythonSyntaxException e) {
            if (source.indexOf('\n') < 0) {
                throw e;
            }
            logger.debug("Retrying multi-line expression in brackets: {}", e.getReason());
            return singleExpression("(" + source + ")");
        }
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    private static Expr singleExpression(String source) throws PythonSyntaxException {
        Module module = parse(source);
        if (module.body().size() != 1 || !(module.body().get(0) instanceof Stmt.ExprStmt statement)) {
            throw new PythonSyntaxException("invalid syntax", 1, 1);
        }
        return statement.value();
    }

    /**
     * The first node, in document order, that is an {@code ERROR} node or was
     * inserted by error recovery.
     */
    private static @Nullable TSNode firstError(TSNode node) {
        if ("ERROR".equals(node.getType()) || node.isMissing()) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                TSNode found = firstError(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
