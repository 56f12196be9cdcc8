package com.raditha.pyrefactor.parser;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.parser.SourceRenderer.Precedence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SourceRendererTest {

    private SourceRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new SourceRenderer();
    }

    private String roundTrip(String expression) throws PythonSyntaxException {
        return renderer.render(PythonParser.parseExpression(expression));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a + b * c",
            "(a + b) * c",
            "a - (b - c)",
            "-x ** 2",
            "(-x) ** 2",
            "not a and b or c",
            "a if b else c",
            "f(a, k=v)",
            "obj.method(*args, **kwargs)",
            "[x for x in items if x]",
            "{'a': 1, **rest}",
            "lambda x: x + 1",
            "a[1:2, ::3]",
            "[1, (2, 3)]",
            "x < y <= z"
    })
    void testCanonicalExpressionsAreStable(String expression) throws PythonSyntaxException {
        assertEquals(expression, roundTrip(expression));
    }

    @Test
    void testSpacingIsNormalized() throws PythonSyntaxException {
        assertEquals("a + b", roundTrip("a+b"));
        assertEquals("f(a, k=v)", roundTrip("f( a ,k = v )"));
    }

    @Test
    void testRedundantParenthesesAreDropped() throws PythonSyntaxException {
        assertEquals("a + b * c", roundTrip("a + (b * c)"));
        assertEquals("x", roundTrip("((x))"));
    }

    @Test
    void testLiteralsKeepTheirSourceText() throws PythonSyntaxException {
        assertEquals("0x_FF", roundTrip("0x_FF"));
        assertEquals("r'\\d+'", roundTrip("r'\\d+'"));
        assertEquals("'a' \"b\"", roundTrip("'a'  \"b\""));
    }

    @Test
    void testFormattedFieldsAreRenderedInPlace() throws PythonSyntaxException {
        assertEquals("f\"hi {self.name}!\"", roundTrip("f\"hi {self .name}!\""));
    }

    @Test
    void testContextAddsParentheses() throws PythonSyntaxException {
        Expr sum = PythonParser.parseExpression("a + b");

        assertEquals("a + b", renderer.render(sum, Precedence.TEST));
        assertEquals("(a + b)", renderer.render(sum, Precedence.ATOM));
        assertEquals(Precedence.ARITH, SourceRenderer.precedenceOf(sum));
    }

    @Test
    void testStatementsAreIndented() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                def f(x, *, y=1):
                    if x:
                        return y
                    else:
                        pass
                """);

        String rendered = renderer.render(module.body(), "  ");
        assertEquals("""
                  def f(x, *, y=1):
                      if x:
                          return y
                      else:
                          pass
                """, rendered);
    }

    @Test
    void testCustomIndentUnit() throws PythonSyntaxException {
        SourceRenderer tabs = new SourceRenderer("\t");
        Stmt statement = PythonParser.parse("while True:\n    x += 1\n").body().get(0);

        assertEquals("while True:\n\tx += 1\n", tabs.render(statement, ""));
        assertEquals("\t", tabs.getIndentUnit());
    }

    @Test
    void testAnnotatedParameters() throws PythonSyntaxException {
        Stmt.FunctionDef function = (Stmt.FunctionDef) PythonParser
                .parse("def f(a: int, b: str = 'x', *rest): pass\n").body().get(0);

        assertEquals("a: int, b: str = 'x', *rest", renderer.renderParameters(function.parameters()));
    }

    @Test
    void testMatchAndTypeStatements() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                type Pair[T] = tuple[T,T]
                def first[T](p: Pair[T]) -> T:
                    match p:
                        case (a, _) if a>0:
                            return a
                        case _:
                            return p[0]
                """);

        assertEquals("""
                type Pair[T] = tuple[T, T]
                def first[T](p: Pair[T]) -> T:
                    match p:
                        case (a, _) if a > 0:
                            return a
                        case _:
                            return p[0]
                """, renderer.render(module.body(), ""));
    }
}
