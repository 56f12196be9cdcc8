package com.raditha.pyrefactor.parser;

import com.raditha.pyrefactor.ast.ConstantKind;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.FormattedField;
import com.raditha.pyrefactor.ast.MatchCase;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Parameter;
import com.raditha.pyrefactor.ast.ParameterKind;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.StringPart;
import com.raditha.pyrefactor.model.Range;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonParserTest {

    @Test
    void testFunctionDefinition() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                def add(a, b=1):
                    return a + b
                """);

        assertEquals(1, module.body().size());
        Stmt.FunctionDef function = assertInstanceOf(Stmt.FunctionDef.class, module.body().get(0));
        assertEquals("add", function.name());
        assertEquals(List.of("a", "b"), function.parameters().names());
        assertTrue(function.parameters().hasDefaults());
        assertEquals(new Range(1, 8, 1, 16), function.parameters().range());
        assertEquals(1, function.range().startLine());
        assertEquals(2, function.range().endLine());

        Stmt.Return ret = assertInstanceOf(Stmt.Return.class, function.body().get(0));
        Expr.BinOp sum = assertInstanceOf(Expr.BinOp.class, ret.value());
        assertEquals("+", sum.op());
    }

    @Test
    void testDecoratorsExtendFullRange() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                class Shape:
                    @staticmethod
                    def unit():
                        return 1
                """);

        Stmt.ClassDef owner = assertInstanceOf(Stmt.ClassDef.class, module.body().get(0));
        Stmt.FunctionDef method = assertInstanceOf(Stmt.FunctionDef.class, owner.body().get(0));
        assertEquals(3, method.range().startLine());
        assertEquals(2, method.fullRange().startLine());
        assertTrue(method.hasDecorator("staticmethod"));
    }

    @Test
    void testParameterKinds() throws PythonSyntaxException {
        Module module = PythonParser.parse("def f(a, /, b, *args, c, d=2, **kw): pass\n");

        Stmt.FunctionDef function = (Stmt.FunctionDef) module.body().get(0);
        List<ParameterKind> kinds = function.parameters().all().stream().map(Parameter::kind).toList();
        assertEquals(List.of(ParameterKind.POSITIONAL_ONLY, ParameterKind.SLASH, ParameterKind.POSITIONAL,
                ParameterKind.VAR_POSITIONAL, ParameterKind.KEYWORD_ONLY, ParameterKind.KEYWORD_ONLY,
                ParameterKind.VAR_KEYWORD), kinds);
        assertEquals(List.of("a", "b", "args", "c", "d", "kw"), function.parameters().names());
        assertTrue(function.parameters().hasVariadic());
    }

    @Test
    void testInlineBodyAndElif() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                if x: y = 1
                elif z:
                    y = 2
                else:
                    y = 3
                """);

        Stmt.If top = assertInstanceOf(Stmt.If.class, module.body().get(0));
        assertEquals(1, top.body().size());
        Stmt.If elif = assertInstanceOf(Stmt.If.class, top.orelse().get(0));
        assertEquals(1, elif.orelse().size());
        assertEquals(5, top.range().endLine());
    }

    @Test
    void testSemicolonsSplitStatements() throws PythonSyntaxException {
        Module module = PythonParser.parse("a = 1; b = 2\n");

        assertEquals(2, module.body().size());
        assertInstanceOf(Stmt.Assign.class, module.body().get(1));
    }

    @Test
    void testAssignmentForms() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                a = b = 1
                c += 2
                d: int = 3
                self.x, y[0] = pair
                """);

        Stmt.Assign chained = (Stmt.Assign) module.body().get(0);
        assertEquals(2, chained.targets().size());
        Stmt.AugAssign augmented = (Stmt.AugAssign) module.body().get(1);
        assertEquals("+", augmented.op());
        assertInstanceOf(Stmt.AnnAssign.class, module.body().get(2));
        Stmt.Assign unpacking = (Stmt.Assign) module.body().get(3);
        assertInstanceOf(Expr.TupleExpr.class, unpacking.targets().get(0));
    }

    @Test
    void testCallWithKeywords() throws PythonSyntaxException {
        Expr expression = PythonParser.parseExpression("service.run(1, name='x', **extra)");

        Expr.Call call = assertInstanceOf(Expr.Call.class, expression);
        assertNull(call.calleeName(), "An attribute call has no bare callee name");
        assertEquals(1, call.args().size());
        assertEquals(2, call.keywords().size());
        assertEquals("name", call.keywords().get(0).arg());
        assertNull(call.keywords().get(1).arg());
    }

    @Test
    void testConstants() throws PythonSyntaxException {
        Expr.Constant none = assertInstanceOf(Expr.Constant.class, PythonParser.parseExpression("None"));
        assertEquals(ConstantKind.NONE, none.kind());
        Expr.Constant number = assertInstanceOf(Expr.Constant.class, PythonParser.parseExpression("0x1F"));
        assertEquals(ConstantKind.NUMBER, number.kind());
        assertEquals("0x1F", number.text());
    }

    @Test
    void testFormattedStringFields() throws PythonSyntaxException {
        Expr.Str str = assertInstanceOf(Expr.Str.class, PythonParser.parseExpression("f\"hi {self.name}\""));

        assertTrue(str.isFormatted());
        assertEquals(1, str.parts().get(0).fields().size());
        assertInstanceOf(Expr.Attribute.class, str.parts().get(0).fields().get(0).expression());
    }

    @Test
    void testComprehensionsAndLambda() throws PythonSyntaxException {
        assertInstanceOf(Expr.ListComp.class, PythonParser.parseExpression("[x * 2 for x in items if x]"));
        assertInstanceOf(Expr.DictComp.class, PythonParser.parseExpression("{k: v for k, v in pairs}"));
        assertInstanceOf(Expr.Lambda.class, PythonParser.parseExpression("lambda a, b=1: a + b"));
    }

    @Test
    void testCompoundStatements() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                try:
                    with open(path) as f, lock:
                        for line in f:
                            if not line:
                                continue
                except (IOError, ValueError) as e:
                    raise RuntimeError() from e
                finally:
                    done = True
                """);

        Stmt.Try statement = assertInstanceOf(Stmt.Try.class, module.body().get(0));
        assertEquals(1, statement.handlers().size());
        assertEquals("e", statement.handlers().get(0).name());
        Stmt.With with = assertInstanceOf(Stmt.With.class, statement.body().get(0));
        assertEquals(2, with.items().size());
    }

    @Test
    void testMatchStatement() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                match command:
                    case 1:
                        handled = True
                    case Point(x=0, y=y) if y > limit:
                        origin(y)
                    case [first, *rest]:
                        pass
                    case Color.RED | _:
                        pass
                """);

        Stmt.Match match = assertInstanceOf(Stmt.Match.class, module.body().get(0));
        assertEquals("command", ((Expr.Name) match.subject()).id());
        assertEquals(4, match.cases().size());
        assertEquals(new Range(1, 1, 9, 13), match.range());

        MatchCase literal = match.cases().get(0);
        assertEquals("1", literal.pattern());
        assertTrue(literal.captures().isEmpty());

        MatchCase point = match.cases().get(1);
        assertEquals("Point(x=0, y=y)", point.pattern());
        assertEquals(List.of("y"), point.captures().stream().map(Expr.Name::id).toList());
        assertEquals("Point", ((Expr.Name) point.values().get(0)).id());
        assertInstanceOf(Expr.Compare.class, point.guard());

        MatchCase sequence = match.cases().get(2);
        assertEquals(List.of("first", "rest"), sequence.captures().stream().map(Expr.Name::id).toList());

        MatchCase alternatives = match.cases().get(3);
        assertTrue(alternatives.captures().isEmpty(), "The wildcard binds nothing");
        assertInstanceOf(Expr.Attribute.class, alternatives.values().get(0));
    }

    @Test
    void testTypeParameters() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                def first[T](items: list[T]) -> T:
                    return items[0]


                class Box[T]:
                    pass
                """);

        Stmt.FunctionDef function = assertInstanceOf(Stmt.FunctionDef.class, module.body().get(0));
        assertEquals("[T]", function.typeParameters());
        assertEquals(List.of("items"), function.parameters().names());
        assertInstanceOf(Expr.Subscript.class, function.parameters().all().get(0).annotation());
        assertEquals("T", ((Expr.Name) function.returns()).id());
        Stmt.ClassDef box = assertInstanceOf(Stmt.ClassDef.class, module.body().get(1));
        assertEquals("[T]", box.typeParameters());
    }

    @Test
    void testTypeAlias() throws PythonSyntaxException {
        Module module = PythonParser.parse("type Point = tuple[float, float]\n");

        Stmt.TypeAlias alias = assertInstanceOf(Stmt.TypeAlias.class, module.body().get(0));
        assertEquals("Point", alias.name().id());
        assertNull(alias.typeParameters());
        Expr.Subscript value = assertInstanceOf(Expr.Subscript.class, alias.value());
        assertEquals(2, assertInstanceOf(Expr.TupleExpr.class, value.slice()).elements().size());
        assertEquals(new Range(1, 1, 1, 33), alias.range());
    }

    @Test
    void testFormattedStringWithNestedQuotes() throws PythonSyntaxException {
        Module module = PythonParser.parse("x = f\"{d[\"k\"]}\"\n");

        Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, module.body().get(0));
        StringPart part = assertInstanceOf(Expr.Str.class, assign.value()).parts().get(0);
        assertEquals("{d[\"k\"]}", part.body());
        FormattedField field = part.fields().get(0);
        assertEquals(1, field.bodyStart());
        assertEquals(7, field.bodyEnd());
        assertInstanceOf(Expr.Subscript.class, field.expression());
    }

    @Test
    void testMultiLineExpression() throws PythonSyntaxException {
        Expr.Call call = assertInstanceOf(Expr.Call.class, PythonParser.parseExpression("run(a,\n    b)"));
        assertEquals(2, call.args().size());
        assertInstanceOf(Expr.BinOp.class, PythonParser.parseExpression("a\n+ b"));
    }

    @Test
    void testKeywordsAreRecognized() {
        assertTrue(PythonParser.isKeyword("lambda"));
        assertTrue(PythonParser.isKeyword("None"));
        assertFalse(PythonParser.isKeyword("print"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "def f(a=1, b): pass|non-default argument follows default argument",
            "def f(*a, *b): pass|* argument may appear only once",
            "def f(*): pass|named arguments must follow bare *",
            "break|'break' outside loop",
            "while x:\\n    def g():\\n        continue|'continue' not properly in loop",
            "def f(a, a): pass|duplicate argument 'a' in function definition",
            "f(a=1, a=2)|keyword argument repeated: a",
            "f(a=1, 2)|positional argument follows keyword argument",
            "del 1|cannot delete literal"
    })
    void testRejectedByCompiler(String source, String reason) {
        String code = source.replace("\\n", "\n") + "\n";

        PythonSyntaxException e = assertThrows(PythonSyntaxException.class, () -> PythonParser.parse(code));
        assertEquals(reason, e.getReason());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "def f():\\nreturn 1|2",
            "x = 1\\n    y = 2|2",
            "try:\\n    pass\\nx = 1|3",
            "x = (1,|2"
    })
    void testGrammarErrors(String source, int line) {
        String code = source.replace("\\n", "\n") + "\n";

        PythonSyntaxException e = assertThrows(PythonSyntaxException.class, () -> PythonParser.parse(code));
        assertTrue(e.getLine() <= line, () -> "Reported at line " + e.getLine());
        assertTrue(e.getMessage().contains("(line " + e.getLine() + ", column "));
    }

    @Test
    void testExpressionMustBeComplete() {
        assertThrows(PythonSyntaxException.class, () -> PythonParser.parseExpression("a +"));
        assertThrows(PythonSyntaxException.class, () -> PythonParser.parseExpression("a b"));
        assertThrows(PythonSyntaxException.class, () -> PythonParser.parseExpression(""));
    }
}
