package com.pyflow.python;

import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Module;
import com.pyflow.python.ast.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonParserTest {

    @Test
    void parsesTypicalPandasScript() {
        String source = """
                import pandas as pd
                from sklearn.preprocessing import StandardScaler, LabelEncoder as LE

                df = pd.read_csv("in.csv")
                df = df.dropna()
                df["total"] = df["a"] + df["b"]
                result = df.groupby("k").agg({"v": "sum"})
                result.to_csv("out.csv", index=False)
                """;
        Module module = PythonParser.parse(source);
        assertEquals(7, module.body().size());

        Stmt.Import imp = assertInstanceOf(Stmt.Import.class, module.body().get(0));
        assertEquals("pd", imp.names().get(0).asName());

        Stmt.ImportFrom from = assertInstanceOf(Stmt.ImportFrom.class, module.body().get(1));
        assertEquals("sklearn.preprocessing", from.module());
        assertEquals("LE", from.names().get(1).asName());

        Stmt.Assign read = assertInstanceOf(Stmt.Assign.class, module.body().get(2));
        assertEquals(4, read.line());
        Expr.Call call = assertInstanceOf(Expr.Call.class, read.value());
        Expr.Attribute func = assertInstanceOf(Expr.Attribute.class, call.func());
        assertEquals("read_csv", func.attr());

        Stmt.Assign column = assertInstanceOf(Stmt.Assign.class, module.body().get(4));
        assertInstanceOf(Expr.Subscript.class, column.targets().get(0));
        assertInstanceOf(Expr.BinOp.class, column.value());

        Stmt.ExprStmt write = assertInstanceOf(Stmt.ExprStmt.class, module.body().get(6));
        Expr.Call toCsv = assertInstanceOf(Expr.Call.class, write.value());
        assertTrue(toCsv.hasKeyword("index"));
    }

    @Test
    void endLineCoversMultiLineStatements() {
        String source = """
                df = df.merge(
                    other,
                    on="id",
                )
                x = 1
                """;
        Module module = PythonParser.parse(source);
        Stmt first = module.body().get(0);
        assertEquals(1, first.line());
        assertEquals(4, first.endLine());
        assertTrue(module.textOf(first).startsWith("df = df.merge("));
    }

    @Test
    void controlFlowBlocks() {
        String source = """
                for col in cols:
                    if col in df:
                        df = df.drop(columns=[col])
                    elif col == "x":
                        pass
                    else:
                        continue
                try:
                    df = df.sort_values("a")
                except (KeyError, ValueError) as e:
                    raise
                finally:
                    done = True
                with open("f") as fh:
                    text = fh.read()
                while n > 0:
                    n -= 1
                """;
        Module module = PythonParser.parse(source);
        assertEquals(4, module.body().size());
        Stmt.For loop = assertInstanceOf(Stmt.For.class, module.body().get(0));
        Stmt.If branch = assertInstanceOf(Stmt.If.class, loop.body().get(0));
        assertInstanceOf(Stmt.If.class, branch.orElse().get(0));
        Stmt.Try attempt = assertInstanceOf(Stmt.Try.class, module.body().get(1));
        assertEquals("e", attempt.handlers().get(0).name());
        assertEquals(1, attempt.finalBody().size());
        Stmt.While loop2 = assertInstanceOf(Stmt.While.class, module.body().get(3));
        assertInstanceOf(Stmt.AugAssign.class, loop2.body().get(0));
    }

    @Test
    void functionsClassesAndDecorators() {
        String source = """
                @cache
                def clean(df, cols=None, *args, **kw) -> pd.DataFrame:
                    return df

                class Model(Base):
                    x: int = 0
                """;
        Module module = PythonParser.parse(source);
        Stmt.FunctionDef def = assertInstanceOf(Stmt.FunctionDef.class, module.body().get(0));
        assertEquals(List.of("df", "cols=None", "*args", "**kw"), def.params());
        assertEquals(1, def.decorators().size());
        assertEquals(1, def.line());
        Stmt.ClassDef cls = assertInstanceOf(Stmt.ClassDef.class, module.body().get(1));
        assertInstanceOf(Stmt.AnnAssign.class, cls.body().get(0));
    }

    @Test
    void semicolonsSplitStatements() {
        Module module = PythonParser.parse("a = 1; b = 2\nif a: c = 3; d = 4\n");
        assertEquals(3, module.body().size());
        Stmt.If branch = assertInstanceOf(Stmt.If.class, module.body().get(2));
        assertEquals(2, branch.body().size());
    }

    @Test
    void chainedAndTupleAssignment() {
        Module module = PythonParser.parse("a = b = df.copy()\nx, y = train_test_split(df)\n");
        Stmt.Assign chained = assertInstanceOf(Stmt.Assign.class, module.body().get(0));
        assertEquals(2, chained.targets().size());
        Stmt.Assign unpack = assertInstanceOf(Stmt.Assign.class, module.body().get(1));
        assertInstanceOf(Expr.Tuple.class, unpack.targets().get(0));
    }

    @Test
    void expressionForms() {
        Expr lambda = PythonParser.parseExpression("df.apply(lambda r: r.a if r.b > 0 else None, axis=1)");
        Expr.Call call = assertInstanceOf(Expr.Call.class, lambda);
        assertInstanceOf(Expr.Lambda.class, call.args().get(0));

        Expr filter = PythonParser.parseExpression("df[(df['a'] > 1) & ~df['b'].isna()]");
        Expr.Subscript sub = assertInstanceOf(Expr.Subscript.class, filter);
        Expr.BinOp and = assertInstanceOf(Expr.BinOp.class, sub.index());
        assertEquals("&", and.op());

        Expr slice = PythonParser.parseExpression("df.iloc[1:10, ::2]");
        Expr.Subscript s = assertInstanceOf(Expr.Subscript.class, slice);
        assertInstanceOf(Expr.Tuple.class, s.index());

        Expr gen = PythonParser.parseExpression("sum(x for x in xs if x)");
        Expr.Call sum = assertInstanceOf(Expr.Call.class, gen);
        assertInstanceOf(Expr.Comprehension.class, sum.args().get(0));

        Expr dict = PythonParser.parseExpression("{'a': 1, **rest}");
        Expr.Dict d = assertInstanceOf(Expr.Dict.class, dict);
        assertNull(d.keys().get(1));

        Expr power = PythonParser.parseExpression("-2 ** 3 ** 2");
        Expr.UnaryOp neg = assertInstanceOf(Expr.UnaryOp.class, power);
        Expr.BinOp pow = assertInstanceOf(Expr.BinOp.class, neg.operand());
        assertInstanceOf(Expr.BinOp.class, pow.right());

        Expr cmp = PythonParser.parseExpression("a is not None and b not in c");
        Expr.BoolOp bool = assertInstanceOf(Expr.BoolOp.class, cmp);
        assertEquals("is not", ((Expr.Compare) bool.values().get(0)).ops().get(0));
        assertEquals("not in", ((Expr.Compare) bool.values().get(1)).ops().get(0));
    }

    @Test
    void adjacentStringsConcatenate() {
        Expr.Constant c = assertInstanceOf(Expr.Constant.class, PythonParser.parseExpression("'a' \"b\""));
        assertEquals("ab", c.value());
        assertInstanceOf(Expr.FormattedString.class, PythonParser.parseExpression("'a' f'{b}'"));
    }

    @Test
    void syntaxErrorsCarryPosition() {
        SourceSyntaxException unclosed = assertThrows(SourceSyntaxException.class,
                () -> PythonParser.parse("import pandas as pd\ndf = broken(\n"));
        assertEquals(2, unclosed.getLine());

        SourceSyntaxException noBlock = assertThrows(SourceSyntaxException.class,
                () -> PythonParser.parse("if x:\ny = 1\n"));
        assertEquals(2, noBlock.getLine());
        assertTrue(noBlock.getMessage().contains("indented block"));

        assertThrows(SourceSyntaxException.class, () -> PythonParser.parse("f() = 1\n"));
        assertThrows(SourceSyntaxException.class, () -> PythonParser.parse("x = = 1\n"));
        assertThrows(SourceSyntaxException.class, () -> PythonParser.parse("x = 1\n    y = 2\n"));
        assertThrows(SourceSyntaxException.class, () -> PythonParser.parse("x = import\n"));
    }

    @Test
    void emptySourceParsesToEmptyModule() {
        assertTrue(PythonParser.parse("").body().isEmpty());
        assertTrue(PythonParser.parse("# only a comment\n\n").body().isEmpty());
    }
}
