package com.pyflow.analyzer;

import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.Transformation;
import com.pyflow.model.transform.TransformationKind;
import com.pyflow.python.SourceSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonCodeAnalyzerTest {

    private final PythonCodeAnalyzer analyzer = new PythonCodeAnalyzer();

    private static List<TransformationKind> kinds(List<Transformation> ts) {
        return ts.stream().map(Transformation::kind).toList();
    }

    @Test
    void readCleanAggregateWrite() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd

                df = pd.read_csv('sales.csv')
                df = df.dropna()
                df['region'] = df['region'].str.upper()
                summary = df.groupby('region').agg({'amount': 'sum'})
                summary.to_csv('summary.csv', index=False)
                """);

        assertEquals(List.of(TransformationKind.READ_DATA, TransformationKind.DROP_NA,
                TransformationKind.STRING_TRANSFORM, TransformationKind.GROUPBY, TransformationKind.WRITE_DATA), kinds(ts));

        Transformation read = ts.get(0);
        assertNull(read.sourceDataframe());
        assertEquals("df", read.targetDataframe());
        assertEquals("sales.csv", read.parameter(Params.PATH));
        assertEquals(3, read.sourceLine());

        Transformation dropna = ts.get(1);
        assertEquals("df", dropna.sourceDataframe());
        assertEquals("df", dropna.targetDataframe());

        Transformation upper = ts.get(2);
        assertEquals("df", upper.sourceDataframe());
        assertEquals("df", upper.targetDataframe());
        assertEquals(List.of("region"), upper.columns());

        Transformation group = ts.get(3);
        assertEquals("df", group.sourceDataframe());
        assertEquals("summary", group.targetDataframe());
        assertEquals(List.of("region"), group.parameters().get(Params.KEYS));
        assertEquals(List.of(Map.of("column", "amount", "function", "sum")), group.parameters().get(Params.AGGREGATIONS));

        Transformation write = ts.get(4);
        assertEquals("summary", write.sourceDataframe());
        assertNull(write.targetDataframe());
        assertEquals("summary.csv", write.parameter(Params.PATH));
    }

    @Test
    void everyChainLinkBecomesOneTransformation() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                clean = df.dropna().fillna(0).sort_values('x')
                """);

        assertEquals(4, ts.size());
        assertEquals(List.of(TransformationKind.DROP_NA, TransformationKind.FILL_NA, TransformationKind.SORT),
                kinds(ts.subList(1, 4)));
        assertEquals("df", ts.get(1).sourceDataframe());
        String first = ts.get(1).targetDataframe();
        assertTrue(first.startsWith(PythonCodeAnalyzer.CHAIN_PREFIX));
        assertEquals(first, ts.get(2).sourceDataframe());
        assertEquals(ts.get(2).targetDataframe(), ts.get(3).sourceDataframe());
        assertEquals("clean", ts.get(3).targetDataframe());
        assertTrue(ts.stream().allMatch(t -> t.sourceLine() != null));
    }

    @Test
    void repeatedRunsAreIdentical() {
        String source = """
                import pandas as pd
                a = pd.read_csv('a.csv')
                b = a.drop_duplicates().head(10)
                b.to_parquet('b.parquet')
                """;
        assertEquals(analyzer.analyze(source), analyzer.analyze(source));
        assertEquals(analyzer.analyze(source), new PythonCodeAnalyzer().analyze(source));
    }

    @Test
    void controlFlowBodiesAreWalkedOnce() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                if len(df) > 100:
                    df = df.head(100)
                else:
                    df = df.dropna()
                for col in ['a', 'b']:
                    print(col)
                try:
                    df = df.drop_duplicates()
                except Exception:
                    pass
                """);

        assertEquals(List.of(TransformationKind.READ_DATA, TransformationKind.HEAD, TransformationKind.DROP_NA,
                TransformationKind.DROP_DUPLICATES), kinds(ts));
    }

    @Test
    void functionBodiesAreNotEntered() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                def clean(frame):
                    return frame.dropna()
                df = pd.read_csv('in.csv')
                """);
        assertEquals(List.of(TransformationKind.READ_DATA), kinds(ts));
    }

    @Test
    void unknownCallOnTracedFrameFallsBackToCode() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                out = df.frobnicate(3)
                """);

        Transformation opaque = ts.get(1);
        assertEquals(TransformationKind.CUSTOM_FUNCTION, opaque.kind());
        assertTrue(opaque.requiresCodeRecipe());
        assertEquals(RecipeType.PYTHON, opaque.effectiveRecipe());
        assertEquals("out = df.frobnicate(3)", opaque.parameter(Params.CODE));
        assertEquals("frobnicate", opaque.parameter(Params.FUNCTION));
        assertEquals("df", opaque.sourceDataframe());
        assertEquals("out", opaque.targetDataframe());
        assertFalse(opaque.notes().isEmpty());
    }

    @Test
    void userFunctionAppliedToFrameIsOpaque() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                def enrich(frame):
                    return frame
                df2 = enrich(df)
                """);
        assertEquals(2, ts.size());
        assertEquals(TransformationKind.CUSTOM_FUNCTION, ts.get(1).kind());
        assertEquals("df2", ts.get(1).targetDataframe());
    }

    @Test
    void invalidSourceRaisesSyntaxError() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class, () -> analyzer.analyze("df = broken("));
        assertTrue(e.getLine() >= 1);
    }

    @Test
    void displayCallsProduceNothing() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                import matplotlib.pyplot as plt
                df = pd.read_csv('in.csv')
                print(df.head())
                df.info()
                df.describe()
                plt.show()
                n = len(df)
                """);
        assertEquals(List.of(TransformationKind.READ_DATA), kinds(ts));
        assertTrue(analyzer.warnings().isEmpty());
    }

    @Test
    void unassignedChainIsKeptWithWarning() {
        List<Transformation> ts = analyzer.analyze("df.dropna().fillna(0).sort_values('x')");

        assertEquals(List.of(TransformationKind.DROP_NA, TransformationKind.FILL_NA, TransformationKind.SORT), kinds(ts));
        assertEquals("df", ts.get(0).sourceDataframe());
        assertEquals(ts.get(0).targetDataframe(), ts.get(1).sourceDataframe());
        assertEquals(ts.get(1).targetDataframe(), ts.get(2).sourceDataframe());
        assertTrue(ts.get(2).targetDataframe().startsWith(PythonCodeAnalyzer.CHAIN_PREFIX));
        assertTrue(ts.get(2).notes().contains("result not assigned"));
        assertEquals(1, analyzer.warnings().size());
        assertTrue(analyzer.warnings().get(0).startsWith("Line 1: result of 'df.dropna().fillna(0).sort_values('x')'"));
    }

    @Test
    void conventionalAliasesWorkWithoutImports() {
        List<Transformation> ts = analyzer.analyze("""
                df = pd.read_csv('in.csv')
                df = df.dropna()
                df['x'] = df['x'].str.upper()
                df['flag'] = np.where(df['x'] == 'A', 1, 0)
                result = df.groupby('cat').agg({'x': 'count'})
                result.to_csv('out.csv')
                """);

        assertEquals(TransformationKind.READ_DATA, ts.get(0).kind());
        assertEquals("in.csv", ts.get(0).parameter(Params.PATH));
        assertEquals(List.of(TransformationKind.DROP_NA, TransformationKind.STRING_TRANSFORM),
                kinds(ts.subList(1, 3)));
        assertEquals(TransformationKind.GROUPBY, ts.get(ts.size() - 2).kind());
        assertEquals(TransformationKind.WRITE_DATA, ts.get(ts.size() - 1).kind());
        assertTrue(analyzer.warnings().isEmpty());
    }

    @Test
    void importedAliasShadowsConventionalOne() {
        List<Transformation> ts = analyzer.analyze("""
                import polars as pd
                df = pd.read_csv('in.csv')
                """);
        assertTrue(ts.isEmpty());
        assertEquals(1, analyzer.warnings().size());
        assertTrue(analyzer.warnings().get(0).contains("'polars.read_csv'"));
    }

    @Test
    void columnAssignmentForms() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                df['total'] = df['price'] * df['qty']
                df['flag'] = 1
                df['price_copy'] = df['price']
                df['total'] += 5
                del df['flag']
                """);

        assertEquals(List.of(TransformationKind.READ_DATA, TransformationKind.COLUMN_CREATE,
                TransformationKind.COLUMN_CREATE, TransformationKind.COLUMN_COPY, TransformationKind.COLUMN_CREATE,
                TransformationKind.COLUMN_DROP), kinds(ts));

        Transformation total = ts.get(1);
        assertEquals("price * qty", total.parameter(Params.EXPRESSION));
        assertEquals("total", total.parameter(Params.OUTPUT));
        assertEquals(List.of("price", "qty"), total.columns());
        assertEquals(ProcessorType.CREATE_COLUMN_WITH_GREL, total.suggestedProcessor());
        assertEquals("df", total.sourceDataframe());
        assertEquals("df", total.targetDataframe());

        assertEquals("1", ts.get(2).parameter(Params.EXPRESSION));
        assertEquals(ProcessorType.COLUMN_COPIER, ts.get(3).suggestedProcessor());
        assertEquals("price_copy", ts.get(3).parameter(Params.OUTPUT));
        assertEquals("total + 5", ts.get(4).parameter(Params.EXPRESSION));
        assertEquals(List.of("flag"), ts.get(5).columns());
    }

    @Test
    void maskSubscriptsBecomeFilters() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                adults = df[df['age'] >= 18]
                mask = (df['city'] == 'Paris') & (df['score'] > 3)
                paris = df[mask]
                known = df.loc[df['email'].notna(), ['name', 'email']]
                """);

        Transformation adults = ts.get(1);
        assertEquals(TransformationKind.FILTER, adults.kind());
        assertEquals(ProcessorType.FILTER_ON_NUMERIC_RANGE, adults.suggestedProcessor());
        assertEquals("age >= 18", adults.parameter(Params.CONDITION));
        assertEquals("adults", adults.targetDataframe());

        Transformation paris = ts.get(2);
        assertEquals(ProcessorType.FILTER_ON_FORMULA, paris.suggestedProcessor());
        assertEquals(List.of("city", "score"), paris.columns());
        assertEquals("paris", paris.targetDataframe());

        assertEquals(TransformationKind.DROP_NA, ts.get(3).kind());
        assertEquals(TransformationKind.COLUMN_SELECT, ts.get(4).kind());
        assertEquals(List.of("name", "email"), ts.get(4).columns());
        assertEquals("known", ts.get(4).targetDataframe());
        assertEquals(ts.get(3).targetDataframe(), ts.get(4).sourceDataframe());
    }

    @Test
    void conditionalLocAssignmentIsIfThenElse() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                df.loc[df['score'] < 0, 'score'] = 0
                """);
        Transformation t = ts.get(1);
        assertEquals(ProcessorType.IF_THEN_ELSE, t.suggestedProcessor());
        assertEquals("score < 0", t.parameter(Params.CONDITION));
        assertEquals(0, t.parameters().get(Params.THEN));
        assertEquals("score", t.parameter(Params.OUTPUT));
    }

    @Test
    void selectedColumnsExpandGroupAggregations() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                totals = df.groupby(['region', 'year'])[['sales', 'units']].sum()
                """);
        Transformation t = ts.get(1);
        assertEquals(TransformationKind.GROUPBY, t.kind());
        assertEquals(List.of("region", "year"), t.parameters().get(Params.KEYS));
        assertEquals(List.of(
                Map.of("column", "sales", "function", "sum"),
                Map.of("column", "units", "function", "sum")), t.parameters().get(Params.AGGREGATIONS));
        assertEquals("totals", t.targetDataframe());
    }

    @Test
    void mergeReadsBothFrames() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                orders = pd.read_csv('orders.csv')
                customers = pd.read_csv('customers.csv')
                joined = orders.merge(customers, on='customer_id', how='left')
                """);
        Transformation merge = ts.get(2);
        assertEquals(TransformationKind.MERGE, merge.kind());
        assertEquals(List.of("orders", "customers"), merge.sourceNames());
        assertEquals("left", merge.parameter(Params.HOW));
    }

    @Test
    void estimatorsFitTransformAndPredict() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                from sklearn.preprocessing import StandardScaler
                from sklearn.linear_model import LogisticRegression
                from sklearn.model_selection import train_test_split

                df = pd.read_csv('train.csv')
                scaler = StandardScaler()
                df[['age', 'income']] = scaler.fit_transform(df[['age', 'income']])
                X = df.drop(columns=['label'])
                y = df['label']
                X_train, X_test, y_train, y_test = train_test_split(X, y, test_size=0.2, random_state=42)
                model = LogisticRegression()
                model.fit(X_train, y_train)
                predictions = model.predict(X_test)
                """);

        assertEquals(List.of(TransformationKind.READ_DATA, TransformationKind.FIT_TRANSFORM,
                TransformationKind.COLUMN_DROP, TransformationKind.SPLIT, TransformationKind.FIT,
                TransformationKind.PREDICT), kinds(ts));

        Transformation scale = ts.get(1);
        assertEquals(RecipeType.PREPARE, scale.effectiveRecipe());
        assertEquals(ProcessorType.NORMALIZER, scale.suggestedProcessor());
        assertEquals(List.of("age", "income"), scale.columns());
        assertEquals("df", scale.targetDataframe());

        Transformation split = ts.get(3);
        assertEquals(List.of("X_train", "X_test", "y_train", "y_test"), split.parameters().get(Params.OUTPUTS));
        assertEquals(0.2, split.parameters().get(Params.TEST_SIZE));
        assertEquals("X", split.sourceDataframe());

        Transformation fit = ts.get(4);
        assertTrue(fit.requiresCodeRecipe());
        assertEquals("model", fit.targetDataframe());
        assertEquals(List.of("X_train", "y_train"), fit.sourceNames());

        Transformation predict = ts.get(5);
        assertEquals("predictions", predict.targetDataframe());
        assertEquals(List.of("X_test", "model"), predict.sourceNames());
    }

    @Test
    void inplaceCallsRebindTheReceiver() {
        List<Transformation> ts = analyzer.analyze("""
                import pandas as pd
                df = pd.read_csv('in.csv')
                df.dropna(inplace=True)
                df.rename(columns={'a': 'b'}, inplace=True)
                """);
        assertEquals(3, ts.size());
        assertEquals("df", ts.get(1).targetDataframe());
        assertEquals("df", ts.get(2).sourceDataframe());
        assertEquals(TransformationKind.COLUMN_RENAME, ts.get(2).kind());
    }

    @Test
    void neverAssignedNamesActAsPlaceholderFrames() {
        List<Transformation> ts = analyzer.analyze("""
                result = raw.dropna()
                """);
        assertEquals(1, ts.size());
        assertEquals("raw", ts.get(0).sourceDataframe());
        assertEquals("result", ts.get(0).targetDataframe());
    }

    @Test
    void emptyScriptGivesNoTransformations() {
        assertTrue(analyzer.analyze("").isEmpty());
        assertTrue(analyzer.analyze("x = 1\nprint(x)\n").isEmpty());
    }
}
