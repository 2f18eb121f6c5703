package com.pyflow.catalog;

import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.TransformationKind;
import com.pyflow.python.PythonParser;
import com.pyflow.python.ast.Expr;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternCatalogTest {

    private final PatternCatalog catalog = PatternCatalog.defaults();

    private static CallArguments args(String call, String... receiverColumns) {
        Expr.Call parsed = (Expr.Call) PythonParser.parseExpression(call);
        return CallArguments.of(parsed, List.of(receiverColumns)).withFrames(Set.of("df"));
    }

    private PatternRule resolve(String name, CallTarget target, CallArguments a) {
        return catalog.resolve(name, target, a.shape());
    }

    @Test
    void defaultsIsSharedAndPopulated() {
        assertSame(PatternCatalog.defaults(), PatternCatalog.defaults());
        assertTrue(catalog.size() > 200);
        assertTrue(catalog.knows("pandas.read_csv", CallTarget.MODULE_FUNCTION));
        assertFalse(catalog.knows("read_csv", CallTarget.DATAFRAME_METHOD));
    }

    @Test
    void readerExtractsPathAndFormat() {
        CallArguments a = args("pd.read_csv('data/in.csv', sep=';')");
        PatternRule rule = resolve("pandas.read_csv", CallTarget.MODULE_FUNCTION, a);
        assertEquals(TransformationKind.READ_DATA, rule.kind());
        assertEquals(Map.of(Params.PATH, "data/in.csv", Params.FORMAT, "csv"), rule.extractor().extract(a));

        CallArguments keyword = args("pd.read_parquet(path='x.parquet')");
        assertEquals("x.parquet", resolve("pandas.read_parquet", CallTarget.MODULE_FUNCTION, keyword)
                .extractor().extract(keyword).get(Params.PATH));
    }

    @Test
    void fillnaVariantsPickProcessorByArgumentShape() {
        CallArguments constant = args("df.fillna(0)");
        PatternRule rule = resolve("fillna", CallTarget.DATAFRAME_METHOD, constant);
        assertEquals(ProcessorType.FILL_EMPTY_WITH_VALUE, rule.processor());
        assertEquals(0, rule.extractor().extract(constant).get(Params.VALUE));

        CallArguments method = args("df.fillna(method='ffill')");
        assertEquals(ProcessorType.FILL_EMPTY_WITH_PREVIOUS_NEXT,
                resolve("fillna", CallTarget.DATAFRAME_METHOD, method).processor());

        CallArguments computed = args("df['age'].fillna(df['age'].mean())", "age");
        PatternRule computedRule = resolve("fillna", CallTarget.COLUMN_METHOD, computed);
        assertEquals(ProcessorType.FILL_EMPTY_WITH_COMPUTED_VALUE, computedRule.processor());
        Map<String, Object> params = computedRule.extractor().extract(computed);
        assertEquals("age", params.get(Params.COLUMN));
        assertEquals("mean", params.get(Params.METHOD));
    }

    @Test
    void dropGuardsAreTriedInOrder() {
        CallArguments byKeyword = args("df.drop(columns=['a', 'b'])");
        PatternRule first = resolve("drop", CallTarget.DATAFRAME_METHOD, byKeyword);
        assertEquals(TransformationKind.COLUMN_DROP, first.kind());
        assertEquals(List.of("a", "b"), first.extractor().extract(byKeyword).get(Params.COLUMNS));

        CallArguments byAxis = args("df.drop('c', axis=1)");
        PatternRule second = resolve("drop", CallTarget.DATAFRAME_METHOD, byAxis);
        assertEquals(TransformationKind.COLUMN_DROP, second.kind());
        assertEquals(List.of("c"), second.extractor().extract(byAxis).get(Params.COLUMNS));

        CallArguments byIndex = args("df.drop(df.index[:3])");
        PatternRule third = resolve("drop", CallTarget.DATAFRAME_METHOD, byIndex);
        assertTrue(third.requiresCodeRecipe());
        assertFalse(third.fallback());
    }

    @Test
    void unknownCalleeResolvesToOpaqueRule() {
        PatternRule rule = catalog.resolve("frobnicate", CallTarget.DATAFRAME_METHOD, ArgumentShape.EMPTY);
        assertTrue(rule.fallback());
        assertTrue(rule.requiresCodeRecipe());
        assertEquals(TransformationKind.CUSTOM_FUNCTION, rule.kind());
        assertEquals(RecipeType.PYTHON, rule.recipe());
        assertTrue(catalog.find("frobnicate", CallTarget.DATAFRAME_METHOD, ArgumentShape.EMPTY).isEmpty());
    }

    @Test
    void sameNameMeansDifferentThingsPerTarget() {
        CallArguments a = args("x.replace('a', 'b')", "name");
        assertEquals(ProcessorType.FIND_REPLACE, resolve("replace", CallTarget.STRING_ACCESSOR, a).processor());
        assertEquals(TransformationKind.STRING_TRANSFORM, resolve("replace", CallTarget.STRING_ACCESSOR, a).kind());
        assertEquals(TransformationKind.VALUE_REPLACE, resolve("replace", CallTarget.COLUMN_METHOD, a).kind());

        assertTrue(resolve("sum", CallTarget.COLUMN_METHOD, args("x.sum()")).displayOnly());
        assertEquals(TransformationKind.GROUPBY, resolve("sum", CallTarget.GROUPBY_METHOD, args("x.sum()")).kind());
        assertEquals(TransformationKind.WINDOW, resolve("sum", CallTarget.WINDOW_METHOD, args("x.sum()")).kind());
    }

    @Test
    void groupbyAggregationsFromDictListAndNamedForms() {
        CallArguments dict = args("g.agg({'v': 'sum', 'w': ['min', 'max']})");
        Object aggs = resolve("agg", CallTarget.GROUPBY_METHOD, dict).extractor().extract(dict).get(Params.AGGREGATIONS);
        assertEquals(List.of(
                Map.of("column", "v", "function", "sum"),
                Map.of("column", "w", "function", "min"),
                Map.of("column", "w", "function", "max")), aggs);

        CallArguments named = args("g.agg(total=('v', 'sum'), n=pd.NamedAgg(column='id', aggfunc='count'))");
        Object namedAggs = resolve("agg", CallTarget.GROUPBY_METHOD, named).extractor().extract(named)
                .get(Params.AGGREGATIONS);
        assertEquals(List.of(
                Map.of("column", "v", "function", "sum", "output", "total"),
                Map.of("column", "id", "function", "count", "output", "n")), namedAggs);

        CallArguments keys = args("df.groupby(['region', 'year'])");
        PatternRule groupby = resolve("groupby", CallTarget.DATAFRAME_METHOD, keys);
        assertEquals(RuleEffect.PENDING_GROUP, groupby.effect());
        assertEquals(List.of("region", "year"), groupby.extractor().extract(keys).get(Params.KEYS));
    }

    @Test
    void formulasUseBareColumnNames() {
        CallArguments a = args("df.assign(total=df['price'] * df['qty'], flag=df.price > 10)");
        Map<String, Object> params = resolve("assign", CallTarget.DATAFRAME_METHOD, a).extractor().extract(a);
        assertEquals(Map.of("total", "price * qty", "flag", "price > 10"), params.get(Params.ASSIGNMENTS));

        CallArguments where = args("np.where(df['score'] >= 50, 'pass', 'fail')");
        Map<String, Object> ifThen = resolve("numpy.where", CallTarget.MODULE_FUNCTION, where).extractor().extract(where);
        assertEquals("score >= 50", ifThen.get(Params.CONDITION));
        assertEquals("pass", ifThen.get(Params.THEN));
        assertEquals("fail", ifThen.get(Params.OTHERWISE));
    }

    @Test
    void estimatorsCarryTheirProcessor() {
        CallArguments scaler = args("StandardScaler()");
        PatternRule rule = resolve("sklearn.preprocessing.StandardScaler", CallTarget.MODULE_FUNCTION, scaler);
        assertEquals(RuleEffect.ESTIMATOR, rule.effect());
        assertEquals(ProcessorType.NORMALIZER, rule.processor());
        assertEquals("StandardScaler", rule.extractor().extract(scaler).get(Params.ESTIMATOR));

        CallArguments imputer = args("SimpleImputer(strategy='median')");
        PatternRule impute = resolve("sklearn.impute.SimpleImputer", CallTarget.MODULE_FUNCTION, imputer);
        assertEquals("median", impute.extractor().extract(imputer).get(Params.METHOD));

        CallArguments split = args("train_test_split(df, test_size=0.2, random_state=42)");
        Map<String, Object> params = resolve("sklearn.model_selection.train_test_split", CallTarget.MODULE_FUNCTION, split)
                .extractor().extract(split);
        assertEquals(0.2, params.get(Params.TEST_SIZE));
        assertEquals(42, params.get(Params.RANDOM_STATE));
    }

    @Test
    void toBuilderDoesNotAffectTheSource() {
        PatternRule custom = PatternRule.on("fillna", CallTarget.DATAFRAME_METHOD)
                .kind(TransformationKind.CUSTOM_FUNCTION)
                .requiresCode()
                .build();
        PatternCatalog modified = catalog.toBuilder().override(custom).build();

        assertNotSame(catalog, modified);
        assertEquals(1, modified.rulesFor("fillna", CallTarget.DATAFRAME_METHOD).size());
        assertTrue(catalog.rulesFor("fillna", CallTarget.DATAFRAME_METHOD).size() > 1);
        assertEquals(TransformationKind.FILL_NA,
                catalog.resolve("fillna", CallTarget.DATAFRAME_METHOD, ArgumentShape.EMPTY).kind());
    }

    @Test
    void prependTakesPriorityOverExistingRules() {
        PatternRule first = PatternRule.on("head", CallTarget.DATAFRAME_METHOD).display().build();
        PatternCatalog custom = PatternCatalog.builder()
                .add(PatternRule.on("head", CallTarget.DATAFRAME_METHOD).kind(TransformationKind.HEAD))
                .prepend(first)
                .build();
        assertEquals(2, custom.size());
        assertTrue(custom.resolve("head", CallTarget.DATAFRAME_METHOD, ArgumentShape.EMPTY).displayOnly());

        PatternCatalog removed = custom.toBuilder().remove("head", CallTarget.DATAFRAME_METHOD).build();
        assertEquals(0, removed.size());
        assertTrue(PatternCatalog.builder().build().resolve("head", CallTarget.DATAFRAME_METHOD, null).fallback());
    }
}
