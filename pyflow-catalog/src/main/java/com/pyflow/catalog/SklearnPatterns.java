package com.pyflow.catalog;

import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.TransformationKind;

import java.util.List;

import static com.pyflow.catalog.CallTarget.ESTIMATOR_METHOD;
import static com.pyflow.catalog.CallTarget.MODULE_FUNCTION;

/**
 * Built-in rules for scikit-learn: train/test split, estimator constructors and the
 * fit / transform / predict methods of estimator instances.
 */
final class SklearnPatterns {

    private static final String[][] SCALERS = {
            {"sklearn.preprocessing.StandardScaler", "standard"},
            {"sklearn.preprocessing.MinMaxScaler", "minmax"},
            {"sklearn.preprocessing.RobustScaler", "robust"},
            {"sklearn.preprocessing.MaxAbsScaler", "maxabs"},
            {"sklearn.preprocessing.Normalizer", "normalize"},
    };

    private static final String[][] ENCODERS = {
            {"sklearn.preprocessing.OneHotEncoder", "onehot"},
            {"sklearn.preprocessing.OrdinalEncoder", "ordinal"},
            {"sklearn.preprocessing.LabelEncoder", "label"},
            {"sklearn.preprocessing.LabelBinarizer", "onehot"},
    };

    private static final List<String> IMPUTERS = List.of(
            "sklearn.impute.SimpleImputer", "sklearn.impute.KNNImputer", "sklearn.impute.IterativeImputer");

    private static final List<String> CODE_ONLY = List.of(
            "sklearn.preprocessing.PolynomialFeatures",
            "sklearn.preprocessing.FunctionTransformer",
            "sklearn.preprocessing.PowerTransformer",
            "sklearn.preprocessing.QuantileTransformer",
            "sklearn.decomposition.PCA",
            "sklearn.feature_selection.SelectKBest",
            "sklearn.feature_extraction.text.TfidfVectorizer",
            "sklearn.feature_extraction.text.CountVectorizer",
            "sklearn.compose.ColumnTransformer",
            "sklearn.pipeline.Pipeline",
            "sklearn.pipeline.make_pipeline",
            "sklearn.model_selection.GridSearchCV",
            "sklearn.model_selection.RandomizedSearchCV",
            "sklearn.linear_model.LinearRegression",
            "sklearn.linear_model.LogisticRegression",
            "sklearn.linear_model.Ridge",
            "sklearn.linear_model.Lasso",
            "sklearn.tree.DecisionTreeClassifier",
            "sklearn.tree.DecisionTreeRegressor",
            "sklearn.ensemble.RandomForestClassifier",
            "sklearn.ensemble.RandomForestRegressor",
            "sklearn.ensemble.GradientBoostingClassifier",
            "sklearn.ensemble.GradientBoostingRegressor",
            "sklearn.svm.SVC",
            "sklearn.svm.SVR",
            "sklearn.neighbors.KNeighborsClassifier",
            "sklearn.neighbors.KNeighborsRegressor",
            "sklearn.cluster.KMeans",
            "sklearn.naive_bayes.GaussianNB");

    private static final List<String> METRICS = List.of(
            "sklearn.metrics.accuracy_score", "sklearn.metrics.precision_score", "sklearn.metrics.recall_score",
            "sklearn.metrics.f1_score", "sklearn.metrics.roc_auc_score", "sklearn.metrics.mean_squared_error",
            "sklearn.metrics.mean_absolute_error", "sklearn.metrics.r2_score", "sklearn.metrics.confusion_matrix",
            "sklearn.metrics.classification_report", "sklearn.model_selection.cross_val_score");

    private SklearnPatterns() {
    }

    static void register(PatternCatalog.Builder b) {
        b.add(PatternRule.on("sklearn.model_selection.train_test_split", MODULE_FUNCTION)
                .kind(TransformationKind.SPLIT)
                .recipe(RecipeType.SPLIT)
                .extract(a -> ParamMap.create()
                        .put(Params.TEST_SIZE, a.literal(-1, "test_size"))
                        .put(Params.TRAIN_SIZE, a.literal(-1, "train_size"))
                        .put(Params.RANDOM_STATE, a.integer(-1, "random_state"))
                        .put("stratify", a.formula(-1, "stratify"))
                        .map()));
        for (String[] s : SCALERS) {
            estimator(b, s[0], ProcessorType.NORMALIZER, s[1]);
        }
        for (String[] e : ENCODERS) {
            estimator(b, e[0], ProcessorType.CATEGORICAL_ENCODER, e[1]);
        }
        for (String name : IMPUTERS) {
            b.add(PatternRule.on(name, MODULE_FUNCTION)
                    .kind(TransformationKind.FIT)
                    .processor(ProcessorType.FILL_EMPTY_WITH_COMPUTED_VALUE)
                    .effect(RuleEffect.ESTIMATOR)
                    .extract(a -> ParamMap.create()
                            .put(Params.ESTIMATOR, shortName(name))
                            .put(Params.METHOD, a.string(-1, "strategy") != null ? a.string(-1, "strategy") : "mean")
                            .put(Params.VALUE, a.literal(-1, "fill_value"))
                            .map()));
        }
        b.add(PatternRule.on("sklearn.preprocessing.KBinsDiscretizer", MODULE_FUNCTION)
                .kind(TransformationKind.FIT)
                .processor(ProcessorType.BINNER)
                .effect(RuleEffect.ESTIMATOR)
                .extract(a -> ParamMap.create()
                        .put(Params.ESTIMATOR, "KBinsDiscretizer")
                        .put(Params.BINS, a.literal(0, "n_bins") != null ? a.literal(0, "n_bins") : Integer.valueOf(5))
                        .put(Params.METHOD, a.string(-1, "strategy"))
                        .map()));
        for (String name : CODE_ONLY) {
            b.add(PatternRule.on(name, MODULE_FUNCTION)
                    .kind(TransformationKind.FIT)
                    .recipe(RecipeType.PYTHON)
                    .effect(RuleEffect.ESTIMATOR)
                    .requiresCode()
                    .extract(a -> ParamMap.create().put(Params.ESTIMATOR, shortName(name)).map()));
        }
        for (String name : METRICS) {
            b.add(PatternRule.on(name, MODULE_FUNCTION).display());
        }

        b.add(PatternRule.on("fit", ESTIMATOR_METHOD)
                .kind(TransformationKind.FIT)
                .recipe(RecipeType.PYTHON)
                .requiresCode());
        for (String m : List.of("fit_transform", "transform")) {
            b.add(PatternRule.on(m, ESTIMATOR_METHOD)
                    .kind(TransformationKind.FIT_TRANSFORM)
                    .extract(a -> ParamMap.create().put(Params.FUNCTION, m).map()));
        }
        b.add(PatternRule.on("inverse_transform", ESTIMATOR_METHOD)
                .kind(TransformationKind.FIT_TRANSFORM)
                .recipe(RecipeType.PYTHON)
                .requiresCode()
                .extract(a -> ParamMap.create().put(Params.FUNCTION, "inverse_transform").map()));
        for (String m : List.of("predict", "predict_proba", "fit_predict", "decision_function")) {
            b.add(PatternRule.on(m, ESTIMATOR_METHOD)
                    .kind(TransformationKind.PREDICT)
                    .recipe(RecipeType.PREDICTION_SCORING)
                    .extract(a -> ParamMap.create().put(Params.FUNCTION, m).map()));
        }
        for (String m : List.of("score", "get_params", "set_params", "get_feature_names_out")) {
            b.add(PatternRule.on(m, ESTIMATOR_METHOD).display());
        }
    }

    private static void estimator(PatternCatalog.Builder b, String name, ProcessorType processor, String method) {
        b.add(PatternRule.on(name, MODULE_FUNCTION)
                .kind(TransformationKind.FIT)
                .processor(processor)
                .effect(RuleEffect.ESTIMATOR)
                .extract(a -> ParamMap.create()
                        .put(Params.ESTIMATOR, shortName(name))
                        .put(Params.METHOD, method)
                        .map()));
    }

    static String shortName(String qualified) {
        return qualified.substring(qualified.lastIndexOf('.') + 1);
    }
}
