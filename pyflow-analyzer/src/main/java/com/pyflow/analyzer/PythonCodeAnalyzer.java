package com.pyflow.analyzer;

import com.pyflow.catalog.CallArguments;
import com.pyflow.catalog.CallTarget;
import com.pyflow.catalog.Formulas;
import com.pyflow.catalog.PatternCatalog;
import com.pyflow.catalog.PatternRule;
import com.pyflow.catalog.RuleEffect;
import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.FlowStep;
import com.pyflow.model.transform.Params;
import com.pyflow.model.transform.Transformation;
import com.pyflow.model.transform.TransformationKind;
import com.pyflow.python.ExpressionRenderer;
import com.pyflow.python.PythonParser;
import com.pyflow.python.SourceSyntaxException;
import com.pyflow.python.ast.Alias;
import com.pyflow.python.ast.ExceptHandler;
import com.pyflow.python.ast.Expr;
import com.pyflow.python.ast.Module;
import com.pyflow.python.ast.Stmt;
import com.pyflow.python.ast.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static analyzer: walks the statements of a script, tracks which variables hold dataframes,
 * grouped frames, windows and estimators, and turns every recognized call into a
 * {@link Transformation} using one {@link PatternCatalog}.
 * <p>
 * Method chains are processed link by link, innermost first. Every emitting link writes to a
 * synthetic {@code _chain_<n>} name that the next link reads; the last one is renamed to the
 * assignment target. Control-flow bodies are walked as if they always ran once; function and
 * class bodies are not entered.
 * <p>
 * Not thread-safe. Each {@link #analyze(String)} call starts from an empty symbol table, so
 * sequential reuse gives identical results for identical input.
 */
public final class PythonCodeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PythonCodeAnalyzer.class);

    /** Prefix of the names given to intermediate chain results. */
    public static final String CHAIN_PREFIX = FlowStep.SYNTHETIC_PREFIX;

    private static final Set<TransformationKind> MULTI_SOURCE = Set.of(
            TransformationKind.MERGE, TransformationKind.CONCAT, TransformationKind.SPLIT,
            TransformationKind.FIT, TransformationKind.PREDICT);

    private static final Set<String> FRAME_PROPERTIES = Set.of(
            "columns", "shape", "dtypes", "index", "values", "size", "empty", "ndim", "axes", "attrs", "flags");

    private static final Set<String> SERIES_PROPERTIES = Set.of(
            "values", "dtype", "dtypes", "shape", "name", "index", "size", "empty", "hasnans", "is_unique",
            "is_monotonic_increasing", "is_monotonic_decreasing", "array", "nbytes", "cat");

    private static final Set<String> WINDOW_OPENERS = Set.of("rolling", "expanding", "ewm");

    private static final String VARIABLE_STATE = "variable";
    private static final String FITTED_STATE = "fitted";
    private static final String EXPRESSION_STATE = "expression";

    /** Marks a chain that reached a display-only call. */
    private static final TracedValue DISPLAY = new TracedValue(TracedValue.Kind.OTHER, "<display>", List.of(),
            Map.of(), null, -1);

    private final PatternCatalog catalog;

    private final SymbolTable symbols = new SymbolTable();
    private final List<Transformation> transformations = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private Module module;
    private int chainCounter;
    private int statementCount;

    /** Analyzer over the shared built-in catalog. */
    public PythonCodeAnalyzer() {
        this(PatternCatalog.defaults());
    }

    public PythonCodeAnalyzer(PatternCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Analyzes a script.
     *
     * @return transformations in source order; empty for a script with no data operations
     * @throws SourceSyntaxException when the source is not valid Python
     */
    public List<Transformation> analyze(String source) {
        Objects.requireNonNull(source, "source");
        symbols.clear();
        transformations.clear();
        warnings.clear();
        chainCounter = 0;
        statementCount = 0;

        module = PythonParser.parse(source);
        walk(module.body());

        long codeRecipes = transformations.stream().filter(Transformation::requiresCodeRecipe).count();
        log.info("Static analysis complete | statements={} | transformations={} | codeRecipes={} | warnings={}",
                statementCount, transformations.size(), codeRecipes, warnings.size());
        return List.copyOf(transformations);
    }

    /** Problems found by the last {@link #analyze(String)} call that did not stop the analysis. */
    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    PatternCatalog catalog() {
        return catalog;
    }

    // ------------------------------------------------------------------ statements

    private void walk(List<Stmt> body) {
        for (Stmt stmt : body) {
            visit(stmt);
        }
    }

    private void visit(Stmt stmt) {
        statementCount++;
        if (stmt instanceof Stmt.Import imp) {
            for (Alias alias : imp.names()) {
                String qualified = alias.asName() != null ? alias.name() : alias.boundName(false);
                symbols.bind(alias.boundName(false), TracedValue.module(qualified));
            }
        } else if (stmt instanceof Stmt.ImportFrom from) {
            importFrom(from);
        } else if (stmt instanceof Stmt.Assign assign) {
            assign(assign.targets(), assign.value(), stmt);
        } else if (stmt instanceof Stmt.AnnAssign ann) {
            if (ann.value() != null) assign(List.of(ann.target()), ann.value(), stmt);
        } else if (stmt instanceof Stmt.AugAssign aug) {
            augmentedAssign(aug, stmt);
        } else if (stmt instanceof Stmt.ExprStmt expr) {
            expressionStatement(expr.value(), stmt);
        } else if (stmt instanceof Stmt.If s) {
            walk(s.body());
            walk(s.orElse());
        } else if (stmt instanceof Stmt.For s) {
            bindOther(s.target());
            walk(s.body());
            walk(s.orElse());
        } else if (stmt instanceof Stmt.While s) {
            walk(s.body());
            walk(s.orElse());
        } else if (stmt instanceof Stmt.With s) {
            for (WithItem item : s.items()) bindOther(item.target());
            walk(s.body());
        } else if (stmt instanceof Stmt.Try s) {
            walk(s.body());
            for (ExceptHandler h : s.handlers()) walk(h.body());
            walk(s.orElse());
            walk(s.finalBody());
        } else if (stmt instanceof Stmt.FunctionDef def) {
            log.debug("Skipping function definition | name={} | line={}", def.name(), def.line());
            symbols.bind(def.name(), TracedValue.OTHER);
        } else if (stmt instanceof Stmt.ClassDef def) {
            log.debug("Skipping class definition | name={} | line={}", def.name(), def.line());
            symbols.bind(def.name(), TracedValue.OTHER);
        } else if (stmt instanceof Stmt.Delete del) {
            for (Expr target : del.targets()) delete(target, stmt);
        }
    }

    private void importFrom(Stmt.ImportFrom from) {
        if (from.module() == null) return;
        for (Alias alias : from.names()) {
            if (alias.name().equals("*")) {
                log.debug("Ignoring star import | module={} | line={}", from.module(), from.line());
                continue;
            }
            symbols.bind(alias.boundName(true), TracedValue.module(from.module() + "." + alias.name()));
        }
    }

    private void bindOther(Expr target) {
        if (target instanceof Expr.Name n) {
            symbols.bind(n.id(), TracedValue.OTHER);
        } else if (target instanceof Expr.Tuple t) {
            t.elements().forEach(this::bindOther);
        } else if (target instanceof Expr.ListExpr l) {
            l.elements().forEach(this::bindOther);
        }
    }

    private void assign(List<Expr> targets, Expr value, Stmt stmt) {
        Expr first = targets.get(0);
        if (first instanceof Expr.Name name) {
            Context ctx = new Context(stmt, text(stmt));
            ctx.target = name.id();
            TracedValue result = assignedValue(value, ctx);
            bindResult(name.id(), result);
            for (int i = 1; i < targets.size(); i++) {
                if (targets.get(i) instanceof Expr.Name alias) bindResult(alias.id(), symbols.lookup(name.id()));
            }
        } else if (first instanceof Expr.Tuple || first instanceof Expr.ListExpr) {
            List<Expr> elements = first instanceof Expr.Tuple t ? t.elements() : ((Expr.ListExpr) first).elements();
            List<String> names = new ArrayList<>();
            for (Expr e : elements) {
                if (e instanceof Expr.Name n) names.add(n.id());
            }
            Context ctx = new Context(stmt, text(stmt));
            ctx.outputs = names;
            ctx.target = names.isEmpty() ? null : names.get(0);
            TracedValue result = evaluateStatement(value, ctx);
            boolean split = lastEmitted(ctx) != null && lastEmitted(ctx).kind() == TransformationKind.SPLIT;
            for (int i = 0; i < names.size(); i++) {
                if (split) symbols.bind(names.get(i), TracedValue.frame(names.get(i), transformations.size() - 1));
                else bindResult(names.get(i), i == 0 ? result : TracedValue.OTHER);
            }
        } else if (first instanceof Expr.Subscript sub) {
            columnAssign(sub, value, stmt);
        } else if (first instanceof Expr.Attribute attr && attr.value() instanceof Expr.Name owner) {
            attributeAssign(owner.id(), attr.attr(), value, stmt);
        }
    }

    private TracedValue assignedValue(Expr value, Context ctx) {
        Set<String> frames = frameVariables(ctx);
        if (value instanceof Expr.Name n) {
            return symbols.lookup(n.id());
        }
        if (MaskFilters.isMask(value, frames, symbols)) {
            return seriesOf(value, frames).withState(MaskFilters.MASK_STATE, value);
        }
        if (value instanceof Expr.BinOp || value instanceof Expr.UnaryOp || value instanceof Expr.IfExp) {
            TracedValue series = seriesOf(value, frames);
            return series.kind() == TracedValue.Kind.SERIES ? series.withState(EXPRESSION_STATE, value) : TracedValue.OTHER;
        }
        return evaluateStatement(value, ctx);
    }

    /** Series over the first frame the expression references, or OTHER when it references none. */
    private TracedValue seriesOf(Expr value, Set<String> frames) {
        for (String name : ExprNames.of(value)) {
            if (frames.contains(name)) {
                String frame = symbols.frameOf(name) != null ? symbols.frameOf(name) : name;
                return new TracedValue(TracedValue.Kind.SERIES, frame, Formulas.columnsOf(value, frames), Map.of(), null, -1);
            }
        }
        return TracedValue.OTHER;
    }

    private void bindResult(String name, TracedValue result) {
        if (result == null || result == DISPLAY) {
            symbols.bind(name, TracedValue.OTHER);
            return;
        }
        if (result.kind() == TracedValue.Kind.ESTIMATOR && result.stateValue(VARIABLE_STATE) == null) {
            symbols.bind(name, result.withState(VARIABLE_STATE, name));
            return;
        }
        if (result.kind() == TracedValue.Kind.MODULE || result.kind() == TracedValue.Kind.UNBOUND) {
            symbols.bind(name, TracedValue.OTHER);
            return;
        }
        symbols.bind(name, result);
    }

    private void expressionStatement(Expr value, Stmt stmt) {
        Context ctx = new Context(stmt, text(stmt));
        ctx.expressionStatement = true;
        evaluateStatement(value, ctx);
    }

    private TracedValue evaluateStatement(Expr value, Context ctx) {
        TracedValue v = evaluate(value, ctx);
        if (v == DISPLAY) {
            truncate(ctx.start);
            log.debug("Skipping display-only statement | line={}", ctx.stmt.line());
            return TracedValue.OTHER;
        }
        int emitted = transformations.size() - ctx.start;
        if (emitted == 0) return v;
        int lastIndex = transformations.size() - 1;
        Transformation last = transformations.get(lastIndex);

        if (ctx.expressionStatement) {
            if (!isSynthetic(last.targetDataframe())) return v;
            if (last.requiresCodeRecipe()) {
                String owner = last.sourceDataframe();
                if (owner == null) return v;
                transformations.set(lastIndex, retarget(last, owner,
                        "result not assigned; assumed to update " + owner + " in place"));
                return TracedValue.frame(owner, lastIndex);
            }
            transformations.set(lastIndex, retarget(last, last.targetDataframe(), "result not assigned"));
            warnings.add(String.format("Line %d: result of '%s' is not assigned to a variable; kept as an unnamed dataset",
                    ctx.stmt.line(), ctx.text.strip()));
            log.warn("Unassigned result kept | line={} | kind={}", ctx.stmt.line(), last.kind().toValue());
            return v;
        }
        if (ctx.target != null && v.kind() == TracedValue.Kind.DATAFRAME
                && isSynthetic(last.targetDataframe()) && last.targetDataframe().equals(v.name())) {
            transformations.set(lastIndex, last.withTarget(ctx.target));
            return TracedValue.frame(ctx.target, lastIndex);
        }
        return v;
    }

    private static Transformation retarget(Transformation t, String target, String note) {
        Transformation.Builder b = Transformation.builder(t.kind())
                .source(t.sourceDataframe())
                .target(target)
                .columns(t.columns())
                .parameters(t.parameters())
                .suggestedRecipe(t.suggestedRecipe())
                .suggestedProcessor(t.suggestedProcessor())
                .line(t.sourceLine())
                .code(t.sourceCode())
                .requiresCodeRecipe(t.requiresCodeRecipe());
        t.additionalSources().forEach(b::additionalSource);
        t.notes().forEach(b::note);
        return b.note(note).build();
    }

    private void truncate(int size) {
        while (transformations.size() > size) transformations.remove(transformations.size() - 1);
    }

    private Transformation lastEmitted(Context ctx) {
        return transformations.size() > ctx.start ? transformations.get(transformations.size() - 1) : null;
    }

    // ------------------------------------------------------------------ column assignment

    private void columnAssign(Expr.Subscript target, Expr value, Stmt stmt) {
        if (target.value() instanceof Expr.Attribute attr && attr.value() instanceof Expr.Name owner
                && (attr.attr().equals("loc") || attr.attr().equals("iloc"))) {
            locAssign(owner.id(), attr.attr(), target.index(), value, stmt);
            return;
        }
        if (!(target.value() instanceof Expr.Name owner)) return;
        TracedValue frame = symbols.lookup(owner.id());
        if (frame.kind() != TracedValue.Kind.DATAFRAME && frame.kind() != TracedValue.Kind.UNBOUND) return;

        Context ctx = columnContext(stmt, owner.id(), frame);
        List<String> columns = CallArguments.strings(target.index());
        if (columns.isEmpty()) {
            emitOpaque(ctx, ctx.columnSource, ctx.columnTarget, "column name not statically known");
            symbols.bind(owner.id(), TracedValue.frame(owner.id(), transformations.size() - 1));
            return;
        }
        ctx.outputColumns = columns;
        assignColumn(value, ctx);
        symbols.bind(owner.id(), TracedValue.frame(owner.id(), transformations.size() - 1));
    }

    private void attributeAssign(String owner, String attr, Expr value, Stmt stmt) {
        TracedValue frame = symbols.lookup(owner);
        if (frame.kind() != TracedValue.Kind.DATAFRAME) return;
        Context ctx = columnContext(stmt, owner, frame);
        if (FRAME_PROPERTIES.contains(attr)) {
            emitOpaque(ctx, ctx.columnSource, owner, "assignment to " + owner + "." + attr);
        } else {
            ctx.outputColumns = List.of(attr);
            assignColumn(value, ctx);
        }
        symbols.bind(owner, TracedValue.frame(owner, transformations.size() - 1));
    }

    private Context columnContext(Stmt stmt, String owner, TracedValue frame) {
        Context ctx = new Context(stmt, text(stmt));
        ctx.columnTarget = owner;
        ctx.columnSource = frame.kind() == TracedValue.Kind.DATAFRAME ? frame.name() : owner;
        ctx.extraFrames.add(owner);
        return ctx;
    }

    /** {@code df.loc[mask, 'c'] = value}: a conditional update of column {@code c}. */
    private void locAssign(String owner, String indexer, Expr index, Expr value, Stmt stmt) {
        TracedValue frame = symbols.lookup(owner);
        if (frame.kind() != TracedValue.Kind.DATAFRAME && frame.kind() != TracedValue.Kind.UNBOUND) return;
        Context ctx = columnContext(stmt, owner, frame);
        Set<String> frames = frameVariables(ctx);

        Expr rows = index;
        List<String> columns = List.of();
        if (index instanceof Expr.Tuple t && t.elements().size() == 2) {
            rows = t.elements().get(0);
            columns = CallArguments.strings(t.elements().get(1));
        }
        boolean allRows = rows instanceof Expr.Slice s && s.lower() == null && s.upper() == null && s.step() == null;
        if (indexer.equals("loc") && columns.size() == 1 && allRows) {
            ctx.outputColumns = columns;
            assignColumn(value, ctx);
        } else if (indexer.equals("loc") && columns.size() == 1 && MaskFilters.isMask(rows, frames, symbols)) {
            String column = columns.get(0);
            Expr condition = MaskFilters.expand(rows, symbols);
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(Params.COLUMN, column);
            params.put(Params.CONDITION, Formulas.render(condition, frames));
            params.put(Params.THEN, valueOf(value, frames));
            params.put(Params.OTHERWISE, column);
            params.put(Params.OUTPUT, column);
            Transformation.Builder b = base(TransformationKind.COLUMN_CREATE, ctx)
                    .source(ctx.columnSource)
                    .target(owner)
                    .suggestedProcessor(ProcessorType.IF_THEN_ELSE)
                    .column(column)
                    .columns(Formulas.columnsOf(condition, frames))
                    .parameters(params);
            add(b.build());
        } else {
            emitOpaque(ctx, ctx.columnSource, owner, indexer + " assignment not statically expressible");
        }
        symbols.bind(owner, TracedValue.frame(owner, transformations.size() - 1));
    }

    private static Object valueOf(Expr e, Set<String> frames) {
        return CallArguments.isLiteral(e) ? CallArguments.literal(e) : Formulas.render(e, frames);
    }

    /** Right-hand side of a column assignment; {@code ctx} names the frame and output columns. */
    private void assignColumn(Expr value, Context ctx) {
        Set<String> frames = frameVariables(ctx);
        String output = ctx.outputColumns.get(0);

        String copied = Formulas.columnOf(value, frames);
        if (copied != null && value instanceof Expr.Subscript s && s.value() instanceof Expr.Name n
                && !sameFrame(n.id(), ctx)) {
            emitOpaque(ctx, ctx.columnSource, ctx.columnTarget, "column taken from another dataframe");
            return;
        }
        if (copied != null && ctx.outputColumns.size() == 1) {
            if (copied.equals(output)) return;
            add(base(TransformationKind.COLUMN_COPY, ctx)
                    .source(ctx.columnSource)
                    .target(ctx.columnTarget)
                    .suggestedProcessor(ProcessorType.COLUMN_COPIER)
                    .column(copied)
                    .parameter(Params.OUTPUT, output)
                    .build());
            return;
        }
        if (value instanceof Expr.Name n) {
            TracedValue bound = symbols.lookup(n.id());
            Object stored = bound.stateValue(MaskFilters.MASK_STATE) != null
                    ? bound.stateValue(MaskFilters.MASK_STATE) : bound.stateValue(EXPRESSION_STATE);
            if (stored instanceof Expr expr) {
                createColumn(expr, ctx);
                return;
            }
            if (bound.kind() == TracedValue.Kind.SERIES && bound.columns().size() == 1 && bound.name().equals(ctx.columnSource)) {
                add(base(TransformationKind.COLUMN_COPY, ctx)
                        .source(ctx.columnSource)
                        .target(ctx.columnTarget)
                        .suggestedProcessor(ProcessorType.COLUMN_COPIER)
                        .column(bound.columns().get(0))
                        .parameter(Params.OUTPUT, output)
                        .build());
                return;
            }
            createColumn(value, ctx);
            return;
        }
        if (value instanceof Expr.Call || value instanceof Expr.Attribute || value instanceof Expr.Subscript) {
            TracedValue v = evaluate(value, ctx);
            if (v == DISPLAY) {
                truncate(ctx.start);
                createColumn(value, ctx);
                return;
            }
            if (transformations.size() == ctx.start) {
                if (v.kind() == TracedValue.Kind.SERIES && v.columns().size() == 1 && v.name().equals(ctx.columnSource)) {
                    if (!v.columns().get(0).equals(output)) {
                        add(base(TransformationKind.COLUMN_COPY, ctx)
                                .source(ctx.columnSource)
                                .target(ctx.columnTarget)
                                .suggestedProcessor(ProcessorType.COLUMN_COPIER)
                                .column(v.columns().get(0))
                                .parameter(Params.OUTPUT, output)
                                .build());
                    }
                } else {
                    createColumn(value, ctx);
                }
            }
            return;
        }
        createColumn(value, ctx);
    }

    private boolean sameFrame(String variable, Context ctx) {
        if (variable.equals(ctx.columnTarget)) return true;
        String frame = symbols.frameOf(variable);
        return frame != null && frame.equals(ctx.columnSource);
    }

    /** Column from a formula: {@code df['c'] = df['a'] * 2}. */
    private void createColumn(Expr value, Context ctx) {
        Set<String> frames = frameVariables(ctx);
        Transformation.Builder b = base(TransformationKind.COLUMN_CREATE, ctx)
                .source(ctx.columnSource)
                .target(ctx.columnTarget)
                .suggestedProcessor(ProcessorType.CREATE_COLUMN_WITH_GREL)
                .columns(Formulas.columnsOf(value, frames))
                .parameter(Params.EXPRESSION, Formulas.render(value, frames));
        if (ctx.outputColumns.size() == 1) b.parameter(Params.OUTPUT, ctx.outputColumns.get(0));
        else b.parameter(Params.OUTPUTS, ctx.outputColumns);
        add(b.build());
    }

    private void augmentedAssign(Stmt.AugAssign aug, Stmt stmt) {
        Expr target = aug.target();
        if (target instanceof Expr.Subscript sub && sub.value() instanceof Expr.Name owner) {
            TracedValue frame = symbols.lookup(owner.id());
            List<String> columns = CallArguments.strings(sub.index());
            if (frame.kind() != TracedValue.Kind.DATAFRAME || columns.size() != 1) return;
            Context ctx = columnContext(stmt, owner.id(), frame);
            ctx.outputColumns = columns;
            createColumn(new Expr.BinOp(target, aug.op(), aug.value(), aug.line()), ctx);
            symbols.bind(owner.id(), TracedValue.frame(owner.id(), transformations.size() - 1));
        } else if (target instanceof Expr.Name n && symbols.lookup(n.id()).kind() == TracedValue.Kind.DATAFRAME) {
            TracedValue frame = symbols.lookup(n.id());
            Context ctx = new Context(stmt, text(stmt));
            emitOpaque(ctx, frame.name(), n.id(), "augmented assignment on a dataframe");
            symbols.bind(n.id(), TracedValue.frame(n.id(), transformations.size() - 1));
        }
    }

    private void delete(Expr target, Stmt stmt) {
        if (target instanceof Expr.Subscript sub && sub.value() instanceof Expr.Name owner
                && symbols.lookup(owner.id()).kind() == TracedValue.Kind.DATAFRAME) {
            List<String> columns = CallArguments.strings(sub.index());
            if (columns.isEmpty()) return;
            Context ctx = columnContext(stmt, owner.id(), symbols.lookup(owner.id()));
            add(base(TransformationKind.COLUMN_DROP, ctx)
                    .source(ctx.columnSource)
                    .target(owner.id())
                    .suggestedProcessor(ProcessorType.COLUMN_DELETER)
                    .columns(columns)
                    .build());
            symbols.bind(owner.id(), TracedValue.frame(owner.id(), transformations.size() - 1));
        } else if (target instanceof Expr.Name n) {
            symbols.remove(n.id());
        }
    }

    // ------------------------------------------------------------------ chains

    private TracedValue evaluate(Expr expr, Context ctx) {
        Chain chain = Chain.unwind(expr);
        TracedValue v = baseValue(chain.base(), ctx);
        for (Chain.Link link : chain.links()) {
            v = switch (link.type()) {
                case METHOD -> method(v, link, ctx);
                case CALL -> call(v, link, ctx);
                case ATTRIBUTE -> attribute(v, link, ctx);
                case SUBSCRIPT -> subscript(v, link, ctx);
            };
            if (v == DISPLAY) return DISPLAY;
            if (log.isDebugEnabled()) log.debug("Chain link | line={} | link={} | value={}", ctx.stmt.line(), linkName(link), v);
        }
        return v;
    }

    private static String linkName(Chain.Link link) {
        return switch (link.type()) {
            case METHOD -> "." + link.name() + "()";
            case ATTRIBUTE -> "." + link.name();
            case CALL -> "()";
            case SUBSCRIPT -> "[" + ExpressionRenderer.render(link.index()) + "]";
        };
    }

    private TracedValue baseValue(Expr base, Context ctx) {
        if (base instanceof Expr.Name n) return symbols.lookup(n.id());
        if (base instanceof Expr.BinOp || base instanceof Expr.UnaryOp || base instanceof Expr.Compare
                || base instanceof Expr.BoolOp) {
            TracedValue series = seriesOf(base, frameVariables(ctx));
            return series.kind() == TracedValue.Kind.SERIES ? series.withState(EXPRESSION_STATE, base) : TracedValue.OTHER;
        }
        return TracedValue.OTHER;
    }

    private TracedValue method(TracedValue v, Chain.Link link, Context ctx) {
        String name = link.name();
        Expr.Call call = link.call();
        switch (v.kind()) {
            case MODULE:
                return moduleCall(v.name() + "." + name, call, ctx);
            case UNBOUND:
                if (catalog.knows(name, CallTarget.DATAFRAME_METHOD)) {
                    log.debug("Treating unbound name as dataframe | name={} | line={}", v.name(), ctx.stmt.line());
                    ctx.extraFrames.add(v.name());
                    return receiverCall(CallTarget.DATAFRAME_METHOD, TracedValue.frame(v.name(), -1), link, ctx);
                }
                return moduleCall(v.name() + "." + name, call, ctx);
            case DATAFRAME:
                return receiverCall(CallTarget.DATAFRAME_METHOD, v, link, ctx);
            case SERIES:
                return receiverCall(CallTarget.COLUMN_METHOD, v, link, ctx);
            case STRING_ACCESSOR:
                return receiverCall(CallTarget.STRING_ACCESSOR, v, link, ctx);
            case DATETIME_ACCESSOR:
                return receiverCall(CallTarget.DATETIME_ACCESSOR, v, link, ctx);
            case GROUPED:
                if (WINDOW_OPENERS.contains(name)) return groupedWindow(v, link, ctx);
                return receiverCall(CallTarget.GROUPBY_METHOD, v, link, ctx);
            case WINDOWED:
                return receiverCall(CallTarget.WINDOW_METHOD, v, link, ctx);
            case ESTIMATOR:
                return estimatorCall(v, link, ctx);
            default:
                return untracedCall(name, call, ctx);
        }
    }

    private TracedValue call(TracedValue v, Chain.Link link, Context ctx) {
        if (v.kind() == TracedValue.Kind.MODULE || v.kind() == TracedValue.Kind.UNBOUND) {
            return moduleCall(v.name(), link.call(), ctx);
        }
        return untracedCall(ExpressionRenderer.render(link.call().func()), link.call(), ctx);
    }

    /** A call on something the analyzer does not trace; opaque only when it touches a traced frame. */
    private TracedValue untracedCall(String name, Expr.Call call, Context ctx) {
        List<String> frames = framesIn(call, false);
        if (frames.isEmpty() && ctx.columnTarget == null) return TracedValue.OTHER;
        PatternRule rule = PatternRule.opaque(name, CallTarget.MODULE_FUNCTION);
        String source = ctx.columnTarget != null ? ctx.columnSource : frames.get(0);
        return emit(rule, name, CallArguments.of(call), null, source, List.of(), call, ctx);
    }

    private TracedValue attribute(TracedValue v, Chain.Link link, Context ctx) {
        String attr = link.name();
        switch (v.kind()) {
            case MODULE:
            case UNBOUND:
                return TracedValue.module(v.name() + "." + attr);
            case DATAFRAME:
                if (attr.equals("loc") || attr.equals("iloc") || attr.equals("at") || attr.equals("iat")) {
                    return v.as(TracedValue.Kind.INDEXER).withState("indexer", attr);
                }
                if (attr.equals("T")) {
                    return receiverRule(CallTarget.DATAFRAME_METHOD, "T", v, CallArguments.empty(List.of()), null, ctx);
                }
                if (FRAME_PROPERTIES.contains(attr)) return TracedValue.OTHER;
                return new TracedValue(TracedValue.Kind.SERIES, v.name(), List.of(attr), Map.of(), null, v.producer());
            case SERIES:
                if (attr.equals("str")) return v.as(TracedValue.Kind.STRING_ACCESSOR);
                if (attr.equals("dt")) return v.as(TracedValue.Kind.DATETIME_ACCESSOR);
                if (SERIES_PROPERTIES.contains(attr)) return TracedValue.OTHER;
                return TracedValue.OTHER;
            case DATETIME_ACCESSOR:
                return receiverRule(CallTarget.DATETIME_ACCESSOR, attr, v, CallArguments.empty(v.columns()), null, ctx);
            case GROUPED:
                if (attr.equals("groups") || attr.equals("ngroups") || attr.equals("indices")) return TracedValue.OTHER;
                return v.withColumns(List.of(attr));
            default:
                return TracedValue.OTHER;
        }
    }

    private TracedValue subscript(TracedValue v, Chain.Link link, Context ctx) {
        Expr index = link.index();
        Set<String> frames = frameVariables(ctx);
        switch (v.kind()) {
            case DATAFRAME:
                return frameSubscript(v, index, ctx, frames);
            case INDEXER:
                return indexerSubscript(v, index, ctx, frames);
            case GROUPED: {
                List<String> columns = CallArguments.strings(index);
                return columns.isEmpty() ? TracedValue.OTHER : v.withColumns(columns);
            }
            case UNBOUND: {
                List<String> columns = CallArguments.strings(index);
                if (index instanceof Expr.Constant c && c.isString()) {
                    ctx.extraFrames.add(v.name());
                    return new TracedValue(TracedValue.Kind.SERIES, v.name(), columns, Map.of(), null, -1);
                }
                return TracedValue.OTHER;
            }
            default:
                return TracedValue.OTHER;
        }
    }

    private TracedValue frameSubscript(TracedValue v, Expr index, Context ctx, Set<String> frames) {
        if (index instanceof Expr.Constant c && c.isString()) {
            return new TracedValue(TracedValue.Kind.SERIES, v.name(), List.of((String) c.value()), Map.of(), null, v.producer());
        }
        if (index instanceof Expr.ListExpr) {
            List<String> columns = CallArguments.strings(index);
            if (ctx.columnTarget != null) {
                return new TracedValue(TracedValue.Kind.SERIES, v.name(), columns, Map.of(), null, v.producer());
            }
            return selectColumns(v, columns, ctx);
        }
        if (MaskFilters.isMask(index, frames, symbols)) {
            return filter(v, MaskFilters.expand(index, symbols), ctx, frames);
        }
        if (index instanceof Expr.Slice slice) {
            return sliceRows(v, slice, ctx);
        }
        return new TracedValue(TracedValue.Kind.SERIES, v.name(), List.of(), Map.of(), null, v.producer());
    }

    private TracedValue indexerSubscript(TracedValue v, Expr index, Context ctx, Set<String> frames) {
        String indexer = String.valueOf(v.stateValue("indexer"));
        TracedValue frame = TracedValue.frame(v.name(), v.producer());
        if (indexer.equals("iloc")) {
            if (index instanceof Expr.Slice slice) return sliceRows(frame, slice, ctx);
            return emitOpaque(ctx, v.name(), null, "positional selection");
        }
        if (!indexer.equals("loc")) return TracedValue.OTHER;

        Expr rows = index;
        Expr cols = null;
        if (index instanceof Expr.Tuple t && t.elements().size() == 2) {
            rows = t.elements().get(0);
            cols = t.elements().get(1);
        }
        TracedValue current = frame;
        boolean allRows = rows instanceof Expr.Slice s && s.lower() == null && s.upper() == null && s.step() == null;
        if (!allRows) {
            if (!MaskFilters.isMask(rows, frames, symbols)) return emitOpaque(ctx, v.name(), null, "label-based row selection");
            current = filter(current, MaskFilters.expand(rows, symbols), ctx, frames);
        }
        if (cols == null) return current;
        if (cols instanceof Expr.Constant c && c.isString()) {
            return new TracedValue(TracedValue.Kind.SERIES, current.name(), List.of((String) c.value()), Map.of(), null, current.producer());
        }
        List<String> columns = CallArguments.strings(cols);
        if (columns.isEmpty()) return current;
        if (ctx.columnTarget != null) {
            return new TracedValue(TracedValue.Kind.SERIES, current.name(), columns, Map.of(), null, current.producer());
        }
        return selectColumns(current, columns, ctx);
    }

    private TracedValue selectColumns(TracedValue v, List<String> columns, Context ctx) {
        return add(base(TransformationKind.COLUMN_SELECT, ctx)
                .source(v.name())
                .target(nextSynthetic())
                .suggestedProcessor(ProcessorType.COLUMNS_SELECTOR)
                .columns(columns)
                .build());
    }

    private TracedValue filter(TracedValue v, Expr mask, Context ctx, Set<String> frames) {
        MaskFilters.Filter f = MaskFilters.describe(mask, frames);
        return add(base(f.kind(), ctx)
                .source(v.name())
                .target(nextSynthetic())
                .suggestedProcessor(f.processor())
                .columns(f.columns())
                .parameters(f.params())
                .build());
    }

    private TracedValue sliceRows(TracedValue v, Expr.Slice slice, Context ctx) {
        Object upper = CallArguments.literal(slice.upper());
        if (slice.lower() == null && slice.step() == null && upper instanceof Number n && n.intValue() >= 0) {
            return add(base(TransformationKind.HEAD, ctx)
                    .source(v.name())
                    .target(nextSynthetic())
                    .suggestedRecipe(RecipeType.TOP_N)
                    .parameter(Params.N, n.intValue())
                    .build());
        }
        Object lower = CallArguments.literal(slice.lower());
        if (slice.upper() == null && slice.step() == null && lower instanceof Number n && n.intValue() < 0) {
            return add(base(TransformationKind.TAIL, ctx)
                    .source(v.name())
                    .target(nextSynthetic())
                    .suggestedRecipe(RecipeType.TOP_N)
                    .parameter(Params.N, -n.intValue())
                    .build());
        }
        return emitOpaque(ctx, v.name(), null, "row slice");
    }

    // ------------------------------------------------------------------ rule application

    private TracedValue receiverCall(CallTarget target, TracedValue v, Chain.Link link, Context ctx) {
        CallArguments args = CallArguments.of(link.call(), v.columns());
        return receiverRule(target, link.name(), v, args, link.call(), ctx);
    }

    private TracedValue receiverRule(CallTarget target, String name, TracedValue v, CallArguments args,
                                     Expr.Call call, Context ctx) {
        PatternRule rule = catalog.resolve(name, target, args.shape());
        if (rule.displayOnly()) return DISPLAY;
        switch (rule.effect()) {
            case PASSTHROUGH:
                return v;
            case PENDING_GROUP: {
                Map<String, Object> params = rule.extractor().extract(args.withFrames(frameVariables(ctx)));
                return new TracedValue(TracedValue.Kind.GROUPED, v.name(), List.of(), params, null, v.producer());
            }
            case PENDING_WINDOW: {
                Map<String, Object> params = new LinkedHashMap<>(rule.extractor().extract(args));
                params.remove(Params.COLUMN);
                params.remove(Params.COLUMNS);
                return new TracedValue(TracedValue.Kind.WINDOWED, v.name(), v.columns(), params, null, v.producer());
            }
            case ESTIMATOR:
                return TracedValue.OTHER;
            default:
                break;
        }
        List<String> additional = new ArrayList<>();
        if (MULTI_SOURCE.contains(rule.kind()) && call != null) additional.addAll(framesIn(call, true));
        return emit(rule, name, args, v, v.name(), additional, call, ctx);
    }

    /** {@code df.groupby('k')['v'].rolling(3)}: a window partitioned by the group keys. */
    private TracedValue groupedWindow(TracedValue v, Chain.Link link, Context ctx) {
        CallArguments args = CallArguments.of(link.call(), v.columns());
        PatternRule rule = catalog.resolve(link.name(), CallTarget.COLUMN_METHOD, args.shape());
        if (rule.effect() != RuleEffect.PENDING_WINDOW) return receiverCall(CallTarget.GROUPBY_METHOD, v, link, ctx);
        Map<String, Object> params = new LinkedHashMap<>(rule.extractor().extract(args));
        params.remove(Params.COLUMN);
        params.remove(Params.COLUMNS);
        params.put(Params.KEYS, v.stateValue(Params.KEYS));
        params.values().removeIf(Objects::isNull);
        return new TracedValue(TracedValue.Kind.WINDOWED, v.name(), v.columns(), params, null, v.producer());
    }

    private TracedValue moduleCall(String qualified, Expr.Call call, Context ctx) {
        CallArguments args = CallArguments.of(call);
        PatternRule rule = catalog.resolve(qualified, CallTarget.MODULE_FUNCTION, args.shape());
        if (rule.displayOnly()) return DISPLAY;
        if (rule.effect() == RuleEffect.ESTIMATOR) {
            Map<String, Object> params = rule.extractor().extract(args);
            return new TracedValue(TracedValue.Kind.ESTIMATOR, qualified, List.of(), params, rule, -1);
        }
        if (rule.effect() != RuleEffect.EMIT) return TracedValue.OTHER;

        boolean multi = MULTI_SOURCE.contains(rule.kind());
        List<String> frames = framesIn(call, multi && !rule.fallback());
        if (rule.kind() == TransformationKind.READ_DATA) {
            return emit(rule, qualified, args, null, null, List.of(), call, ctx);
        }
        if (ctx.columnTarget != null) {
            return emit(rule, qualified, args, null, ctx.columnSource, List.of(), call, ctx);
        }
        if (frames.isEmpty()) {
            if (!rule.fallback()) {
                log.debug("Call without dataframe arguments ignored | callee={} | line={}", qualified, ctx.stmt.line());
            } else if (looksLikePandasReader(qualified)) {
                warnings.add(String.format("Line %d: '%s' looks like a pandas reader but its module is not imported; statement ignored",
                        ctx.stmt.line(), qualified));
                log.warn("Unresolved reader call | callee={} | line={}", qualified, ctx.stmt.line());
            }
            return TracedValue.OTHER;
        }
        List<String> additional = multi ? frames.subList(1, frames.size()) : List.of();
        return emit(rule, qualified, args, null, frames.get(0), additional, call, ctx);
    }

    private boolean looksLikePandasReader(String qualified) {
        int dot = qualified.lastIndexOf('.');
        String function = qualified.substring(dot + 1);
        return function.startsWith("read_") && catalog.knows("pandas." + function, CallTarget.MODULE_FUNCTION);
    }

    private TracedValue estimatorCall(TracedValue estimator, Chain.Link link, Context ctx) {
        Expr.Call call = link.call();
        CallArguments args = CallArguments.of(call);
        PatternRule rule = catalog.resolve(link.name(), CallTarget.ESTIMATOR_METHOD, args.shape());
        if (rule.displayOnly()) return DISPLAY;
        List<String> frames = framesIn(call, false);
        String variable = (String) estimator.stateValue(VARIABLE_STATE);
        if (frames.isEmpty() && ctx.columnTarget == null) return TracedValue.OTHER;

        PatternRule constructor = estimator.rule();
        Map<String, Object> params = new LinkedHashMap<>(estimator.state());
        params.remove(VARIABLE_STATE);
        params.remove(FITTED_STATE);
        params.putAll(rule.extractor().extract(args));

        ProcessorType processor = rule.processor() != null ? rule.processor()
                : constructor != null ? constructor.processor() : null;
        boolean requiresCode = rule.requiresCodeRecipe() || rule.fallback();
        RecipeType recipe = rule.recipe();
        if (rule.kind() == TransformationKind.FIT_TRANSFORM && !requiresCode) {
            if (constructor == null || constructor.requiresCodeRecipe() || processor == null) {
                requiresCode = true;
                recipe = RecipeType.PYTHON;
            } else {
                recipe = RecipeType.PREPARE;
            }
        }

        String source = ctx.columnTarget != null ? ctx.columnSource : frames.get(0);
        Transformation.Builder b = base(rule.kind(), ctx)
                .source(source)
                .suggestedRecipe(recipe)
                .suggestedProcessor(processor)
                .requiresCodeRecipe(requiresCode)
                .columns(columnsIn(call, ctx))
                .parameters(params);
        if (rule.fallback()) {
            b.parameter(Params.CODE, ctx.text).parameter(Params.FUNCTION, link.name());
            b.note("unrecognized estimator method " + link.name());
        }
        for (int i = 1; i < frames.size(); i++) b.additionalSource(frames.get(i));

        if (rule.kind() == TransformationKind.FIT) {
            String model = variable != null ? variable : ctx.target != null ? ctx.target : nextSynthetic();
            add(b.target(model).build());
            TracedValue fitted = estimator.withState(FITTED_STATE, Boolean.TRUE).withState(VARIABLE_STATE, model);
            if (variable != null) symbols.bind(variable, fitted);
            return fitted;
        }
        if (rule.kind() == TransformationKind.PREDICT && variable != null
                && Boolean.TRUE.equals(symbols.lookup(variable).stateValue(FITTED_STATE))) {
            b.additionalSource(variable);
        }
        if (ctx.columnTarget != null) {
            outputColumns(b, ctx, columnsIn(call, ctx));
            add(b.target(ctx.columnTarget).build());
            return new TracedValue(TracedValue.Kind.SERIES, ctx.columnSource, ctx.outputColumns, Map.of(), null,
                    transformations.size() - 1);
        }
        return add(b.target(nextSynthetic()).build());
    }

    private TracedValue emit(PatternRule rule, String callee, CallArguments args, TracedValue receiver,
                             String source, List<String> additional, Expr.Call call, Context ctx) {
        Set<String> frames = frameVariables(ctx);
        Map<String, Object> params = new LinkedHashMap<>(rule.extractor().extract(args.withFrames(frames)));

        Transformation.Builder b = base(rule.kind(), ctx)
                .source(source)
                .suggestedRecipe(rule.recipe())
                .suggestedProcessor(rule.processor())
                .requiresCodeRecipe(rule.requiresCodeRecipe());
        additional.forEach(b::additionalSource);

        if (receiver != null) b.columns(receiver.columns());
        Object listed = params.remove(Params.COLUMNS);
        if (listed instanceof List<?> list) {
            for (Object o : list) b.column(String.valueOf(o));
        }
        if (params.get(Params.COLUMN) instanceof String single) b.column(single);
        if (receiver == null && call != null && rule.kind() != TransformationKind.READ_DATA) {
            b.columns(columnsIn(call, ctx));
        }

        if (receiver != null && receiver.kind() == TracedValue.Kind.GROUPED) {
            groupedParameters(receiver, params);
        } else if (receiver != null && receiver.kind() == TracedValue.Kind.WINDOWED) {
            for (Map.Entry<String, Object> e : receiver.state().entrySet()) params.putIfAbsent(e.getKey(), e.getValue());
        }

        if (rule.fallback()) {
            b.requiresCodeRecipe(true).suggestedRecipe(RecipeType.PYTHON);
            params.put(Params.FUNCTION, callee);
            params.put(Params.CODE, ctx.text);
            b.note("unrecognized call " + callee);
            log.warn("Unrecognized call on traced data | callee={} | line={} | using a code recipe", callee, ctx.stmt.line());
        }
        if (call != null && Boolean.TRUE.equals(CallArguments.literal(call.keyword("inplace")))) {
            params.remove("inplace");
        }

        if (ctx.columnTarget != null) {
            if (receiver != null && receiver.isFrameLike() && !receiver.name().equals(ctx.columnSource)) {
                b.requiresCodeRecipe(true).suggestedRecipe(RecipeType.PYTHON);
                params.put(Params.CODE, ctx.text);
                b.note("column computed from another dataframe");
            }
            b.parameters(params);
            outputColumns(b, ctx, receiver != null ? receiver.columns() : List.of());
            add(b.target(ctx.columnTarget).build());
            return new TracedValue(TracedValue.Kind.SERIES, ctx.columnSource, ctx.outputColumns, Map.of(), null,
                    transformations.size() - 1);
        }

        b.parameters(params);
        if (rule.kind() == TransformationKind.SPLIT && !ctx.outputs.isEmpty()) {
            b.parameter(Params.OUTPUTS, ctx.outputs);
            add(b.target(ctx.outputs.get(0)).build());
            return TracedValue.frame(ctx.outputs.get(0), transformations.size() - 1);
        }
        if (rule.kind() == TransformationKind.WRITE_DATA) {
            add(b.target(null).build());
            return TracedValue.OTHER;
        }
        boolean inplace = call != null && Boolean.TRUE.equals(CallArguments.literal(call.keyword("inplace")));
        String target = inplace && receiver != null && receiver.isFrameLike() ? inplaceTarget(receiver, ctx) : nextSynthetic();
        return add(b.target(target).build());
    }

    /** The variable an in-place call rebinds: the chain's root variable, else the receiver frame. */
    private String inplaceTarget(TracedValue receiver, Context ctx) {
        if (ctx.stmt instanceof Stmt.ExprStmt e) {
            Chain chain = Chain.unwind(e.value());
            if (chain.base() instanceof Expr.Name n) return n.id();
        }
        return receiver.name();
    }

    /** Group keys and the selected columns folded into the aggregation parameters. */
    @SuppressWarnings("unchecked")
    private static void groupedParameters(TracedValue grouped, Map<String, Object> params) {
        Object keys = grouped.stateValue(Params.KEYS);
        if (keys != null) {
            Map<String, Object> reordered = new LinkedHashMap<>();
            reordered.put(Params.KEYS, keys);
            reordered.putAll(params);
            params.clear();
            params.putAll(reordered);
        }
        if (!(params.get(Params.AGGREGATIONS) instanceof List<?> aggregations) || grouped.columns().isEmpty()) return;
        List<Map<String, Object>> expanded = new ArrayList<>();
        for (Object o : aggregations) {
            Map<String, Object> agg = (Map<String, Object>) o;
            if (agg.containsKey("column")) {
                expanded.add(agg);
                continue;
            }
            for (String column : grouped.columns()) {
                Map<String, Object> copy = new LinkedHashMap<>();
                copy.put("column", column);
                copy.putAll(agg);
                expanded.add(copy);
            }
        }
        params.put(Params.AGGREGATIONS, expanded);
    }

    /** Output column parameters for the first column-level link of a column assignment. */
    private static void outputColumns(Transformation.Builder b, Context ctx, List<String> inputColumns) {
        if (ctx.outputAssigned) return;
        ctx.outputAssigned = true;
        if (ctx.outputColumns.size() == 1) {
            String output = ctx.outputColumns.get(0);
            if (!(inputColumns.size() == 1 && inputColumns.get(0).equals(output))) b.parameter(Params.OUTPUT, output);
        } else if (!ctx.outputColumns.equals(inputColumns)) {
            b.parameter(Params.OUTPUTS, ctx.outputColumns);
        }
    }

    private TracedValue emitOpaque(Context ctx, String source, String target, String reason) {
        Transformation.Builder b = base(TransformationKind.CUSTOM_FUNCTION, ctx)
                .source(source)
                .target(target != null ? target : nextSynthetic())
                .suggestedRecipe(RecipeType.PYTHON)
                .requiresCodeRecipe(true)
                .parameter(Params.CODE, ctx.text)
                .note(reason);
        log.warn("Statement not statically expressible | line={} | reason={}", ctx.stmt.line(), reason);
        return add(b.build());
    }

    private TracedValue add(Transformation t) {
        transformations.add(t);
        if (log.isDebugEnabled()) {
            log.debug("Transformation | line={} | kind={} | {} -> {}", t.sourceLine(), t.kind().toValue(),
                    t.sourceNames(), t.targetDataframe());
        }
        return TracedValue.frame(t.targetDataframe(), transformations.size() - 1);
    }

    private Transformation.Builder base(TransformationKind kind, Context ctx) {
        return Transformation.builder(kind).line(ctx.stmt.line()).code(ctx.text);
    }

    // ------------------------------------------------------------------ helpers

    private String nextSynthetic() {
        return CHAIN_PREFIX + (++chainCounter);
    }

    static boolean isSynthetic(String name) {
        return FlowStep.isSyntheticName(name);
    }

    /** Variables whose subscripts are column references in this statement. */
    private Set<String> frameVariables(Context ctx) {
        Set<String> frames = new LinkedHashSet<>(symbols.frames());
        frames.addAll(ctx.extraFrames);
        return frames;
    }

    /**
     * Dataframes referenced by a call's arguments, in order, resolved to the frame they stand for.
     * With {@code includeUnbound}, plain never-assigned names passed as arguments count as
     * dataframes too.
     */
    private List<String> framesIn(Expr.Call call, boolean includeUnbound) {
        Set<String> out = new LinkedHashSet<>();
        for (String name : ExprNames.ofArguments(call)) {
            String frame = symbols.frameOf(name);
            if (frame != null) {
                out.add(frame);
            } else if (includeUnbound && !symbols.isBound(name) && isDirectArgument(call, name)) {
                out.add(name);
            }
        }
        return new ArrayList<>(out);
    }

    private static boolean isDirectArgument(Expr.Call call, String name) {
        List<Expr> candidates = new ArrayList<>(call.args());
        call.keywords().forEach(k -> candidates.add(k.value()));
        for (Expr e : candidates) {
            if (e instanceof Expr.Name n && n.id().equals(name)) return true;
            List<Expr> items = e instanceof Expr.ListExpr l ? l.elements() : e instanceof Expr.Tuple t ? t.elements() : List.of();
            for (Expr item : items) {
                if (item instanceof Expr.Name n && n.id().equals(name)) return true;
            }
        }
        return false;
    }

    private List<String> columnsIn(Expr.Call call, Context ctx) {
        Set<String> frames = frameVariables(ctx);
        Set<String> out = new LinkedHashSet<>();
        for (Expr a : call.args()) out.addAll(Formulas.columnsOf(a, frames));
        call.keywords().forEach(k -> out.addAll(Formulas.columnsOf(k.value(), frames)));
        return new ArrayList<>(out);
    }

    private String text(Stmt stmt) {
        return module.textOf(stmt);
    }

    /** Per-statement state. */
    private final class Context {
        final Stmt stmt;
        final String text;
        final int start;
        final Set<String> extraFrames = new LinkedHashSet<>();
        String target;
        List<String> outputs = List.of();
        boolean expressionStatement;
        String columnTarget;
        String columnSource;
        List<String> outputColumns = List.of();
        boolean outputAssigned;

        Context(Stmt stmt, String text) {
            this.stmt = stmt;
            this.text = text;
            this.start = transformations.size();
        }
    }
}
