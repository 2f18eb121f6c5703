package com.pyflow.converter;

import com.pyflow.analyzer.PythonCodeAnalyzer;
import com.pyflow.assembler.DeclaredDataset;
import com.pyflow.assembler.RecipeNamer;
import com.pyflow.assembler.SemanticFlowAssembler;
import com.pyflow.assembler.StaticFlowAssembler;
import com.pyflow.config.AnalysisMode;
import com.pyflow.config.ConverterConfig;
import com.pyflow.llm.AnalysisResult;
import com.pyflow.llm.DatasetInfo;
import com.pyflow.llm.LlmCodeAnalyzer;
import com.pyflow.llm.LlmProvider;
import com.pyflow.llm.LlmProviders;
import com.pyflow.llm.ProviderSettings;
import com.pyflow.llm.RetryingLlmProvider;
import com.pyflow.model.Flow;
import com.pyflow.model.FlowRecommendation;
import com.pyflow.model.Severity;
import com.pyflow.model.transform.Transformation;
import com.pyflow.optimizer.FlowOptimizer;
import com.pyflow.optimizer.OptimizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the converter: analyzes a pandas script, assembles the flow and optionally
 * optimizes it. Analyzer and assembler instances are created per call, so one converter may be
 * used from several threads as long as its provider is thread-safe.
 */
public final class FlowConverter {

    private static final Logger log = LoggerFactory.getLogger(FlowConverter.class);

    /** Recommendation type for advice the model gave during semantic analysis. */
    public static final String ANALYSIS_RECOMMENDATION = "ANALYSIS";

    private final ConverterConfig config;
    private final LlmProvider provider;

    /** Static converter with default settings. */
    public FlowConverter() {
        this(ConverterConfig.defaults());
    }

    /** Converter whose LLM provider, if semantic analysis is configured, is discovered by name. */
    public FlowConverter(ConverterConfig config) {
        this(config, null);
    }

    /**
     * @param provider provider for semantic analysis; null to discover it from the configuration
     *                 on first use
     */
    public FlowConverter(ConverterConfig config, LlmProvider provider) {
        this.config = Objects.requireNonNull(config, "config");
        this.provider = provider;
    }

    public static FlowConverter fromEnvironment() {
        ConverterConfig config = ConverterConfig.fromEnvironment();
        log.info("Converter configured from environment | {}", config);
        return new FlowConverter(config);
    }

    public ConverterConfig getConfig() {
        return config;
    }

    /**
     * Converts script text.
     *
     * @throws com.pyflow.model.ConversionException subtypes for syntax errors, provider failures,
     *                                              unparseable model replies and cyclic flows
     */
    public ConversionResult convert(String source) {
        Objects.requireNonNull(source, "source");
        return config.getAnalysisMode() == AnalysisMode.SEMANTIC ? convertSemantic(source) : convertStatic(source);
    }

    /** Reads the file as UTF-8 and converts it; the flow records the file name as its source. */
    public ConversionResult convert(Path file) {
        Objects.requireNonNull(file, "file");
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read script " + file, e);
        }
        ConversionResult result = convert(source);
        Path name = file.getFileName();
        result.flow().setSourceName(name != null ? name.toString() : file.toString());
        return result;
    }

    private ConversionResult convertStatic(String source) {
        PythonCodeAnalyzer analyzer = new PythonCodeAnalyzer();
        List<Transformation> transformations = analyzer.analyze(source);
        Flow flow = new StaticFlowAssembler(config.getFlowName(), namer()).assemble(transformations);
        for (String warning : analyzer.warnings()) {
            flow.addWarning(Severity.WARNING, warning);
        }
        OptimizationResult optimization = optimize(flow);
        log.info("Conversion complete | mode=static | {}", flow.summary());
        return new ConversionResult(flow, transformations, null, optimization);
    }

    private ConversionResult convertSemantic(String source) {
        AnalysisResult analysis = new LlmCodeAnalyzer(provider()).analyze(source);
        List<DeclaredDataset> declared = new ArrayList<>();
        for (DatasetInfo d : analysis.datasets()) {
            declared.add(new DeclaredDataset(d.name(), d.role(), d.source(), d.columns()));
        }
        Flow flow = new SemanticFlowAssembler(config.getFlowName(), namer(), declared).assemble(analysis.steps());
        for (String advice : analysis.recommendations()) {
            flow.addRecommendation(new FlowRecommendation(ANALYSIS_RECOMMENDATION, "LOW", advice));
        }
        for (String hint : analysis.optimizationHints()) {
            flow.addRecommendation(new FlowRecommendation(ANALYSIS_RECOMMENDATION, "MEDIUM", hint));
        }
        OptimizationResult optimization = optimize(flow);
        log.info("Conversion complete | mode=semantic | model={} | {}", analysis.modelUsed(), flow.summary());
        return new ConversionResult(flow, List.of(), analysis, optimization);
    }

    private OptimizationResult optimize(Flow flow) {
        return config.isOptimize() ? new FlowOptimizer().optimize(flow) : null;
    }

    private RecipeNamer namer() {
        return new RecipeNamer(config.getRecipePrefix(), config.getRecipeSuffix());
    }

    private LlmProvider provider() {
        LlmProvider base = provider != null ? provider : LlmProviders.create(config.getLlmProvider(),
                new ProviderSettings(config.getLlmModel(), config.getLlmBaseUrl(), config.getLlmApiKey(), config.getLlmTimeout()));
        return new RetryingLlmProvider(base, config.getLlmMaxAttempts(), config.getLlmRetryBackoff());
    }
}
