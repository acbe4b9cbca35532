package io.surfworks.convfuse.fusion;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import io.surfworks.convfuse.config.FusionConfig;
import io.surfworks.convfuse.config.FusionConfigLoader;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.passes.ConstantPropagation;
import io.surfworks.convfuse.ir.passes.GraphPass;
import io.surfworks.convfuse.ir.passes.NodeEvaluator;
import io.surfworks.convfuse.ir.runtime.OperatorRegistry;
import io.surfworks.convfuse.jfr.FusionStepEvent;
import io.surfworks.convfuse.packed.PrepackedOperators;

/**
 * Rewrites 2-D convolutions into packed convolutions with fused post-ops.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>{@link ConvolutionNormalizer}: {@code aten::_convolution} to {@code aten::conv2d}</li>
 *   <li>{@link PrepackConvInserter}: eligible convolutions to prepack/run pairs</li>
 *   <li>{@link EltwiseFusion}: elementwise post-ops from the rule table</li>
 *   <li>{@link SumFusion}: residual additions, then sum followed by relu</li>
 *   <li>{@link ConstantPropagation}</li>
 *   <li>{@link PrepackFolder}: prepacks with constant inputs to packed constants</li>
 * </ol>
 * Running the pass on its own output changes nothing.
 *
 * <p>Example usage:
 * <pre>{@code
 * ConvEltwiseFusionPass pass = ConvEltwiseFusionPass.fromConfigFile();
 * FusionReport report = pass.apply(graph);
 * }</pre>
 */
public final class ConvEltwiseFusionPass implements GraphPass {

    private static final Logger LOG = Logger.getLogger(ConvEltwiseFusionPass.class.getName());

    private final List<GraphPass> steps;
    private final GraphTrace trace;

    public ConvEltwiseFusionPass(FusionConfig config, OperatorRegistry registry, PostOpRuleTable table) {
        NodeEvaluator evaluator = new NodeEvaluator(registry);
        this.steps = List.of(
                new ConvolutionNormalizer(),
                new PrepackConvInserter(ConvEligibility.forConfig(config)),
                new EltwiseFusion(table),
                new SumFusion(),
                new ConstantPropagation(evaluator),
                new PrepackFolder(evaluator));
        this.trace = new GraphTrace(config);
    }

    /**
     * Pass with the default config, the standard and prepacked kernels and the default rule table.
     * Ignores the config file; see {@link #fromConfigFile()}.
     */
    public static ConvEltwiseFusionPass withDefaults() {
        return withConfig(FusionConfig.defaults());
    }

    /**
     * Pass configured from the user's config file, or with the defaults when there is none.
     *
     * @throws io.surfworks.convfuse.config.FusionConfigException if the file is malformed
     */
    public static ConvEltwiseFusionPass fromConfigFile() {
        return withConfig(FusionConfigLoader.load());
    }

    /**
     * Pass configured from {@code configFile}, or with the defaults when the file doesn't exist.
     */
    public static ConvEltwiseFusionPass fromConfigFile(Path configFile) {
        return withConfig(FusionConfigLoader.load(configFile));
    }

    private static ConvEltwiseFusionPass withConfig(FusionConfig config) {
        return new ConvEltwiseFusionPass(config, PrepackedOperators.registry(), PostOpRuleTable.DEFAULT);
    }

    @Override
    public String name() {
        return "ConvEltwiseFusion";
    }

    @Override
    public int run(Graph graph) {
        return apply(graph).totalRewrites();
    }

    /**
     * Runs every step on the graph.
     *
     * @return the rewrite count of each step
     */
    public FusionReport apply(Graph graph) {
        FusionReport report = new FusionReport();
        trace.dump("Before " + name(), graph);
        for (GraphPass step : steps) {
            FusionStepEvent event = trace.startStep();
            int rewrites = step.run(graph);
            trace.finishStep(event, step.name(), rewrites, graph);
            report.record(step.name(), rewrites);
        }
        LOG.fine(() -> name() + ": " + report);
        return report;
    }

    List<GraphPass> steps() {
        return steps;
    }
}
