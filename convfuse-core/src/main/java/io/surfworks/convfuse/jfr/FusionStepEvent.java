package io.surfworks.convfuse.jfr;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event recording one step of the convolution fusion pipeline.
 *
 * <p>The event duration covers the step itself.
 *
 * <p>Usage:
 * <pre>{@code
 * FusionStepEvent event = new FusionStepEvent();
 * event.begin();
 * int rewrites = step.run(graph);
 * event.end();
 * event.step = step.name();
 * event.rewrites = rewrites;
 * event.nodeCount = graph.allNodes().size();
 * event.commit();
 * }</pre>
 */
@Name("io.surfworks.convfuse.FusionStep")
@Label("Fusion Pipeline Step")
@Category({"ConvFuse", "Compiler"})
@Description("Records one step of the convolution prepack and post-op fusion pipeline")
public class FusionStepEvent extends Event {

    @Label("Step")
    @Description("Name of the pipeline step")
    public String step;

    @Label("Rewrites")
    @Description("Number of rewrites the step performed")
    public int rewrites;

    @Label("Node Count")
    @Description("Number of nodes in the graph after the step, nested blocks included")
    public int nodeCount;
}
