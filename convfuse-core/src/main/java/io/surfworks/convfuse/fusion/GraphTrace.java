package io.surfworks.convfuse.fusion;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.convfuse.config.FusionConfig;
import io.surfworks.convfuse.ir.Graph;
import io.surfworks.convfuse.ir.GraphPrinter;
import io.surfworks.convfuse.jfr.FusionStepEvent;

/**
 * Graph dumps and JFR events around the pipeline steps.
 */
final class GraphTrace {

    private static final Logger LOG = Logger.getLogger(GraphTrace.class.getName());

    private final FusionConfig config;

    GraphTrace(FusionConfig config) {
        this.config = config;
    }

    void dump(String label, Graph graph) {
        if (config.traceGraphs() && LOG.isLoggable(Level.FINE)) {
            LOG.fine(label + ":\n" + GraphPrinter.print(graph));
        }
    }

    FusionStepEvent startStep() {
        FusionStepEvent event = new FusionStepEvent();
        if (config.recordJfrEvents()) {
            event.begin();
        }
        return event;
    }

    void finishStep(FusionStepEvent event, String step, int rewrites, Graph graph) {
        if (config.recordJfrEvents()) {
            event.end();
            if (event.shouldCommit()) {
                event.step = step;
                event.rewrites = rewrites;
                event.nodeCount = graph.allNodes().size();
                event.commit();
            }
        }
        dump("After " + step + " (" + rewrites + " rewrite(s))", graph);
    }
}
