package io.surfworks.convfuse.ir;

/**
 * Scoped insert-point guard.
 *
 * <p>While open, {@link Graph#insertNode} and {@link Graph#insertConstant}
 * place new nodes at this point. Closing restores the previous insert point:
 * <pre>{@code
 * try (InsertPoint ip = graph.insertPointBefore(node)) {
 *     Value size = graph.insertConstant(Literals.intList(sizes));
 *     ...
 * }
 * }</pre>
 */
public final class InsertPoint implements AutoCloseable {

    private final Graph graph;
    private final Block previousBlock;
    private final Node previousAnchor;

    InsertPoint(Graph graph, Block previousBlock, Node previousAnchor) {
        this.graph = graph;
        this.previousBlock = previousBlock;
        this.previousAnchor = previousAnchor;
    }

    @Override
    public void close() {
        graph.restoreInsertPoint(previousBlock, previousAnchor);
    }
}
