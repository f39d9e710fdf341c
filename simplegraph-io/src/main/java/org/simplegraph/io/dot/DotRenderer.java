package org.simplegraph.io.dot;

import org.simplegraph.common.GraphType;
import org.simplegraph.graph.GraphVisitor;
import org.simplegraph.graph.WeightedGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Graphviz source of a graph, from its visitor only. Undirected graphs write each edge once, in the
 * direction where source &lt;= destination.
 */
public class DotRenderer {

    private DotRenderer() {
    }

    public static <N> String render(WeightedGraph<N> graph) {
        return render(graph, graph.numeric()::print);
    }

    public static <N> String render(GraphVisitor<N> graph, Function<N, String> printer) {
        boolean direct = graph.graphType() == GraphType.DIRECT;
        String arrow = direct ? "->" : "--";
        List<String> lines = new ArrayList<>(graph.totalEntries());
        graph.visitNodes((i, w) -> lines.add("\tn" + i + " [label=\"" + printer.apply(w) + "\"];"));
        graph.visitArcs((i, j, w) -> {
            if (direct || i <= j) {
                lines.add("\tn" + i + " " + arrow + " n" + j + " [label=\"" + printer.apply(w) + "\"];");
            }
        });
        return (direct ? "digraph" : "graph") + " {\n" + String.join("\n", lines) + "\n}";
    }
}
