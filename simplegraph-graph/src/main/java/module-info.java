module org.simplegraph.graph {
    requires transitive org.simplegraph.common;
    requires org.slf4j;

    exports org.simplegraph.graph;
    exports org.simplegraph.graph.impl;
    exports org.simplegraph.graph.path;
}
