module org.simplegraph.io {
    requires transitive org.simplegraph.common;
    requires transitive org.simplegraph.graph;
    requires com.fasterxml.jackson.databind;
    requires org.slf4j;

    exports org.simplegraph.io;
    exports org.simplegraph.io.impl;
    exports org.simplegraph.io.dot;
}
