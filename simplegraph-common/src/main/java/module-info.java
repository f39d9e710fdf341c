module org.simplegraph.common {
    exports org.simplegraph.common;
    exports org.simplegraph.common.numeric;
}
