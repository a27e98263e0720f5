package uast.nodes;

/// The kinds of [Node] values.
public enum Kind {
    NULL,
    BOOL,
    INT,
    FLOAT,
    STRING,
    ARRAY,
    OBJECT
}
