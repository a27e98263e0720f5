package uast.nodes;

/// Exception thrown when a JSON document cannot be read into, or written from, a [Node].
@SuppressWarnings("serial")
public final class NodeJsonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NodeJsonException(String message) {
        super(message);
    }

    public NodeJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
