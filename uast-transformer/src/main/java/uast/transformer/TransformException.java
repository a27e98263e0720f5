package uast.transformer;

/// Fatal error while transforming a tree.
///
/// A shape mismatch is never reported this way: it is a `false` check result. This exception
/// aborts the whole transform of the current document and no partial result is returned.
@SuppressWarnings("serial")
public class TransformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
