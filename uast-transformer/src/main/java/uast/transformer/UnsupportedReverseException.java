package uast.transformer;

/// A reverse (construct) path that is not implemented was exercised.
@SuppressWarnings("serial")
public final class UnsupportedReverseException extends TransformException {

    private static final long serialVersionUID = 1L;

    public UnsupportedReverseException(String message) {
        super(message);
    }
}
