package uast.transformer;

/// A tree or binding invariant does not hold, for example an unbound variable or a field that
/// would be written twice.
@SuppressWarnings("serial")
public final class InvariantViolationException extends TransformException {

    private static final long serialVersionUID = 1L;

    public InvariantViolationException(String message) {
        super(message);
    }
}
