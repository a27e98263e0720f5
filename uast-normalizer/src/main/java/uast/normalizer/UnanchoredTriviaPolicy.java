package uast.normalizer;

/// What [MoveTrivia] does with a relocated token wrapper that holds trivia only.
///
/// Every token wrapper is expected to hold the token it was built around. A wrapper without one
/// means an earlier rule deleted the token, and the trivia cannot be split into leading and
/// trailing parts any more.
public enum UnanchoredTriviaPolicy {
    /// Move all of the trivia to the leading side, set the field to null and log a warning.
    TREAT_AS_LEADING,
    /// Abort the transform with an invariant violation.
    FAIL
}
