package uast.normalizer;

import uast.nodes.Node;
import uast.transformer.Mappings;
import uast.transformer.Pipeline;

import java.util.Objects;
import java.util.logging.Logger;

/// Converts a native C# syntax tree into a canonical semantic tree.
///
/// Two pipelines run in order:
///
/// 1. **Preprocess** drops whitespace trivia and redundant span fields and turns spans into
///    canonical `@pos` nodes.
/// 2. **Normalize** first relocates all trivia in a stage of its own, then applies the
///    semantic rules, ending with the group merger.
///
/// Usage:
/// ```java
/// Node canonical = Normalizer.csharp().transform(NodeJson.parse(nativeJson));
/// ```
///
/// A [uast.transformer.TransformException] aborts the call; no partially normalized tree is
/// returned. A normalizer holds no mutable state and may be shared between threads.
public final class Normalizer {

    private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

    private final NormalizerConfig config;
    private final Pipeline preprocess;
    private final Pipeline normalize;

    private Normalizer(NormalizerConfig config) {
        this.config = config;
        this.preprocess = Pipeline.of("preprocess",
                new Mappings("preprocess", Preprocessors.rules(config)));
        this.normalize = Pipeline.of("normalize",
                Mappings.of("trivia", Normalizers.moveTrivia(config)),
                new Mappings("semantic", Normalizers.rules(config)));
    }

    /// {@return a normalizer with the default C# tables}
    public static Normalizer csharp() {
        return create(NormalizerConfig.csharp());
    }

    public static Normalizer create(NormalizerConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new Normalizer(config);
    }

    public NormalizerConfig config() {
        return config;
    }

    /// Runs the preprocess pipeline.
    /// @param root the native tree
    /// @return the cleaned native tree
    public Node preprocess(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        return preprocess.transform(root);
    }

    /// Runs the normalize pipeline on a preprocessed tree.
    /// @param root the preprocessed tree
    /// @return the canonical tree
    public Node normalize(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        return normalize.transform(root);
    }

    /// Runs both pipelines.
    /// @param root the native tree
    /// @return the canonical tree
    public Node transform(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        LOG.fine(() -> "Normalizing tree with root kind " + root.kind());
        return normalize(preprocess(root));
    }
}
