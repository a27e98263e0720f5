package uast.transformer;

import uast.nodes.Node;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A named, ordered sequence of stages. Each stage receives the output of the one before.
public record Pipeline(String name, List<Transformer> stages) implements Transformer {

    private static final Logger LOG = Logger.getLogger(Pipeline.class.getName());

    public Pipeline {
        Objects.requireNonNull(name, "name must not be null");
        stages = List.copyOf(Objects.requireNonNull(stages, "stages must not be null"));
    }

    public static Pipeline of(String name, Transformer... stages) {
        return new Pipeline(name, List.of(stages));
    }

    @Override
    public Node transform(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        LOG.fine(() -> "Pipeline '" + name + "': " + stages.size() + " stages");
        var current = root;
        for (final var stage : stages) {
            current = stage.transform(current);
        }
        return current;
    }
}
