package uast.transformer;

import uast.nodes.Node;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Capture store for one match attempt.
///
/// A fresh state is created for every attempt and dropped when the attempt fails, so bindings
/// never leak from one attempt into the next.
public final class State {

    private final Map<String, Node> vars;

    public State() {
        this(new HashMap<>());
    }

    private State(Map<String, Node> vars) {
        this.vars = vars;
    }

    /// Binds a variable.
    ///
    /// Binding a name twice succeeds only if both values are equal, which lets a pattern require
    /// two fields to hold the same value.
    /// @param name the variable name
    /// @param value the captured node
    /// @return `false` if the name is already bound to a different value
    public boolean bind(String name, Node value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        final var current = vars.putIfAbsent(name, value);
        return current == null || current.equals(value);
    }

    /// {@return the value bound to `name`}
    /// @throws InvariantViolationException if the variable is not bound
    public Node get(String name) {
        final var value = vars.get(name);
        if (value == null) {
            throw new InvariantViolationException("variable '" + name + "' is not bound");
        }
        return value;
    }

    public Optional<Node> find(String name) {
        return Optional.ofNullable(vars.get(name));
    }

    public boolean isBound(String name) {
        return vars.containsKey(name);
    }

    /// {@return a scratch copy to try an alternative on}
    public State copy() {
        return new State(new HashMap<>(vars));
    }

    /// Replaces all bindings with those of a scratch copy that matched.
    public void commit(State scratch) {
        if (scratch == this) return;
        vars.clear();
        vars.putAll(scratch.vars);
    }

    /// {@return a snapshot of the current bindings}
    public Map<String, Node> bindings() {
        return Map.copyOf(vars);
    }

    @Override
    public String toString() {
        return "State" + vars.keySet();
    }
}
