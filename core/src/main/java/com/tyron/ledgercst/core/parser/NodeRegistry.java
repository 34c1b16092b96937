package com.tyron.ledgercst.core.parser;

import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.core.model.TreeNode;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Maps terminal types to token factories and grammar rules to {@link NodeType}s.
 * Built once per language and passed to the tree builder explicitly.
 */
public final class NodeRegistry {

    private final Map<String, Function<String, ? extends TokenNode>> tokenFactories;
    private final Map<Class<?>, String> tokenTypes;
    private final Map<String, NodeType<?>> rules;
    private final Map<Class<?>, NodeType<?>> nodeTypes;

    private NodeRegistry(Builder builder) {
        this.tokenFactories = Map.copyOf(builder.tokenFactories);
        this.tokenTypes = Map.copyOf(builder.tokenTypes);
        this.rules = Map.copyOf(builder.rules);
        this.nodeTypes = Map.copyOf(builder.nodeTypes);
    }

    public static @NotNull Builder builder() {
        return new Builder();
    }

    /**
     * @throws GrammarInconsistencyException if no factory is registered for {@code type}
     */
    public @NotNull TokenNode createToken(@NotNull String type, @NotNull String rawText) {
        Function<String, ? extends TokenNode> factory = tokenFactories.get(type);
        if (factory == null) {
            throw new GrammarInconsistencyException("no token model registered for type=" + type);
        }
        return factory.apply(rawText);
    }

    public @NotNull String tokenType(@NotNull Class<? extends TokenNode> tokenClass) {
        String type = tokenTypes.get(tokenClass);
        if (type == null) {
            throw new IllegalArgumentException("token class not registered: " + tokenClass.getName());
        }
        return type;
    }

    /**
     * @throws GrammarInconsistencyException if no node type is registered for {@code rule}
     */
    public @NotNull NodeType<?> nodeType(@NotNull String rule) {
        NodeType<?> type = rules.get(rule);
        if (type == null) {
            throw new GrammarInconsistencyException("no tree model registered for rule=" + rule);
        }
        return type;
    }

    @SuppressWarnings("unchecked")
    public <N extends TreeNode> @NotNull NodeType<N> nodeType(@NotNull Class<N> nodeClass) {
        NodeType<?> type = nodeTypes.get(nodeClass);
        if (type == null) {
            throw new IllegalArgumentException("tree class not registered: " + nodeClass.getName());
        }
        return (NodeType<N>) type;
    }

    public static final class Builder {

        private final Map<String, Function<String, ? extends TokenNode>> tokenFactories = new HashMap<>();
        private final Map<Class<?>, String> tokenTypes = new HashMap<>();
        private final Map<String, NodeType<?>> rules = new HashMap<>();
        private final Map<Class<?>, NodeType<?>> nodeTypes = new HashMap<>();

        private Builder() {
        }

        public <T extends TokenNode> @NotNull Builder token(@NotNull String type, @NotNull Class<T> tokenClass, @NotNull Function<String, T> factory) {
            Objects.requireNonNull(factory, "factory");
            if (tokenFactories.putIfAbsent(type, factory) != null) {
                throw new IllegalArgumentException("duplicate token type: " + type);
            }
            tokenTypes.putIfAbsent(tokenClass, type);
            return this;
        }

        public @NotNull Builder tree(@NotNull NodeType<?> nodeType) {
            if (rules.putIfAbsent(nodeType.rule(), nodeType) != null) {
                throw new IllegalArgumentException("duplicate rule: " + nodeType.rule());
            }
            nodeTypes.put(nodeType.type(), nodeType);
            return this;
        }

        public @NotNull NodeRegistry build() {
            return new NodeRegistry(this);
        }
    }
}
