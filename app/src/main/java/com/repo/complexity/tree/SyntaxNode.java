package com.repo.complexity.tree;

import com.repo.complexity.core.Location;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Language-neutral syntax tree node.
 * Sub-nodes are ordered children; scalar properties (operator, name, value, ...)
 * are kept as attributes.
 */
public record SyntaxNode(
        /** Node kind, e.g. "IfStatement" */
        String type,

        /** Scalar properties of the node */
        Map<String, Object> attributes,

        /** Child nodes in document order */
        List<SyntaxNode> children,

        /** Source span, or null if unknown */
        Location location) {

    public SyntaxNode {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static SyntaxNode of(String type, SyntaxNode... children) {
        return new SyntaxNode(type, Map.of(), List.of(children), null);
    }

    public Optional<Location> getLocation() {
        return Optional.ofNullable(location);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    /**
     * String form of an attribute, or null if absent.
     */
    public String text(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }

    public boolean is(String kind) {
        return type.equals(kind);
    }

    public Optional<SyntaxNode> child(int index) {
        return index < children.size() ? Optional.of(children.get(index)) : Optional.empty();
    }
}
