package io.logictree.core.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A generic parsed markup node: a tag, attributes, optional text and ordered children.
///
/// Produced by an external document reader; {@link LogicTreeReader} only consumes it. Tags
/// may carry a namespace, either as `{uri}name` or `prefix:name`.
///
/// @param tag element tag, possibly namespaced, not null
/// @param attributes attributes in document order, not null
/// @param text trimmed text content, may be null
/// @param children child nodes in document order, not null
public record SourceNode(
        String tag, Map<String, String> attributes, String text, List<SourceNode> children) {

    public SourceNode {
        Objects.requireNonNull(tag, "tag must not be null");
        attributes =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(
                                Objects.requireNonNull(attributes, "attributes must not be null")));
        children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
    }

    /// Creates an element node without text.
    ///
    /// @param tag element tag, not null
    /// @param attributes attributes, not null
    /// @param children children, not null
    /// @return new node, never null
    public static SourceNode element(
            String tag, Map<String, String> attributes, List<SourceNode> children) {
        return new SourceNode(tag, attributes, null, children);
    }

    /// Creates a text-only node.
    ///
    /// @param tag element tag, not null
    /// @param text text content, may be null
    /// @return new node, never null
    public static SourceNode text(String tag, String text) {
        return new SourceNode(tag, Map.of(), text, List.of());
    }

    /// Returns the tag without its namespace.
    ///
    /// @return local name, never null
    public String localName() {
        int brace = tag.lastIndexOf('}');
        if (brace >= 0) {
            return tag.substring(brace + 1);
        }
        int colon = tag.lastIndexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }

    /// Returns whether the tag ends with the given marker.
    ///
    /// @param marker tag suffix such as `logicTreeBranchSet`, not null
    /// @return `true` if the tag ends with `marker`
    public boolean isA(String marker) {
        return tag.endsWith(marker);
    }

    /// Returns an attribute value.
    ///
    /// @param name attribute name, not null
    /// @return the value, or null if absent
    public String attribute(String name) {
        return attributes.get(name);
    }

    /// Finds the first child whose local name matches.
    ///
    /// @param localName child local name, not null
    /// @return the child, or empty
    public Optional<SourceNode> child(String localName) {
        return children.stream().filter(c -> c.localName().equals(localName)).findFirst();
    }

    @Override
    public String toString() {
        return "<" + tag + " " + attributes + (children.isEmpty() ? "" : " ...") + ">";
    }
}
