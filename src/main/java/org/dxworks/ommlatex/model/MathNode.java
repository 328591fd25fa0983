package org.dxworks.ommlatex.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable node of an equation tree.
 *
 * <p>Which fields are meaningful depends on {@link #getKind()}: runs carry {@link #getText()},
 * structural nodes carry role children and attributes, containers carry positional children.
 * The child list is never null.</p>
 */
public final class MathNode {

    private static final Set<String> TRUE_VALUES = Set.of("1", "on", "true");

    private final MathNodeKind kind;
    private final String tag;
    private final List<MathNode> children;
    private final Map<MathRole, MathNode> namedChildren;
    private final String text;
    private final Map<MathAttribute, String> attributes;

    private MathNode(Builder builder) {
        this.kind = builder.kind;
        this.tag = builder.tag != null ? builder.tag : builder.kind.getTag();
        this.children = Collections.unmodifiableList(new ArrayList<>(builder.children));
        this.namedChildren = builder.namedChildren.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(builder.namedChildren));
        this.text = builder.text;
        this.attributes = builder.attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(builder.attributes));
    }

    public MathNodeKind getKind() {
        return kind;
    }

    /** Element name the node was read from, or null when built programmatically without one. */
    public String getTag() {
        return tag;
    }

    public List<MathNode> getChildren() {
        return children;
    }

    public MathNode getChild(MathRole role) {
        return namedChildren.get(role);
    }

    public String getText() {
        return text;
    }

    /** Attribute value, or null when absent. An empty string is a present, empty value. */
    public String getAttribute(MathAttribute attribute) {
        return attributes.get(attribute);
    }

    public String getAttribute(MathAttribute attribute, String defaultValue) {
        String value = attributes.get(attribute);
        return value != null ? value : defaultValue;
    }

    /** True for on/off attributes switched on ("1", "on" or "true"). */
    public boolean isFlagSet(MathAttribute attribute) {
        String value = attributes.get(attribute);
        return value != null && TRUE_VALUES.contains(value.trim().toLowerCase());
    }

    public List<MathNode> getChildren(MathNodeKind childKind) {
        List<MathNode> result = new ArrayList<>();
        for (MathNode child : children) {
            if (child.kind == childKind) {
                result.add(child);
            }
        }
        return result;
    }

    public MathNode findFirstChild(MathNodeKind childKind) {
        for (MathNode child : children) {
            if (child.kind == childKind) {
                return child;
            }
        }
        return null;
    }

    public boolean containsDescendant(MathNodeKind descendantKind) {
        for (MathNode child : children) {
            if (child.kind == descendantKind || child.containsDescendant(descendantKind)) {
                return true;
            }
        }
        return false;
    }

    /** Concatenated text of every run below this node, in document order. */
    public String plainText() {
        if (kind == MathNodeKind.RUN) {
            return text != null ? text : "";
        }
        StringBuilder sb = new StringBuilder();
        for (MathNode child : children) {
            sb.append(child.plainText());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return kind == MathNodeKind.RUN ? "r[" + text + "]" : kind + children.toString();
    }

    public static Builder builder(MathNodeKind kind) {
        return new Builder(kind);
    }

    public static MathNode run(String text) {
        return builder(MathNodeKind.RUN).text(text).build();
    }

    public static final class Builder {
        private final MathNodeKind kind;
        private String tag;
        private final List<MathNode> children = new ArrayList<>();
        private final Map<MathRole, MathNode> namedChildren = new EnumMap<>(MathRole.class);
        private String text;
        private final Map<MathAttribute, String> attributes = new EnumMap<>(MathAttribute.class);

        private Builder(MathNodeKind kind) {
            if (kind == null) {
                throw new IllegalArgumentException("Node kind must not be null");
            }
            this.kind = kind;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder child(MathNode child) {
            if (child != null) {
                children.add(child);
            }
            return this;
        }

        /**
         * Adds a role child. It also becomes a positional child, so generic traversal sees it.
         * The first child registered for a role keeps it.
         */
        public Builder child(MathRole role, MathNode child) {
            if (child == null) return this;
            children.add(child);
            namedChildren.putIfAbsent(role, child);
            return this;
        }

        public Builder attribute(MathAttribute attribute, String value) {
            if (value != null) {
                attributes.put(attribute, value);
            }
            return this;
        }

        public MathNode build() {
            return new MathNode(this);
        }
    }
}
