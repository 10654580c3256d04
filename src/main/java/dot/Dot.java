package dot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A labelled directed graph that renders itself as Graphviz DOT text.
 * Nodes and edges keep their insertion order so the output is deterministic.
 */
public final class Dot {

    // Distinct, printable colours; cycled through for edge labels.
    public static final String[] COLORS = {
            "#00ff00", "#ff00ff", "#007fff", "#ff7f00", "#7fbf7f", "#4604ac",
            "#de0328", "#19801d", "#d881f5", "#00ffff", "#ffff00", "#00ff7f",
            "#ad5867", "#85f610", "#84e9f5", "#f5c778", "#207090", "#764ef3"
    };

    private final String name;
    private final Map<String, String> graphAttrs = new LinkedHashMap<>();
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    public Dot(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public Dot graphAttr(String key, String value) {
        graphAttrs.put(key, value);
        return this;
    }

    /** Adds a node, or returns the existing one with the same name. */
    public Node addNode(String nodeName) {
        return nodes.computeIfAbsent(nodeName, Node::new);
    }

    public Node node(String nodeName) {
        Node node = nodes.get(nodeName);
        if (node == null) {
            throw new IllegalArgumentException("no node named " + nodeName);
        }
        return node;
    }

    public boolean hasNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    /** Adds an edge {@code from -> to} between two existing nodes. */
    public Edge addEdge(String from, String to) {
        node(from);
        node(to);
        Edge edge = new Edge(from, to);
        edges.add(edge);
        return edge;
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public void write(Path file) throws IOException {
        Files.writeString(file, toString(), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64 + 32 * (nodes.size() + edges.size()));
        sb.append("digraph ").append(quote(name)).append(" {\n");
        for (Map.Entry<String, String> attr : graphAttrs.entrySet()) {
            sb.append("  ").append(attr.getKey()).append('=').append(quote(attr.getValue())).append(";\n");
        }
        for (Node node : nodes.values()) {
            sb.append("  ").append(quote(node.name));
            appendAttrs(sb, node.attrs);
            sb.append(";\n");
        }
        for (Edge edge : edges) {
            sb.append("  ").append(quote(edge.from)).append(" -> ").append(quote(edge.to));
            appendAttrs(sb, edge.attrs);
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void appendAttrs(StringBuilder sb, Map<String, String> attrs) {
        if (attrs.isEmpty()) {
            return;
        }
        sb.append(" [");
        boolean first = true;
        for (Map.Entry<String, String> attr : attrs.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(attr.getKey()).append('=').append(quote(attr.getValue()));
            first = false;
        }
        sb.append(']');
    }

    static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    public static final class Node {
        private final String name;
        private final Map<String, String> attrs = new LinkedHashMap<>();

        private Node(String name) {
            this.name = name;
        }

        public String name() { return name; }

        public Node attr(String key, String value) {
            attrs.put(key, value);
            return this;
        }

        public String attr(String key) {
            return attrs.get(key);
        }
    }

    public static final class Edge {
        private final String from;
        private final String to;
        private final Map<String, String> attrs = new LinkedHashMap<>();

        private Edge(String from, String to) {
            this.from = from;
            this.to = to;
        }

        /** Source node name; Graphviz calls this the tail of the edge. */
        public String from() { return from; }
        public String to() { return to; }

        public Edge attr(String key, String value) {
            attrs.put(key, value);
            return this;
        }

        public String attr(String key) {
            return attrs.get(key);
        }
    }
}
