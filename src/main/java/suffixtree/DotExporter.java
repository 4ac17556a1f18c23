package suffixtree;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Renders a suffix tree as a Graphviz DOT digraph for inspection: leaves are filled light
 * grey and labelled with their suffix index, highlighted nodes are red, suffix links are
 * dashed light green edges. Render only; nothing reads this format back.
 */
public final class DotExporter {

    private boolean suffixLinks = true;
    private final IntSet highlighted = new IntOpenHashSet();

    public DotExporter withSuffixLinks(boolean suffixLinks) {
        this.suffixLinks = suffixLinks;
        return this;
    }

    public DotExporter highlight(int... nodes) {
        for (int node : nodes) {
            highlighted.add(node);
        }
        return this;
    }

    public String render(SuffixTree tree) {
        StringBuilder sb = new StringBuilder(256);
        render(tree, sb);
        return sb.toString();
    }

    public void render(SuffixTree tree, Appendable out) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(out, "out");
        try {
            write(tree, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render suffix tree", e);
        }
    }

    private void write(SuffixTree tree, Appendable out) throws IOException {
        TreeStore store = tree.store();
        int[] text = tree.getText();
        int shown = Math.min(tree.getOriginalLength(), text.length);

        out.append("digraph suffixtree {\n");
        out.append("  graph [ratio=1];\n");
        out.append("  node [shape=circle, margin=0.2];\n");
        out.append("  edge [fontsize=10];\n");
        out.append("  // ").append(escape(tree.renderSymbols(text, 0, shown))).append('\n');

        for (int node : tree.depthFirst()) {
            out.append("  n").append(String.valueOf(node)).append(" [label=\"");
            if (node == TreeStore.ROOT) {
                out.append("root");
            } else if (store.isLeaf(node)) {
                out.append(String.valueOf(store.suffixIndex(node)));
            }
            out.append('"');
            if (highlighted.contains(node)) {
                out.append(", style=filled, fillcolor=red");
            } else if (store.isLeaf(node)) {
                out.append(", style=filled, fillcolor=lightgrey");
            }
            out.append("];\n");

            if (node != TreeStore.ROOT) {
                int start = store.edgeStart(node);
                int end = store.edgeEnd(node) + 1;
                out.append("  n").append(String.valueOf(store.parent(node)))
                        .append(" -> n").append(String.valueOf(node))
                        .append(" [label=\"").append(escape(tree.renderSymbols(text, start, end))).append("\"];\n");
            }
        }

        if (suffixLinks) {
            for (int node : tree.depthFirst()) {
                if (node == TreeStore.ROOT || store.isLeaf(node)) {
                    continue;
                }
                int link = store.getSuffixLink(node);
                if (link != TreeStore.NO_NODE) {
                    out.append("  n").append(String.valueOf(node))
                            .append(" -> n").append(String.valueOf(link))
                            .append(" [style=dashed, color=lightgreen];\n");
                }
            }
        }
        out.append("}\n");
    }

    private static String escape(String label) {
        StringBuilder sb = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
