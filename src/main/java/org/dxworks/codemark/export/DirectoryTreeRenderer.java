package org.dxworks.codemark.export;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Draws the exported files as an indented tree, directories first, each level sorted by name.
 */
public class DirectoryTreeRenderer {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE = "│   ";
    private static final String SPACE = "    ";

    public String render(String rootName, List<String> relativePaths) {
        Node root = new Node();
        for (String path : relativePaths) {
            Node current = root;
            String[] parts = path.split("/");
            for (int i = 0; i < parts.length; i++) {
                boolean file = i == parts.length - 1;
                Map<String, Node> siblings = file ? current.files : current.directories;
                current = siblings.computeIfAbsent(parts[i], k -> new Node());
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append(rootName).append('/').append('\n');
        renderChildren(root, "", sb);
        return sb.toString();
    }

    private void renderChildren(Node node, String prefix, StringBuilder sb) {
        int remaining = node.directories.size() + node.files.size();
        for (Map.Entry<String, Node> directory : node.directories.entrySet()) {
            remaining--;
            boolean last = remaining == 0;
            sb.append(prefix).append(last ? LAST_BRANCH : BRANCH).append(directory.getKey()).append('/').append('\n');
            renderChildren(directory.getValue(), prefix + (last ? SPACE : PIPE), sb);
        }
        for (String file : node.files.keySet()) {
            remaining--;
            sb.append(prefix).append(remaining == 0 ? LAST_BRANCH : BRANCH).append(file).append('\n');
        }
    }

    private static class Node {
        final Map<String, Node> directories = new TreeMap<>();
        final Map<String, Node> files = new TreeMap<>();
    }
}
