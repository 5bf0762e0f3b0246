package im.arun.printtree.util;

import im.arun.printtree.model.Tree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Helpers for building trees from flat data.
 */
public class TreeUtils {

    private TreeUtils() {
    }

    /**
     * Build a forest from delimited paths, e.g. "src/main/java" and "src/test" become
     * <pre>
     *   src
     *   ├── main
     *   │   ╰── java
     *   ╰── test
     * </pre>
     * Segments shared by several paths are added once, in the order they are first seen.
     * Empty segments (leading, trailing or doubled separators) are skipped.
     */
    public static Tree fromPaths(List<String> paths, String separator) {
        Tree root = Tree.newTree();
        if (paths == null || paths.isEmpty()) {
            return root;
        }

        // Track every node by its full path so shared prefixes resolve to the same branch
        Map<String, Tree> nodes = new HashMap<>();
        String splitter = Pattern.quote(separator);

        for (String path : paths) {
            if (path == null || path.isBlank()) {
                continue;
            }

            Tree parent = root;
            StringBuilder key = new StringBuilder();
            for (String segment : path.strip().split(splitter)) {
                if (segment.isEmpty()) {
                    continue;
                }
                key.append(separator).append(segment);

                Tree node = nodes.get(key.toString());
                if (node == null) {
                    node = parent.addBranch(segment);
                    nodes.put(key.toString(), node);
                }
                parent = node;
            }
        }

        return root;
    }

    /**
     * Every label below the given node, in pre-order.
     */
    public static List<String> labels(Tree tree) {
        List<String> labels = new ArrayList<>();
        collectLabels(tree, labels);
        return labels;
    }

    private static void collectLabels(Tree tree, List<String> labels) {
        for (Tree branch : tree.getBranches()) {
            labels.add(branch.getLabel());
            collectLabels(branch, labels);
        }
    }
}
