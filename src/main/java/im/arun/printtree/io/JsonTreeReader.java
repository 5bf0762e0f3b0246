package im.arun.printtree.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.printtree.model.Tree;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Reads a tree from JSON.
 *
 * <p>An object with a {@code label} becomes a branch and its {@code branches} array its children.
 * An object without a label stands for a root, its branches are spliced into the parent. An array
 * is a list of siblings and a scalar is a leaf labeled with its text:
 * <pre>
 * {"label": "Fruit", "branches": ["Lemon", {"label": "Orange", "branches": ["Mandarin"]}]}
 * </pre>
 */
public class JsonTreeReader {
    static final String LABEL = "label";
    static final String BRANCHES = "branches";

    private final ObjectMapper objectMapper;

    public JsonTreeReader() {
        this.objectMapper = new ObjectMapper();
    }

    public Tree read(Path path) throws IOException {
        return toTree(objectMapper.readTree(path.toFile()));
    }

    public Tree read(InputStream in) throws IOException {
        return toTree(objectMapper.readTree(in));
    }

    public Tree read(String json) throws IOException {
        return toTree(objectMapper.readTree(json));
    }

    private Tree toTree(JsonNode node) throws IOException {
        Tree tree = Tree.newTree();
        if (node != null && !node.isMissingNode()) {
            addNode(tree, node);
        }
        return tree;
    }

    private void addNode(Tree parent, JsonNode node) throws IOException {
        if (node.isArray()) {
            for (JsonNode element : node) {
                addNode(parent, element);
            }
        } else if (node.isObject()) {
            JsonNode label = node.get(LABEL);
            Tree target = parent;
            if (label != null && !label.isNull()) {
                if (!label.isValueNode()) {
                    throw new IOException("Field '" + LABEL + "' must be a string, got " + label.getNodeType());
                }
                target = parent.addBranch(label.asText());
            }

            JsonNode branches = node.get(BRANCHES);
            if (branches != null && !branches.isNull()) {
                addNode(target, branches);
            }
        } else if (!node.isNull()) {
            parent.addBranch(node.asText());
        }
    }
}
