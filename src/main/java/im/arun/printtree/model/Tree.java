package im.arun.printtree.model;

import im.arun.printtree.render.TreeRenderer;
import im.arun.printtree.style.StyleRegistry;
import im.arun.printtree.style.TreeStyle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A node in a printable tree. Each node owns its branches, in the order they are rendered.
 *
 * <p>A tree created with {@link #newTree()} is a root: it has no label and is never printed
 * itself, only its branches are. This allows several top level entries:
 * <pre>
 *   Tree tree = Tree.newTree();
 *   tree.addBranch("1. First").addBranch("a. Alpha");
 *   tree.addBranch("2. Second").addBranch("b. Bravo");
 * </pre>
 * prints
 * <pre>
 *   1. First
 *   ╰── a. Alpha
 *   2. Second
 *   ╰── b. Bravo
 * </pre>
 *
 * <p>Nothing stops a caller from grafting a tree into itself; rendering such a tree recurses
 * until the stack runs out. Instances are not thread safe.
 */
public class Tree {

    /**
     * Orders branches by label, comparing Unicode code points. This is the same order as comparing
     * the UTF-8 bytes, which {@link String#compareTo} does not give for characters outside the BMP.
     */
    public static final Comparator<Tree> BY_LABEL = (first, second) -> compareCodePoints(first.label, second.label);

    private final String label;
    private final boolean root;
    private final List<Tree> branches = new ArrayList<>();

    public Tree() {
        this.label = "";
        this.root = true;
    }

    private Tree(String label) {
        this.label = Objects.requireNonNull(label, "label");
        this.root = false;
    }

    public static Tree newTree() {
        return new Tree();
    }

    /**
     * Label of this branch, possibly spanning several lines. Empty for a root.
     */
    public String getLabel() {
        return label;
    }

    public boolean isRoot() {
        return root;
    }

    public List<Tree> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    /**
     * Appends a new branch and returns it.
     */
    public Tree addBranch(String label) {
        Tree branch = new Tree(label);
        branches.add(branch);
        return branch;
    }

    /**
     * Appends one branch per label, returning the new branches in the same order.
     */
    public List<Tree> addBranches(String... labels) {
        List<Tree> added = new ArrayList<>(labels.length);
        for (String branchLabel : labels) {
            added.add(addBranch(branchLabel));
        }
        return added;
    }

    /**
     * Appends a branch labeled {@code String.format(format, args)}. Format errors propagate as
     * {@link java.util.IllegalFormatException}.
     */
    public Tree addBranchFormatted(String format, Object... args) {
        return addBranch(String.format(format, args));
    }

    /**
     * Grafts another tree in. A root contributes its branches, which become siblings of the
     * existing branches; any other node is appended as a single branch.
     */
    public void addTreeAsBranch(Tree other) {
        Objects.requireNonNull(other, "other");
        if (other.isRoot()) {
            branches.addAll(new ArrayList<>(other.branches));
        } else {
            branches.add(other);
        }
    }

    /**
     * 0 for a node without branches, otherwise one more than the deepest branch.
     */
    public int depth() {
        int depth = 0;
        for (Tree branch : branches) {
            depth = Math.max(depth, 1 + branch.depth());
        }
        return depth;
    }

    public void sort() {
        sortCustom(BY_LABEL);
    }

    /**
     * Sorts every level of this tree by label.
     */
    public void deepSort() {
        deepSortCustom(BY_LABEL);
    }

    /**
     * Stable sort of the direct branches. Branches that compare equal keep their insertion order.
     */
    public void sortCustom(Comparator<? super Tree> order) {
        Objects.requireNonNull(order, "order");
        branches.sort(order);
    }

    public void deepSortCustom(Comparator<? super Tree> order) {
        sortCustom(order);
        for (Tree branch : branches) {
            branch.deepSortCustom(order);
        }
    }

    static int compareCodePoints(String first, String second) {
        int i = 0;
        int j = 0;
        while (i < first.length() && j < second.length()) {
            int a = first.codePointAt(i);
            int b = second.codePointAt(j);
            if (a != b) {
                return Integer.compare(a, b);
            }
            i += Character.charCount(a);
            j += Character.charCount(b);
        }
        return Boolean.compare(i < first.length(), j < second.length());
    }

    /**
     * Renders the tree in the default {@link TreeStyle#BOX} style.
     */
    public String print() {
        return print(TreeStyle.DEFAULT);
    }

    public String print(TreeStyle style) {
        return print(style, StyleRegistry.getDefault());
    }

    /**
     * Renders the tree with a style from the given registry. Unknown styles fall back to
     * {@link TreeStyle#DEFAULT}.
     */
    public String print(TreeStyle style, StyleRegistry registry) {
        return new TreeRenderer(registry.resolve(style)).render(this);
    }

    /**
     * The tree indented with whitespace only.
     */
    @Override
    public String toString() {
        return print(TreeStyle.WHITE_SPACE);
    }
}
