package im.arun.printtree.render;

import im.arun.printtree.model.Tree;
import im.arun.printtree.ordinal.PlaceholderSubstitution;
import im.arun.printtree.style.Scaffolding;

import java.util.List;
import java.util.Objects;

/**
 * Lays a tree out line by line with one scaffolding.
 *
 * <p>Every line of a branch label becomes one output line. The first line gets the label prefix
 * (the branch glyph or bullet), the remaining lines get the flow prefix, which is also the
 * padding the branch hands down to its own branches. Branches directly under the rendered node
 * have no prefix at all.
 */
public class TreeRenderer {
    private final Scaffolding scaffolding;

    public TreeRenderer(Scaffolding scaffolding) {
        this.scaffolding = Objects.requireNonNull(scaffolding, "scaffolding");
    }

    public String render(Tree tree) {
        StringBuilder out = new StringBuilder();
        render(tree, out, 0, "");
        return out.toString();
    }

    private void render(Tree tree, StringBuilder out, int depth, String padding) {
        List<Tree> branches = tree.getBranches();
        for (int index = 0; index < branches.size(); index++) {
            Tree branch = branches.get(index);
            boolean last = index == branches.size() - 1;
            String flow = padding + flowPadding(depth, last);

            String[] lines = branch.getLabel().split("\n", -1);
            for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
                String prefix = lineIndex == 0 ? padding + labelPadding(depth, index, last) : flow;
                out.append(prefix).append(lines[lineIndex]).append('\n');
            }

            render(branch, out, depth + 1, flow);
        }
    }

    String labelPadding(int depth, int index, boolean last) {
        if (depth == 0) {
            return "";
        }
        if (scaffolding.isList()) {
            return PlaceholderSubstitution.expand(scaffolding.templateForDepth(depth), index + 1);
        }
        return last ? scaffolding.lastBranch() : scaffolding.midBranch();
    }

    String flowPadding(int depth, boolean last) {
        if (depth == 0) {
            return "";
        }
        if (scaffolding.isList()) {
            return scaffolding.indent();
        }
        return last ? scaffolding.noBranch() : scaffolding.bypassBranch();
    }
}
