package im.arun.printtree.style;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The markup used to draw one tree style.
 *
 * <p>A structural scaffolding holds exactly four strings: mid branch, last branch, bypass and
 * blank. A list scaffolding holds the indent followed by one or more bullet templates, which are
 * cycled by nesting depth.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Scaffolding {
    private static final int MID_BRANCH = 0;
    private static final int LAST_BRANCH = 1;
    private static final int BYPASS_BRANCH = 2;
    private static final int NO_BRANCH = 3;

    private static final int INDENT = 0;
    private static final int FIRST_TEMPLATE = 1;

    boolean list;
    List<String> markup;

    public static Scaffolding structural(String midBranch, String lastBranch, String bypassBranch, String noBranch) {
        List<String> markup = List.of(
            Objects.requireNonNull(midBranch, "midBranch"),
            Objects.requireNonNull(lastBranch, "lastBranch"),
            Objects.requireNonNull(bypassBranch, "bypassBranch"),
            Objects.requireNonNull(noBranch, "noBranch"));
        return new Scaffolding(false, markup);
    }

    public static Scaffolding list(String indent, String... templates) {
        return list(indent, templates == null ? null : List.of(templates));
    }

    public static Scaffolding list(String indent, List<String> templates) {
        Objects.requireNonNull(indent, "indent");
        if (templates == null || templates.isEmpty()) {
            throw new IllegalArgumentException("A list style needs at least one bullet template");
        }

        List<String> markup = new ArrayList<>(templates.size() + 1);
        markup.add(indent);
        for (String template : templates) {
            markup.add(Objects.requireNonNull(template, "template"));
        }
        return new Scaffolding(true, List.copyOf(markup));
    }

    public String midBranch() {
        return structuralMarkup(MID_BRANCH);
    }

    public String lastBranch() {
        return structuralMarkup(LAST_BRANCH);
    }

    public String bypassBranch() {
        return structuralMarkup(BYPASS_BRANCH);
    }

    public String noBranch() {
        return structuralMarkup(NO_BRANCH);
    }

    public String indent() {
        requireList();
        return markup.get(INDENT);
    }

    public int templateCount() {
        requireList();
        return markup.size() - FIRST_TEMPLATE;
    }

    /**
     * Template for a nesting depth of 1 or more. Templates repeat once the depth passes the last one.
     */
    public String templateForDepth(int depth) {
        int offset = (depth - 1) % templateCount();
        return markup.get(FIRST_TEMPLATE + offset);
    }

    private String structuralMarkup(int index) {
        if (list) {
            throw new IllegalStateException("List scaffolding has no branch markup");
        }
        return markup.get(index);
    }

    private void requireList() {
        if (!list) {
            throw new IllegalStateException("Structural scaffolding has no list markup");
        }
    }
}
