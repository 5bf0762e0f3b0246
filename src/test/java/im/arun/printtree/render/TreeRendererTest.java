package im.arun.printtree.render;

import im.arun.printtree.model.Tree;
import im.arun.printtree.style.StyleRegistry;
import im.arun.printtree.style.TreeStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class TreeRendererTest {

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void rootBranchesHaveNoMarkup() {
        Tree tree = Tree.newTree();
        tree.addBranches("1", "2", "3");

        assertThat(tree.print(TreeStyle.ASCII)).isEqualTo("1\n2\n3\n");
    }

    @Test
    void emptyTreeRendersNothing() {
        assertThat(Tree.newTree().print()).isEmpty();
    }

    @Test
    void children() {
        Tree tree = Tree.newTree();
        tree.addBranch("1").addBranches("a", "b");

        assertThat(tree.print(TreeStyle.ASCII)).isEqualTo(lines(
            "1",
            "|-- a",
            "'-- b"));
    }

    @Test
    void grandChildren() {
        Tree tree = Tree.newTree();
        tree.addBranch("1").addBranch("a").addBranches("i", "ii");

        assertThat(tree.print(TreeStyle.ASCII)).isEqualTo(lines(
            "1",
            "'-- a",
            "    |-- i",
            "    '-- ii"));
    }

    @Test
    void multipleRoots() {
        Tree tree = Tree.newTree();
        tree.addBranch("1").addBranches("a", "b");
        tree.addBranch("2").addBranches("a", "b");

        assertThat(tree.print(TreeStyle.ASCII)).isEqualTo(lines(
            "1",
            "|-- a",
            "'-- b",
            "2",
            "|-- a",
            "'-- b"));
    }

    @Test
    void nephews() {
        Tree tree = Tree.newTree();
        Tree root = tree.addBranch("1");
        root.addBranch("a").addBranches("i", "ii");
        root.addBranch("b").addBranches("i", "ii");

        assertThat(tree.print(TreeStyle.ASCII)).isEqualTo(lines(
            "1",
            "|-- a",
            "|   |-- i",
            "|   '-- ii",
            "'-- b",
            "    |-- i",
            "    '-- ii"));
    }

    @Test
    void multilineLabelsUseFlowPadding() {
        Tree tree = Tree.newTree();
        Tree root = tree.addBranch("1");
        root.addBranch("a\nalfa\nalpha\nable");
        root.addBranch("b");

        assertThat(tree.print(TreeStyle.ASCII)).isEqualTo(lines(
            "1",
            "|-- a",
            "|   alfa",
            "|   alpha",
            "|   able",
            "'-- b"));
    }

    @Test
    void defaultStyleIsBox() {
        Tree tree = Tree.newTree();
        Tree fruit = tree.addBranch("Fruit");
        fruit.addBranch("Lemon");
        fruit.addBranch("Orange").addBranch("Mandarin");
        fruit.addBranch("Lime");

        assertThat(tree.print()).isEqualTo(lines(
            "Fruit",
            "├── Lemon",
            "├── Orange",
            "│   ╰── Mandarin",
            "╰── Lime"));
    }

    @Test
    void formattedLabelsKeepTheirAlignment() {
        Tree tree = Tree.newTree();
        Tree users = tree.addBranch("/Users (disk space)");
        users.addBranchFormatted("%-12s (%6dMB)", "lister", 12);
        users.addBranchFormatted("%-12s (%6dMB)", "kryten", 167);
        users.addBranchFormatted("%-12s (%6dMB)", "rimmer", 876252);

        assertThat(tree.print()).isEqualTo(lines(
            "/Users (disk space)",
            "├── lister       (    12MB)",
            "├── kryten       (   167MB)",
            "╰── rimmer       (876252MB)"));
    }

    private static Tree minimal() {
        Tree tree = Tree.newTree();
        Tree root = tree.addBranch("1");
        root.addBranch("a").addBranch("i");
        root.addBranch("b\nB");
        return tree;
    }

    static Stream<Arguments> structuralStyles() {
        return Stream.of(
            Arguments.of(TreeStyle.ASCII, lines("1", "|-- a", "|   '-- i", "'-- b", "    B")),
            Arguments.of(TreeStyle.BOX, lines("1", "├── a", "│   ╰── i", "╰── b", "    B")),
            Arguments.of(TreeStyle.BOX_BOLD, lines("1", "┣━━ a", "┃   ┗━━ i", "┗━━ b", "    B")),
            Arguments.of(TreeStyle.ASCII_NARROW, lines("1", "|-a", "| '-i", "'-b", "  B")),
            Arguments.of(TreeStyle.BOX_NARROW, lines("1", "├ a", "│ ╰ i", "╰ b", "  B")),
            Arguments.of(TreeStyle.BOX_BOLD_NARROW, lines("1", "┣ a", "┃ ┗ i", "┗ b", "  B"))
        );
    }

    @ParameterizedTest
    @MethodSource("structuralStyles")
    void structuralStyles(TreeStyle style, String expected) {
        assertThat(minimal().print(style)).isEqualTo(expected);
    }

    @Test
    void unknownStyleFallsBackToBox() {
        assertThat(minimal().print(TreeStyle.of(999999))).isEqualTo(minimal().print(TreeStyle.BOX));
        assertThat(minimal().print(TreeStyle.of(-3))).isEqualTo(minimal().print(TreeStyle.BOX));
    }

    private static Tree monitors() {
        Tree tree = Tree.newTree();
        Tree root = tree.addBranch("Monitors");
        Tree mono = root.addBranch("Monochrome");
        mono.addBranch("Old School").addBranches("black", "green");
        mono.addBranch("Contemporary").addBranches("black", "white");
        root.addBranch("Color").addBranches("red", "green", "blue");
        return tree;
    }

    static Stream<Arguments> listStyles() {
        return Stream.of(
            Arguments.of(TreeStyle.WHITE_SPACE, lines(
                "Monitors",
                "    Monochrome",
                "        Old School",
                "            black",
                "            green",
                "        Contemporary",
                "            black",
                "            white",
                "    Color",
                "        red",
                "        green",
                "        blue")),
            Arguments.of(TreeStyle.ASCII_BULLET, lines(
                "Monitors",
                "* Monochrome",
                "  + Old School",
                "    - black",
                "    - green",
                "  + Contemporary",
                "    - black",
                "    - white",
                "* Color",
                "  + red",
                "  + green",
                "  + blue")),
            Arguments.of(TreeStyle.BULLET, lines(
                "Monitors",
                "● Monochrome",
                "  ○ Old School",
                "    ■ black",
                "    ■ green",
                "  ○ Contemporary",
                "    ■ black",
                "    ■ white",
                "● Color",
                "  ○ red",
                "  ○ green",
                "  ○ blue")),
            Arguments.of(TreeStyle.ORDERED, lines(
                "Monitors",
                " 1. Monochrome",
                "     a. Old School",
                "         i. black",
                "        ii. green",
                "     b. Contemporary",
                "         i. black",
                "        ii. white",
                " 2. Color",
                "     a. red",
                "     b. green",
                "     c. blue")),
            Arguments.of(TreeStyle.NUMBER, lines(
                "Monitors",
                " 1. Monochrome",
                "     1. Old School",
                "         1. black",
                "         2. green",
                "     2. Contemporary",
                "         1. black",
                "         2. white",
                " 2. Color",
                "     1. red",
                "     2. green",
                "     3. blue")),
            Arguments.of(TreeStyle.ALPHA, lines(
                "Monitors",
                " a. Monochrome",
                "     a. Old School",
                "         a. black",
                "         b. green",
                "     b. Contemporary",
                "         a. black",
                "         b. white",
                " b. Color",
                "     a. red",
                "     b. green",
                "     c. blue")),
            Arguments.of(TreeStyle.ALPHA_UC, lines(
                "Monitors",
                " A. Monochrome",
                "     A. Old School",
                "         A. black",
                "         B. green",
                "     B. Contemporary",
                "         A. black",
                "         B. white",
                " B. Color",
                "     A. red",
                "     B. green",
                "     C. blue")),
            Arguments.of(TreeStyle.ROMAN, lines(
                "Monitors",
                "   i. Monochrome",
                "         i. Old School",
                "               i. black",
                "              ii. green",
                "        ii. Contemporary",
                "               i. black",
                "              ii. white",
                "  ii. Color",
                "         i. red",
                "        ii. green",
                "       iii. blue")),
            Arguments.of(TreeStyle.ROMAN_UC, lines(
                "Monitors",
                "   I. Monochrome",
                "         I. Old School",
                "               I. black",
                "              II. green",
                "        II. Contemporary",
                "               I. black",
                "              II. white",
                "  II. Color",
                "         I. red",
                "        II. green",
                "       III. blue"))
        );
    }

    @ParameterizedTest
    @MethodSource("listStyles")
    void listStyles(TreeStyle style, String expected) {
        assertThat(monitors().print(style)).isEqualTo(expected);
    }

    @Test
    void toStringIsWhiteSpaceStyle() {
        assertThat(monitors().toString()).isEqualTo(monitors().print(TreeStyle.WHITE_SPACE));
    }

    @Test
    void bulletsCycleWithDepth() {
        Tree tree = Tree.newTree();
        tree.addBranch("One")
            .addBranch("Two")
            .addBranch("Three")
            .addBranch("Four")
            .addBranch("Five")
            .addBranch("Six");

        assertThat(tree.print(TreeStyle.ASCII_BULLET)).isEqualTo(lines(
            "One",
            "* Two",
            "  + Three",
            "    - Four",
            "      * Five",
            "        + Six"));
    }

    @Test
    void complexTree() {
        Tree tree = Tree.newTree();
        Tree vda = tree.addBranch("vda");
        var children = vda.addBranches("api", "clair", "engine-run-test", "errors.go", "go-config");
        children.get(0).addBranches("auth.go", "engine.go", "graphql.go");
        children.get(1).addBranch("api").addBranch("v1").addBranches("models.go", "readme.md");
        children.get(2).addBranch("engine-run.go");
        children.get(4).addBranches("config.go", "config_test.go", "testdata").get(2)
            .addBranches("config_test.json", "config_test.yaml");

        assertThat(tree.print(TreeStyle.ASCII)).isEqualTo(lines(
            "vda",
            "|-- api",
            "|   |-- auth.go",
            "|   |-- engine.go",
            "|   '-- graphql.go",
            "|-- clair",
            "|   '-- api",
            "|       '-- v1",
            "|           |-- models.go",
            "|           '-- readme.md",
            "|-- engine-run-test",
            "|   '-- engine-run.go",
            "|-- errors.go",
            "'-- go-config",
            "    |-- config.go",
            "    |-- config_test.go",
            "    '-- testdata",
            "        |-- config_test.json",
            "        '-- config_test.yaml"));

        assertThat(tree.print(TreeStyle.ORDERED)).isEqualTo(lines(
            "vda",
            " 1. api",
            "     a. auth.go",
            "     b. engine.go",
            "     c. graphql.go",
            " 2. clair",
            "     a. api",
            "         i. v1",
            "             A. models.go",
            "             B. readme.md",
            " 3. engine-run-test",
            "     a. engine-run.go",
            " 4. errors.go",
            " 5. go-config",
            "     a. config.go",
            "     b. config_test.go",
            "     c. testdata",
            "         i. config_test.json",
            "        ii. config_test.yaml"));
    }

    @Test
    void customStructuralStyle() {
        StyleRegistry registry = new StyleRegistry();
        TreeStyle style = registry.registerStructuralStyle(">- ", "*- ", "}  ", "...");
        Tree tree = Tree.newTree();
        Tree mom = tree.addBranch("Mom");
        mom.addBranch("Myself").addBranch("Child");
        mom.addBranch("Sister\nBrother");

        assertThat(tree.print(style, registry)).isEqualTo(lines(
            "Mom",
            ">- Myself",
            "}  *- Child",
            "*- Sister",
            "...Brother"));
    }

    @Test
    void customListStyle() {
        StyleRegistry registry = new StyleRegistry();
        TreeStyle style = registry.registerListStyle("   ", "(1)", "(•)", "(i)");
        Tree tree = Tree.newTree();
        Tree mom = tree.addBranch("Mom");
        mom.addBranch("Myself").addBranches("Child1", "Child2");
        mom.addBranch("Sister\nBrother");

        assertThat(tree.print(style, registry)).isEqualTo(lines(
            "Mom",
            "(1)Myself",
            "   (•)Child1",
            "   (•)Child2",
            "(2)Sister",
            "   Brother"));
    }

    @Test
    void numbersGrowIntoTheSpacesOnTheirLeft() {
        StyleRegistry registry = new StyleRegistry();
        TreeStyle style = registry.registerListStyle("  ", "( 1) ");
        Tree tree = Tree.newTree();
        Tree top = tree.addBranch("top");
        for (int i = 1; i <= 100; i++) {
            top.addBranch("item");
        }

        String[] rendered = tree.print(style, registry).split("\n");

        assertThat(rendered[1]).isEqualTo("( 1) item");
        assertThat(rendered[10]).isEqualTo("(10) item");
        assertThat(rendered[100]).isEqualTo("(100) item");
    }

    @Test
    void fourthLevelReusesFirstTemplate() {
        StyleRegistry registry = new StyleRegistry();
        TreeStyle style = registry.registerListStyle("  ", "1. ", "a. ", "i. ");
        Tree tree = Tree.newTree();
        tree.addBranch("root").addBranch("one").addBranch("two").addBranch("three").addBranch("four");

        assertThat(tree.depth()).isEqualTo(5);
        assertThat(tree.print(style, registry)).isEqualTo(lines(
            "root",
            "1. one",
            "  a. two",
            "    i. three",
            "      1. four"));
    }

    @Test
    void renderingIsRepeatable() {
        Tree tree = monitors();

        assertThat(tree.print(TreeStyle.ORDERED)).isEqualTo(tree.print(TreeStyle.ORDERED));
    }

    @Test
    void prefixesAtTopLevelAreEmpty() {
        TreeRenderer renderer = new TreeRenderer(new StyleRegistry().resolve(TreeStyle.ORDERED));

        assertThat(renderer.labelPadding(0, 4, true)).isEmpty();
        assertThat(renderer.flowPadding(0, false)).isEmpty();
        assertThat(renderer.labelPadding(1, 4, false)).isEqualTo(" 5. ");
        assertThat(renderer.flowPadding(1, true)).isEqualTo("    ");
    }
}
