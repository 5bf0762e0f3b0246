package im.arun.printtree.style;

import java.util.Locale;
import java.util.Optional;

/**
 * Styles every {@link StyleRegistry} starts with. The ordinal of each constant is its style id,
 * so new constants may only ever be appended.
 */
public enum BuiltinStyle {
    ASCII(Scaffolding.structural("|-- ", "'-- ", "|   ", "    ")),
    BOX(Scaffolding.structural("├── ", "╰── ", "│   ", "    ")),
    BOX_BOLD(Scaffolding.structural("┣━━ ", "┗━━ ", "┃   ", "    ")),
    ASCII_NARROW(Scaffolding.structural("|-", "'-", "| ", "  ")),
    BOX_NARROW(Scaffolding.structural("├ ", "╰ ", "│ ", "  ")),
    BOX_BOLD_NARROW(Scaffolding.structural("┣ ", "┗ ", "┃ ", "  ")),
    WHITE_SPACE(Scaffolding.list("    ", "    ")),
    ASCII_BULLET(Scaffolding.list("  ", "* ", "+ ", "- ")),
    BULLET(Scaffolding.list("  ", "● ", "○ ", "■ ", "□ ")),
    ORDERED(Scaffolding.list("    ", " 1. ", " a. ", " i. ", " A. ", " I. ")),
    NUMBER(Scaffolding.list("    ", " 1. ")),
    ALPHA(Scaffolding.list("    ", " a. ")),
    ALPHA_UC(Scaffolding.list("    ", " A. ")),
    ROMAN(Scaffolding.list("      ", "   i. ")),
    ROMAN_UC(Scaffolding.list("      ", "   I. "));

    private final Scaffolding scaffolding;

    BuiltinStyle(Scaffolding scaffolding) {
        this.scaffolding = scaffolding;
    }

    public Scaffolding scaffolding() {
        return scaffolding;
    }

    public TreeStyle style() {
        return TreeStyle.of(ordinal());
    }

    /**
     * Looks a builtin style up by name, ignoring case, dashes and underscores, so {@code box-bold},
     * {@code BOX_BOLD} and {@code BoxBold} all match.
     */
    public static Optional<BuiltinStyle> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = normalize(name);
        for (BuiltinStyle style : values()) {
            if (normalize(style.name()).equals(wanted)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }

    static String normalize(String name) {
        return name.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
    }
}
