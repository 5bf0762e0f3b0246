package im.arun.printtree.style;

import lombok.Value;

/**
 * Identifier of a style in a {@link StyleRegistry}. Builtin styles keep the ids listed in
 * {@link BuiltinStyle}; custom styles get the next free id when they are registered.
 */
@Value(staticConstructor = "of")
public class TreeStyle {
    int id;

    public static final TreeStyle ASCII = BuiltinStyle.ASCII.style();
    public static final TreeStyle BOX = BuiltinStyle.BOX.style();
    public static final TreeStyle BOX_BOLD = BuiltinStyle.BOX_BOLD.style();
    public static final TreeStyle ASCII_NARROW = BuiltinStyle.ASCII_NARROW.style();
    public static final TreeStyle BOX_NARROW = BuiltinStyle.BOX_NARROW.style();
    public static final TreeStyle BOX_BOLD_NARROW = BuiltinStyle.BOX_BOLD_NARROW.style();
    public static final TreeStyle WHITE_SPACE = BuiltinStyle.WHITE_SPACE.style();
    public static final TreeStyle ASCII_BULLET = BuiltinStyle.ASCII_BULLET.style();
    public static final TreeStyle BULLET = BuiltinStyle.BULLET.style();
    public static final TreeStyle ORDERED = BuiltinStyle.ORDERED.style();
    public static final TreeStyle NUMBER = BuiltinStyle.NUMBER.style();
    public static final TreeStyle ALPHA = BuiltinStyle.ALPHA.style();
    public static final TreeStyle ALPHA_UC = BuiltinStyle.ALPHA_UC.style();
    public static final TreeStyle ROMAN = BuiltinStyle.ROMAN.style();
    public static final TreeStyle ROMAN_UC = BuiltinStyle.ROMAN_UC.style();

    /** Used by {@code Tree.print()} and for ids the registry does not know. */
    public static final TreeStyle DEFAULT = BOX;
}
