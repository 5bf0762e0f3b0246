package im.arun.printtree.ordinal;

import java.util.Locale;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Placeholder characters recognized in list templates. Declaration order is the detection
 * priority: the first marker whose character appears anywhere in a template governs it.
 */
public enum OrdinalMarker {
    DECIMAL('1', OrdinalConverter::toDecimal),
    ALPHA('a', OrdinalConverter::toAlpha),
    ALPHA_UPPER('A', n -> OrdinalConverter.toAlpha(n).toUpperCase(Locale.ROOT)),
    ROMAN('i', OrdinalConverter::toRoman),
    ROMAN_UPPER('I', n -> OrdinalConverter.toRoman(n).toUpperCase(Locale.ROOT));

    private final char placeholder;
    private final IntFunction<String> converter;

    OrdinalMarker(char placeholder, IntFunction<String> converter) {
        this.placeholder = placeholder;
        this.converter = converter;
    }

    public char getPlaceholder() {
        return placeholder;
    }

    public String convert(int position) {
        return converter.apply(position);
    }

    /**
     * Finds the marker governing a template, if any.
     */
    public static Optional<OrdinalMarker> detect(String template) {
        for (OrdinalMarker marker : values()) {
            if (template.indexOf(marker.placeholder) >= 0) {
                return Optional.of(marker);
            }
        }
        return Optional.empty();
    }
}
