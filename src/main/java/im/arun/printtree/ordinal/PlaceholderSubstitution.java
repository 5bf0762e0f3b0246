package im.arun.printtree.ordinal;

/**
 * Expands list templates such as {@code " 1. "} or {@code "( i)"} into the bullet for a given
 * sibling position.
 *
 * <p>The placeholder and the run of spaces directly to its left form the field. The value is
 * right aligned inside that field, so spaces on the left are consumed before the template grows.
 * A value wider than the field is never truncated and pushes the rest of the template right:
 * <pre>
 *    ( 9)       ( x)       ( i)
 *    (98)       (xx)       (ii)
 *    (987)      (xxx)      (iii)
 * </pre>
 */
public final class PlaceholderSubstitution {

    private PlaceholderSubstitution() {
    }

    /**
     * Replaces the first occurrence of {@code placeholder}, together with the spaces directly left
     * of it, by {@code value} padded on the left to the width of the replaced span.
     */
    public static String substitute(String template, char placeholder, String value) {
        int end = template.indexOf(placeholder);
        if (end < 0) {
            return template;
        }

        int start = end;
        while (start > 0 && template.charAt(start - 1) == ' ') {
            start--;
        }
        end++;

        int width = end - start;
        StringBuilder sb = new StringBuilder(template.length() + value.length());
        sb.append(template, 0, start);
        for (int i = value.length(); i < width; i++) {
            sb.append(' ');
        }
        sb.append(value);
        sb.append(template, end, template.length());
        return sb.toString();
    }

    /**
     * Expands a template for the sibling at the given 1-based position. Templates without a
     * recognized placeholder are static bullets and come back unchanged.
     */
    public static String expand(String template, int position) {
        return OrdinalMarker.detect(template)
            .map(marker -> substitute(template, marker.getPlaceholder(), marker.convert(position)))
            .orElse(template);
    }
}
