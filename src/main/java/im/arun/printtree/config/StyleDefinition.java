package im.arun.printtree.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.printtree.style.Scaffolding;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A custom style declared in the configuration file.
 *
 * <pre>
 * styles:
 *   - name: arrows
 *     type: structural
 *     markup: ["|>- ", " `- ", "|   ", "    "]
 *   - name: outline
 *     type: list
 *     markup: ["    ", "(1) ", "(A) ", "(I) "]
 * </pre>
 * For a list style the first markup entry is the indent and the rest are the bullet templates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StyleDefinition {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("markup")
    private List<String> markup;

    /**
     * @throws IllegalArgumentException if the type is unknown or the markup does not fit it
     */
    public Scaffolding toScaffolding() {
        if (markup == null || markup.isEmpty()) {
            throw new IllegalArgumentException("Style '" + name + "' has no markup");
        }

        if ("structural".equalsIgnoreCase(type)) {
            if (markup.size() != 4) {
                throw new IllegalArgumentException("Structural style '" + name
                    + "' needs 4 markup strings (mid, last, bypass, blank), got " + markup.size());
            }
            return Scaffolding.structural(markup.get(0), markup.get(1), markup.get(2), markup.get(3));
        }
        if ("list".equalsIgnoreCase(type)) {
            return Scaffolding.list(markup.get(0), markup.subList(1, markup.size()));
        }
        throw new IllegalArgumentException("Style '" + name + "' has unknown type: " + type);
    }
}
