package im.arun.printtree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrintTreeConfig {

    public enum SortMode {
        NONE, SHALLOW, DEEP
    }

    private String style = "BOX";

    @JsonProperty("show_hidden")
    private boolean showHidden = false;

    @JsonProperty("show_sizes")
    private boolean showSizes = false;

    private SortMode sort = SortMode.NONE;

    @JsonProperty("path_separator")
    private String pathSeparator = "/";

    private List<StyleDefinition> styles = new ArrayList<>();
}
