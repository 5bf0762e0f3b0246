package im.arun.printtree.style;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps style ids to scaffolding. A registry starts with every {@link BuiltinStyle} in declaration
 * order; custom styles are appended and existing ids never change.
 *
 * <p>{@link #getDefault()} is the process wide instance used by {@code Tree.print(...)} when no
 * registry is passed. It is created on first use with only the builtin styles.
 */
public class StyleRegistry {
    private static final Logger logger = LoggerFactory.getLogger(StyleRegistry.class);

    private static final StyleRegistry DEFAULT = new StyleRegistry();

    private final List<Scaffolding> scaffoldings = new ArrayList<>();
    private final Map<String, Integer> names = new LinkedHashMap<>();
    private final Map<Integer, String> customNames = new LinkedHashMap<>();

    public StyleRegistry() {
        for (BuiltinStyle builtin : BuiltinStyle.values()) {
            scaffoldings.add(builtin.scaffolding());
            names.put(BuiltinStyle.normalize(builtin.name()), builtin.ordinal());
        }
    }

    public static StyleRegistry getDefault() {
        return DEFAULT;
    }

    /**
     * Adds a style that draws the tree structure. Best results come from markup strings that all
     * have the same width. For example {@code ">- ", "*- ", "}  ", "..."} draws
     * <pre>
     *   Mom
     *   >- Myself
     *   }  *- Child
     *   *- Sister
     *   ...Brother
     * </pre>
     *
     * @return the id to render with
     */
    public TreeStyle registerStructuralStyle(String midBranch, String lastBranch, String bypassBranch, String noBranch) {
        return register(null, Scaffolding.structural(midBranch, lastBranch, bypassBranch, noBranch));
    }

    /**
     * Adds a bulleted or numbered list style. Each template is used for one nesting level and
     * the templates repeat when the tree is deeper than the template list. A template containing
     * 1, a, A, i or I is numbered (decimal, letters, upper case letters, Roman, upper case Roman),
     * anything else is a plain bullet.
     *
     * @param indent indentation added per nesting level, also used for continuation lines
     * @return the id to render with
     * @throws IllegalArgumentException if no template is given
     */
    public TreeStyle registerListStyle(String indent, String... templates) {
        return register(null, Scaffolding.list(indent, templates));
    }

    /**
     * Adds a style under a name that {@link #resolve(String)} will find. Names may not repeat a
     * builtin name or look like a numeric id.
     */
    public TreeStyle register(String name, Scaffolding scaffolding) {
        if (name != null && BuiltinStyle.fromName(name).isPresent()) {
            throw new IllegalArgumentException("Style name clashes with a builtin style: " + name);
        }
        if (name != null && name.trim().matches("[+-]?\\d+")) {
            throw new IllegalArgumentException("Style name must not be a number: " + name);
        }

        synchronized (this) {
            scaffoldings.add(scaffolding);
            int id = scaffoldings.size() - 1;
            if (name != null) {
                names.put(BuiltinStyle.normalize(name), id);
                customNames.put(id, name);
            }
            logger.debug("Registered {} style {} as id {}", scaffolding.isList() ? "list" : "structural",
                name == null ? "(unnamed)" : name, id);
            return TreeStyle.of(id);
        }
    }

    /**
     * Scaffolding for a style. Ids outside the registry fall back to {@link TreeStyle#DEFAULT}.
     */
    public synchronized Scaffolding resolve(TreeStyle style) {
        int id = style == null ? -1 : style.getId();
        if (id < 0 || id >= scaffoldings.size()) {
            logger.debug("Unknown style id {}, using default style", id);
            return scaffoldings.get(TreeStyle.DEFAULT.getId());
        }
        return scaffoldings.get(id);
    }

    /**
     * Finds a style by builtin name, registered name or numeric id.
     */
    public synchronized Optional<TreeStyle> resolve(String nameOrId) {
        if (nameOrId == null || nameOrId.isBlank()) {
            return Optional.empty();
        }

        Integer id = names.get(BuiltinStyle.normalize(nameOrId));
        if (id != null) {
            return Optional.of(TreeStyle.of(id));
        }

        try {
            int parsed = Integer.parseInt(nameOrId.trim());
            if (parsed >= 0 && parsed < scaffoldings.size()) {
                return Optional.of(TreeStyle.of(parsed));
            }
        } catch (NumberFormatException e) {
            logger.debug("Style '{}' is neither a known name nor an id", nameOrId);
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return scaffoldings.size();
    }

    /**
     * Style names keyed by id, in id order. Unnamed custom styles are not listed.
     */
    public synchronized Map<Integer, String> names() {
        Map<Integer, String> byId = new LinkedHashMap<>();
        for (BuiltinStyle builtin : BuiltinStyle.values()) {
            byId.put(builtin.ordinal(), builtin.name());
        }
        byId.putAll(customNames);
        return Collections.unmodifiableMap(byId);
    }
}
