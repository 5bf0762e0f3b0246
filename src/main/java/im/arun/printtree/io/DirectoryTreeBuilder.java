package im.arun.printtree.io;

import im.arun.printtree.model.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Builds a tree that mirrors a directory on disk. The directory itself becomes the single top
 * level branch, its entries are added in file name order and directories are walked recursively.
 * Symbolic links show up as leaves.
 */
public class DirectoryTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryTreeBuilder.class);

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private final boolean showHidden;
    private final boolean showSizes;

    public DirectoryTreeBuilder() {
        this(false, false);
    }

    /**
     * @param showHidden include entries whose name starts with a dot
     * @param showSizes  label files as {@code name (size)}
     */
    public DirectoryTreeBuilder(boolean showHidden, boolean showSizes) {
        this.showHidden = showHidden;
        this.showSizes = showSizes;
    }

    /**
     * @throws IOException if {@code directory} is not a readable directory
     */
    public Tree build(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }

        Tree tree = Tree.newTree();
        Tree top = tree.addBranch(directory.toString());
        addEntries(top, directory, true);
        return tree;
    }

    private void addEntries(Tree parent, Path directory, boolean failOnError) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException e) {
            if (failOnError) {
                throw e;
            }
            logger.warn("Unable to read directory {}: {}", directory, e.getMessage());
            return;
        }
        entries.sort(Comparator.comparing(entry -> entry.getFileName().toString()));

        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (!showHidden && name.startsWith(".")) {
                continue;
            }

            // symlinks are listed as leaves, never followed
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                addEntries(parent.addBranch(name), entry, false);
            } else if (showSizes) {
                parent.addBranchFormatted("%s (%s)", name, formatSize(sizeOf(entry)));
            } else {
                parent.addBranch(name);
            }
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            logger.warn("Unable to read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }

    /**
     * Human readable size with 1024 steps, e.g. 512 -> "512 B", 2048 -> "2.0 KB".
     */
    static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < SIZE_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, SIZE_UNITS[unit]);
    }
}
