package io.yamlschema.core.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Common shape of the schema and validation error trees: a node carries a breadcrumb and is either
 * a leaf with a message or an aggregate of sibling errors.
 *
 * <p>
 * Rendering walks the tree depth-first. An aggregate appends its own breadcrumb to the prefix
 * accumulated so far and recurses; a leaf emits one line {@code <prefix><breadcrumb>: <message>}.
 * The prefix starts as {@code #}.
 */
public interface PathError {

    /** Path of this node relative to its parent aggregate (or to the root). */
    Breadcrumb breadcrumb();

    /** Sibling errors if this node is an aggregate, otherwise an empty list. */
    List<? extends PathError> children();

    /** Human-readable description of a leaf. */
    String message();

    default boolean isAggregate() {
        return !children().isEmpty();
    }

    /** Renders the whole tree, one newline-terminated line per leaf. */
    default String render() {
        StringBuilder out = new StringBuilder();
        flatten(out, "#");
        return out.toString();
    }

    /** Returns the rendered lines without their trailing newlines. */
    default List<String> lines() {
        List<String> lines = new ArrayList<>();
        collect(lines, "#");
        return lines;
    }

    /** Number of leaf errors in this tree. */
    default int leafCount() {
        if (!isAggregate()) {
            return 1;
        }
        int count = 0;
        for (PathError child : children()) {
            count += child.leafCount();
        }
        return count;
    }

    private void flatten(StringBuilder out, String root) {
        List<String> lines = new ArrayList<>();
        collect(lines, root);
        for (String line : lines) {
            out.append(line).append('\n');
        }
    }

    private void collect(List<String> lines, String root) {
        String prefix = root + breadcrumb().render();
        if (isAggregate()) {
            for (PathError child : children()) {
                child.collect(lines, prefix);
            }
        } else {
            lines.add(prefix + ": " + message());
        }
    }
}
