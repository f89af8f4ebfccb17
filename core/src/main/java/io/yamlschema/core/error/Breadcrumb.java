package io.yamlschema.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Path attached to an error. Segments are pushed while the error travels up the call stack, so
 * they are stored leaf-to-root and rendered in reverse.
 *
 * <p>
 * Immutable: {@link #push(BreadcrumbSegment)} returns a new breadcrumb.
 *
 * @param segments path segments in push (leaf-to-root) order
 */
public record Breadcrumb(List<BreadcrumbSegment> segments) {

    private static final Breadcrumb EMPTY = new Breadcrumb(List.of());

    public Breadcrumb {
        segments = List.copyOf(segments);
    }

    /** Returns the empty breadcrumb (the document root). */
    public static Breadcrumb empty() {
        return EMPTY;
    }

    /**
     * Builds a breadcrumb from segments given in leaf-to-root order, e.g. {@code of(name("leaf"),
     * name("items"))} renders as {@code .items.leaf}.
     */
    public static Breadcrumb of(BreadcrumbSegment... leafToRoot) {
        return new Breadcrumb(List.of(leafToRoot));
    }

    public static BreadcrumbSegment name(String name) {
        return new BreadcrumbSegment.Name(name);
    }

    public static BreadcrumbSegment index(int index) {
        return new BreadcrumbSegment.Index(index);
    }

    /** Returns a new breadcrumb with {@code segment} added on the root side. */
    public Breadcrumb push(BreadcrumbSegment segment) {
        List<BreadcrumbSegment> pushed = new ArrayList<>(segments.size() + 1);
        pushed.addAll(segments);
        pushed.add(segment);
        return new Breadcrumb(pushed);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /** Segments in display (root-to-leaf) order. */
    public List<BreadcrumbSegment> rootToLeaf() {
        List<BreadcrumbSegment> reversed = new ArrayList<>(segments);
        Collections.reverse(reversed);
        return reversed;
    }

    /** Renders the path root-to-leaf, e.g. {@code .items.something[2].field}. */
    public String render() {
        StringBuilder out = new StringBuilder();
        for (int i = segments.size() - 1; i >= 0; i--) {
            out.append(segments.get(i).render());
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
