package io.yamlschema.core.error;

/**
 * One step on the path from the root of a document (or schema) to the point of failure: either a
 * mapping key or a sequence index.
 */
public sealed interface BreadcrumbSegment {

    /** Renders this segment the way it appears in an error report. */
    String render();

    /** A mapping key, rendered as {@code .name}. */
    record Name(String name) implements BreadcrumbSegment {
        @Override
        public String render() {
            return "." + name;
        }
    }

    /** A sequence position, rendered as {@code [n]}. */
    record Index(int index) implements BreadcrumbSegment {
        @Override
        public String render() {
            return "[" + index + "]";
        }
    }
}
