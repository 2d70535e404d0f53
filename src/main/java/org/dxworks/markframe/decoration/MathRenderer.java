package org.dxworks.markframe.decoration;

/**
 * Renders an inline formula to HTML for display next to its hidden source.
 * Implementations live outside the core, typically wrapping a TeX engine.
 */
@FunctionalInterface
public interface MathRenderer {

    /**
     * @param formula the formula text between the {@code $} delimiters
     * @return the rendered HTML; an empty string when nothing should be shown
     */
    String renderInline(String formula);
}
