package com.example.brd.model;

/**
 * Per-section hints for the renderer. Only an explicit {@code false} in the
 * sections JSON switches a hint off.
 *
 * @param includeReferences whether extra reference blocks are rendered for the section
 * @param includeQuotes     whether evidence quotes are rendered for the section
 */
public record RenderingHints(boolean includeReferences, boolean includeQuotes) {

    public static final RenderingHints DEFAULT = new RenderingHints(true, true);
}
