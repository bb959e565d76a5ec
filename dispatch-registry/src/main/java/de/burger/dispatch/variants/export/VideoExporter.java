package de.burger.dispatch.variants.export;

/** Video codec. */
public interface VideoExporter extends MediaExporter {
}
