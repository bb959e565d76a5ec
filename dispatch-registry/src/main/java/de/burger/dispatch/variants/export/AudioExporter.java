package de.burger.dispatch.variants.export;

/** Audio codec. */
public interface AudioExporter extends MediaExporter {
}
