package de.burger.dispatch.variants.export;

/**
 * Pairs a video and an audio codec. Every call returns a new exporter; the factory keeps no
 * reference to what it created.
 */
public interface ExporterFactory {
    VideoExporter videoExporter();

    AudioExporter audioExporter();
}
