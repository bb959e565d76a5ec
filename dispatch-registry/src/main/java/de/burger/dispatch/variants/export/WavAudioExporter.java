package de.burger.dispatch.variants.export;

/** Lossless WAV audio. */
public final class WavAudioExporter extends CodecExporter implements AudioExporter {
    public WavAudioExporter() {
        super("audio", "WAV");
    }
}
