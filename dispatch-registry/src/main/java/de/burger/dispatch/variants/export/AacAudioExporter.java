package de.burger.dispatch.variants.export;

public final class AacAudioExporter extends CodecExporter implements AudioExporter {
    public AacAudioExporter() {
        super("audio", "AAC");
    }
}
