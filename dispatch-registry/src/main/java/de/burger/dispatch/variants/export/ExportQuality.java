package de.burger.dispatch.variants.export;

import de.burger.dispatch.registry.TypeRegistry;

import java.util.function.Supplier;

/** Export quality presets and the registry that maps their keys to exporter factories. */
public enum ExportQuality implements ExporterFactory {
    /** High speed, lower quality. */
    LOW("low", H264BaselineVideoExporter::new, AacAudioExporter::new),
    /** Slower, high quality. */
    HIGH("high", H264Hi422VideoExporter::new, AacAudioExporter::new),
    /** High speed, high quality. */
    MASTER("master", LosslessVideoExporter::new, WavAudioExporter::new);

    private final String key;
    private final Supplier<VideoExporter> video;
    private final Supplier<AudioExporter> audio;

    ExportQuality(String key, Supplier<VideoExporter> video, Supplier<AudioExporter> audio) {
        this.key = key;
        this.video = video;
        this.audio = audio;
    }

    public String key() {
        return key;
    }

    @Override
    public VideoExporter videoExporter() {
        return video.get();
    }

    @Override
    public AudioExporter audioExporter() {
        return audio.get();
    }

    public static TypeRegistry<ExporterFactory> registry() {
        TypeRegistry<ExporterFactory> registry = new TypeRegistry<>();
        for (ExportQuality quality : values()) {
            registry.register(quality.key(), () -> quality);
        }
        return registry;
    }
}
