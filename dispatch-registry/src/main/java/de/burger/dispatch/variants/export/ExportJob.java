package de.burger.dispatch.variants.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Runs a video and an audio export with the exporters of one factory. */
public final class ExportJob {
    private static final Logger LOG = LoggerFactory.getLogger(ExportJob.class);

    private final ExporterFactory factory;

    public ExportJob(ExporterFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /** Prepares both streams, then exports both; returns the performed steps in order. */
    public List<String> run(String videoData, String audioData, Path folder) {
        VideoExporter video = factory.videoExporter();
        AudioExporter audio = factory.audioExporter();

        List<String> steps = new ArrayList<>(4);
        steps.add(video.prepare(videoData));
        steps.add(audio.prepare(audioData));
        steps.add(video.export(folder));
        steps.add(audio.export(folder));
        steps.forEach(LOG::info);
        return List.copyOf(steps);
    }
}
