package de.burger.dispatch.variants.export;

import java.nio.file.Path;
import java.util.Objects;

/** Describes the prepare and export steps of a single named format. Holds no per-job state. */
abstract class CodecExporter implements MediaExporter {
    private final String media;
    private final String format;

    CodecExporter(String media, String format) {
        this.media = media;
        this.format = format;
    }

    @Override
    public String prepare(String data) {
        Objects.requireNonNull(data, media + " data");
        return "Preparing " + media + " data for " + format + " export.";
    }

    @Override
    public String export(Path folder) {
        Objects.requireNonNull(folder, "folder");
        return "Exporting " + media + " data in " + format + " format to " + folder + ".";
    }
}
