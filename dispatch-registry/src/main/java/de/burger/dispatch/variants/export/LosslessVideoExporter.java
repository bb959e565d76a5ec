package de.burger.dispatch.variants.export;

/** Lossless video codec. */
public final class LosslessVideoExporter extends CodecExporter implements VideoExporter {
    public LosslessVideoExporter() {
        super("video", "lossless");
    }
}
