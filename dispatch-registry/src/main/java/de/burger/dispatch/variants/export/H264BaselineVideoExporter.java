package de.burger.dispatch.variants.export;

/** H.264 with Baseline profile. */
public final class H264BaselineVideoExporter extends CodecExporter implements VideoExporter {
    public H264BaselineVideoExporter() {
        super("video", "H.264 (Baseline)");
    }
}
