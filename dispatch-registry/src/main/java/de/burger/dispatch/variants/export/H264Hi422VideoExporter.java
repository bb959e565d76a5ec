package de.burger.dispatch.variants.export;

/** H.264 with Hi422P profile (10-bit, 4:2:2 chroma sampling). */
public final class H264Hi422VideoExporter extends CodecExporter implements VideoExporter {
    public H264Hi422VideoExporter() {
        super("video", "H.264 (Hi422P)");
    }
}
