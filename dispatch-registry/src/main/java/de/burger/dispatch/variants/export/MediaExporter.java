package de.burger.dispatch.variants.export;

import de.burger.dispatch.capability.Capability;

import java.nio.file.Path;

/**
 * One export codec. {@link #prepare(String)} precedes {@link #export(Path)} in a job; both
 * return a human readable description of the step performed.
 */
public interface MediaExporter extends Capability<Path, String> {
    String prepare(String data);

    String export(Path folder);

    @Override
    default String perform(Path folder) {
        return export(folder);
    }
}
