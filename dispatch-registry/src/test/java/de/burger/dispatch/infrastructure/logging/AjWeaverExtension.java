package de.burger.dispatch.infrastructure.logging;

import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * Auto-detected JUnit 5 extension (see {@code junit-platform.properties}) that installs AspectJ
 * load-time weaving when the first test class is loaded.
 */
public class AjWeaverExtension implements BeforeAllCallback {
    static {
        AjWeaverBootstrap.ensureInstalled();
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        AjWeaverBootstrap.ensureInstalled();
    }
}
