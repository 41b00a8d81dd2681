package com.hexarchitect.core.registry;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Contributes the entries of a manifest file.
 *
 * <p>The manifest is read on every {@link #contribute(ComponentRegistry)} call, so a rebuild
 * picks up changes made to the file since the previous one.
 */
public class ManifestContributor implements ComponentContributor {

    private final Path manifestPath;

    public ManifestContributor(Path manifestPath) {
        this.manifestPath = Objects.requireNonNull(manifestPath, "manifestPath must not be null");
    }

    @Override
    public String getId() {
        return "manifest:" + manifestPath.getFileName();
    }

    @Override
    public void contribute(ComponentRegistry registry) {
        registry.registerAll(ManifestLoader.load(manifestPath));
    }
}
