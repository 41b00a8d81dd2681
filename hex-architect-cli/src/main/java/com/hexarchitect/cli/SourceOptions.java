package com.hexarchitect.cli;

import com.hexarchitect.core.config.ConfigLoader;
import com.hexarchitect.core.config.EngineConfig;
import com.hexarchitect.core.registry.ComponentContributor;
import com.hexarchitect.core.registry.ContributorDiscovery;
import com.hexarchitect.core.registry.ManifestContributor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by commands that build a graph: the optional manifest, the config file and
 * whether class path contributors are discovered.
 */
public class SourceOptions {

    private static final Logger log = LoggerFactory.getLogger(SourceOptions.class);

    @Parameters(index = "0", arity = "0..1", description = "Component manifest (YAML or JSON)")
    Path manifest;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    Path configFile;

    @Option(names = "--no-discovery", description = "Skip component contributors found on the class path")
    boolean noDiscovery;

    /**
     * Loads the configuration, falling back to defaults when the file is absent.
     *
     * @return engine configuration
     */
    public EngineConfig loadConfig() {
        return ConfigLoader.load(configFile == null ? Paths.get(ConfigLoader.DEFAULT_FILE_NAME) : configFile);
    }

    /**
     * Returns the contributors to run: class path contributors, then the manifest if given.
     *
     * @return contributors in execution order
     */
    public List<ComponentContributor> contributors() {
        List<ComponentContributor> contributors = new ArrayList<>();
        if (!noDiscovery) {
            contributors.addAll(ContributorDiscovery.discover());
        }
        if (manifest != null) {
            contributors.add(new ManifestContributor(manifest));
        }
        if (contributors.isEmpty()) {
            log.warn("No manifest given and no contributors discovered; the graph will be empty");
        }
        return contributors;
    }
}
