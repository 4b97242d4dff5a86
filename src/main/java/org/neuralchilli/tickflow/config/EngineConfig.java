package org.neuralchilli.tickflow.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@ConfigMapping(prefix = "tickflow")
public interface EngineConfig {

    /**
     * Tick budget of a run when the caller does not give one
     */
    @WithName("max-ticks")
    @WithDefault("1000")
    int maxTicks();

    Catalog catalog();

    Workflows workflows();

    Provenance provenance();

    interface Catalog {
        /**
         * Catalog YAML on the filesystem; the bundled catalog is used when absent
         */
        @WithName("location")
        Optional<String> location();
    }

    interface Workflows {
        /**
         * Directory scanned for workflow YAML at startup
         */
        @WithName("path")
        Optional<String> path();
    }

    interface Provenance {
        @WithName("enabled")
        @WithDefault("true")
        boolean enabled();
    }
}
