package de.bsommerfeld.convotree.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Typed view of all {@code convotree.*} settings. Instances are produced by
 * {@link ConvoTreeConfigLoader}.
 */
@ConfigMapping(prefix = "convotree")
public interface ConvoTreeConfig {

    Database database();

    Tree tree();

    Branch branch();

    interface Database {

        /** SQLite file location. Unset means {@code <app data>/convotree.db}. */
        Optional<String> path();

        @WithDefault("5000")
        int busyTimeoutMs();
    }

    interface Tree {

        /** Levels expanded by {@code getTree} when the caller gives no depth. */
        @WithDefault("1")
        int defaultDepth();

        @WithDefault("50")
        int previewLength();
    }

    interface Branch {

        @WithDefault("20")
        int defaultLimit();
    }
}
