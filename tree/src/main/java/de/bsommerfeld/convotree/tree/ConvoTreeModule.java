package de.bsommerfeld.convotree.tree;

import com.google.inject.AbstractModule;
import de.bsommerfeld.convotree.core.config.ConvoTreeConfig;
import de.bsommerfeld.convotree.core.config.ConvoTreeConfigLoader;
import de.bsommerfeld.convotree.db.SqlTreeStore;
import de.bsommerfeld.convotree.db.TreeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring the tree engine. {@link MessageTreeService},
 * {@link TopicService} and the event bus are {@code @Singleton} classes and
 * bind just-in-time.
 */
public class ConvoTreeModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ConvoTreeModule.class);

    private final ConvoTreeConfig config;

    /** Uses the configuration from the default sources. */
    public ConvoTreeModule() {
        this(null);
    }

    public ConvoTreeModule(ConvoTreeConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        ConvoTreeConfig resolved = config != null ? config : ConvoTreeConfigLoader.load();
        LOG.info("Tree engine configured (default depth {}, default page size {})",
                resolved.tree().defaultDepth(), resolved.branch().defaultLimit());

        bind(ConvoTreeConfig.class).toInstance(resolved);
        bind(TreeStore.class).to(SqlTreeStore.class);
    }
}
