package com.jobgrid.internal;

import com.jobgrid.catalog.JobCatalog;
import com.jobgrid.catalog.JobDefinitionRegistry;
import com.jobgrid.config.JobGridProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Reconciles the stored job definitions with the job catalog on startup.
 */
@Component
public class JobCatalogInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobCatalogInitializer.class);

    private final JobDefinitionRegistry registry;
    private final JobCatalog catalog;
    private final JobGridProperties properties;
    private boolean running = false;

    public JobCatalogInitializer(JobDefinitionRegistry registry, JobCatalog catalog, JobGridProperties properties) {
        this.registry = registry;
        this.catalog = catalog;
        this.properties = properties;
    }

    @Override
    public void start() {
        if (properties.getJobs().isReconcileOnStartup()) {
            log.info("Reconciling {} job(s) from the job catalog...", catalog.size());
            try {
                registry.reconcile(catalog.handles());
            } catch (Exception e) {
                log.error("Failed to reconcile job definitions with the job catalog", e);
            }
        }
        this.running = true;
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1; // Before the scheduler picks up work
    }
}
