package com.jobgrid.internal;

import com.jobgrid.catalog.JobCatalog;
import com.jobgrid.catalog.JobDefinitionRegistry;
import com.jobgrid.config.JobGridProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobCatalogInitializerTest {

    private JobDefinitionRegistry registry;
    private JobGridProperties properties;
    private JobCatalog catalog;

    @BeforeEach
    void setUp() {
        registry = mock(JobDefinitionRegistry.class);
        properties = new JobGridProperties();
        catalog = JobCatalog.empty();
    }

    @Test
    void shouldReconcileCatalogOnStart() {
        JobCatalogInitializer initializer = new JobCatalogInitializer(registry, catalog, properties);

        initializer.start();

        verify(registry).reconcile(catalog.handles());
        assertTrue(initializer.isRunning());
    }

    @Test
    void shouldSkipReconcileWhenDisabled() {
        properties.getJobs().setReconcileOnStartup(false);

        new JobCatalogInitializer(registry, catalog, properties).start();

        verify(registry, never()).reconcile(any());
    }

    @Test
    void shouldNotFailStartupWhenReconcileFails() {
        when(registry.reconcile(any())).thenThrow(new IllegalStateException("database unavailable"));
        JobCatalogInitializer initializer = new JobCatalogInitializer(registry, catalog, properties);

        assertDoesNotThrow(initializer::start);
        assertTrue(initializer.isRunning());
    }

    @Test
    void shouldReconcileWithEmptyHandleListWhenNoJobsAreInstalled() {
        new JobCatalogInitializer(registry, JobCatalog.empty(), properties).start();

        verify(registry).reconcile(List.of());
    }
}
