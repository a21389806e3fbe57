package com.jobgrid.catalog;

import com.jobgrid.JobContext;
import com.jobgrid.JobHookReceiver;
import com.jobgrid.JobWorker;
import com.jobgrid.annotation.Job;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobCatalogTest {

    @Job(name = "Export Devices", grouping = "Exports", description = "Exports all devices",
            hasSensitiveVariables = false, softTimeLimit = 30, timeLimit = 60, taskQueues = { "exports", "default" })
    static class ExportDevicesJob implements JobWorker {
        @Override
        public Object run(JobContext context, Map<String, Object> kwargs) {
            return "exported";
        }
    }

    static class PlainJob implements JobWorker {
        @Override
        public Object run(JobContext context, Map<String, Object> kwargs) {
            return null;
        }
    }

    static class AuditHook implements JobHookReceiver {
        @Override
        public Object run(JobContext context, Map<String, Object> kwargs) {
            return kwargs.get(OBJECT_CHANGE_KWARG);
        }
    }

    @Test
    void shouldReadAnnotatedMetadata() {
        JobMetadata metadata = JobMetadata.of(ExportDevicesJob.class);

        assertEquals("Export Devices", metadata.name());
        assertEquals("Exports", metadata.grouping());
        assertEquals("Exports all devices", metadata.description());
        assertFalse(metadata.hasSensitiveVariables());
        assertEquals(30, metadata.softTimeLimit());
        assertEquals(60, metadata.timeLimit());
        assertEquals(List.of("exports", "default"), metadata.taskQueues());
        assertFalse(metadata.jobHookReceiver());
    }

    @Test
    void shouldDefaultMetadataOfUnannotatedWorker() {
        JobMetadata metadata = JobMetadata.of(PlainJob.class);

        assertEquals("PlainJob", metadata.name());
        assertEquals("com.jobgrid.catalog", metadata.grouping());
        assertTrue(metadata.hasSensitiveVariables());
        assertEquals(0, metadata.timeLimit());
        assertTrue(metadata.taskQueues().isEmpty());
    }

    @Test
    void shouldDetectHookReceivers() {
        assertTrue(JobMetadata.of(AuditHook.class).jobHookReceiver());
    }

    @Test
    void shouldKeyHandlesByClassPathInRegistrationOrder() {
        JobCatalog catalog = JobCatalog.fromWorkers(List.of(new PlainJob(), new ExportDevicesJob()));

        assertEquals(2, catalog.size());
        assertThat(catalog.handles()).extracting(JobHandle::className)
                .containsExactly("PlainJob", "ExportDevicesJob");
        assertTrue(catalog.lookup("com.jobgrid.catalog", "ExportDevicesJob").isPresent());
        assertTrue(catalog.lookup("com.jobgrid.catalog.PlainJob").isPresent());
        assertTrue(catalog.lookup("com.jobgrid.catalog.MissingJob").isEmpty());
    }

    @Test
    void shouldRejectDuplicateJobClasses() {
        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> JobCatalog.fromWorkers(List.of(new PlainJob(), new PlainJob())));

        assertThat(exception.getMessage()).contains("com.jobgrid.catalog.PlainJob");
    }

    @Test
    void shouldResolveProxiedWorkerToItsTargetClass() throws Exception {
        ProxyFactory proxyFactory = new ProxyFactory(new ExportDevicesJob());
        proxyFactory.setProxyTargetClass(true);
        JobWorker proxy = (JobWorker) proxyFactory.getProxy();

        JobCatalog catalog = JobCatalog.fromWorkers(List.of(proxy));
        JobHandle handle = catalog.lookup("com.jobgrid.catalog.ExportDevicesJob").orElseThrow();

        assertEquals("Export Devices", handle.metadata().name());
        assertEquals("exported", handle.execute(null, List.of(), Map.of()));
    }

    @Test
    void emptyCatalogHasNoHandles() {
        assertEquals(0, JobCatalog.empty().size());
    }
}
