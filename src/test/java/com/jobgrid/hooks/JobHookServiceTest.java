package com.jobgrid.hooks;

import com.jobgrid.JobValidationException;
import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobHook;
import com.jobgrid.model.ObjectChangeAction;
import com.jobgrid.repository.JobHookRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobHookServiceTest {

    private JobHookRepository jobHookRepository;
    private JobHookService service;
    private JobDefinition job;

    @BeforeEach
    void setUp() {
        jobHookRepository = mock(JobHookRepository.class);
        service = new JobHookService(jobHookRepository);
        when(jobHookRepository.findByContentTypeAndJob(anyString(), any())).thenReturn(List.of());
        when(jobHookRepository.save(any(JobHook.class))).thenAnswer(invocation -> invocation.getArgument(0));

        job = new JobDefinition("com.example.hooks", "AuditHook");
        job.setJobHookReceiver(true);
    }

    private JobHook hook(String name, boolean create, boolean update, boolean delete, String... contentTypes) {
        JobHook hook = new JobHook(name, job, Set.of(contentTypes));
        hook.setTypeCreate(create);
        hook.setTypeUpdate(update);
        hook.setTypeDelete(delete);
        return hook;
    }

    @Test
    void shouldReportOverlappingActions() {
        JobHook existing = hook("existing", true, true, false, "dcim.device");
        when(jobHookRepository.findByContentTypeAndJob("dcim.device", job)).thenReturn(List.of(existing));

        List<JobHookConflict> conflicts = service.checkForConflicts(Set.of("dcim.device", "dcim.site"), job,
                false, true, true, null);

        assertEquals(1, conflicts.size());
        JobHookConflict conflict = conflicts.get(0);
        assertEquals("type_update", conflict.field());
        assertEquals(ObjectChangeAction.UPDATE, conflict.action());
        assertEquals("A job hook already exists for update on dcim.device to job AuditHook", conflict.message());
    }

    @Test
    void shouldIgnoreTheHookBeingEdited() {
        JobHook existing = hook("existing", true, true, true, "dcim.device");
        when(jobHookRepository.findByContentTypeAndJob("dcim.device", job)).thenReturn(List.of(existing));

        assertTrue(service.checkForConflicts(Set.of("dcim.device"), job, true, true, true, existing).isEmpty());
    }

    @Test
    void shouldRejectConflictingHookOnSave() {
        JobHook existing = hook("existing", false, false, true, "dcim.device");
        when(jobHookRepository.findByContentTypeAndJob("dcim.device", job)).thenReturn(List.of(existing));

        JobValidationException exception = assertThrows(JobValidationException.class,
                () -> service.save(hook("second", false, false, true, "dcim.device")));

        assertEquals("type_delete", exception.getField());
        verify(jobHookRepository, never()).save(any(JobHook.class));
    }

    @Test
    void shouldRequireAtLeastOneAction() {
        JobValidationException exception = assertThrows(JobValidationException.class,
                () -> service.validate(hook("idle", false, false, false, "dcim.device")));

        assertEquals("type_create", exception.getField());
    }

    @Test
    void shouldRequireHookReceiverJob() {
        job.setJobHookReceiver(false);

        JobValidationException exception = assertThrows(JobValidationException.class,
                () -> service.validate(hook("plain", true, false, false, "dcim.device")));

        assertEquals("job", exception.getField());
    }

    @Test
    void shouldSaveValidHook() {
        JobHook hook = hook("audit", true, false, false, "dcim.device");

        service.save(hook);

        verify(jobHookRepository).save(hook);
    }
}
