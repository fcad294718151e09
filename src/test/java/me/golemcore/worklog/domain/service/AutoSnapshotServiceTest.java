package me.golemcore.worklog.domain.service;

import me.golemcore.worklog.domain.model.AutoSnapshotResult;
import me.golemcore.worklog.domain.model.SnapshotOptions;
import me.golemcore.worklog.domain.model.SnapshotResult;
import me.golemcore.worklog.domain.model.SnapshotSource;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import me.golemcore.worklog.port.outbound.StorageLockException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoSnapshotServiceTest {

    private SnapshotAssemblyService assemblyService;
    private WorklogProperties properties;
    private AutoSnapshotService service;

    @BeforeEach
    void setUp() {
        assemblyService = mock(SnapshotAssemblyService.class);
        properties = new WorklogProperties();
        service = new AutoSnapshotService(assemblyService, properties);

        when(assemblyService.isRepository()).thenReturn(true);
        when(assemblyService.assembleAndSave(any())).thenReturn(new SnapshotResult(
                WorkSnapshot.builder().date(LocalDate.of(2026, 2, 10)).projectId("acme").build(),
                false, List.of(), 5));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void shouldTakeLightSnapshotTaggedWithSource() {
        AutoSnapshotResult result = service.sideEffectSnapshot(SnapshotSource.POST_CHECKOUT, "Switched branch");

        assertTrue(result.taken());
        assertNull(result.skipReason());
        ArgumentCaptor<SnapshotOptions> captor = ArgumentCaptor.forClass(SnapshotOptions.class);
        verify(assemblyService).assembleAndSave(captor.capture());
        SnapshotOptions options = captor.getValue();
        assertTrue(options.isLight());
        assertEquals("Switched branch", options.getNote());
        assertEquals(List.of("auto:post-checkout"), options.getTags());
    }

    @Test
    void shouldSkipWhenDisabled() {
        properties.getJournal().setAutoSnapshot(false);

        AutoSnapshotResult result = service.sideEffectSnapshot(SnapshotSource.RECALL, null);

        assertFalse(result.taken());
        assertEquals("auto-snapshot disabled", result.skipReason());
        verify(assemblyService, never()).assembleAndSave(any());
    }

    @Test
    void shouldSkipOutsideRepository() {
        when(assemblyService.isRepository()).thenReturn(false);

        AutoSnapshotResult result = service.sideEffectSnapshot(SnapshotSource.RECALL, null);

        assertEquals("not a git repository", result.skipReason());
    }

    @Test
    void shouldReportFailureInsteadOfThrowing() {
        when(assemblyService.assembleAndSave(any())).thenThrow(new StorageLockException("lock busy"));

        AutoSnapshotResult result = service.sideEffectSnapshot(SnapshotSource.WEEK, null);

        assertFalse(result.taken());
        assertEquals("snapshot failed: lock busy", result.skipReason());
    }

    @Test
    void shouldRunInBackground() throws Exception {
        AutoSnapshotResult result = service.fireAndForget(SnapshotSource.JOURNAL, null).get(5, TimeUnit.SECONDS);

        assertTrue(result.taken());
        assertEquals("acme", result.result().snapshot().getProjectId());
    }

    @Test
    void shouldCompleteNormallyWhenBackgroundCaptureFails() throws Exception {
        when(assemblyService.isRepository()).thenThrow(new IllegalStateException("boom"));

        AutoSnapshotResult result = service.fireAndForget(SnapshotSource.RECALL, null).get(5, TimeUnit.SECONDS);

        assertFalse(result.taken());
        assertTrue(result.skipReason().contains("boom"));
    }

    @Test
    void shouldNotScheduleWhenDisabled() throws Exception {
        properties.getJournal().setAutoSnapshot(false);

        AutoSnapshotResult result = service.fireAndForget(SnapshotSource.RECALL, null).get(1, TimeUnit.SECONDS);

        assertEquals("auto-snapshot disabled", result.skipReason());
        verify(assemblyService, never()).isRepository();
    }
}
