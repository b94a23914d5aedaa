package io.voicecast.application.service;

import io.voicecast.application.port.output.Endpoint;
import io.voicecast.application.port.output.MediaSession;
import io.voicecast.domain.model.EndpointStatus;
import io.voicecast.domain.model.PlaybackStatus;
import io.voicecast.domain.model.PlayerState;
import io.voicecast.domain.model.RestoreOutcome;
import io.voicecast.domain.model.TargetStateSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TargetStateManagerTest {

    @Mock
    private Endpoint target;
    @Mock
    private MediaSession session;

    private TargetStateManager manager;
    private ShutdownSignal signal;

    @BeforeEach
    void setUp() {
        manager = new TargetStateManager(0.5, Duration.ofMillis(10), 3);
        signal = new ShutdownSignal();
    }

    @Test
    void snapshot_capturesStateThenForcesNotificationSettings() {
        when(target.status()).thenReturn(new EndpointStatus(0.8, true, "CC1AD845", "Spotify"));
        when(target.mediaSession()).thenReturn(session);
        when(session.status()).thenReturn(new PlaybackStatus(PlayerState.PLAYING, 200.0, 12.0, true));

        TargetStateSnapshot snapshot = manager.snapshot(target);

        assertEquals(new TargetStateSnapshot(0.8, true, "CC1AD845", true), snapshot);
        InOrder order = inOrder(target);
        order.verify(target).stopApp();
        order.verify(target).setVolume(0.5);
        order.verify(target).setMuted(false);
    }

    @Test
    void snapshot_withoutReportedStateIsEmpty() {
        when(target.status()).thenReturn(null);
        when(target.mediaSession()).thenReturn(null);

        TargetStateSnapshot snapshot = manager.snapshot(target);

        assertTrue(snapshot.isEmpty());
        verify(target).setVolume(0.5);
    }

    @Test
    void snapshot_continuesWhenQuitAppFails() {
        when(target.status()).thenReturn(new EndpointStatus(0.2, false, null, null));
        when(target.mediaSession()).thenReturn(null);
        doThrow(new IllegalStateException("not connected")).when(target).stopApp();

        manager.snapshot(target);

        verify(target).setVolume(0.5);
        verify(target).setMuted(false);
    }

    @Test
    void restore_reappliesExactValuesInOrder() {
        when(target.isReady()).thenReturn(true);

        RestoreOutcome outcome = manager.restore(target, new TargetStateSnapshot(0.8, true, "CC1AD845", true), signal);

        assertEquals(RestoreOutcome.RESTORED, outcome);
        InOrder order = inOrder(target);
        order.verify(target).stopApp();
        order.verify(target).setVolume(0.8);
        order.verify(target).setMuted(true);
    }

    @Test
    void restore_emptySnapshotTouchesNothing() {
        RestoreOutcome outcome = manager.restore(target, TargetStateSnapshot.EMPTY, signal);

        assertEquals(RestoreOutcome.NOTHING_TO_RESTORE, outcome);
        verify(target, never()).stopApp();
        verify(target, never()).setVolume(anyDouble());
        verify(target, never()).setMuted(anyBoolean());
    }

    @Test
    void restore_waitsForTargetToReconnect() {
        when(target.isReady()).thenReturn(false, false, true);

        RestoreOutcome outcome = manager.restore(target, new TargetStateSnapshot(0.4, false, null, null), signal);

        assertEquals(RestoreOutcome.RESTORED, outcome);
        verify(target).setVolume(0.4);
        verify(target).setMuted(false);
    }

    @Test
    void restore_givesUpWhenTargetNeverReconnects() {
        when(target.isReady()).thenReturn(false);

        RestoreOutcome outcome = manager.restore(target, new TargetStateSnapshot(0.4, false, null, null), signal);

        assertEquals(RestoreOutcome.TIMED_OUT, outcome);
        verify(target, never()).setVolume(anyDouble());
        verify(target, never()).setMuted(anyBoolean());
    }

    @Test
    void restore_cancelledByShutdownWhileWaiting() {
        when(target.isReady()).thenReturn(false);
        signal.trigger();

        RestoreOutcome outcome = manager.restore(target, new TargetStateSnapshot(0.4, false, null, null), signal);

        assertEquals(RestoreOutcome.CANCELLED, outcome);
        verify(target, never()).setVolume(anyDouble());
    }

    @Test
    void restore_readyTargetIsRestoredEvenDuringShutdown() {
        when(target.isReady()).thenReturn(true);
        signal.trigger();

        assertEquals(RestoreOutcome.RESTORED,
            manager.restore(target, new TargetStateSnapshot(0.4, null, null, null), signal));
        verify(target).setVolume(0.4);
        verify(target, never()).setMuted(anyBoolean());
    }

    @Test
    void restore_withoutSavedVolumeIsNoOp() {
        assertEquals(RestoreOutcome.NOTHING_TO_RESTORE,
            manager.restore(target, new TargetStateSnapshot(null, true, null, null), signal));
        verify(target, never()).isReady();
        verify(target, never()).stopApp();
        verify(target, never()).setMuted(anyBoolean());
    }

    @Test
    void rejectsVolumeOutsideUnitRange() {
        assertThrows(IllegalArgumentException.class, () -> new TargetStateManager(1.5));
    }
}
