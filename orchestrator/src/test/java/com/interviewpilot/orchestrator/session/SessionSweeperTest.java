package com.interviewpilot.orchestrator.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionSweeperTest {

    @Mock SessionManager sessionManager;

    @Test
    void sweep_evictsIdleSessions() {
        when(sessionManager.evictIdleSessions()).thenReturn(2);
        when(sessionManager.activeSessionCount()).thenReturn(5);

        new SessionSweeper(sessionManager).sweep();

        verify(sessionManager).evictIdleSessions();
        verify(sessionManager).activeSessionCount();
    }

    @Test
    void sweep_nothingIdle_staysQuiet() {
        when(sessionManager.evictIdleSessions()).thenReturn(0);

        new SessionSweeper(sessionManager).sweep();

        verify(sessionManager, never()).activeSessionCount();
    }
}
