package com.renewalsync.ingestion.job;

import com.renewalsync.renewal.lock.RenewalLockProperties;
import com.renewalsync.renewal.lock.RenewalLockService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.annotation.Scheduled;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RenewalLockSweepJobTest {

    @Mock
    private RenewalLockService renewalLockService;

    @InjectMocks
    private RenewalLockSweepJob job;

    @Test
    @DisplayName("scheduled job delegates to the expired lock sweep")
    void runScheduled_delegatesToService() {
        job.runScheduled();
        verify(renewalLockService).releaseExpiredLocks();
    }

    @Test
    void runScheduled_storeFailure_isContained() {
        when(renewalLockService.releaseExpiredLocks()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(() -> job.runScheduled()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("schedule reads the bound sweep interval key with the same default")
    void schedule_matchesLockProperties() throws Exception {
        Scheduled scheduled = RenewalLockSweepJob.class.getMethod("runScheduled").getAnnotation(Scheduled.class);
        String expected = "${renewalsync.renewal.lock.sweep-interval-ms:" + new RenewalLockProperties().getSweepIntervalMs() + "}";

        assertThat(scheduled.fixedDelayString()).isEqualTo(expected);
        assertThat(scheduled.initialDelayString()).isEqualTo(expected);
    }
}
