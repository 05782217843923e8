package github.sarthakdev143.production_planner.service.impl;

import github.sarthakdev143.production_planner.config.PlannerProperties;
import github.sarthakdev143.production_planner.service.QueryAnalysisService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryRetentionSweeperTest {

    @Mock
    private QueryAnalysisService queryAnalysisService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private final PlannerProperties properties = new PlannerProperties(
            new PlannerProperties.AnalysisProperties(4, 100, Duration.ofSeconds(5)),
            new PlannerProperties.FfmpegProperties(""),
            new PlannerProperties.PreflightProperties(false),
            new PlannerProperties.RetentionProperties(Duration.ofMinutes(20), Duration.ofSeconds(30)));

    @Test
    void startSchedulesSweepWithConfiguredIntervalAndTtl() {
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(30)));
        QueryRetentionSweeper sweeper = new QueryRetentionSweeper(queryAnalysisService, taskScheduler, properties);

        sweeper.start();

        ArgumentCaptor<Runnable> sweep = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleWithFixedDelay(sweep.capture(), eq(Duration.ofSeconds(30)));
        sweep.getValue().run();
        verify(queryAnalysisService).evictFinishedQueries(Duration.ofMinutes(20));

        sweeper.stop();
        verify(future).cancel(false);
    }

    @Test
    void failedSweepIsContainedSoLaterRunsStillHappen() {
        when(queryAnalysisService.evictFinishedQueries(Duration.ofMinutes(20)))
                .thenThrow(new IllegalStateException("tracker map busy"));
        QueryRetentionSweeper sweeper = new QueryRetentionSweeper(queryAnalysisService, taskScheduler, properties);

        assertThatCode(sweeper::runOnce).doesNotThrowAnyException();
        verify(queryAnalysisService).evictFinishedQueries(Duration.ofMinutes(20));
    }

    @Test
    void stopBeforeStartIsHarmless() {
        QueryRetentionSweeper sweeper = new QueryRetentionSweeper(queryAnalysisService, taskScheduler, properties);

        assertThatCode(sweeper::stop).doesNotThrowAnyException();
    }
}
