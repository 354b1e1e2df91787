package com.tournament.analytics.job;

import com.tournament.analytics.domain.model.report.ReportRunResult;
import com.tournament.analytics.domain.service.ProgressListener;
import com.tournament.analytics.domain.service.report.ScheduledReportService;
import com.tournament.analytics.domain.service.report.ScheduledReportWorkflow;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.job.payload.ScheduledReportJobPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ScheduledReportJobHandler implements AnalyticsJobHandler<ScheduledReportJobPayload> {

    private final ScheduledReportWorkflow workflow;
    private final ScheduledReportService scheduledReportService;

    @Override
    public JobType type() {
        return JobType.SCHEDULED_REPORT;
    }

    @Override
    public Class<ScheduledReportJobPayload> payloadType() {
        return ScheduledReportJobPayload.class;
    }

    @Override
    public ReportRunResult handle(ScheduledReportJobPayload payload, ProgressListener progress) {
        return workflow.run(payload.getReportId(), progress);
    }

    /**
     * A report that keeps failing moves on to its next occurrence instead of staying due.
     */
    @Override
    public void onExhausted(ScheduledReportJobPayload payload) {
        scheduledReportService.skipToNextRun(payload.getReportId());
    }
}
