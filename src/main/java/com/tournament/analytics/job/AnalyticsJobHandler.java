package com.tournament.analytics.job;

import com.tournament.analytics.domain.service.ProgressListener;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;

/**
 * Executes one job type. The returned object is stored as the job's JSON result.
 *
 * @param <P> payload type, deserialized from the job's JSON payload
 */
public interface AnalyticsJobHandler<P> {

    JobType type();

    Class<P> payloadType();

    Object handle(P payload, ProgressListener progress);

    /**
     * Called once when the last attempt has failed.
     */
    default void onExhausted(P payload) {
    }
}
