package com.tournament.analytics.domain.service;

/**
 * Receives 0-100 progress markers from long-running work.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> { };

    void onProgress(int percent);
}
