package com.tournament.analytics.domain.model.cohort;

public enum CohortMaturity {
    NEW,
    MATURING,
    MATURE;

    public static CohortMaturity fromMonthsOfData(int months) {
        if (months <= 3) {
            return NEW;
        }
        return months <= 6 ? MATURING : MATURE;
    }
}
