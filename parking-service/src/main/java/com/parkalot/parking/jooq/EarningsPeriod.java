package com.parkalot.parking.jooq;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Bucket size for the owner earnings history. Unrecognised names fall back to {@link #MONTH}.
 */
@Getter
@RequiredArgsConstructor
public enum EarningsPeriod {

    WEEK("week"),
    MONTH("month"),
    YEAR("year");

    private final String code;

    public static EarningsPeriod from(String code) {
        if (code != null) {
            for (EarningsPeriod period : values()) {
                if (period.code.equalsIgnoreCase(code.trim())) {
                    return period;
                }
            }
        }
        return MONTH;
    }
}
