package com.spreadengine.domain.model;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A two-leg vertical spread offered for scoring.
 *
 * <p>Numeric fields are boxed because candidates arrive from external option chains and
 * may be incomplete. Credit spreads carry {@code netCredit}, debit spreads {@code netDebit}.
 * Greeks are inputs; nothing here prices options.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpreadCandidate {

    private Double longStrike;
    private Double shortStrike;
    private Double netCredit;
    private Double netDebit;
    private LocalDate expiration;
    private Double shortDelta;

    /** Delta of the long leg; debit spreads score this one when present. */
    private Double longDelta;

    private Double ivRank;

    /**
     * Distance between the strikes, or null when either strike is missing.
     */
    public Double getWidth() {
        if (longStrike == null || shortStrike == null) {
            return null;
        }
        return Math.abs(shortStrike - longStrike);
    }
}
