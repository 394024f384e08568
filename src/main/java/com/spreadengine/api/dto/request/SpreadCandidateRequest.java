package com.spreadengine.api.dto.request;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A spread candidate from an option chain. Fields are deliberately unvalidated: incomplete
 * candidates are skipped by the engine with a warning instead of failing the request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpreadCandidateRequest {

    private Double longStrike;
    private Double shortStrike;

    /** Credit spreads only. */
    private Double netCredit;

    /** Debit spreads only. */
    private Double netDebit;

    private LocalDate expiration;
    private Double shortDelta;
    private Double longDelta;
    private Double ivRank;
}
