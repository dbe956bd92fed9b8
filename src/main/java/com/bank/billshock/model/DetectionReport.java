package com.bank.billshock.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of scoring a batch: the rows labelled as bill shocks plus batch figures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionReport {

    // Rows labelled BILL_SHOCK, in source order, with every original column plus the label column
    private Dataset anomalies;

    private int totalRecords;

    // Rows with a non-missing amount; rows without one are not scored
    private int scoredRecords;

    private int anomalyCount;

    // Percentage of total records, 0-100
    private double anomalyPct;

    private double threshold;
}
