package com.bank.billshock.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Bill shocks found in a batch, with batch figures")
public class DetectionResponse {

    @Schema(description = "Number of rows submitted", example = "3")
    private int totalRecords;

    @Schema(description = "Rows that had an amount and were scored", example = "3")
    private int scoredRecords;

    @Schema(description = "Number of rows labelled Bill Shock", example = "1")
    private int anomalyCount;

    @Schema(description = "Bill shocks as a percentage of submitted rows", example = "33.3")
    private double anomalyPct;

    @Schema(description = "Model score threshold used for labelling", example = "0.62")
    private double threshold;

    @Schema(description = "Output columns: the input columns followed by the label column")
    private List<String> columns;

    @Schema(description = "Rows labelled Bill Shock, in input order, keyed by their original index")
    private List<TransactionRecord> anomalies;

    public static DetectionResponse from(DetectionReport report) {
        return DetectionResponse.builder()
                .totalRecords(report.getTotalRecords())
                .scoredRecords(report.getScoredRecords())
                .anomalyCount(report.getAnomalyCount())
                .anomalyPct(report.getAnomalyPct())
                .threshold(report.getThreshold())
                .columns(report.getAnomalies().getColumns())
                .anomalies(report.getAnomalies().getRecords())
                .build();
    }
}
