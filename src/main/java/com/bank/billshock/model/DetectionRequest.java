package com.bank.billshock.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A batch of transaction rows to score against the stored model")
public class DetectionRequest {

    @NotNull
    @Schema(description = "Rows in source order. Each row needs an amount; other columns are passed through.",
            example = "[{\"Date\": \"2024-03-01\", \"Amount\": 120}, {\"Date\": \"2024-03-02\", \"Amount\": 9000}]")
    private List<Map<String, Object>> records;
}
