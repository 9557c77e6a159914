package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "Complete output of one ranking run")
public class RankingRun {

    @Schema(description = "Run identifier", example = "5b8f3c1e-8d0b-4d53-9d8a-2f1f4f0c9e11")
    String runId;

    @Schema(description = "Identifier of the dataset snapshot that was analyzed")
    String snapshotId;

    Instant startedAt;

    Instant completedAt;

    @Schema(description = "Ranked results, highest risk first")
    List<AggregateResult> results;

    RunSummary summary;
}
