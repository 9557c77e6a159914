package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Claims snapshot to rank")
public class RankingRequest {

    @Schema(description = "Claim records shared by every detector of the run")
    @Builder.Default
    private List<ClaimRecord> claims = new ArrayList<>();
}
