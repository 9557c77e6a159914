package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single pharmacy claim row of the dataset snapshot")
public class ClaimRecord {

    @Schema(description = "Claim identifier", example = "CLM-000001")
    private String claimId;

    @Schema(description = "Pharmacy identifier (the ranked entity)", example = "PH-10042")
    private String pharmacyNumber;

    @Schema(description = "Pharmacy display name", example = "Main Street Pharmacy")
    private String pharmacyName;

    @Schema(description = "Pharmacy city", example = "Dallas")
    private String pharmacyCity;

    @Schema(description = "Pharmacy state", example = "TX")
    private String pharmacyState;

    @Schema(description = "Patient identifier", example = "PAT-7781")
    private String patientId;

    @Schema(description = "Coverage type of the claim", example = "Cash")
    private String coverageType;

    @Schema(description = "Other coverage code", example = "3")
    private Integer occ;

    @Schema(description = "Copay amount", example = "35.00")
    private double copayCost;

    @Schema(description = "Out-of-pocket amount", example = "120.00")
    private double oopCost;

    @Schema(description = "Copay fee amount", example = "2.50")
    private double copayFeeCost;

    @Schema(description = "Original claim cost", example = "450.00")
    private double originalCost;

    @Schema(description = "Claim status", example = "REJECTED")
    private String claimStatus;

    @Schema(description = "Fill timestamp in epoch milliseconds", example = "1739886764000")
    private long filledAt;
}
