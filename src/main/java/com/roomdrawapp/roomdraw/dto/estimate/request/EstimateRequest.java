package com.roomdrawapp.roomdraw.dto.estimate.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EstimateRequest {
    @NotBlank private String firstName;
    @NotBlank private String lastName;

    // Other parallel pool lists, file names relative to the input directory or absolute paths
    private List<String> additionalPools;

    @Min(0) private Integer crossPoolTopN;

    private boolean includeCompetitors;
}
