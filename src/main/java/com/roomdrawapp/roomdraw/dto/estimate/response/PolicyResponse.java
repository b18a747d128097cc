package com.roomdrawapp.roomdraw.dto.estimate.response;

import lombok.*;

import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class PolicyResponse {
    private int crossPoolTopN;
    private String scarceGroup;
    private String scarceUnit;
    private String scarceOccupancyType;
    private String rankBasis;
    private Map<String, Integer> occupancySpots;
}
