package com.roomdrawapp.roomdraw.dto.estimate.response;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CompetitorResponse {
    private int position;
    private String name;
    private String puid;
    private String drawTime;
}
