package com.incentives.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankMovement {
    private String competitionId;
    private String userId;
    private Integer oldRank;
    private Integer newRank;
}
