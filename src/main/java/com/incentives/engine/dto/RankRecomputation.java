package com.incentives.engine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankRecomputation {
    private String competitionId;
    private int updatedCount;
    private Integer focusUserRank;
    private Integer focusPreviousRank;

    public boolean focusImproved() {
        return focusUserRank != null && focusPreviousRank != null && focusUserRank < focusPreviousRank;
    }
}
