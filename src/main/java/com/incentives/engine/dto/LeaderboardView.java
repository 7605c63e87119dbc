package com.incentives.engine.dto;

import com.incentives.engine.model.CompetitionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardView {
    private String competitionId;
    private String competitionName;
    private CompetitionStatus status;
    private long totalParticipants;

    @Builder.Default
    private List<LeaderboardEntry> entries = new ArrayList<>();
}
