package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonStanding {
    private String seasonId;
    private String userId;
    private String userName;
    private int totalPoints;
    private int competitionsEntered;
    private int competitionsWon;
    private Instant updatedAt;
}
