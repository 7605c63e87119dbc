package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Season {
    private String id;
    private String name;

    @Builder.Default
    private List<String> competitionIds = new ArrayList<>();

    private String championUserId;
    private Instant updatedAt;
}
