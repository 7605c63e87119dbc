package com.incentives.engine.dto;

import com.incentives.engine.model.Competition;
import com.incentives.engine.model.Participant;
import com.incentives.engine.model.Rule;
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
public class LotteryPool {
    private Competition competition;
    private Rule rule;

    // Ranking order
    @Builder.Default
    private List<Participant> qualifiers = new ArrayList<>();
}
