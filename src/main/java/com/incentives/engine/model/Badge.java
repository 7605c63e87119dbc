package com.incentives.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Badge {
    private String id;
    private String name;
    private String icon;

    @Builder.Default
    private String tier = "common";
}
