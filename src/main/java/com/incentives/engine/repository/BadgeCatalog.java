package com.incentives.engine.repository;

import com.incentives.engine.model.Badge;

import java.util.Optional;

public interface BadgeCatalog {
    Optional<Badge> getBadge(String badgeId);
}
