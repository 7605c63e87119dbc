package com.incentives.engine.repository;

import com.incentives.engine.model.UserBadge;

import java.util.List;

public interface UserBadgeRepository {
    UserBadge save(UserBadge userBadge);
    boolean existsByUserIdAndBadgeId(String userId, String badgeId);
    List<UserBadge> findByUserId(String userId);
}
