package com.incentives.engine.repository.impl;

import com.incentives.engine.model.UserBadge;
import com.incentives.engine.repository.UserBadgeRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.List;

/**
 * User badges partitioned by user and keyed by badge id, so a user can hold each badge once.
 */
@Repository
public class JsonUserBadgeRepository extends JsonDocumentStore<UserBadge> implements UserBadgeRepository {

    public JsonUserBadgeRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "user-badges").toString(), UserBadge.class);
    }

    @Override
    protected String partitionOf(UserBadge userBadge) {
        return userBadge.getUserId();
    }

    @Override
    protected String idOf(UserBadge userBadge) {
        return userBadge.getBadgeId();
    }

    @Override
    public UserBadge save(UserBadge userBadge) {
        if (userBadge == null || userBadge.getUserId() == null || userBadge.getBadgeId() == null) {
            throw new IllegalArgumentException("UserBadge userId and badgeId are required");
        }
        if (!putIfAbsent(userBadge)) {
            throw new IllegalStateException("User " + userBadge.getUserId()
                + " already holds badge " + userBadge.getBadgeId());
        }
        return userBadge;
    }

    @Override
    public boolean existsByUserIdAndBadgeId(String userId, String badgeId) {
        return get(userId, badgeId).isPresent();
    }

    @Override
    public List<UserBadge> findByUserId(String userId) {
        return list(userId);
    }
}
