package com.incentives.engine.repository.impl;

import com.incentives.engine.exception.IncentivesException;
import com.incentives.engine.model.RankedParticipant;
import com.incentives.engine.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.resps.Tuple;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Live leaderboard mirror in Redis sorted sets, one set per competition.
 *
 * <p>The score is the negated participant value, which a double holds exactly, and
 * the member is {@code <reached-at millis, 13 digits>:<userId>}. Ascending
 * {@code ZRANGE} then orders by value descending, equal values by earliest reach
 * time, then by user id. A hash per competition maps each user to their current
 * member so it can be replaced when the reach time moves.
 */
@Repository
public class JedisRedisRepository implements RedisRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisRedisRepository.class);

    static final String COMPETITION_KEY_PREFIX = "competition:";
    static final String MEMBER_INDEX_SUFFIX = ":members";
    static final long MAX_TIMESTAMP = 9999999999999L; // Year 2286 in milliseconds
    private static final int TIMESTAMP_DIGITS = 13;

    // Replaces the user's member unless the stored value is already higher
    static final String UPDATE_SCRIPT =
        "local previous = redis.call('HGET', KEYS[2], ARGV[1]) "
            + "if previous then "
            + "  local current = redis.call('ZSCORE', KEYS[1], previous) "
            + "  if current and tonumber(current) < tonumber(ARGV[2]) then return 0 end "
            + "  redis.call('ZREM', KEYS[1], previous) "
            + "end "
            + "redis.call('ZADD', KEYS[1], ARGV[2], ARGV[3]) "
            + "redis.call('HSET', KEYS[2], ARGV[1], ARGV[3]) "
            + "return 1";

    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @Value("${redis.enabled:true}")
    private boolean enabled;

    public JedisRedisRepository() {
    }

    JedisRedisRepository(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
        this.available = true;
        this.enabled = true;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            logger.info("Redis live leaderboard disabled, reads fall back to the document store");
            return;
        }
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(128);
            poolConfig.setMaxIdle(32);
            poolConfig.setMinIdle(8);
            poolConfig.setTestOnBorrow(true);
            poolConfig.setTestOnReturn(true);

            HostAndPort hostAndPort = new HostAndPort(redisHost, redisPort);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);
            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }
            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, hostAndPort, clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Failed to initialize Redis connection to {}:{}, live leaderboard writes will be queued",
                redisHost, redisPort, e);
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        if (!available || jedisPool == null) {
            return false;
        }
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            return true;
        } catch (Exception e) {
            logger.debug("Redis ping failed", e);
            available = false;
            return false;
        }
    }

    @Override
    public boolean updateValue(String competitionId, String userId, long value, Instant valueReachedAt) {
        if (competitionId == null || competitionId.trim().isEmpty()) {
            throw new IllegalArgumentException("CompetitionId cannot be null or empty");
        }
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("UserId cannot be null or empty");
        }
        if (!isAvailable()) {
            throw new IncentivesException("Redis is not available", "REDIS_UNAVAILABLE");
        }

        try (Jedis jedis = jedisPool.getResource()) {
            Object applied = jedis.eval(UPDATE_SCRIPT,
                List.of(keyFor(competitionId), indexKeyFor(competitionId)),
                List.of(userId, scoreArgument(value), memberFor(userId, valueReachedAt)));
            return applied instanceof Long && (Long) applied == 1L;
        } catch (Exception e) {
            throw new IncentivesException("Failed to update value in Redis", "REDIS_WRITE_FAILED", e);
        }
    }

    @Override
    public List<RankedParticipant> getTopN(String competitionId, int offset, int limit) {
        if (competitionId == null || competitionId.trim().isEmpty() || limit <= 0 || offset < 0) {
            return new ArrayList<>();
        }
        if (!isAvailable()) {
            return new ArrayList<>();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            List<Tuple> tuples = jedis.zrangeWithScores(keyFor(competitionId), offset, offset + limit - 1L);

            List<RankedParticipant> ranked = new ArrayList<>();
            int rank = offset + 1;
            for (Tuple tuple : tuples) {
                String member = tuple.getElement();
                ranked.add(RankedParticipant.builder()
                    .userId(userIdOf(member))
                    .rank(rank++)
                    .value(valueOf(tuple.getScore()))
                    .valueReachedAt(reachedAtOf(member))
                    .build());
            }
            return ranked;
        } catch (Exception e) {
            logger.warn("Failed to get top {} from Redis for competition {}", limit, competitionId, e);
            return new ArrayList<>();
        }
    }

    @Override
    public Long getRankPosition(String competitionId, String userId) {
        if (competitionId == null || competitionId.trim().isEmpty() || userId == null || userId.trim().isEmpty()) {
            return null;
        }
        if (!isAvailable()) {
            return null;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            String member = jedis.hget(indexKeyFor(competitionId), userId);
            if (member == null) {
                return null;
            }
            Long rank = jedis.zrank(keyFor(competitionId), member);
            return rank != null ? rank + 1 : null; // Redis ranks are 0-based
        } catch (Exception e) {
            logger.warn("Failed to get rank position from Redis for user {} in competition {}",
                userId, competitionId, e);
            return null;
        }
    }

    @Override
    public Long getTotalParticipants(String competitionId) {
        if (competitionId == null || competitionId.trim().isEmpty()) {
            return 0L;
        }
        if (!isAvailable()) {
            return 0L;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.zcard(keyFor(competitionId));
        } catch (Exception e) {
            logger.warn("Failed to get participant count from Redis for competition {}", competitionId, e);
            return 0L;
        }
    }

    static String keyFor(String competitionId) {
        return COMPETITION_KEY_PREFIX + competitionId;
    }

    static String indexKeyFor(String competitionId) {
        return keyFor(competitionId) + MEMBER_INDEX_SUFFIX;
    }

    static String scoreArgument(long value) {
        return Long.toString(-value);
    }

    /**
     * Sorted-set member for a participant. Members of equal score compare byte-wise, so
     * the zero-padded reach time orders earlier first and an unknown time sorts last.
     */
    static String memberFor(String userId, Instant valueReachedAt) {
        long timestampMillis = valueReachedAt == null ? MAX_TIMESTAMP : valueReachedAt.toEpochMilli();
        if (timestampMillis > MAX_TIMESTAMP) {
            timestampMillis = MAX_TIMESTAMP;
        }
        if (timestampMillis < 0) {
            timestampMillis = 0;
        }
        return String.format(Locale.ROOT, "%0" + TIMESTAMP_DIGITS + "d:%s", timestampMillis, userId);
    }

    static String userIdOf(String member) {
        return member.substring(TIMESTAMP_DIGITS + 1);
    }

    static Instant reachedAtOf(String member) {
        long timestampMillis = Long.parseLong(member.substring(0, TIMESTAMP_DIGITS));
        return timestampMillis == MAX_TIMESTAMP ? null : Instant.ofEpochMilli(timestampMillis);
    }

    private static long valueOf(double score) {
        return -Math.round(score);
    }
}
