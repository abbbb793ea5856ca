package com.microservices.learningservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Redis-backed counters. Redis being unavailable never fails the calling request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheService {

    public static final String COURSE_VIEWS_PREFIX = "course:views:";
    public static final String COURSE_ENROLLS_PREFIX = "course:enrolls:";

    private final StringRedisTemplate redisTemplate;

    /**
     * Increment a counter and (re)arm its TTL.
     */
    public Long increment(String key, long timeout, TimeUnit unit) {
        try {
            Long value = redisTemplate.opsForValue().increment(key);
            redisTemplate.expire(key, timeout, unit);
            return value;
        } catch (Exception e) {
            log.error("Error incrementing counter for key: {}", key, e);
            return null;
        }
    }

    /**
     * Current counter value, 0 when absent or unreadable.
     */
    public Long getCounter(String key) {
        try {
            String value = redisTemplate.opsForValue().get(key);
            return value != null ? Long.parseLong(value) : 0L;
        } catch (Exception e) {
            log.error("Error getting counter for key: {}", key, e);
            return 0L;
        }
    }

    public void delete(String key) {
        try {
            redisTemplate.delete(key);
            log.debug("Deleted cache key: {}", key);
        } catch (Exception e) {
            log.error("Error deleting cache key: {}", key, e);
        }
    }

    public Long recordCourseView(Long courseId) {
        return increment(COURSE_VIEWS_PREFIX + courseId, 24, TimeUnit.HOURS);
    }

    public Long getCourseViews(Long courseId) {
        return getCounter(COURSE_VIEWS_PREFIX + courseId);
    }

    public Long recordEnrollment(Long courseId) {
        return increment(COURSE_ENROLLS_PREFIX + courseId, 7, TimeUnit.DAYS);
    }

    public Long getRecentEnrollments(Long courseId) {
        return getCounter(COURSE_ENROLLS_PREFIX + courseId);
    }

    public void clearCourseCounters(Long courseId) {
        delete(COURSE_VIEWS_PREFIX + courseId);
        delete(COURSE_ENROLLS_PREFIX + courseId);
    }
}
