package com.flagship.letter_workflow.allowance;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Per-user lifetime consumption counter kept in {@code user_profiles}.
 *
 * Plain JDBC: the counter row doubles as the per-user serialization point
 * of credit deduction, and the lock statement is easier to read as SQL.
 */
@Repository
public class UsageCounterRepository {

    private final JdbcTemplate jdbcTemplate;

    public UsageCounterRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Ensures the profile row exists, locks it and returns the lifetime count.
     * Must run inside a transaction; the lock is held until it ends.
     */
    int lockAndGet(UUID userId) {
        jdbcTemplate.update(
            "INSERT INTO user_profiles (user_id) VALUES (?) ON CONFLICT (user_id) DO NOTHING",
            userId
        );
        Integer total = jdbcTemplate.queryForObject(
            "SELECT total_letters_generated FROM user_profiles WHERE user_id = ? FOR UPDATE",
            Integer.class,
            userId
        );
        return total != null ? total : 0;
    }

    void increment(UUID userId) {
        jdbcTemplate.update(
            "UPDATE user_profiles SET total_letters_generated = total_letters_generated + 1, " +
            "updated_at = now() WHERE user_id = ?",
            userId
        );
    }

    public int get(UUID userId) {
        List<Integer> totals = jdbcTemplate.queryForList(
            "SELECT total_letters_generated FROM user_profiles WHERE user_id = ?",
            Integer.class,
            userId
        );
        return totals.isEmpty() ? 0 : totals.get(0);
    }
}
