package com.tekir.backend.modules.quota.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;

import com.tekir.backend.modules.quota.domain.DailyCounterKind;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Global per-day counters. Single-statement upsert so concurrent hits never lose an increment.
 */
@Repository
public class DailyCounterRepository {

    private final JdbcTemplate jdbcTemplate;

    public DailyCounterRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void increment(LocalDate day, DailyCounterKind kind) {
        jdbcTemplate.update(
                """
                        INSERT INTO daily_counter (counter_day, kind, hit_count)
                        VALUES (?, ?, 1)
                        ON CONFLICT (counter_day, kind) DO UPDATE
                        SET hit_count = daily_counter.hit_count + 1
                        """,
                day,
                kind.name()
        );
    }

    public long find(LocalDate day, DailyCounterKind kind) {
        List<Long> counts = jdbcTemplate.queryForList(
                "SELECT hit_count FROM daily_counter WHERE counter_day = ? AND kind = ?",
                Long.class,
                day,
                kind.name()
        );
        return counts.isEmpty() ? 0L : counts.get(0);
    }
}
