package com.assetdesk.allocation.unit.entity;

import com.assetdesk.allocation.entity.LicensePool;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LicensePoolTest {

    @Test
    void tryClaim_lastSeat_thenRefuses() {
        LicensePool pool = pool(1);

        assertThat(pool.tryClaim()).isTrue();
        assertThat(pool.tryClaim()).isFalse();
        assertThat(pool.getAvailableCount()).isZero();
        assertThat(pool.getUsedCount()).isEqualTo(1);
    }

    @Test
    void release_whenAllSeatsFree_staysAtTotal() {
        LicensePool pool = pool(3);

        pool.release();

        assertThat(pool.getAvailableCount()).isEqualTo(3);
    }

    @Test
    void addSeats_negative_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> pool(3).addSeats(-2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addSeats_overflowingTotal_throwsAndLeavesCountersUnchanged() {
        LicensePool pool = pool(2);

        assertThatThrownBy(() -> pool.addSeats(Integer.MAX_VALUE))
            .isInstanceOf(ArithmeticException.class);

        assertThat(pool.getTotalCount()).isEqualTo(2);
        assertThat(pool.getAvailableCount()).isEqualTo(2);
    }

    @Test
    void isExpiredOn_expiryDayCountsAsExpired() {
        LicensePool pool = pool(3);
        pool.setExpiryDate(LocalDate.of(2025, 6, 1));

        assertThat(pool.isExpiredOn(LocalDate.of(2025, 5, 31))).isFalse();
        assertThat(pool.isExpiredOn(LocalDate.of(2025, 6, 1))).isTrue();
    }

    private LicensePool pool(int total) {
        LicensePool pool = new LicensePool();
        pool.setTotalCount(total);
        pool.setAvailableCount(total);
        pool.setExpiryDate(LocalDate.of(2030, 1, 1));
        return pool;
    }
}
