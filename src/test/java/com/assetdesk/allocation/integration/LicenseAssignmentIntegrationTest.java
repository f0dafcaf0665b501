package com.assetdesk.allocation.integration;

import com.assetdesk.allocation.dto.request.AssignLicenseRequest;
import com.assetdesk.allocation.dto.request.CloseLicenseAssignmentRequest;
import com.assetdesk.allocation.dto.request.IncreaseSeatsRequest;
import com.assetdesk.allocation.dto.request.RegisterLicensePoolRequest;
import com.assetdesk.allocation.dto.response.ErrorResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.dto.response.LicensePoolResponse;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.entity.PricingModel;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class LicenseAssignmentIntegrationTest extends AbstractIntegrationTest {

    private static final String POOLS_URL = "/api/v1/license-pools";
    private static final String ASSIGNMENTS_URL = "/api/v1/license-assignments";

    private final LocalDate today = LocalDate.now(ZoneOffset.UTC);

    @Test
    void poolOfTwo_thirdAssignmentRejectedUntilSeatReleased() {
        Long poolId = registerPool("Figma", 2, today.plusYears(1));

        Long first = assign(poolId, 10L).getBody().id();
        assign(poolId, 11L);
        assertThat(getPool(poolId).availableCount()).isZero();

        ResponseEntity<ErrorResponse> exhausted = restTemplate.postForEntity(ASSIGNMENTS_URL,
            new AssignLicenseRequest(poolId, 12L, "Design work", today, null), ErrorResponse.class);
        assertThat(exhausted.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(exhausted.getBody().retryable()).isTrue();
        assertThat(getPool(poolId).availableCount()).isZero();

        // REVOKE one seat
        ResponseEntity<LicenseAssignmentResponse> revoked = close(first, LicenseAssignmentStatus.REVOKED,
            LicenseAssignmentResponse.class);
        assertThat(revoked.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(revoked.getBody().status()).isEqualTo(LicenseAssignmentStatus.REVOKED);
        assertThat(revoked.getBody().closedAt()).isNotNull();
        assertThat(getPool(poolId).availableCount()).isEqualTo(1);

        ResponseEntity<LicenseAssignmentResponse> retry = assign(poolId, 12L);
        assertThat(retry.getStatusCode()).isEqualTo(HttpStatus.CREATED);

        assertCapacityInvariant(poolId);
    }

    @Test
    void assign_sameHolderTwice_returns409() {
        Long poolId = registerPool("Slack", 5, today.plusYears(1));
        assign(poolId, 10L);

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(ASSIGNMENTS_URL,
            new AssignLicenseRequest(poolId, 10L, "Second seat", today, null), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).contains("already has an active seat");
        assertThat(getPool(poolId).availableCount()).isEqualTo(4);
    }

    @Test
    void close_withExpiredReason_returns400() {
        Long poolId = registerPool("Jira", 5, today.plusYears(1));
        Long assignmentId = assign(poolId, 10L).getBody().id();

        ResponseEntity<ErrorResponse> response = close(assignmentId, LicenseAssignmentStatus.EXPIRED,
            ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(getPool(poolId).availableCount()).isEqualTo(4);
    }

    @Test
    void close_twice_secondReturns409AndSeatCountUnchanged() {
        Long poolId = registerPool("Miro", 3, today.plusYears(1));
        Long assignmentId = assign(poolId, 10L).getBody().id();

        close(assignmentId, LicenseAssignmentStatus.RETURNED, LicenseAssignmentResponse.class);
        ResponseEntity<ErrorResponse> second = close(assignmentId, LicenseAssignmentStatus.REVOKED,
            ErrorResponse.class);

        assertThat(second.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(getPool(poolId).availableCount()).isEqualTo(3);
    }

    @Test
    void assign_endDateAfterPoolExpiry_returns400() {
        Long poolId = registerPool("Notion", 3, today.plusDays(30));

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(ASSIGNMENTS_URL,
            new AssignLicenseRequest(poolId, 10L, "Docs", today, today.plusDays(31)), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(getPool(poolId).availableCount()).isEqualTo(3);
    }

    @Test
    void increaseSeats_addsAvailableSeats() {
        Long poolId = registerPool("Zoom", 1, today.plusYears(1));
        assign(poolId, 10L);

        ResponseEntity<LicensePoolResponse> response = restTemplate.postForEntity(
            POOLS_URL + "/" + poolId + "/seats", new IncreaseSeatsRequest(4), LicensePoolResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().totalCount()).isEqualTo(5);
        assertThat(response.getBody().availableCount()).isEqualTo(4);
        assertCapacityInvariant(poolId);
    }

    @Test
    void registerPool_zeroSeats_returns400() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(POOLS_URL,
            new RegisterLicensePoolRequest("Empty", "Standard", null, 0, PricingModel.MONTHLY,
                BigDecimal.TEN, null, today.plusYears(1), null),
            ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().fieldErrors())
            .extracting(ErrorResponse.FieldError::field)
            .contains("totalCount");
    }

    private void assertCapacityInvariant(Long poolId) {
        Integer active = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM license_assignments WHERE pool_id = ? AND status = 'ACTIVE'",
            Integer.class, poolId);
        LicensePoolResponse pool = getPool(poolId);
        assertThat(pool.availableCount()).isEqualTo(pool.totalCount() - active);
    }

    private Long registerPool(String softwareName, int seats, LocalDate expiry) {
        ResponseEntity<LicensePoolResponse> response = restTemplate.postForEntity(POOLS_URL,
            new RegisterLicensePoolRequest(softwareName, "Business", "Vendor Inc", seats, PricingModel.YEARLY,
                new BigDecimal("120.00"), today.minusMonths(1), expiry, null),
            LicensePoolResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    private ResponseEntity<LicenseAssignmentResponse> assign(Long poolId, Long holderId) {
        ResponseEntity<LicenseAssignmentResponse> response = restTemplate.postForEntity(ASSIGNMENTS_URL,
            new AssignLicenseRequest(poolId, holderId, "Design work", today, null), LicenseAssignmentResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response;
    }

    private <T> ResponseEntity<T> close(Long assignmentId, LicenseAssignmentStatus reason, Class<T> type) {
        return restTemplate.exchange(ASSIGNMENTS_URL + "/" + assignmentId + "/close", HttpMethod.PATCH,
            new HttpEntity<>(new CloseLicenseAssignmentRequest(reason, null)), type);
    }

    private LicensePoolResponse getPool(Long poolId) {
        return restTemplate.getForEntity(POOLS_URL + "/" + poolId, LicensePoolResponse.class).getBody();
    }
}
