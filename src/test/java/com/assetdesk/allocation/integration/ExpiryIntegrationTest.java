package com.assetdesk.allocation.integration;

import com.assetdesk.allocation.dto.request.AssignLicenseRequest;
import com.assetdesk.allocation.dto.request.RegisterDeviceRequest;
import com.assetdesk.allocation.dto.request.RegisterLicensePoolRequest;
import com.assetdesk.allocation.dto.response.AlertResponse;
import com.assetdesk.allocation.dto.response.DeviceResponse;
import com.assetdesk.allocation.dto.response.ErrorResponse;
import com.assetdesk.allocation.dto.response.LicenseAssignmentResponse;
import com.assetdesk.allocation.dto.response.LicensePoolResponse;
import com.assetdesk.allocation.dto.response.SweepResponse;
import com.assetdesk.allocation.entity.DeviceCategory;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
import com.assetdesk.allocation.entity.PricingModel;
import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.service.AlertSeverity;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiryIntegrationTest extends AbstractIntegrationTest {

    private static final String POOLS_URL = "/api/v1/license-pools";
    private static final String ASSIGNMENTS_URL = "/api/v1/license-assignments";
    private static final String EXPIRY_URL = "/api/v1/expiry";

    private final LocalDate today = LocalDate.now(ZoneOffset.UTC);

    @Test
    void poolExpiringTomorrow_alertedThenSweptAfterExpiry() {
        Long poolId = registerPool("Sketch", 3, today.plusDays(1));
        Long assignmentId = restTemplate.postForEntity(ASSIGNMENTS_URL,
            new AssignLicenseRequest(poolId, 10L, "UI mockups", today, null),
            LicenseAssignmentResponse.class).getBody().id();

        // ALERTS
        ResponseEntity<AlertResponse[]> alerts = restTemplate.getForEntity(
            EXPIRY_URL + "/alerts?asOf=" + today, AlertResponse[].class);
        assertThat(alerts.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(alerts.getBody()).hasSize(1);
        AlertResponse alert = alerts.getBody()[0];
        assertThat(alert.resourceKind()).isEqualTo(ResourceKind.LICENSE);
        assertThat(alert.assignmentId()).isEqualTo(assignmentId);
        assertThat(alert.daysUntilExpiry()).isEqualTo(1);
        assertThat(alert.severity()).isEqualTo(AlertSeverity.CRITICAL);

        // SWEEP
        ResponseEntity<SweepResponse> sweep = restTemplate.postForEntity(
            EXPIRY_URL + "/sweep?asOf=" + today.plusDays(2), null, SweepResponse.class);
        assertThat(sweep.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(sweep.getBody().expiredCount()).isEqualTo(1);
        assertThat(sweep.getBody().expired().get(0).status()).isEqualTo(LicenseAssignmentStatus.EXPIRED);

        LicensePoolResponse pool = restTemplate.getForEntity(POOLS_URL + "/" + poolId, LicensePoolResponse.class).getBody();
        assertThat(pool.availableCount()).isEqualTo(3);

        // Second sweep changes nothing
        ResponseEntity<SweepResponse> again = restTemplate.postForEntity(
            EXPIRY_URL + "/sweep?asOf=" + today.plusDays(2), null, SweepResponse.class);
        assertThat(again.getBody().expiredCount()).isZero();
        pool = restTemplate.getForEntity(POOLS_URL + "/" + poolId, LicensePoolResponse.class).getBody();
        assertThat(pool.availableCount()).isEqualTo(3);
    }

    @Test
    void sweepBeforeExpiry_leavesSeatActive() {
        Long poolId = registerPool("Loom", 2, today.plusDays(10));
        restTemplate.postForEntity(ASSIGNMENTS_URL,
            new AssignLicenseRequest(poolId, 10L, "Async demos", today, null), LicenseAssignmentResponse.class);

        ResponseEntity<SweepResponse> sweep = restTemplate.postForEntity(
            EXPIRY_URL + "/sweep?asOf=" + today, null, SweepResponse.class);

        assertThat(sweep.getBody().expiredCount()).isZero();
        Integer active = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM license_assignments WHERE pool_id = ? AND status = 'ACTIVE'",
            Integer.class, poolId);
        assertThat(active).isEqualTo(1);
    }

    @Test
    void alerts_includeDeviceWarrantyWithinHorizon() {
        restTemplate.postForEntity("/api/v1/devices",
            new RegisterDeviceRequest(DeviceCategory.TABLET, "Samsung", "Galaxy Tab S9", "SGT-S9-0001",
                today.minusYears(2), today.plusDays(20), null),
            DeviceResponse.class);

        ResponseEntity<AlertResponse[]> alerts = restTemplate.getForEntity(
            EXPIRY_URL + "/alerts?asOf=" + today + "&horizonDays=30", AlertResponse[].class);

        assertThat(alerts.getBody()).hasSize(1);
        assertThat(alerts.getBody()[0].resourceKind()).isEqualTo(ResourceKind.DEVICE);
        assertThat(alerts.getBody()[0].severity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(alerts.getBody()[0].label()).endsWith("warranty");
    }

    @Test
    void assign_expiredPool_returns400() {
        Long poolId = registerPool("Legacy Tool", 2, today.minusDays(1));

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(ASSIGNMENTS_URL,
            new AssignLicenseRequest(poolId, 10L, "Maintenance", today.minusDays(5), null), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).contains("expired");
    }

    @Test
    void alerts_negativeHorizon_returns400() {
        ResponseEntity<ErrorResponse> response = restTemplate.getForEntity(
            EXPIRY_URL + "/alerts?horizonDays=-1", ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    private Long registerPool(String softwareName, int seats, LocalDate expiry) {
        return restTemplate.postForEntity(POOLS_URL,
            new RegisterLicensePoolRequest(softwareName, "Team", null, seats, PricingModel.MONTHLY,
                new BigDecimal("9.00"), null, expiry, null),
            LicensePoolResponse.class).getBody().id();
    }
}
