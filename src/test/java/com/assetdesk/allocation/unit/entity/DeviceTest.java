package com.assetdesk.allocation.unit.entity;

import com.assetdesk.allocation.entity.Device;
import com.assetdesk.allocation.entity.DeviceStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceTest {

    @Test
    void tryClaim_onlyFromAvailable() {
        Device device = new Device();

        assertThat(device.tryClaim()).isTrue();
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.ASSIGNED);
        assertThat(device.tryClaim()).isFalse();
    }

    @Test
    void release_fromMaintenance_keepsMaintenance() {
        Device device = new Device();
        device.setStatus(DeviceStatus.MAINTENANCE);

        device.release();

        assertThat(device.getStatus()).isEqualTo(DeviceStatus.MAINTENANCE);
    }
}
