package com.assetdesk.allocation.mapper;

import com.assetdesk.allocation.dto.request.RegisterDeviceRequest;
import com.assetdesk.allocation.dto.response.DeviceResponse;
import com.assetdesk.allocation.entity.Device;
import com.assetdesk.allocation.entity.DeviceStatus;

public final class DeviceMapper {

    private DeviceMapper() {}

    public static Device toEntity(RegisterDeviceRequest request) {
        Device device = new Device();
        device.setCategory(request.category());
        device.setManufacturer(request.manufacturer());
        device.setModel(request.model());
        device.setSerialNumber(request.serialNumber());
        device.setPurchaseDate(request.purchaseDate());
        device.setWarrantyExpiry(request.warrantyExpiry());
        device.setNotes(request.notes());
        device.setStatus(DeviceStatus.AVAILABLE);
        return device;
    }

    public static DeviceResponse toResponse(Device device) {
        return new DeviceResponse(
            device.getId(),
            device.getCategory(),
            device.getManufacturer(),
            device.getModel(),
            device.getSerialNumber(),
            device.getPurchaseDate(),
            device.getWarrantyExpiry(),
            device.getStatus(),
            device.getNotes(),
            device.getCreatedAt(),
            device.getUpdatedAt()
        );
    }
}
