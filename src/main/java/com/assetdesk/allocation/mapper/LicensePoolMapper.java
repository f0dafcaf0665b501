package com.assetdesk.allocation.mapper;

import com.assetdesk.allocation.dto.request.RegisterLicensePoolRequest;
import com.assetdesk.allocation.dto.response.LicensePoolResponse;
import com.assetdesk.allocation.entity.LicensePool;

public final class LicensePoolMapper {

    private LicensePoolMapper() {}

    public static LicensePool toEntity(RegisterLicensePoolRequest request) {
        LicensePool pool = new LicensePool();
        pool.setSoftwareName(request.softwareName());
        pool.setLicenseType(request.licenseType());
        pool.setVendorName(request.vendorName());
        pool.setTotalCount(request.totalCount());
        pool.setAvailableCount(request.totalCount());
        pool.setPricingModel(request.pricingModel());
        pool.setUnitPrice(request.unitPrice());
        pool.setPurchaseDate(request.purchaseDate());
        pool.setExpiryDate(request.expiryDate());
        pool.setNotes(request.notes());
        return pool;
    }

    public static LicensePoolResponse toResponse(LicensePool pool) {
        return new LicensePoolResponse(
            pool.getId(),
            pool.getSoftwareName(),
            pool.getLicenseType(),
            pool.getVendorName(),
            pool.getTotalCount(),
            pool.getAvailableCount(),
            pool.getUsedCount(),
            pool.getPricingModel(),
            pool.getUnitPrice(),
            pool.getPurchaseDate(),
            pool.getExpiryDate(),
            pool.getNotes(),
            pool.getCreatedAt(),
            pool.getUpdatedAt()
        );
    }
}
