package com.assetdesk.allocation.dto.response;

import com.assetdesk.allocation.entity.PricingModel;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record LicensePoolResponse(
    Long id,
    String softwareName,
    String licenseType,
    String vendorName,
    int totalCount,
    int availableCount,
    int usedCount,
    PricingModel pricingModel,
    BigDecimal unitPrice,
    LocalDate purchaseDate,
    LocalDate expiryDate,
    String notes,
    Instant createdAt,
    Instant updatedAt
) {}
