package com.assetdesk.allocation.dto.request;

import com.assetdesk.allocation.entity.PricingModel;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RegisterLicensePoolRequest(

    @NotBlank(message = "Software name must not be blank")
    @Size(max = 200, message = "Software name must not exceed 200 characters")
    String softwareName,

    @NotBlank(message = "License type must not be blank")
    @Size(max = 100, message = "License type must not exceed 100 characters")
    String licenseType,

    @Size(max = 200, message = "Vendor name must not exceed 200 characters")
    String vendorName,

    @NotNull(message = "Total count is required")
    @Min(value = 1, message = "Total count must be at least 1")
    Integer totalCount,

    @NotNull(message = "Pricing model is required")
    PricingModel pricingModel,

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.00", message = "Unit price must not be negative")
    @Digits(integer = 8, fraction = 2, message = "Unit price must have at most 8 integer and 2 fraction digits")
    BigDecimal unitPrice,

    LocalDate purchaseDate,

    @NotNull(message = "Expiry date is required")
    LocalDate expiryDate,

    @Size(max = 10000, message = "Notes must not exceed 10000 characters")
    String notes
) {}
