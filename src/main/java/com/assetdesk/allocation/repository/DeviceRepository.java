package com.assetdesk.allocation.repository;

import com.assetdesk.allocation.entity.Device;
import com.assetdesk.allocation.entity.DeviceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DeviceRepository extends JpaRepository<Device, Long>, JpaSpecificationExecutor<Device> {

    boolean existsBySerialNumber(String serialNumber);

    /**
     * Loads the device and takes its row lock ({@code SELECT ... FOR UPDATE}). Every status
     * change goes through this method so that changes to one device are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT d FROM Device d WHERE d.id = :id")
    Optional<Device> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT d FROM Device d WHERE d.status <> :excluded AND d.warrantyExpiry <= :until "
        + "ORDER BY d.warrantyExpiry, d.id")
    List<Device> findWarrantyExpiringOnOrBefore(@Param("until") LocalDate until,
                                                @Param("excluded") DeviceStatus excluded);
}
