package com.assetdesk.allocation.repository;

import com.assetdesk.allocation.entity.DeviceAssignment;
import com.assetdesk.allocation.entity.DeviceAssignmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.List;
import java.util.Optional;

public interface DeviceAssignmentRepository extends JpaRepository<DeviceAssignment, Long>,
        JpaSpecificationExecutor<DeviceAssignment> {

    boolean existsByDeviceIdAndStatus(Long deviceId, DeviceAssignmentStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT a FROM DeviceAssignment a WHERE a.id = :id")
    Optional<DeviceAssignment> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT a FROM DeviceAssignment a JOIN FETCH a.device WHERE a.id = :id")
    Optional<DeviceAssignment> findByIdWithDevice(@Param("id") Long id);

    @Query("SELECT a FROM DeviceAssignment a JOIN FETCH a.device "
        + "WHERE a.device.id = :deviceId AND a.status = :status ORDER BY a.assignedDate DESC, a.id DESC")
    List<DeviceAssignment> findByDeviceIdAndStatus(@Param("deviceId") Long deviceId,
                                                   @Param("status") DeviceAssignmentStatus status);

    @Query("SELECT a FROM DeviceAssignment a JOIN FETCH a.device "
        + "WHERE a.holderId = :holderId ORDER BY a.assignedDate DESC, a.id DESC")
    List<DeviceAssignment> findAllByHolderId(@Param("holderId") Long holderId);

    @Query("SELECT a FROM DeviceAssignment a JOIN FETCH a.device WHERE a.idempotencyKey = :key")
    Optional<DeviceAssignment> findByIdempotencyKey(@Param("key") String key);
}
