package com.assetdesk.allocation.repository;

import com.assetdesk.allocation.entity.LicenseAssignment;
import com.assetdesk.allocation.entity.LicenseAssignmentStatus;
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

public interface LicenseAssignmentRepository extends JpaRepository<LicenseAssignment, Long>,
        JpaSpecificationExecutor<LicenseAssignment> {

    boolean existsByPoolIdAndHolderIdAndStatus(Long poolId, Long holderId, LicenseAssignmentStatus status);

    long countByPoolIdAndStatus(Long poolId, LicenseAssignmentStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT a FROM LicenseAssignment a WHERE a.id = :id")
    Optional<LicenseAssignment> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT a FROM LicenseAssignment a JOIN FETCH a.pool WHERE a.id = :id")
    Optional<LicenseAssignment> findByIdWithPool(@Param("id") Long id);

    @Query("SELECT a FROM LicenseAssignment a JOIN FETCH a.pool "
        + "WHERE a.pool.id = :poolId AND a.status = :status ORDER BY a.assignedDate DESC, a.id DESC")
    List<LicenseAssignment> findByPoolIdAndStatus(@Param("poolId") Long poolId,
                                                  @Param("status") LicenseAssignmentStatus status);

    @Query("SELECT a FROM LicenseAssignment a JOIN FETCH a.pool "
        + "WHERE a.holderId = :holderId ORDER BY a.assignedDate DESC, a.id DESC")
    List<LicenseAssignment> findAllByHolderId(@Param("holderId") Long holderId);

    @Query("SELECT a FROM LicenseAssignment a JOIN FETCH a.pool WHERE a.status = :status ORDER BY a.id")
    List<LicenseAssignment> findAllWithPoolByStatus(@Param("status") LicenseAssignmentStatus status);

    @Query("SELECT a FROM LicenseAssignment a JOIN FETCH a.pool WHERE a.idempotencyKey = :key")
    Optional<LicenseAssignment> findByIdempotencyKey(@Param("key") String key);

    /**
     * Ids only, so that the sweep loads each entry for the first time through
     * {@link #findByIdForUpdate(Long)} and decides on locked, current state.
     */
    @Query("SELECT a.id FROM LicenseAssignment a JOIN a.pool p "
        + "WHERE a.status = :status "
        + "AND (p.expiryDate <= :asOf OR (a.endDate IS NOT NULL AND a.endDate <= :asOf)) "
        + "ORDER BY a.id")
    List<Long> findIdsByStatusExpiringOnOrBefore(@Param("status") LicenseAssignmentStatus status,
                                                 @Param("asOf") LocalDate asOf);
}
