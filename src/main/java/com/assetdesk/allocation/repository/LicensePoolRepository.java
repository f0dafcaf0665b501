package com.assetdesk.allocation.repository;

import com.assetdesk.allocation.entity.LicensePool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Optional;

public interface LicensePoolRepository extends JpaRepository<LicensePool, Long>,
        JpaSpecificationExecutor<LicensePool> {

    /**
     * Loads the pool and takes its row lock. The seat counter must only be read for a
     * decision through this method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT p FROM LicensePool p WHERE p.id = :id")
    Optional<LicensePool> findByIdForUpdate(@Param("id") Long id);
}
