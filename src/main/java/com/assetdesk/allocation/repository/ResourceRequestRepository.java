package com.assetdesk.allocation.repository;

import com.assetdesk.allocation.entity.ResourceRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Optional;

public interface ResourceRequestRepository extends JpaRepository<ResourceRequest, Long>,
        JpaSpecificationExecutor<ResourceRequest> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM ResourceRequest r WHERE r.id = :id")
    Optional<ResourceRequest> findByIdForUpdate(@Param("id") Long id);
}
