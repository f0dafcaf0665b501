package com.assetdesk.allocation.repository;

import com.assetdesk.allocation.entity.ResourceKind;
import com.assetdesk.allocation.entity.ReturnRequest;
import com.assetdesk.allocation.entity.ReturnRequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Collection;
import java.util.Optional;

public interface ReturnRequestRepository extends JpaRepository<ReturnRequest, Long>,
        JpaSpecificationExecutor<ReturnRequest> {

    boolean existsByRequestTypeAndAssignmentIdAndStatusIn(ResourceKind requestType, Long assignmentId,
                                                          Collection<ReturnRequestStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM ReturnRequest r WHERE r.id = :id")
    Optional<ReturnRequest> findByIdForUpdate(@Param("id") Long id);
}
