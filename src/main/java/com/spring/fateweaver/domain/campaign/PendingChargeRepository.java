package com.spring.fateweaver.domain.campaign;

import com.spring.fateweaver.domain.enums.ChargeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PendingChargeRepository extends JpaRepository<PendingCharge, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PendingCharge p where p.id = :id")
    Optional<PendingCharge> findByIdForUpdate(@Param("id") Long id);

    List<PendingCharge> findTop50ByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(ChargeStatus status, LocalDateTime before);
}
