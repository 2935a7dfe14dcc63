package com.spring.fateweaver.domain.usage;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ModelUsageRepository extends JpaRepository<ModelUsage, Long> {

    Optional<ModelUsage> findByUserIdAndModelKey(Long userId, String modelKey);

    List<ModelUsage> findAllByUserId(Long userId);
}
