package com.spring.fateweaver.domain.campaign;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CampaignRepository extends JpaRepository<Campaign, String> {

    @EntityGraph(attributePaths = {"user"})
    Optional<Campaign> findWithUserById(String id);
}
