package com.spring.fateweaver.domain.campaign;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TranscriptEntryRepository extends JpaRepository<TranscriptEntry, Long> {

    Page<TranscriptEntry> findByCampaign_Id(String campaignId, Pageable pageable);

    long countByCampaign_Id(String campaignId);
}
