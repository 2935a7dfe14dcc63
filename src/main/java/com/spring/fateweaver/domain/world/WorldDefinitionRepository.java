package com.spring.fateweaver.domain.world;

import org.springframework.data.jpa.repository.JpaRepository;

public interface WorldDefinitionRepository extends JpaRepository<WorldDefinition, String> {
}
