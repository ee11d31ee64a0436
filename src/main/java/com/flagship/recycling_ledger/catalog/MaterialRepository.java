package com.flagship.recycling_ledger.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MaterialRepository extends JpaRepository<MaterialEntity, UUID> {

    Optional<MaterialEntity> findByNameIgnoreCaseAndActiveTrue(String name);

    Optional<MaterialEntity> findByNameIgnoreCase(String name);

    List<MaterialEntity> findByActiveTrueOrderByNameAsc();

    long countByActiveTrue();
}
