package com.flagship.recycling_ledger.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MachineRepository extends JpaRepository<MachineEntity, UUID> {

    Optional<MachineEntity> findByMachineCodeIgnoreCaseAndActiveTrue(String machineCode);

    Optional<MachineEntity> findByMachineCodeIgnoreCase(String machineCode);

    List<MachineEntity> findByActiveTrueOrderByMachineCodeAsc();

    long countByActiveTrue();
}
