package com.flagship.recycling_ledger.catalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Reference catalog of materials and machines.
 *
 * Lookups are case-insensitive and only ever return active records. An unknown or
 * inactive name resolves to {@link Optional#empty()}; callers decide how to report it
 * (the deposit ledger turns it into a client-input rejection).
 *
 * Administrative operations keep history intact: a rate change affects future
 * deposits only, and deactivating a machine leaves its past deposits untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private static final int RATE_SCALE = 2;

    private final MaterialRepository materialRepository;
    private final MachineRepository machineRepository;

    @Transactional(readOnly = true)
    public Optional<Material> lookupMaterial(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return materialRepository.findByNameIgnoreCaseAndActiveTrue(name.trim())
            .map(MaterialEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Machine> lookupMachine(String machineCode) {
        if (machineCode == null || machineCode.isBlank()) {
            return Optional.empty();
        }
        return machineRepository.findByMachineCodeIgnoreCaseAndActiveTrue(machineCode.trim())
            .map(MachineEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Material> listActiveMaterials() {
        return materialRepository.findByActiveTrueOrderByNameAsc().stream()
            .map(MaterialEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Machine> listActiveMachines() {
        return machineRepository.findByActiveTrueOrderByMachineCodeAsc().stream()
            .map(MachineEntity::toDomain)
            .toList();
    }

    /**
     * Registers a new active material.
     *
     * @throws IllegalArgumentException if the name is blank or the rate is not positive
     * @throws IllegalStateException if a material with the same name (any case) exists
     */
    @Transactional
    public Material registerMaterial(String name, BigDecimal pointsPerKg, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Material name is required");
        }
        BigDecimal rate = validateRate(pointsPerKg);
        if (materialRepository.findByNameIgnoreCase(name.trim()).isPresent()) {
            throw new IllegalStateException("Material already exists: " + name.trim());
        }

        MaterialEntity saved = materialRepository.save(MaterialEntity.create(name.trim(), rate, description));
        log.info("Registered material: name={}, pointsPerKg={}", saved.getName(), saved.getPointsPerKg());
        return saved.toDomain();
    }

    /**
     * Changes the reward rate of a material for future deposits.
     */
    @Transactional
    public Material changeMaterialRate(String name, BigDecimal pointsPerKg) {
        BigDecimal rate = validateRate(pointsPerKg);
        MaterialEntity entity = materialRepository.findByNameIgnoreCase(name == null ? "" : name.trim())
            .orElseThrow(() -> new IllegalArgumentException("Material not found: " + name));

        BigDecimal previous = entity.getPointsPerKg();
        entity.changeRate(rate);
        MaterialEntity saved = materialRepository.save(entity);
        log.info("Changed material rate: name={}, from={}, to={}", saved.getName(), previous, rate);
        return saved.toDomain();
    }

    @Transactional
    public Material setMaterialActive(String name, boolean active) {
        MaterialEntity entity = materialRepository.findByNameIgnoreCase(name == null ? "" : name.trim())
            .orElseThrow(() -> new IllegalArgumentException("Material not found: " + name));
        entity.setActive(active);
        log.info("Material {} is now {}", entity.getName(), active ? "active" : "inactive");
        return materialRepository.save(entity).toDomain();
    }

    /**
     * Registers a new active machine.
     *
     * @throws IllegalStateException if the machine code is already taken (any case)
     */
    @Transactional
    public Machine registerMachine(String machineCode, String location, BigDecimal latitude, BigDecimal longitude) {
        if (machineCode == null || machineCode.isBlank()) {
            throw new IllegalArgumentException("Machine id is required");
        }
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Machine location is required");
        }
        if (machineRepository.findByMachineCodeIgnoreCase(machineCode.trim()).isPresent()) {
            throw new IllegalStateException("Machine already exists: " + machineCode.trim());
        }

        MachineEntity saved = machineRepository.save(
            MachineEntity.create(machineCode.trim(), location.trim(), latitude, longitude));
        log.info("Registered machine: machineId={}, location={}", saved.getMachineCode(), saved.getLocation());
        return saved.toDomain();
    }

    @Transactional
    public Machine setMachineActive(String machineCode, boolean active) {
        MachineEntity entity = machineRepository.findByMachineCodeIgnoreCase(machineCode == null ? "" : machineCode.trim())
            .orElseThrow(() -> new IllegalArgumentException("Machine not found: " + machineCode));
        entity.setActive(active);
        log.info("Machine {} is now {}", entity.getMachineCode(), active ? "active" : "inactive");
        return machineRepository.save(entity).toDomain();
    }

    private BigDecimal validateRate(BigDecimal pointsPerKg) {
        if (pointsPerKg == null || pointsPerKg.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Points per kg must be positive");
        }
        if (pointsPerKg.stripTrailingZeros().scale() > RATE_SCALE) {
            throw new IllegalArgumentException("Points per kg supports at most " + RATE_SCALE + " decimal places");
        }
        return pointsPerKg.setScale(RATE_SCALE);
    }
}
