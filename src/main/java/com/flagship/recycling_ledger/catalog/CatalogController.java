package com.flagship.recycling_ledger.catalog;

import com.flagship.recycling_ledger.catalog.dto.ActivationRequest;
import com.flagship.recycling_ledger.catalog.dto.ChangeRateRequest;
import com.flagship.recycling_ledger.catalog.dto.MachineResponse;
import com.flagship.recycling_ledger.catalog.dto.MaterialResponse;
import com.flagship.recycling_ledger.catalog.dto.RegisterMachineRequest;
import com.flagship.recycling_ledger.catalog.dto.RegisterMaterialRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Catalog endpoints: public listing of active materials and machines, plus the
 * administrative operations. Access control for /api/admin is enforced upstream.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;

    @GetMapping("/materials")
    public List<MaterialResponse> listMaterials() {
        return catalogService.listActiveMaterials().stream()
            .map(MaterialResponse::from)
            .toList();
    }

    @GetMapping("/machines")
    public List<MachineResponse> listMachines() {
        return catalogService.listActiveMachines().stream()
            .map(MachineResponse::from)
            .toList();
    }

    @PostMapping("/admin/materials")
    public ResponseEntity<MaterialResponse> registerMaterial(@Valid @RequestBody RegisterMaterialRequest request) {
        Material material = catalogService.registerMaterial(
            request.getName(), request.getPointsPerKg(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(MaterialResponse.from(material));
    }

    @PutMapping("/admin/materials/{name}/rate")
    public MaterialResponse changeMaterialRate(@PathVariable("name") String name,
                                               @Valid @RequestBody ChangeRateRequest request) {
        return MaterialResponse.from(catalogService.changeMaterialRate(name, request.getPointsPerKg()));
    }

    @PutMapping("/admin/materials/{name}/active")
    public MaterialResponse setMaterialActive(@PathVariable("name") String name,
                                              @Valid @RequestBody ActivationRequest request) {
        return MaterialResponse.from(catalogService.setMaterialActive(name, request.getActive()));
    }

    @PostMapping("/admin/machines")
    public ResponseEntity<MachineResponse> registerMachine(@Valid @RequestBody RegisterMachineRequest request) {
        Machine machine = catalogService.registerMachine(
            request.getMachineId(), request.getLocation(), request.getLatitude(), request.getLongitude());
        return ResponseEntity.status(HttpStatus.CREATED).body(MachineResponse.from(machine));
    }

    @PutMapping("/admin/machines/{machineId}/active")
    public MachineResponse setMachineActive(@PathVariable("machineId") String machineId,
                                            @Valid @RequestBody ActivationRequest request) {
        return MachineResponse.from(catalogService.setMachineActive(machineId, request.getActive()));
    }
}
