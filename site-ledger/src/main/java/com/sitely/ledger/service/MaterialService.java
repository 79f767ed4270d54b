package com.sitely.ledger.service;

import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.exception.RecordNotFoundException;
import com.sitely.ledger.model.Amounts;
import com.sitely.ledger.model.Material;
import com.sitely.ledger.model.MaterialStock;
import com.sitely.ledger.model.MaterialUpdate;
import com.sitely.ledger.model.MaterialUsage;
import com.sitely.ledger.repository.MaterialRepository;
import com.sitely.ledger.repository.MaterialUsageRepository;
import com.sitely.ledger.sync.CloudMirror;
import com.sitely.ledger.sync.MirroredEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.sitely.ledger.service.LedgerStore.newId;
import static com.sitely.ledger.service.LedgerStore.requireAmount;
import static com.sitely.ledger.service.LedgerStore.requireText;

/**
 * Material purchases and their consumption.
 *
 * totalAmount is written with the row and rewritten whenever quantity or
 * rate changes; it is never derived on read.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MaterialService {

    private final StorageInitializer storageInitializer;
    private final LedgerTransactions transactions;
    private final CloudMirror cloudMirror;
    private final Clock clock;
    private final MaterialRepository materialRepository;
    private final MaterialUsageRepository materialUsageRepository;

    public Material createMaterial(Material material) {
        requireText(material.getSiteId(), "Material site");
        requireText(material.getName(), "Material name");
        if (material.getUnit() == null) {
            throw new LedgerConstraintException("Material unit is required");
        }
        BigDecimal quantity = Amounts.quantity(orZero(material.getQuantity()));
        BigDecimal rate = Amounts.money(orZero(material.getRatePerUnit()));
        requireAmount(quantity, "Quantity");
        requireAmount(rate, "Rate per unit");
        requireAmount(orZero(material.getAmountPaid()), "Amount paid");
        storageInitializer.awaitReady();

        Material created = transactions.write(() -> {
            Material toInsert = material.toBuilder()
                    .id(material.getId() == null ? newId() : material.getId())
                    .quantity(quantity)
                    .ratePerUnit(rate)
                    .totalAmount(Material.totalFor(quantity, rate))
                    .amountPaid(Amounts.money(orZero(material.getAmountPaid())))
                    .purchasedAt(material.getPurchasedAt() == null ? clock.instant() : material.getPurchasedAt())
                    .build();
            materialRepository.insert(toInsert);
            return toInsert;
        });
        mirror(MirroredEntity.MATERIAL, created.getId(), created);
        return created;
    }

    public List<Material> listMaterials(String siteId) {
        storageInitializer.awaitReady();
        return materialRepository.findBySiteId(siteId);
    }

    public Optional<Material> findMaterial(String materialId) {
        storageInitializer.awaitReady();
        return materialRepository.findById(materialId);
    }

    public Material updateMaterial(String materialId, MaterialUpdate update) {
        if (update.getQuantity() != null) requireAmount(update.getQuantity(), "Quantity");
        if (update.getRatePerUnit() != null) requireAmount(update.getRatePerUnit(), "Rate per unit");
        if (update.getAmountPaid() != null) requireAmount(update.getAmountPaid(), "Amount paid");
        storageInitializer.awaitReady();

        Material updated = transactions.write(() -> {
            Material current = materialRepository.findById(materialId)
                    .orElseThrow(() -> new RecordNotFoundException(materialRepository.table(), materialId));
            BigDecimal quantity = Amounts.quantity(update.getQuantity());
            BigDecimal rate = Amounts.money(update.getRatePerUnit());
            BigDecimal recomputedTotal = null;
            if (quantity != null || rate != null) {
                recomputedTotal = Material.totalFor(
                        quantity != null ? quantity : current.getQuantity(),
                        rate != null ? rate : current.getRatePerUnit());
            }
            Material changes = Material.builder()
                    .name(update.getName())
                    .vendorName(update.getVendorName())
                    .vendorPhone(update.getVendorPhone())
                    .quantity(quantity)
                    .unit(update.getUnit())
                    .ratePerUnit(rate)
                    .amountPaid(Amounts.money(update.getAmountPaid()))
                    .billPhotoUri(update.getBillPhotoUri())
                    .build();
            materialRepository.update(materialId, changes, recomputedTotal);
            return materialRepository.findById(materialId)
                    .orElseThrow(() -> new RecordNotFoundException(materialRepository.table(), materialId));
        });
        mirror(MirroredEntity.MATERIAL, materialId, updated);
        return updated;
    }

    /** Usages go with the material. */
    public void deleteMaterial(String materialId) {
        storageInitializer.awaitReady();
        transactions.run(() -> {
            if (materialRepository.deleteById(materialId) == 0) {
                throw new RecordNotFoundException(materialRepository.table(), materialId);
            }
        });
    }

    /**
     * Records consumption. Using more than was bought is allowed and shows
     * up as {@link MaterialStock#overConsumed()}.
     */
    public MaterialUsage addMaterialUsage(MaterialUsage usage) {
        requireText(usage.getMaterialId(), "Usage material");
        requireAmount(usage.getQuantityUsed(), "Quantity used");
        storageInitializer.awaitReady();

        MaterialUsage created = transactions.write(() -> {
            Material material = materialRepository.findById(usage.getMaterialId())
                    .orElseThrow(() -> new RecordNotFoundException(materialRepository.table(), usage.getMaterialId()));
            MaterialUsage toInsert = usage.toBuilder()
                    .id(usage.getId() == null ? newId() : usage.getId())
                    .siteId(material.getSiteId())
                    .quantityUsed(Amounts.quantity(usage.getQuantityUsed()))
                    .description(usage.getDescription() == null ? "" : usage.getDescription())
                    .date(usage.getDate() == null ? LocalDate.now(clock) : usage.getDate())
                    .build();
            materialUsageRepository.insert(toInsert);
            return toInsert;
        });
        mirror(MirroredEntity.MATERIAL_USAGE, created.getId(), created);
        return created;
    }

    public List<MaterialUsage> listMaterialUsages(String materialId) {
        storageInitializer.awaitReady();
        return materialUsageRepository.findByMaterialId(materialId);
    }

    public MaterialStock materialStock(String materialId) {
        storageInitializer.awaitReady();
        Material material = materialRepository.findById(materialId)
                .orElseThrow(() -> new RecordNotFoundException(materialRepository.table(), materialId));
        return new MaterialStock(materialId, material.getQuantity(), materialUsageRepository.sumUsed(materialId));
    }

    private void mirror(MirroredEntity kind, String id, Object entity) {
        try {
            cloudMirror.upsert(kind, id, entity);
        } catch (RuntimeException e) {
            log.warn("Cloud mirror upsert of {} {} failed: {}", kind, id, e.getMessage());
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
