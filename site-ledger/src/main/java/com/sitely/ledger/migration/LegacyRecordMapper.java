package com.sitely.ledger.migration;

import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.migration.legacy.LegacyLedgerEntry;
import com.sitely.ledger.migration.legacy.LegacyMaterial;
import com.sitely.ledger.migration.legacy.LegacyMaterialUsage;
import com.sitely.ledger.migration.legacy.LegacyPhoto;
import com.sitely.ledger.migration.legacy.LegacySite;
import com.sitely.ledger.migration.legacy.LegacyWorker;
import com.sitely.ledger.model.Amounts;
import com.sitely.ledger.model.ExpenseRecord;
import com.sitely.ledger.model.Material;
import com.sitely.ledger.model.MaterialUnit;
import com.sitely.ledger.model.MaterialUsage;
import com.sitely.ledger.model.PaymentMethod;
import com.sitely.ledger.model.PaymentRecord;
import com.sitely.ledger.model.Photo;
import com.sitely.ledger.model.Site;
import com.sitely.ledger.model.SiteType;
import com.sitely.ledger.model.WageRecord;
import com.sitely.ledger.model.Worker;
import com.sitely.ledger.model.WorkerCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Maps legacy JSON elements to the relational domain model. Legacy ids are
 * kept as they are so re-running the migration finds rows it already wrote.
 *
 * Anything that cannot be mapped faithfully throws; the engine logs and
 * skips that one record.
 */
@Component
@RequiredArgsConstructor
public class LegacyRecordMapper {

    private final Clock clock;

    public Site toSite(LegacySite raw) {
        boolean running = raw.getRunning() == null || raw.getRunning();
        return Site.builder()
                .id(required(raw.getId(), "id"))
                .name(required(raw.getName(), "name"))
                .type(SiteType.fromCode(raw.getType()))
                .location(nullToEmpty(raw.getLocation()))
                .startDate(optionalDate(raw.getStartDate()))
                .endDate(running ? null : optionalDate(raw.getEndDate()))
                .running(running)
                .ownerName(nullToEmpty(raw.getOwnerName()))
                .contact(nullToEmpty(raw.getContact()))
                .siteCode(blankToNull(raw.getSiteCode()) == null ? null : raw.getSiteCode().trim().toUpperCase(Locale.ROOT))
                .createdAt(instantOrNow(raw.getCreatedAt()))
                .build();
    }

    public Worker toWorker(LegacyWorker raw) {
        return Worker.builder()
                .id(required(raw.getId(), "id"))
                .siteId(required(raw.getSiteId(), "siteId"))
                .name(required(raw.getName(), "name"))
                .age(nullToEmpty(raw.getAge()))
                .contact(nullToEmpty(raw.getContact()))
                .village(nullToEmpty(raw.getVillage()))
                .category(WorkerCategory.fromCode(raw.getCategory()))
                .photoUri(blankToNull(raw.getPhotoUri()))
                .joiningDate(raw.getJoiningDate() == null ? LocalDate.now(clock) : date(raw.getJoiningDate()))
                .build();
    }

    public WageRecord toWage(LegacyLedgerEntry raw) {
        return WageRecord.builder()
                .id(required(raw.getId(), "id"))
                .siteId(required(raw.getSiteId(), "siteId"))
                .workerId(required(raw.getWorkerId(), "workerId"))
                .workerName(nullToEmpty(raw.getWorkerName()))
                .workerCategory(WorkerCategory.fromCode(raw.getWorkerCategory()))
                .amount(amount(raw.getAmount()))
                .overtime(raw.getOvertime() == null ? BigDecimal.ZERO : raw.getOvertime())
                .date(date(raw.getDate()))
                .time(nullToEmpty(raw.getTime()))
                .build();
    }

    public ExpenseRecord toExpense(LegacyLedgerEntry raw) {
        return ExpenseRecord.builder()
                .id(required(raw.getId(), "id"))
                .siteId(required(raw.getSiteId(), "siteId"))
                .workerId(required(raw.getWorkerId(), "workerId"))
                .workerName(nullToEmpty(raw.getWorkerName()))
                .workerCategory(WorkerCategory.fromCode(raw.getWorkerCategory()))
                .description(nullToEmpty(raw.getDescription()))
                .amount(amount(raw.getAmount()))
                .date(date(raw.getDate()))
                .time(nullToEmpty(raw.getTime()))
                .build();
    }

    public PaymentRecord toPayment(LegacyLedgerEntry raw) {
        return PaymentRecord.builder()
                .id(required(raw.getId(), "id"))
                .siteId(required(raw.getSiteId(), "siteId"))
                .workerId(required(raw.getWorkerId(), "workerId"))
                .workerName(nullToEmpty(raw.getWorkerName()))
                .workerCategory(WorkerCategory.fromCode(raw.getWorkerCategory()))
                .amount(amount(raw.getAmount()))
                .method(PaymentMethod.fromCode(raw.getMethod()))
                .date(date(raw.getDate()))
                .time(nullToEmpty(raw.getTime()))
                .build();
    }

    public Photo toPhoto(LegacyPhoto raw) {
        return Photo.builder()
                .id(required(raw.getId(), "id"))
                .siteId(required(raw.getSiteId(), "siteId"))
                .groupId(blankToNull(raw.getGroupId()))
                .uri(required(raw.getUri(), "uri"))
                .description(nullToEmpty(raw.getDescription()))
                .date(date(raw.getDate()))
                .time(nullToEmpty(raw.getTime()))
                .build();
    }

    /**
     * @param bucketSiteId site id taken from the legacy key, used when the element lacks one
     */
    public Material toMaterial(LegacyMaterial raw, String bucketSiteId) {
        String siteId = blankToNull(raw.getSiteId()) != null ? raw.getSiteId() : bucketSiteId;
        BigDecimal quantity = Amounts.quantity(raw.getQuantity() == null ? BigDecimal.ZERO : raw.getQuantity());
        BigDecimal rate = Amounts.money(raw.getRatePerUnit() == null ? BigDecimal.ZERO : raw.getRatePerUnit());
        return Material.builder()
                .id(required(raw.getId(), "id"))
                .siteId(required(siteId, "siteId"))
                .name(required(raw.getName(), "name"))
                .vendorName(nullToEmpty(raw.getVendorName()))
                .vendorPhone(nullToEmpty(raw.getVendorPhone()))
                .quantity(quantity)
                .unit(MaterialUnit.fromCode(raw.getUnit()))
                .ratePerUnit(rate)
                .totalAmount(Material.totalFor(quantity, rate))
                .amountPaid(Amounts.money(raw.getAmountPaid() == null ? BigDecimal.ZERO : raw.getAmountPaid()))
                .billPhotoUri(blankToNull(raw.getBillPhotoUrl()))
                .purchasedAt(instantOrNow(raw.getPurchasedAt()))
                .build();
    }

    public MaterialUsage toMaterialUsage(LegacyMaterialUsage raw, String bucketSiteId, String bucketMaterialId) {
        String siteId = blankToNull(raw.getSiteId()) != null ? raw.getSiteId() : bucketSiteId;
        String materialId = blankToNull(raw.getMaterialId()) != null ? raw.getMaterialId() : bucketMaterialId;
        return MaterialUsage.builder()
                .id(required(raw.getId(), "id"))
                .materialId(required(materialId, "materialId"))
                .siteId(required(siteId, "siteId"))
                .quantityUsed(amount(raw.getQuantityUsed()))
                .description(nullToEmpty(raw.getDescription()))
                .date(date(raw.getDate()))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Legacy dates are "yyyy-MM-dd" or full ISO timestamps; only the day counts.
     */
    LocalDate date(String value) {
        String raw = required(value, "date").trim();
        try {
            return LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
        } catch (DateTimeParseException e) {
            throw new LedgerConstraintException("Unparseable legacy date: " + value, e);
        }
    }

    private LocalDate optionalDate(String value) {
        return blankToNull(value) == null ? null : date(value);
    }

    private Instant instantOrNow(String value) {
        if (blankToNull(value) == null) {
            return clock.instant();
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            return date(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
    }

    private static BigDecimal amount(BigDecimal value) {
        if (value == null) {
            throw new LedgerConstraintException("Legacy record has no amount");
        }
        if (value.signum() < 0) {
            throw new LedgerConstraintException("Legacy record has a negative amount: " + value);
        }
        return value;
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new LedgerConstraintException("Legacy record is missing " + field);
        }
        return value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }
}
