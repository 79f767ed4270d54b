package com.sitely.ledger.service;

import com.sitely.ledger.InMemoryLegacyStore;
import com.sitely.ledger.TestLedger;
import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.exception.RecordNotFoundException;
import com.sitely.ledger.model.ExpenseRecord;
import com.sitely.ledger.model.Material;
import com.sitely.ledger.model.MaterialUnit;
import com.sitely.ledger.model.MaterialUsage;
import com.sitely.ledger.model.PaymentMethod;
import com.sitely.ledger.model.PaymentRecord;
import com.sitely.ledger.model.Photo;
import com.sitely.ledger.model.PhotoGroup;
import com.sitely.ledger.model.Site;
import com.sitely.ledger.model.SiteType;
import com.sitely.ledger.model.SiteUpdate;
import com.sitely.ledger.model.WageRecord;
import com.sitely.ledger.model.Worker;
import com.sitely.ledger.model.WorkerCategory;
import com.sitely.ledger.model.WorkerTotals;
import com.sitely.ledger.model.WorkerUpdate;
import com.sitely.ledger.sync.CloudMirror;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class LedgerStoreTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 6, 15);

    private TestLedger ledger;
    private LedgerStore store;

    @BeforeEach
    void setUp() {
        ledger = new TestLedger();
        store = ledger.ledgerStore;
    }

    @Test
    @DisplayName("wage 500 + overtime 50, expense 100, payment 300 leaves 150 remaining")
    void workerTotalsScenario() {
        Site site = newSite("Shivaji Nagar");
        Worker worker = newWorker(site, "Ramesh");

        store.addWageRecords(List.of(wage(site, worker, "500", "50", TODAY)));
        store.addExpenseRecords(List.of(expense(site, worker, "100", TODAY)));
        store.addPayment(payment(site, worker, "300", TODAY));

        WorkerTotals totals = store.workerTotals(site.getId(), worker.getId());
        assertThat(totals.totalWage()).isEqualByComparingTo("550");
        assertThat(totals.totalExpense()).isEqualByComparingTo("100");
        assertThat(totals.totalPaid()).isEqualByComparingTo("300");
        assertThat(totals.remaining()).isEqualByComparingTo("150");
    }

    @Test
    @DisplayName("deleting a site removes every dependent row of that site and nothing of another")
    void deleteSiteCascadesAndIsolates() {
        Site doomed = newSite("Doomed");
        Site other = newSite("Other");
        for (Site site : List.of(doomed, other)) {
            Worker worker = newWorker(site, "Worker of " + site.getName());
            store.addWageRecords(List.of(wage(site, worker, "400", "0", TODAY)));
            store.addExpenseRecords(List.of(expense(site, worker, "50", TODAY)));
            store.addPayment(payment(site, worker, "100", TODAY));
            Material cement = ledger.materialService.createMaterial(Material.builder()
                    .siteId(site.getId()).name("Cement").unit(MaterialUnit.BAG)
                    .quantity(new BigDecimal("10")).ratePerUnit(new BigDecimal("380")).build());
            ledger.materialService.addMaterialUsage(MaterialUsage.builder()
                    .materialId(cement.getId()).quantityUsed(new BigDecimal("2")).build());
            PhotoGroup group = ledger.photoService.createPhotoGroup(site.getId(), "Slab");
            ledger.photoService.addPhoto(Photo.builder()
                    .siteId(site.getId()).groupId(group.getId()).uri("file:///slab.jpg").build());
        }
        Worker doomedWorker = store.listWorkers(doomed.getId()).get(0);

        store.deleteSite(doomed.getId());

        assertThat(store.findSite(doomed.getId())).isEmpty();
        assertThat(store.listWorkers(doomed.getId())).isEmpty();
        assertThat(store.listWageRecords(doomed.getId())).isEmpty();
        assertThat(store.listExpenseRecords(doomed.getId())).isEmpty();
        assertThat(store.listPayments(doomed.getId())).isEmpty();
        assertThat(ledger.materialService.listMaterials(doomed.getId())).isEmpty();
        assertThat(ledger.rowCount("material_usages", doomed.getId())).isZero();
        assertThat(ledger.photoService.listPhotos(doomed.getId())).isEmpty();
        assertThat(ledger.photoService.listPhotoGroups(doomed.getId())).isEmpty();

        WorkerTotals totals = store.workerTotals(doomed.getId(), doomedWorker.getId());
        assertThat(totals.totalWage()).isEqualByComparingTo("0");
        assertThat(totals.remaining()).isEqualByComparingTo("0");

        assertThat(store.listWorkers(other.getId())).hasSize(1);
        assertThat(store.listWageRecords(other.getId())).hasSize(1);
        assertThat(store.listExpenseRecords(other.getId())).hasSize(1);
        assertThat(store.listPayments(other.getId())).hasSize(1);
        assertThat(ledger.materialService.listMaterials(other.getId())).hasSize(1);
        assertThat(ledger.rowCount("material_usages", other.getId())).isEqualTo(1);
        assertThat(ledger.photoService.listPhotos(other.getId())).hasSize(1);
        assertThat(ledger.photoService.listPhotoGroups(other.getId())).hasSize(1);
    }

    @Test
    @DisplayName("remaining does not depend on the order rows were written in")
    void totalsAreOrderIndependent() {
        Random random = new Random(42);
        BigDecimal expected = null;

        for (int round = 0; round < 5; round++) {
            TestLedger fresh = new TestLedger();
            Site site = fresh.ledgerStore.createSite(Site.builder()
                    .name("Round " + round).type(SiteType.RESIDENTIAL).running(true).build());
            Worker worker = fresh.ledgerStore.createWorker(Worker.builder()
                    .siteId(site.getId()).name("Suresh").category(WorkerCategory.UNSKILLED).build());

            List<Runnable> writes = new ArrayList<>();
            for (int day = 1; day <= 6; day++) {
                LocalDate date = TODAY.minusDays(day);
                writes.add(() -> fresh.ledgerStore.addWageRecords(List.of(wage(site, worker, "450", "25", date))));
                writes.add(() -> fresh.ledgerStore.addExpenseRecords(List.of(expense(site, worker, "60", date))));
                writes.add(() -> fresh.ledgerStore.addPayment(payment(site, worker, "200", date)));
            }
            Collections.shuffle(writes, random);
            writes.forEach(Runnable::run);

            BigDecimal remaining = fresh.ledgerStore.workerTotals(site.getId(), worker.getId()).remaining();
            // 6 * (475 - 60 - 200)
            assertThat(remaining).isEqualByComparingTo("1290");
            if (expected != null) {
                assertThat(remaining).isEqualByComparingTo(expected);
            }
            expected = remaining;
        }
    }

    @Test
    @DisplayName("ledger reads and totals skip rows older than the retention horizon")
    void retentionFilteredReads() {
        Site site = newSite("Old site");
        Worker worker = newWorker(site, "Ganesh");
        LocalDate cutoff = ledger.retentionPolicy.cutoff();

        store.addWageRecords(List.of(
                wage(site, worker, "300", "0", cutoff.minusDays(1)),
                wage(site, worker, "700", "0", cutoff)));
        store.addPayment(payment(site, worker, "100", cutoff.minusYears(1)));

        assertThat(store.listWageRecords(site.getId()))
                .extracting(WageRecord::getDate)
                .containsExactly(cutoff);
        assertThat(store.listPayments(site.getId())).isEmpty();

        WorkerTotals totals = store.workerTotals(site.getId(), worker.getId());
        assertThat(totals.totalWage()).isEqualByComparingTo("700");
        assertThat(totals.totalPaid()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("ledger rows keep the worker snapshot after the worker is renamed or deleted")
    void snapshotSurvivesWorkerChanges() {
        Site site = newSite("Snapshot");
        Worker worker = newWorker(site, "Mahesh");
        store.addWageRecords(List.of(wage(site, worker, "500", "0", TODAY)));

        store.updateWorker(worker.getId(), WorkerUpdate.builder()
                .name("Mahesh Patil").category(WorkerCategory.UNSKILLED).build());
        assertThat(store.listWageRecords(site.getId()).get(0).getWorkerName()).isEqualTo("Mahesh");
        assertThat(store.listWageRecords(site.getId()).get(0).getWorkerCategory()).isEqualTo(WorkerCategory.SKILLED);

        store.deleteWorker(worker.getId());
        assertThat(store.listWageRecords(site.getId())).hasSize(1);
        assertThat(store.workerTotals(site.getId(), worker.getId()).totalWage()).isEqualByComparingTo("500");
    }

    @Test
    @DisplayName("site-wide totals group every live ledger row by worker")
    void workerTotalsForSite() {
        Site site = newSite("Grouped");
        Worker a = newWorker(site, "A");
        Worker b = newWorker(site, "B");
        store.addWageRecords(List.of(wage(site, a, "100", "10", TODAY), wage(site, b, "200", "0", TODAY)));
        store.addPayment(payment(site, b, "50", TODAY));

        Map<String, WorkerTotals> totals = store.workerTotalsForSite(site.getId());

        assertThat(totals).containsOnlyKeys(a.getId(), b.getId());
        assertThat(totals.get(a.getId()).remaining()).isEqualByComparingTo("110");
        assertThat(totals.get(b.getId()).remaining()).isEqualByComparingTo("150");
    }

    @Test
    @DisplayName("a wage batch is stored whole or not at all")
    void wageBatchIsAtomic() {
        Site site = newSite("Batch");
        Worker worker = newWorker(site, "Vijay");
        WageRecord good = wage(site, worker, "500", "0", TODAY);
        WageRecord unknownWorker = WageRecord.builder()
                .siteId(site.getId()).workerId("no-such-worker")
                .amount(new BigDecimal("500")).date(TODAY).build();

        assertThatThrownBy(() -> store.addWageRecords(List.of(good, unknownWorker)))
                .isInstanceOf(LedgerConstraintException.class);
        assertThat(store.listWageRecords(site.getId())).isEmpty();
    }

    @Test
    @DisplayName("negative amounts and unknown sites are rejected")
    void constraintViolations() {
        Site site = newSite("Checks");
        Worker worker = newWorker(site, "Anil");

        assertThatThrownBy(() -> store.addPayment(payment(site, worker, "-1", TODAY)))
                .isInstanceOf(LedgerConstraintException.class);
        assertThatThrownBy(() -> store.createWorker(Worker.builder()
                .siteId("missing-site").name("Ghost").category(WorkerCategory.SKILLED).build()))
                .isInstanceOf(LedgerConstraintException.class);
    }

    @Test
    @DisplayName("payments default to cash and fill date, time and id")
    void paymentDefaults() {
        Site site = newSite("Defaults");
        Worker worker = newWorker(site, "Prakash");

        PaymentRecord stored = store.addPayment(PaymentRecord.builder()
                .siteId(site.getId()).workerId(worker.getId()).amount(new BigDecimal("250")).build());

        assertThat(stored.getId()).isNotBlank();
        assertThat(stored.getMethod()).isEqualTo(PaymentMethod.CASH);
        assertThat(stored.getDate()).isEqualTo(TODAY);
        assertThat(stored.getTime()).isEqualTo("10:00");
        assertThat(stored.getWorkerName()).isEqualTo("Prakash");
        assertThat(store.listPayments(site.getId(), worker.getId()))
                .extracting(PaymentRecord::getId)
                .containsExactly(stored.getId());
    }

    @Test
    @DisplayName("listSites returns the user's sites plus unowned ones")
    void perUserVisibility() {
        Site mine = store.createSite(site("Mine").userId("user-1").build());
        Site theirs = store.createSite(site("Theirs").userId("user-2").build());
        Site legacy = store.createSite(site("Legacy").build());

        assertThat(store.listSites("user-1")).extracting(Site::getId)
                .containsExactlyInAnyOrder(mine.getId(), legacy.getId());
        assertThat(store.listSites(null)).extracting(Site::getId)
                .containsExactlyInAnyOrder(mine.getId(), theirs.getId(), legacy.getId());
    }

    @Test
    @DisplayName("site codes are assigned on create and found case-insensitively")
    void siteCodeLookup() {
        Site site = newSite("Coded");

        assertThat(site.getSiteCode()).matches("[A-Z0-9]{6}");
        assertThat(store.findSiteByCode(site.getSiteCode().toLowerCase()).map(Site::getId))
                .contains(site.getId());
    }

    @Test
    @DisplayName("marking a site running again clears its end date")
    void updateSiteRunningClearsEndDate() {
        Site site = store.createSite(site("Finished").running(false).endDate(TODAY.minusDays(3)).build());
        assertThat(site.getEndDate()).isEqualTo(TODAY.minusDays(3));

        Site reopened = store.updateSite(site.getId(), SiteUpdate.builder().running(true).build());

        assertThat(reopened.isRunning()).isTrue();
        assertThat(reopened.getEndDate()).isNull();
    }

    @Test
    @DisplayName("a supplied site code is upper-cased, must be six of A-Z0-9 and must be free")
    void suppliedSiteCodes() {
        Site first = store.createSite(site("First").siteCode("abc123").build());
        assertThat(first.getSiteCode()).isEqualTo("ABC123");

        assertThatThrownBy(() -> store.createSite(site("Second").siteCode("ABC123").build()))
                .isInstanceOf(LedgerConstraintException.class)
                .hasMessageContaining("already in use");
        assertThatThrownBy(() -> store.createSite(site("Third").siteCode("hello world!").build()))
                .isInstanceOf(LedgerConstraintException.class);
        assertThatThrownBy(() -> store.createSite(site("Fourth").siteCode("AB12").build()))
                .isInstanceOf(LedgerConstraintException.class);

        assertThat(store.listSites(null)).hasSize(1);
        assertThat(store.findSiteByCode("abc123").map(Site::getId)).contains(first.getId());
    }

    @Test
    @DisplayName("an end date is refused for a running site unless the same update closes it")
    void endDateOnlyForClosedSites() {
        Site site = newSite("Ongoing");

        assertThatThrownBy(() -> store.updateSite(site.getId(),
                SiteUpdate.builder().endDate(LocalDate.of(2026, 1, 1)).build()))
                .isInstanceOf(LedgerConstraintException.class);
        Site unchanged = store.findSite(site.getId()).orElseThrow();
        assertThat(unchanged.isRunning()).isTrue();
        assertThat(unchanged.getEndDate()).isNull();

        Site closed = store.updateSite(site.getId(),
                SiteUpdate.builder().running(false).endDate(LocalDate.of(2026, 1, 1)).build());
        assertThat(closed.getEndDate()).isEqualTo(LocalDate.of(2026, 1, 1));

        Site corrected = store.updateSite(site.getId(), SiteUpdate.builder().endDate(LocalDate.of(2026, 2, 1)).build());
        assertThat(corrected.isRunning()).isFalse();
        assertThat(corrected.getEndDate()).isEqualTo(LocalDate.of(2026, 2, 1));
    }

    @Test
    @DisplayName("a ledger row with a full snapshot still needs its worker on the same site")
    void suppliedSnapshotStillChecksWorker() {
        Site site = newSite("Here");
        Site elsewhere = newSite("Elsewhere");
        Worker stranger = newWorker(elsewhere, "Stranger");

        WageRecord foreign = wage(site, stranger, "100", "0", TODAY).toBuilder()
                .workerName("Stranger").workerCategory(WorkerCategory.SKILLED).build();
        WageRecord ghost = foreign.toBuilder().workerId("no-such-worker").build();

        assertThatThrownBy(() -> store.addWageRecords(List.of(foreign)))
                .isInstanceOf(LedgerConstraintException.class);
        assertThatThrownBy(() -> store.addPayment(payment(site, stranger, "50", TODAY).toBuilder()
                .workerName("Stranger").workerCategory(WorkerCategory.SKILLED).build()))
                .isInstanceOf(LedgerConstraintException.class);
        assertThatThrownBy(() -> store.addWageRecords(List.of(ghost)))
                .isInstanceOf(LedgerConstraintException.class);
        assertThat(ledger.rowCount("wage_records")).isZero();
        assertThat(ledger.rowCount("payment_records")).isZero();
    }

    @Test
    @DisplayName("ledger amounts are rounded to cents before they are stored and returned")
    void amountsAreRoundedToCents() {
        Site site = newSite("Rounding");
        Worker worker = newWorker(site, "Kiran");

        WageRecord stored = store.addWageRecords(List.of(wage(site, worker, "100.005", "0.004", TODAY))).get(0);

        assertThat(stored.getAmount()).isEqualTo(new BigDecimal("100.01"));
        assertThat(stored.getOvertime()).isEqualTo(new BigDecimal("0.00"));
        assertThat(store.workerTotals(site.getId(), worker.getId()).totalWage()).isEqualByComparingTo("100.01");
    }

    @Test
    @DisplayName("update and delete of a missing id raise RecordNotFoundException")
    void notFound() {
        assertThatThrownBy(() -> store.deleteSite("nope")).isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> store.updateWorker("nope", WorkerUpdate.builder().name("x").build()))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    @DisplayName("a failing cloud mirror does not affect the local write")
    void cloudMirrorFailureIsIgnored() {
        CloudMirror failing = mock(CloudMirror.class);
        doThrow(new IllegalStateException("offline")).when(failing).upsert(any(), any(), any());
        TestLedger mirrored = new TestLedger(Clock.fixed(TestLedger.NOW, ZoneOffset.UTC),
                new InMemoryLegacyStore(), failing);

        Site site = mirrored.ledgerStore.createSite(site("Mirrored").build());

        assertThat(mirrored.ledgerStore.findSite(site.getId())).isPresent();
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private Site.SiteBuilder site(String name) {
        return Site.builder().name(name).type(SiteType.RESIDENTIAL).location("Pune").running(true);
    }

    private Site newSite(String name) {
        return store.createSite(site(name).build());
    }

    private Worker newWorker(Site site, String name) {
        return store.createWorker(Worker.builder()
                .siteId(site.getId()).name(name).category(WorkerCategory.SKILLED).build());
    }

    static WageRecord wage(Site site, Worker worker, String amount, String overtime, LocalDate date) {
        return WageRecord.builder()
                .siteId(site.getId()).workerId(worker.getId())
                .amount(new BigDecimal(amount)).overtime(new BigDecimal(overtime))
                .date(date).time("09:00").build();
    }

    static ExpenseRecord expense(Site site, Worker worker, String amount, LocalDate date) {
        return ExpenseRecord.builder()
                .siteId(site.getId()).workerId(worker.getId())
                .amount(new BigDecimal(amount)).description("advance")
                .date(date).time("12:00").build();
    }

    static PaymentRecord payment(Site site, Worker worker, String amount, LocalDate date) {
        return PaymentRecord.builder()
                .siteId(site.getId()).workerId(worker.getId())
                .amount(new BigDecimal(amount)).method(PaymentMethod.UPI)
                .date(date).time("18:00").build();
    }
}
