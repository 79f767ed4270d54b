package com.sitely.ledger.output;

import com.opencsv.CSVWriter;
import com.sitely.ledger.model.PaymentRecord;
import com.sitely.ledger.model.WorkerTotals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Delimited-text exports built from rows the caller already fetched.
 *
 * Site report: one line per worker with the three sums and what is left to pay.
 * Payment history: one numbered line per payment, in the order given.
 */
@Component
@Slf4j
public class LedgerReportWriter {

    static final String[] SITE_REPORT_HEADERS = {
            "Worker Name", "Category", "Total Wage", "Total Expense", "Total Paid", "Remaining"
    };

    static final String[] PAYMENT_HISTORY_HEADERS = {
            "No.", "Worker Name", "Category", "Amount", "Method", "Date", "Time"
    };

    public String siteReport(List<WorkerSummary> summaries) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = newWriter(out)) {
            writer.writeNext(SITE_REPORT_HEADERS, false);
            for (WorkerSummary s : summaries) {
                WorkerTotals t = s.totals();
                writer.writeNext(new String[]{
                        str(s.workerName()),
                        s.category() == null ? "" : s.category().code(),
                        amount(t.totalWage()),
                        amount(t.totalExpense()),
                        amount(t.totalPaid()),
                        amount(t.remaining())
                }, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Site report write failed", e);
        }
        log.debug("Site report written for {} worker(s)", summaries.size());
        return out.toString();
    }

    public String paymentHistory(List<PaymentRecord> payments) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = newWriter(out)) {
            writer.writeNext(PAYMENT_HISTORY_HEADERS, false);
            int no = 1;
            for (PaymentRecord p : payments) {
                writer.writeNext(new String[]{
                        String.valueOf(no++),
                        str(p.getWorkerName()),
                        p.getWorkerCategory() == null ? "" : p.getWorkerCategory().code(),
                        amount(p.getAmount()),
                        p.getMethod() == null ? "" : p.getMethod().code(),
                        str(p.getDate()),
                        str(p.getTime())
                }, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Payment history write failed", e);
        }
        return out.toString();
    }

    private static CSVWriter newWriter(StringWriter out) {
        return new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
    }

    private static String amount(BigDecimal value) {
        return value == null ? "0" : value.stripTrailingZeros().toPlainString();
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
