package com.payroll.processor;

import com.payroll.engine.model.Payslip;
import com.payroll.processor.model.YtdTotals;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class YtdLedgerTest {

    private final YtdLedger ledger = new YtdLedger();

    @Test
    void emptyLedgerStartsFromZero() {
        assertThat(ledger.totalsBefore("emp-1", 2024, LocalDate.of(2024, 3, 1))).isSameAs(YtdTotals.ZERO);
    }

    @Test
    void sumsOnlyRunsThatStartedEarlier() {
        ledger.record(2024, payslip("run-01", "2024-01-01", 100_000, 10_000, 5_000));
        ledger.record(2024, payslip("run-02", "2024-02-01", 120_000, 12_000, 6_000));
        ledger.record(2024, payslip("run-03", "2024-03-01", 130_000, 13_000, 7_000));

        YtdTotals totals = ledger.totalsBefore("emp-1", 2024, LocalDate.of(2024, 3, 1));

        assertThat(totals.getGrossEarnings()).isEqualTo(220_000);
        assertThat(totals.getPaye()).isEqualTo(22_000);
        assertThat(totals.getNis()).isEqualTo(11_000);
    }

    @Test
    void recordingTheSameRunReplacesIt() {
        ledger.record(2024, payslip("run-01", "2024-01-01", 100_000, 10_000, 5_000));
        ledger.record(2024, payslip("run-01", "2024-01-01", 90_000, 9_000, 4_000));

        YtdTotals totals = ledger.totalsBefore("emp-1", 2024, LocalDate.of(2024, 2, 1));

        assertThat(totals.getGrossEarnings()).isEqualTo(90_000);
        assertThat(totals.getPaye()).isEqualTo(9_000);
    }

    @Test
    void taxYearsAreSeparate() {
        ledger.record(2023, payslip("run-dec", "2023-12-01", 100_000, 10_000, 5_000));

        assertThat(ledger.totalsBefore("emp-1", 2024, LocalDate.of(2024, 1, 1)).getGrossEarnings()).isZero();
    }

    private static Payslip payslip(String runId, String periodStart, long gross, long paye, long nis) {
        return Payslip.builder()
            .payrollRunId(runId)
            .employeeId("emp-1")
            .periodStart(periodStart)
            .grossEarnings(gross)
            .payeAmount(paye)
            .nisEmployee(nis)
            .build();
    }
}
