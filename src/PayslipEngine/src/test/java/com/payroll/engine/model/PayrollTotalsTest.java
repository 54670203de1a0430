package com.payroll.engine.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayrollTotalsTest {

    private static Payslip payslip(long gross, long paye, long nisEmployee, long nisEmployer, long other) {
        long totalDeductions = paye + nisEmployee + other;
        return Payslip.builder()
            .grossEarnings(gross)
            .payeAmount(paye)
            .nisEmployee(nisEmployee)
            .nisEmployer(nisEmployer)
            .otherDeductions(other)
            .totalDeductions(totalDeductions)
            .netPay(gross - totalDeductions)
            .build();
    }

    @Test
    void sumsEveryPayslip() {
        PayrollTotals totals = PayrollTotals.of(List.of(
            payslip(550_000, 54_167, 30_800, 46_200, 0),
            payslip(300_000, 12_000, 16_800, 25_200, 5_000)));

        assertThat(totals.getEmployeeCount()).isEqualTo(2);
        assertThat(totals.getTotalGrossEarnings()).isEqualTo(850_000);
        assertThat(totals.getTotalPaye()).isEqualTo(66_167);
        assertThat(totals.getTotalNisEmployee()).isEqualTo(47_600);
        assertThat(totals.getTotalNisEmployer()).isEqualTo(71_400);
        assertThat(totals.getTotalDeductions()).isEqualTo(118_767);
        assertThat(totals.getTotalNetPay()).isEqualTo(731_233);
    }

    @Test
    void emptyRunHasZeroTotals() {
        PayrollTotals totals = PayrollTotals.of(List.of());

        assertThat(totals.getEmployeeCount()).isZero();
        assertThat(totals.getTotalGrossEarnings()).isZero();
    }
}
