package com.payroll.processor;

import com.payroll.engine.model.Payslip;
import com.payroll.processor.model.YtdTotals;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-employee, per-tax-year record of payslips already emitted, used to derive
 * the year-to-date inputs for the next run.
 *
 * Entries are keyed by payroll run, so recalculating a run replaces its own
 * figures instead of adding them twice.
 */
public class YtdLedger {

    private final ConcurrentHashMap<String, Map<String, Entry>> entries = new ConcurrentHashMap<>();

    /**
     * Totals of every recorded run for the employee and year that started before {@code periodStart}.
     */
    public YtdTotals totalsBefore(String employeeId, int taxYear, LocalDate periodStart) {
        Map<String, Entry> runs = entries.get(key(employeeId, taxYear));
        if (runs == null) return YtdTotals.ZERO;

        YtdTotals totals = YtdTotals.ZERO;
        for (Entry e : runs.values()) {
            if (e.periodStart.isBefore(periodStart)) {
                totals = totals.plus(e.grossEarnings, e.paye, e.nis);
            }
        }
        return totals;
    }

    public void record(int taxYear, Payslip payslip) {
        entries.computeIfAbsent(key(payslip.getEmployeeId(), taxYear), k -> new ConcurrentHashMap<>())
            .put(payslip.getPayrollRunId(), new Entry(
                LocalDate.parse(payslip.getPeriodStart()),
                payslip.getGrossEarnings(),
                payslip.getPayeAmount(),
                payslip.getNisEmployee()));
    }

    private static String key(String employeeId, int taxYear) {
        return employeeId + ":" + taxYear;
    }

    private static final class Entry {
        private final LocalDate periodStart;
        private final long grossEarnings;
        private final long paye;
        private final long nis;

        private Entry(LocalDate periodStart, long grossEarnings, long paye, long nis) {
            this.periodStart = periodStart;
            this.grossEarnings = grossEarnings;
            this.paye = paye;
            this.nis = nis;
        }
    }
}
