package com.payroll.processor.model;

/**
 * Year-to-date amounts fed into a payslip calculation, in cents.
 */
public final class YtdTotals {

    public static final YtdTotals ZERO = new YtdTotals(0, 0, 0);

    private final long grossEarnings;
    private final long paye;
    private final long nis;

    public YtdTotals(long grossEarnings, long paye, long nis) {
        this.grossEarnings = grossEarnings;
        this.paye = paye;
        this.nis = nis;
    }

    public YtdTotals plus(long grossEarnings, long paye, long nis) {
        return new YtdTotals(this.grossEarnings + grossEarnings, this.paye + paye, this.nis + nis);
    }

    public long getGrossEarnings() { return grossEarnings; }
    public long getPaye() { return paye; }
    public long getNis() { return nis; }
}
