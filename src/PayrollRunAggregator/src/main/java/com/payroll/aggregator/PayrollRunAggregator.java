package com.payroll.aggregator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.engine.model.PayrollTotals;
import com.payroll.engine.model.Payslip;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Folds employee payslip records into per-run state.
 *
 * Only the latest payslip per employee per run is kept, so a recalculated
 * payslip replaces the earlier one in the totals.
 */
public class PayrollRunAggregator {

    private static final ObjectMapper mapper = new ObjectMapper();

    // runId -> employeeId -> latest payslip
    private final Map<String, TreeMap<String, Payslip>> payslipsByRun = new ConcurrentHashMap<>();

    /**
     * Apply one employee-payslips record.
     * Key: {"employeeId":"...","payrollRunId":"..."}; a null value removes the employee from the run.
     *
     * @return the id of the run whose totals changed, or null if the record was ignored
     */
    public String apply(String rawKey, String rawValue) throws Exception {
        if (rawKey == null) return null;

        JsonNode keyNode = mapper.readTree(rawKey);
        String employeeId = keyNode.path("employeeId").asText(null);
        String runId = keyNode.path("payrollRunId").asText(null);
        if (employeeId == null || runId == null) return null;

        if (rawValue == null) {
            // Tombstone
            TreeMap<String, Payslip> payslips = payslipsByRun.get(runId);
            if (payslips == null || payslips.remove(employeeId) == null) return null;
            return runId;
        }

        JsonNode payslipNode = mapper.readTree(rawValue).path("payslip");
        if (payslipNode.isMissingNode() || payslipNode.isNull()) return null;

        payslipsByRun.computeIfAbsent(runId, k -> new TreeMap<>())
            .put(employeeId, toPayslip(runId, employeeId, payslipNode));
        return runId;
    }

    /**
     * @return the run's totals, or null once every payslip has been removed from it
     */
    public PayrollTotals totalsFor(String runId) {
        TreeMap<String, Payslip> payslips = payslipsByRun.get(runId);
        if (payslips == null || payslips.isEmpty()) return null;
        return PayrollTotals.of(payslips.values());
    }

    public int runCount() {
        return payslipsByRun.size();
    }

    public void clear() {
        payslipsByRun.clear();
    }

    private static Payslip toPayslip(String runId, String employeeId, JsonNode value) {
        return Payslip.builder()
            .payrollRunId(runId)
            .employeeId(employeeId)
            .organizationId(value.path("organizationId").asText(null))
            .periodStart(value.path("periodStart").asText(null))
            .periodEnd(value.path("periodEnd").asText(null))
            .payDate(value.path("payDate").asText(null))
            .basePay(value.path("basePay").asLong(0))
            .allowances(value.path("allowances").asLong(0))
            .grossEarnings(value.path("grossEarnings").asLong(0))
            .taxableIncome(value.path("taxableIncome").asLong(0))
            .payeAmount(value.path("payeAmount").asLong(0))
            .nisableEarnings(value.path("nisableEarnings").asLong(0))
            .nisEmployee(value.path("nisEmployee").asLong(0))
            .nisEmployer(value.path("nisEmployer").asLong(0))
            .otherDeductions(value.path("otherDeductions").asLong(0))
            .totalDeductions(value.path("totalDeductions").asLong(0))
            .netPay(value.path("netPay").asLong(0))
            .build();
    }
}
