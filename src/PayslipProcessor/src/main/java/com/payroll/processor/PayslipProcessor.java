package com.payroll.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.Payslip;
import com.payroll.engine.model.PayslipResult;
import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.payslip.PayslipAssembler;
import com.payroll.engine.tax.InvalidTaxRuleException;
import com.payroll.processor.model.PayslipRequest;
import com.payroll.processor.model.YtdTotals;
import org.apache.kafka.streams.processor.api.Processor;
import org.apache.kafka.streams.processor.api.ProcessorContext;
import org.apache.kafka.streams.processor.api.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Processor shared by the tax-rules and payslip-requests sources.
 *
 * Rules and year-to-date figures live in the {@link TaxRuleStore} and {@link YtdLedger}
 * handed in by the topology rather than in partitioned state stores: the two source
 * topics are keyed differently, so a request and the rule it needs rarely land in the
 * same task.
 */
public class PayslipProcessor implements Processor<String, String, String, String> {

    private static final Logger log = LoggerFactory.getLogger(PayslipProcessor.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    static final String TAX_RULES_SOURCE = "tax-rules";
    static final String PAYSLIP_REQUESTS_SOURCE = "payslip-requests";

    static final String INCOME_TAX_RULE = "income-tax-rule";
    static final String SOCIAL_SECURITY_RULE = "social-security-rule";

    private final String sourceName;
    private final TaxRuleStore ruleStore;
    private final YtdLedger ytdLedger;
    private final PayslipAssembler assembler;
    private ProcessorContext<String, String> context;

    /**
     * @param sourceName identifies which source topic this processor instance handles:
     *                   "tax-rules" or "payslip-requests"
     */
    public PayslipProcessor(String sourceName, TaxRuleStore ruleStore, YtdLedger ytdLedger,
                            PayslipAssembler assembler) {
        this.sourceName = sourceName;
        this.ruleStore = ruleStore;
        this.ytdLedger = ytdLedger;
        this.assembler = assembler;
    }

    @Override
    public void init(ProcessorContext<String, String> context) {
        this.context = context;
    }

    @Override
    public void process(Record<String, String> record) {
        if (record.value() == null) return;

        try {
            if (TAX_RULES_SOURCE.equals(sourceName)) {
                applyTaxRule(ruleStore, mapper.readTree(record.value()));
            } else {
                handlePayslipRequest(record);
            }
        } catch (Exception e) {
            log.error("Error processing record from {}: {}", sourceName, e.getMessage(), e);
        }
    }

    /**
     * Store the rule carried by a tax-rules event. Unknown event types are ignored;
     * rules failing validation are logged and dropped.
     */
    static void applyTaxRule(TaxRuleStore store, JsonNode event) throws Exception {
        String type = event.path("type").asText("");
        JsonNode ruleNode = event.path("rule");
        if (ruleNode.isMissingNode() || ruleNode.isNull()) return;

        try {
            if (INCOME_TAX_RULE.equals(type)) {
                IncomeTaxRule rule = mapper.treeToValue(ruleNode, IncomeTaxRule.class);
                store.put(rule);
                log.info("Income tax rule updated: jurisdiction={}, year={}, bands={}",
                    rule.getJurisdictionId(), rule.getTaxYear(), rule.getTaxBands().size());
            } else if (SOCIAL_SECURITY_RULE.equals(type)) {
                SocialSecurityRule rule = mapper.treeToValue(ruleNode, SocialSecurityRule.class);
                store.put(rule);
                log.info("Social security rule updated: jurisdiction={}, year={}",
                    rule.getJurisdictionId(), rule.getYear());
            }
        } catch (InvalidTaxRuleException e) {
            log.warn("Tax rule rejected: {}", e.getMessage());
        }
    }

    private void handlePayslipRequest(Record<String, String> record) throws Exception {
        PayslipRequest request = mapper.readValue(record.value(), PayslipRequest.class);
        if (request.getEmployee() == null || request.getPayrollRun() == null) {
            log.warn("Payslip request without employee or payroll run skipped: key={}", record.key());
            return;
        }

        LocalDate periodStart = LocalDate.parse(request.getPayrollRun().getPeriodStart());
        int taxYear = periodStart.getYear();
        String jurisdictionId = request.getJurisdictionId();

        // Throws TaxRuleNotConfiguredException before any calculation
        IncomeTaxRule incomeTaxRule = ruleStore.requireIncomeTaxRule(jurisdictionId, taxYear);
        SocialSecurityRule nisRule = ruleStore.requireSocialSecurityRule(jurisdictionId, taxYear);

        String employeeId = request.getEmployee().getId();
        YtdTotals ytd = ytdLedger.totalsBefore(employeeId, taxYear, periodStart);

        PayslipResult result = assembler.calculatePayslip(request.getEmployee(), request.getPayrollRun(),
            incomeTaxRule, nisRule, ytd.getGrossEarnings(), ytd.getPaye(), ytd.getNis());
        Payslip payslip = result.getPayslip();
        ytdLedger.record(taxYear, payslip);

        for (String warning : result.getWarnings()) {
            log.info("Payslip warning: employee={}, run={}, {}", employeeId, payslip.getPayrollRunId(), warning);
        }

        // Output key: {"employeeId":"...","payrollRunId":"..."}
        String outputKey = mapper.writeValueAsString(
            mapper.createObjectNode()
                .put("employeeId", employeeId)
                .put("payrollRunId", payslip.getPayrollRunId())
        );
        String outputValue = mapper.writeValueAsString(result);

        context.forward(new Record<>(outputKey, outputValue, System.currentTimeMillis()));
        log.info("Payslip emitted: employee={}, run={}, gross={}, net={}",
            employeeId, payslip.getPayrollRunId(), payslip.getGrossEarnings(), payslip.getNetPay());
    }
}
