package com.prismTax.simulator.action;

import com.prismTax.simulator.collaborator.client.TaxCalculationApiClient;
import com.prismTax.simulator.collaborator.dto.IncomeTaxRequest;
import com.prismTax.simulator.collaborator.dto.IncomeTaxResponse;
import com.prismTax.simulator.collaborator.dto.VatCalculationRequest;
import com.prismTax.simulator.collaborator.dto.VatCalculationResponse;
import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.emitter.model.ListMenu;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

import static com.prismTax.simulator.util.NairaFormatter.format;
import static com.prismTax.simulator.util.NairaFormatter.percent;

/**
 * Tax calculation actions.
 *
 * VAT and income tax are computed by the remote tax calculator and relayed as returned.
 * Rental withholding and the minimum-wage check are local policy rules.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxCalculationActions {

    public static final String CALC_VAT_STANDARD = "calc_vat_standard";
    public static final String CALC_INCOME_TAX = "calc_income_tax";
    public static final String CALC_FREELANCE = "calc_freelance";
    public static final String CALC_PENSION = "calc_pension";
    public static final String CALC_RENTAL = "calc_rental";
    public static final String CALC_MIN_WAGE = "calc_min_wage";

    private static final String DEFAULT_ITEM = "general goods";

    private final TaxCalculationApiClient taxCalculationApiClient;
    private final ResponseEmitter responseEmitter;
    private final SimulatorPolicyProperties policy;

    public void vat(TurnContext turn, long amount, String itemDescription) {
        String item = itemDescription == null || itemDescription.isBlank() ? DEFAULT_ITEM : itemDescription;
        responseEmitter.processing(turn, "🧮 Calculating VAT...");

        VatCalculationResponse result;
        try {
            result = taxCalculationApiClient.calculateVat(
                    VatCalculationRequest.builder().amount(amount).itemDescription(item).build(),
                    turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        StringBuilder reply = new StringBuilder()
                .append("📊 *VAT Calculation*\n\n")
                .append("Item: ").append(item).append('\n')
                .append("Classification: ").append(result.getClassification()).append('\n')
                .append("Subtotal: ").append(format(result.getSubtotal())).append('\n')
                .append("VAT (").append(percent(result.getVatRate())).append("): ")
                .append(format(result.getVatAmount())).append('\n')
                .append("*Total: ").append(format(result.getTotal())).append("*");
        if (Boolean.TRUE.equals(result.getCanClaimInputVat())) {
            reply.append("\n\n✅ Input VAT on this purchase can be claimed.");
        } else if (Boolean.FALSE.equals(result.getCanClaimInputVat())) {
            reply.append("\n\n❌ Input VAT on this purchase cannot be claimed.");
        }
        appendReference(reply, result.getActReference());

        responseEmitter.text(turn, reply.toString());
    }

    public void annualIncomeTax(TurnContext turn, long grossIncome) {
        incomeTax(turn, "💼 *Annual Income Tax*", IncomeTaxRequest.builder()
                .grossIncome(grossIncome)
                .period(IncomeTaxRequest.PERIOD_ANNUAL)
                .incomeType("employment")
                .build());
    }

    public void monthlyIncomeTax(TurnContext turn, long monthlySalary) {
        incomeTax(turn, "💵 *Monthly PAYE*", IncomeTaxRequest.builder()
                .grossIncome(monthlySalary)
                .period(IncomeTaxRequest.PERIOD_MONTHLY)
                .incomeType("employment")
                .build());
    }

    public void pensionIncomeTax(TurnContext turn, long pensionIncome) {
        incomeTax(turn, "👴 *Pension Income*", IncomeTaxRequest.builder()
                .grossIncome(pensionIncome)
                .period(IncomeTaxRequest.PERIOD_ANNUAL)
                .incomeType("pension")
                .pensionAmount(pensionIncome)
                .build());
    }

    public void freelanceIncomeTax(TurnContext turn, long businessIncome, long businessExpenses) {
        incomeTax(turn, "🧑‍💻 *Freelance / Business Income*", IncomeTaxRequest.builder()
                .grossIncome(businessIncome)
                .period(IncomeTaxRequest.PERIOD_ANNUAL)
                .incomeType("business")
                .deductions(IncomeTaxRequest.Deductions.builder().businessExpenses(businessExpenses).build())
                .build());
    }

    public void mixedIncomeTax(TurnContext turn, long pensionIncome, long businessIncome) {
        incomeTax(turn, "🔀 *Pension + Business Income*", IncomeTaxRequest.builder()
                .grossIncome(businessIncome)
                .period(IncomeTaxRequest.PERIOD_ANNUAL)
                .incomeType("mixed")
                .pensionAmount(pensionIncome)
                .build());
    }

    public void sideHustleIncomeTax(TurnContext turn, long monthlyIncome) {
        incomeTax(turn, "🛍️ *Side Hustle Income (monthly)*", IncomeTaxRequest.builder()
                .grossIncome(monthlyIncome)
                .period(IncomeTaxRequest.PERIOD_MONTHLY)
                .incomeType("business")
                .build());
    }

    /**
     * Income tax from a classifier entity set, e.g. income_type "business" with an amount.
     */
    public void incomeTaxForType(TurnContext turn, String incomeType, long amount) {
        String type = incomeType == null ? "" : incomeType.toLowerCase(Locale.ROOT);
        switch (type) {
            case "business", "freelance" -> freelanceIncomeTax(turn, amount, 0L);
            case "pension" -> pensionIncomeTax(turn, amount);
            default -> annualIncomeTax(turn, amount);
        }
    }

    public void rentalIncome(TurnContext turn, long rentalIncome) {
        BigDecimal gross = BigDecimal.valueOf(rentalIncome);
        BigDecimal withholding = gross.multiply(policy.getRentalWithholdingRate()).setScale(2, RoundingMode.HALF_UP);
        BigDecimal net = gross.subtract(withholding);

        responseEmitter.text(turn, "🏠 *Rental Income*\n\n"
                + "Gross rent: " + format(gross) + "\n"
                + "Withholding tax (" + percent(policy.getRentalWithholdingRate()) + "): " + format(withholding) + "\n"
                + "*Net rent: " + format(net) + "*\n\n"
                + "Your tenant deducts the withholding tax and remits it for you. Keep the WHT credit notes "
                + "to offset against your annual tax.");
    }

    public void minimumWageCheck(TurnContext turn, Long monthlyIncome) {
        if (monthlyIncome == null) {
            responseEmitter.text(turn, "⚖️ *Minimum Wage Check*\n\n"
                    + "Monthly earnings of " + format(policy.getMinimumMonthlyWage()) + " or less are exempt from PAYE.\n\n"
                    + "Send *minimum wage check <monthly amount>* to check an income, e.g. *minimum wage check 65000*.");
            return;
        }
        boolean exempt = monthlyIncome <= policy.getMinimumMonthlyWage();
        String verdict = exempt
                ? "✅ *Exempt* - " + format(monthlyIncome) + " is at or below the minimum wage of "
                        + format(policy.getMinimumMonthlyWage()) + ". No PAYE is due."
                : "❌ *Not exempt* - " + format(monthlyIncome) + " is above the minimum wage of "
                        + format(policy.getMinimumMonthlyWage()) + ". Send *salary " + monthlyIncome
                        + "* to calculate PAYE.";
        responseEmitter.text(turn, "⚖️ *Minimum Wage Check*\n\n" + verdict);
    }

    /**
     * Tax calculation list menu.
     */
    public void showMenu(TurnContext turn) {
        ListMenu menu = ListMenu.builder()
                .header("🧮 Tax Calculator")
                .buttonText("Choose calculation")
                .footer("Amounts are in Naira")
                .sections(List.of(
                        ListMenu.Section.builder().title("Consumption tax").rows(List.of(
                                row(CALC_VAT_STANDARD, "VAT", "7.5% standard-rated supply"))).build(),
                        ListMenu.Section.builder().title("Income tax").rows(List.of(
                                row(CALC_INCOME_TAX, "Employment income", "Annual PAYE bands"),
                                row(CALC_FREELANCE, "Freelance / business", "Income less expenses"),
                                row(CALC_PENSION, "Pension income", "Exempt pension"),
                                row(CALC_RENTAL, "Rental income", "10% withholding"),
                                row(CALC_MIN_WAGE, "Minimum wage check", "PAYE exemption"))).build()))
                .build();
        responseEmitter.listMenu(turn, "What would you like to calculate?", menu);
    }

    /**
     * Explains the command for a calculation picked from the menu.
     */
    public void promptFor(TurnContext turn, String buttonId) {
        String prompt = switch (buttonId) {
            case CALC_VAT_STANDARD -> "📝 Send *vat <amount> <item>*, e.g. *vat 50000 electronics*";
            case CALC_INCOME_TAX -> "💼 Send *tax <annual income>*, e.g. *tax 10000000*, or *salary <monthly pay>*";
            case CALC_FREELANCE -> "🧑‍💻 Send *freelance <income> expenses <amount>*, e.g. *freelance 7200000 expenses 1800000*";
            case CALC_PENSION -> "👴 Send *pension <annual pension>*, e.g. *pension 2400000*";
            case CALC_RENTAL -> "🏠 Send *rental income <amount>*, e.g. *rental income 2400000*";
            case CALC_MIN_WAGE -> "⚖️ Send *minimum wage check <monthly amount>*, e.g. *minimum wage check 65000*";
            default -> throw new IllegalArgumentException("Unknown calculation button: " + buttonId);
        };
        responseEmitter.text(turn, prompt);
    }

    private void incomeTax(TurnContext turn, String title, IncomeTaxRequest request) {
        responseEmitter.processing(turn, "🧮 Calculating your tax...");

        IncomeTaxResponse result;
        try {
            result = taxCalculationApiClient.calculateIncomeTax(request, turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        StringBuilder reply = new StringBuilder(title).append("\n\n");
        reply.append(IncomeTaxRequest.PERIOD_MONTHLY.equals(request.getPeriod()) ? "Monthly income: " : "Gross income: ")
                .append(format(request.getGrossIncome())).append('\n');
        if (request.getPensionAmount() > 0 && "mixed".equals(request.getIncomeType())) {
            reply.append("Pension income: ").append(format(request.getPensionAmount())).append(" (exempt)\n");
        }
        if (request.getDeductions() != null && request.getDeductions().getBusinessExpenses() > 0) {
            reply.append("Business expenses: ").append(format(request.getDeductions().getBusinessExpenses())).append('\n');
        }

        if (result.getTaxBreakdown() != null && !result.getTaxBreakdown().isEmpty()) {
            reply.append("\n*Breakdown:*\n");
            for (IncomeTaxResponse.BandTax band : result.getTaxBreakdown()) {
                reply.append("• ").append(band.getBand())
                        .append(" @ ").append(percent(band.getRate()))
                        .append(": ").append(format(band.getTaxInBand())).append('\n');
            }
        }

        reply.append("\n*Total tax: ").append(format(result.getTotalTax())).append("*\n");
        if (result.getEffectiveRate() != null) {
            reply.append("Effective rate: ").append(result.getEffectiveRate().stripTrailingZeros().toPlainString()).append("%\n");
        }
        if (result.getMonthlyTax() != null) {
            reply.append("Monthly tax: ").append(format(result.getMonthlyTax())).append('\n');
        }
        if (Boolean.TRUE.equals(result.getMinimumWageExempt())) {
            reply.append("\n✅ Exempt: income is at or below the minimum wage.");
        }
        if (Boolean.TRUE.equals(result.getPensionExempt())) {
            reply.append("\n✅ Pension income is exempt from tax.");
        }
        appendReference(reply, result.getActReference());

        log.info("Income tax relayed - correlationId: {}, incomeType: {}, period: {}",
                turn.getCorrelationId(), request.getIncomeType(), request.getPeriod());
        responseEmitter.text(turn, reply.toString().trim());
    }

    private static void appendReference(StringBuilder reply, String actReference) {
        if (actReference != null && !actReference.isBlank()) {
            reply.append("\n\n📖 ").append(actReference);
        }
    }

    private static ListMenu.Row row(String id, String title, String description) {
        return ListMenu.Row.builder().id(id).title(title).description(description).build();
    }
}
