package com.prismTax.simulator.statement.service;

import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.risk.model.RiskFlag;
import com.prismTax.simulator.risk.service.RiskFlaggingService;
import com.prismTax.simulator.statement.model.CategorizedStatement;
import com.prismTax.simulator.statement.model.CategorizedTransaction;
import com.prismTax.simulator.statement.model.StatementTransaction;
import com.prismTax.simulator.statement.model.TransactionCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Bank statement categorizer.
 *
 * Responsibilities:
 * - Assign every statement line exactly one category
 * - Queue large transfer credits for source-of-funds review
 * - Compute output / input / net VAT from SALES credits and EXPENSES debits
 * - Run the risk heuristic on debits
 *
 * Credits:
 * - transfer keyword and amount above the large-transaction threshold: SALES (queued for review)
 * - transfer keyword otherwise: TRANSFERS_IN
 * - anything else: OTHER
 *
 * Debits, first match wins: SALARIES, UTILITIES, EXPENSES, OTHER.
 *
 * Keywords match at the start of a word, so plural and suffixed narrations ("transfers", "purchases")
 * match while "deposit" does not match "pos". Stems cover irregular plurals ("salaries", "utilities").
 * A zero amount counts as absent.
 *
 * The result depends only on the input lines, so categorizing the same statement twice gives equal results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BankStatementCategorizer {

    static final String REVIEW_FLAG = "Large credit - confirm source of funds";

    private static final Pattern TRANSFER_KEYWORDS =
            keywords("transfer", "trf", "nip", "payment", "pymt", "deposit", "lodgement");
    private static final Pattern SALARY_KEYWORDS =
            keywords("salar", "payroll", "pay roll", "wage", "staff pay");
    private static final Pattern UTILITY_KEYWORDS =
            keywords("utilit", "electricity", "ikedc", "ekedc", "aedc", "phcn", "dstv", "gotv", "startimes",
                    "water", "mtn", "airtel", "glo", "9mobile", "spectranet", "internet");
    private static final Pattern EXPENSE_KEYWORDS =
            keywords("pos", "purchase", "vendor", "supplier", "web");

    private final SimulatorPolicyProperties policy;
    private final RiskFlaggingService riskFlaggingService;

    /**
     * Categorizes a full statement.
     *
     * @param transactions statement lines in statement order
     * @return categorized statement with totals and VAT exposure
     * @throws IllegalArgumentException if a line carries both a positive credit and a positive debit
     */
    public CategorizedStatement categorize(List<StatementTransaction> transactions) {
        List<StatementTransaction> lines = transactions == null ? List.of() : transactions;

        List<CategorizedTransaction> categorized = new ArrayList<>(lines.size());
        List<CategorizedTransaction> reviewQueue = new ArrayList<>();
        Map<TransactionCategory, BigDecimal> creditTotals = new EnumMap<>(TransactionCategory.class);
        Map<TransactionCategory, BigDecimal> debitTotals = new EnumMap<>(TransactionCategory.class);
        BigDecimal totalCredits = BigDecimal.ZERO;
        BigDecimal totalDebits = BigDecimal.ZERO;

        for (int i = 0; i < lines.size(); i++) {
            StatementTransaction line = lines.get(i);
            if (line.hasCredit() && line.hasDebit()) {
                throw new IllegalArgumentException(
                        "Statement line " + (i + 1) + " has both a credit and a debit: " + line.getDescription());
            }

            String description = line.getDescription() == null ? "" : line.getDescription().toLowerCase(Locale.ROOT);

            if (line.hasCredit()) {
                boolean largeTransfer = isLargeTransfer(description, line.getCredit());
                TransactionCategory category = categorizeCredit(description, largeTransfer);
                CategorizedTransaction entry = CategorizedTransaction.builder()
                        .transaction(line)
                        .category(category)
                        .riskFlag(largeTransfer ? REVIEW_FLAG : null)
                        .build();
                categorized.add(entry);
                if (largeTransfer) {
                    reviewQueue.add(entry);
                }
                creditTotals.merge(category, line.getCredit(), BigDecimal::add);
                totalCredits = totalCredits.add(line.getCredit());
            } else if (line.hasDebit()) {
                TransactionCategory category = categorizeDebit(description);
                categorized.add(CategorizedTransaction.builder()
                        .transaction(line)
                        .category(category)
                        .riskFlag(debitRiskFlag(line))
                        .build());
                debitTotals.merge(category, line.getDebit(), BigDecimal::add);
                totalDebits = totalDebits.add(line.getDebit());
            } else {
                categorized.add(CategorizedTransaction.builder()
                        .transaction(line)
                        .category(TransactionCategory.OTHER)
                        .build());
            }
        }

        BigDecimal outputVat = vatOn(creditTotals.getOrDefault(TransactionCategory.SALES, BigDecimal.ZERO));
        BigDecimal inputVat = vatOn(debitTotals.getOrDefault(TransactionCategory.EXPENSES, BigDecimal.ZERO));

        log.info("Statement categorized - lines: {}, totalCredits: {}, totalDebits: {}, reviewQueue: {}",
                lines.size(), totalCredits, totalDebits, reviewQueue.size());

        return CategorizedStatement.builder()
                .transactions(Collections.unmodifiableList(categorized))
                .creditTotals(Collections.unmodifiableMap(creditTotals))
                .debitTotals(Collections.unmodifiableMap(debitTotals))
                .totalCredits(totalCredits)
                .totalDebits(totalDebits)
                .outputVat(outputVat)
                .inputVat(inputVat)
                .netVat(outputVat.subtract(inputVat))
                .reviewQueue(Collections.unmodifiableList(reviewQueue))
                .build();
    }

    private boolean isLargeTransfer(String description, BigDecimal credit) {
        return TRANSFER_KEYWORDS.matcher(description).find()
                && credit.compareTo(policy.getLargeTransactionThreshold()) > 0;
    }

    private TransactionCategory categorizeCredit(String description, boolean largeTransfer) {
        if (largeTransfer) {
            return TransactionCategory.SALES;
        }
        if (TRANSFER_KEYWORDS.matcher(description).find()) {
            return TransactionCategory.TRANSFERS_IN;
        }
        return TransactionCategory.OTHER;
    }

    private TransactionCategory categorizeDebit(String description) {
        if (SALARY_KEYWORDS.matcher(description).find()) {
            return TransactionCategory.SALARIES;
        }
        if (UTILITY_KEYWORDS.matcher(description).find()) {
            return TransactionCategory.UTILITIES;
        }
        if (EXPENSE_KEYWORDS.matcher(description).find()) {
            return TransactionCategory.EXPENSES;
        }
        return TransactionCategory.OTHER;
    }

    private String debitRiskFlag(StatementTransaction line) {
        long amount = line.getDebit().setScale(0, RoundingMode.FLOOR).longValue();
        List<RiskFlag> flags = riskFlaggingService.assess(line.getDescription(), amount);
        if (flags.isEmpty()) {
            return null;
        }
        return flags.stream().map(RiskFlag::getLabel).collect(Collectors.joining("; "));
    }

    private BigDecimal vatOn(BigDecimal base) {
        return base.multiply(policy.getVatRate()).setScale(2, RoundingMode.HALF_UP);
    }

    private static Pattern keywords(String... words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")");
    }
}
