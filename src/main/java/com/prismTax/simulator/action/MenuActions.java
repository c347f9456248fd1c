package com.prismTax.simulator.action;

import com.prismTax.simulator.emitter.model.ListMenu;
import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Menus for bank connection, identity verification and filing reminders.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MenuActions {

    public static final String VERIFY_NIN = "verify_nin";
    public static final String VERIFY_TIN = "verify_tin";
    public static final String VERIFY_CAC = "verify_cac";
    public static final String REMINDER_VAT = "reminder_vat";
    public static final String REMINDER_PAYE = "reminder_paye";
    public static final String REMINDER_ANNUAL = "reminder_annual";

    private static final int VAT_DUE_DAY = 21;
    private static final int PAYE_DUE_DAY = 10;
    private static final DateTimeFormatter DUE_DATE = DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH);

    /**
     * Banks offered for connection.
     */
    public enum Bank {
        GTB("bank_gtb", "GTBank"),
        ZENITH("bank_zenith", "Zenith Bank"),
        ACCESS("bank_access", "Access Bank"),
        UBA("bank_uba", "UBA"),
        FIRST("bank_first", "First Bank");

        private final String buttonId;
        private final String title;

        Bank(String buttonId, String title) {
            this.buttonId = buttonId;
            this.title = title;
        }

        public String getButtonId() {
            return buttonId;
        }

        public String getTitle() {
            return title;
        }

        public static Bank fromButtonId(String buttonId) {
            for (Bank bank : values()) {
                if (bank.buttonId.equals(buttonId)) {
                    return bank;
                }
            }
            return null;
        }
    }

    private final ResponseEmitter responseEmitter;

    @Value("${simulator.time-zone:Africa/Lagos}")
    private String timeZone;

    public void bankMenu(TurnContext turn, String mentionedBank) {
        ListMenu menu = ListMenu.builder()
                .header("🏦 Connect Your Bank")
                .buttonText("Select bank")
                .footer("Read-only access. We never see your login details.")
                .sections(List.of(ListMenu.Section.builder()
                        .title("Banks")
                        .rows(Arrays.stream(Bank.values())
                                .map(bank -> ListMenu.Row.builder().id(bank.getButtonId()).title(bank.getTitle()).build())
                                .toList())
                        .build()))
                .build();
        responseEmitter.listMenu(turn, "🏦 *Connect Your Bank Account*\n\n"
                + "Linking your bank lets PRISM:\n"
                + "✅ Import transactions automatically\n"
                + "✅ Categorize income and expenses\n"
                + "✅ Detect VAT-liable transactions\n\n"
                + (mentionedBank != null ? "You mentioned " + mentionedBank + ". " : "")
                + "Select your bank to connect:", menu);
    }

    public void connectBank(TurnContext turn, Bank bank) {
        log.info("Bank selected - correlationId: {}, bank: {}", turn.getCorrelationId(), bank);
        responseEmitter.text(turn, "🔗 *" + bank.getTitle() + "*\n\n"
                + "In the live channel you would now get a secure link to authorize read-only access.\n\n"
                + "In the simulator, type *upload* and send a " + bank.getTitle()
                + " statement to see how transactions are categorized.");
    }

    public void verificationMenu(TurnContext turn, String mentionedIdType) {
        String intro = mentionedIdType != null
                ? "🆔 Let's verify your " + mentionedIdType + ".\n\n"
                : "🆔 *Identity Verification*\n\n";
        responseEmitter.buttons(turn, intro + "Which document would you like to verify?", List.of(
                ReplyButton.of(VERIFY_NIN, "NIN"),
                ReplyButton.of(VERIFY_TIN, "TIN"),
                ReplyButton.of(VERIFY_CAC, "CAC")));
    }

    public void verificationPrompt(TurnContext turn, String buttonId) {
        String prompt = switch (buttonId) {
            case VERIFY_NIN -> "🆔 Send your 11-digit NIN to verify it against the NIMC register.";
            case VERIFY_TIN -> "🆔 Send your TIN (at least 10 digits) to verify it with FIRS.";
            case VERIFY_CAC -> "🏢 Send your CAC registration number (e.g. RC123456) to verify your company.";
            default -> throw new IllegalArgumentException("Unknown verification button: " + buttonId);
        };
        responseEmitter.text(turn, prompt);
    }

    public void reminderMenu(TurnContext turn) {
        LocalDate today = LocalDate.now(Clock.system(ZoneId.of(timeZone)));
        responseEmitter.buttons(turn, "📅 *Tax Filing Reminders*\n\n"
                        + "🔹 VAT return: " + nextMonthlyDeadline(today, VAT_DUE_DAY).format(DUE_DATE) + "\n"
                        + "🔹 Monthly PAYE: " + nextMonthlyDeadline(today, PAYE_DUE_DAY).format(DUE_DATE) + "\n"
                        + "🔹 Annual returns: " + nextAnnualDeadline(today).format(DUE_DATE) + "\n\n"
                        + "Which reminders would you like?",
                List.of(
                        ReplyButton.of(REMINDER_VAT, "📊 VAT"),
                        ReplyButton.of(REMINDER_PAYE, "💰 PAYE"),
                        ReplyButton.of(REMINDER_ANNUAL, "📅 Annual")));
    }

    public void setReminder(TurnContext turn, String buttonId) {
        LocalDate today = LocalDate.now(Clock.system(ZoneId.of(timeZone)));
        String text = switch (buttonId) {
            case REMINDER_VAT -> "✅ VAT reminder set. Returns are due on the 21st of every month; next deadline "
                    + nextMonthlyDeadline(today, VAT_DUE_DAY).format(DUE_DATE) + ".";
            case REMINDER_PAYE -> "✅ PAYE reminder set. Remittances are due on the 10th of every month; next deadline "
                    + nextMonthlyDeadline(today, PAYE_DUE_DAY).format(DUE_DATE) + ".";
            case REMINDER_ANNUAL -> "✅ Annual return reminder set. Returns are due by 31 March; next deadline "
                    + nextAnnualDeadline(today).format(DUE_DATE) + ".";
            default -> throw new IllegalArgumentException("Unknown reminder button: " + buttonId);
        };
        responseEmitter.text(turn, text + "\n\nI'll remind you 3 days before.");
    }

    static LocalDate nextMonthlyDeadline(LocalDate today, int dueDay) {
        LocalDate thisMonth = today.withDayOfMonth(dueDay);
        return today.isAfter(thisMonth) ? thisMonth.plusMonths(1) : thisMonth;
    }

    static LocalDate nextAnnualDeadline(LocalDate today) {
        LocalDate thisYear = LocalDate.of(today.getYear(), 3, 31);
        return today.isAfter(thisYear) ? thisYear.plusYears(1) : thisYear;
    }
}
