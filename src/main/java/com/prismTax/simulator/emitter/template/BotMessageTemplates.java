package com.prismTax.simulator.emitter.template;

/**
 * Fixed bot copy used across the simulator flows.
 *
 * Text uses WhatsApp markup (*bold*, _italic_) because the simulator mirrors the WhatsApp channel.
 */
public class BotMessageTemplates {

    private BotMessageTemplates() {}

    public static final String HELP_MESSAGE = """
            Welcome to PRISM! 🇳🇬

            Available commands:
            📝 *vat 50000 electronics* - Calculate VAT on an item
            💼 *tax 10000000* - Annual income tax
            💵 *salary 450000* - Monthly PAYE
            👴 *pension 2400000* - Pension income
            🧑‍💻 *freelance 7200000 expenses 1800000* - Business income
            🏠 *rental income 2400000* - Rental withholding
            ⚖️ *minimum wage check* - Minimum wage exemption
            🎁 *reliefs* - Tax reliefs you can claim
            🏗️ *new project Name 5000000 from Sponsor* - Track a project fund
            📊 *summary* - VAT filing summary
            💰 *paid* - Confirm payment for a filing
            📤 *upload* - Upload an invoice or bank statement
            👤 *profile* - Your registration details
            🔄 *reset* - Start over

            Or just tell me what you need in your own words!""";

    public static final String NOT_UNDERSTOOD = "I didn't understand that command.\n\n" + HELP_MESSAGE;

    public static final String NEW_USER_NUDGE =
            "Hello! 👋 I'm the PRISM assistant.\n\nIt looks like you're new here. Type *hi* or *help* to get started!";

    public static final String ASK_TIN =
            "Welcome to PRISM - Nigeria's tax automation platform! 🇳🇬\n\n"
                    + "To get started, I'll need to verify your business.\n\n"
                    + "Please enter your TIN (Tax Identification Number):";

    public static final String ASK_NIN =
            "Welcome to PRISM - Nigeria's tax automation platform! 🇳🇬\n\n"
                    + "To get started, I'll need to verify your identity.\n\n"
                    + "Please enter your 11-digit NIN (National Identification Number):";

    public static final String INVALID_TIN =
            "❌ Invalid TIN format. Please enter a valid %d+ digit Tax Identification Number:";

    public static final String INVALID_NIN =
            "❌ Invalid NIN format.\n\nNIN must be exactly %d digits.\n\nPlease try again:";

    public static final String ASK_FULL_NAME = "✅ NIN received: %s\n\nWhat is your full name?";

    public static final String INVALID_FULL_NAME = "Please enter your full name (letters only):";

    public static final String ASK_EMPLOYMENT_STATUS = "Thanks, %s! 🙏\n\nWhat is your employment status?";

    public static final String INVALID_EMPLOYMENT_STATUS =
            "Please choose one of the options below: Employed, Self-employed or Retired.";

    public static final String ASK_BUSINESS_NAME = "✅ TIN verified: %s\n\nNow, please enter your business name:";

    public static final String INVALID_BUSINESS_NAME = "Please enter your registered business name:";

    public static final String UPLOAD_PROMPT =
            "📤 *Document Upload*\n\nSend an image of your invoice or bank statement and I'll extract the details automatically.";

    public static final String UPLOAD_NOT_ALLOWED =
            "Please finish registration before uploading documents. Type *help* if you are stuck.";

    public static final String INVOICE_CONFIRM_REPROMPT =
            "Please confirm the extracted invoice: reply *confirm* to save it or *edit* to discard it.";

    public static final String INVOICE_CONFIRMED =
            "✅ Invoice confirmed and added to your records!\n\n"
                    + "Your Input VAT has been updated.\nType *summary* to see your updated VAT position.";

    public static final String INVOICE_DISCARDED =
            "✏️ Invoice discarded.\n\nPlease upload a clearer image or type *upload* to try again.";

    public static final String COLLABORATOR_FAILED = "⚠️ %s failed. Please try again in a moment.";

    public static final String TURN_FAILED =
            "⚠️ Something went wrong while handling your message. Please try again.";

    public static final String OPTION_UNAVAILABLE = "That option is no longer available.\n\n" + HELP_MESSAGE;

    public static final String SESSION_RESET = "🔄 Conversation reset. Type *hi* to start again.";
}
