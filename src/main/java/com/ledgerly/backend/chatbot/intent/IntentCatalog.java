package com.ledgerly.backend.chatbot.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Built-in intent table. The order below is the tie-break order used by {@link IntentMatcher}.
 *
 * A pattern must not be listed under two intents: the later intent could never win it.
 */
public final class IntentCatalog {

    public static final String GREETING = "greeting";
    public static final String BALANCE_INQUIRY = "balance_inquiry";
    public static final String SPENDING_ANALYSIS = "spending_analysis";
    public static final String BUDGET_HELP = "budget_help";
    public static final String SAVINGS_ADVICE = "savings_advice";
    public static final String TRANSACTION_SEARCH = "transaction_search";
    public static final String FINANCIAL_GOALS = "financial_goals";
    public static final String INVESTMENT_ADVICE = "investment_advice";
    public static final String BILL_REMINDERS = "bill_reminders";
    public static final String EXPORT_DATA = "export_data";
    public static final String HELP = "help";
    public static final String GOODBYE = "goodbye";

    private IntentCatalog() {}

    public static List<IntentDefinition> defaultIntents() {
        List<IntentDefinition> items = new ArrayList<>();

        items.add(new IntentDefinition(GREETING,
                List.of("hello", "hi", "hey", "good morning", "good afternoon",
                        "good evening", "greetings", "what's up", "howdy"),
                List.of("Hello! I'm your personal finance assistant. How can I help you today?",
                        "Hi there! I'm here to help you manage your finances. What would you like to know?",
                        "Greetings! I can help you with budgets, transactions, and financial insights.")));

        items.add(new IntentDefinition(BALANCE_INQUIRY,
                List.of("what's my balance", "show balance", "account balance", "how much money",
                        "current balance", "balance check", "money left", "account total"),
                List.of("Let me check your account balances for you.",
                        "I'll retrieve your current account balances.")));

        items.add(new IntentDefinition(SPENDING_ANALYSIS,
                List.of("spending analysis", "where did I spend", "spending breakdown", "expense report",
                        "spending summary", "money spent on", "spending patterns", "expense analysis"),
                List.of("I'll analyze your spending patterns for you.",
                        "Let me break down your expenses by category.")));

        items.add(new IntentDefinition(BUDGET_HELP,
                List.of("budget help", "create budget", "budget advice", "budgeting tips",
                        "how to budget", "budget planning", "budget management", "budget recommendation"),
                List.of("I'd be happy to help you with budgeting!",
                        "Let me provide some budget recommendations based on your spending.")));

        items.add(new IntentDefinition(SAVINGS_ADVICE,
                List.of("saving money", "savings advice", "how to save", "savings tips",
                        "save more money", "savings plan", "savings goal", "emergency fund"),
                List.of("I can help you create a savings plan!",
                        "Let me analyze your spending to find savings opportunities.")));

        items.add(new IntentDefinition(TRANSACTION_SEARCH,
                List.of("find transaction", "search transactions", "look for payment", "transaction history",
                        "find purchase", "search spending", "transaction details", "payment history"),
                List.of("I'll search your transaction history for you.",
                        "Let me find the transactions you're looking for.")));

        // "savings goal" lives under savings_advice only
        items.add(new IntentDefinition(FINANCIAL_GOALS,
                List.of("financial goals", "set goal", "financial planning",
                        "goal tracking", "achieve goal", "financial targets", "money goals"),
                List.of("I can help you set and track your financial goals!",
                        "Let's work on your financial goal planning.")));

        items.add(new IntentDefinition(INVESTMENT_ADVICE,
                List.of("investment advice", "should I invest", "investment tips", "portfolio",
                        "stocks", "bonds", "investing money", "investment strategy"),
                List.of("I can provide general investment guidance based on your financial situation.",
                        "Let me help you understand your investment options.")));

        items.add(new IntentDefinition(BILL_REMINDERS,
                List.of("bill reminders", "upcoming bills", "bill due dates", "payment reminders",
                        "bill schedule", "payment due", "bill notifications", "recurring payments"),
                List.of("I'll check your upcoming bill due dates.",
                        "Let me show you your bill payment schedule.")));

        items.add(new IntentDefinition(EXPORT_DATA,
                List.of("export data", "download report", "export transactions", "generate report",
                        "export to excel", "pdf report", "download statements", "export csv"),
                List.of("I can help you export your financial data.",
                        "What type of report would you like to generate?")));

        items.add(new IntentDefinition(HELP,
                List.of("help", "what can you do", "commands", "features", "assistance",
                        "how to use", "capabilities", "options", "support"),
                List.of("I can help you with:\n• Account balances\n• Spending analysis\n• Budget planning\n"
                                + "• Savings advice\n• Transaction search\n• Financial goals\n• Bill reminders\n• Export reports",
                        "I'm your financial assistant! I can analyze spending, help with budgets, track goals, and much more.")));

        items.add(new IntentDefinition(GOODBYE,
                List.of("goodbye", "bye", "see you later", "talk to you later", "farewell",
                        "good night", "take care", "until next time", "see ya", "adios"),
                List.of("Goodbye! Feel free to ask me anything about your finances anytime.",
                        "Take care! I'm here whenever you need financial assistance.",
                        "See you later! Remember to check your budget regularly.")));

        return Collections.unmodifiableList(items);
    }
}
