package com.ledgerly.backend.chatbot.responses;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;

/**
 * Offers report downloads. Rendering happens elsewhere; this only returns the actions.
 */
@Component
@Order(90)
public class ExportOptionsResponseBuilder implements ResponseBuilder {

    static final String TEXT = "Export Options:\n\n"
            + "I can generate reports in these formats:\n"
            + "• PDF - Detailed financial summary with charts\n"
            + "• Excel - Transaction data for analysis\n"
            + "• CSV - Raw transaction data\n\n"
            + "What type of report would you like?";

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.EXPORT_DATA);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        return ChatReply.withActions(TEXT, List.of(
                exportAction("pdf", "Download PDF Report"),
                exportAction("excel", "Download Excel Report")
        ));
    }

    private static Map<String, Object> exportAction(String format, String label) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "export");
        action.put("format", format);
        action.put("label", label);
        return action;
    }
}
