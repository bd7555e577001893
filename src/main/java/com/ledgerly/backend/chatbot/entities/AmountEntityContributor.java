package com.ledgerly.backend.chatbot.entities;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Monetary amounts: optional "$", digits with optional thousands separators and an optional
 * two-digit fraction. "1,250.50" -> 1250.50.
 */
@Component
@Order(10)
public class AmountEntityContributor implements StructuredEntityContributor {

    private static final Pattern MONEY = Pattern.compile("\\$?(\\d+(?:,\\d{3})*(?:\\.\\d{2})?)");

    @Override
    public void contribute(String message, List<ExtractedEntity> namedEntities, StructuredEntities.Builder entities) {
        if (message == null || message.isEmpty()) {
            return;
        }
        Matcher m = MONEY.matcher(message);
        while (m.find()) {
            entities.amount(new BigDecimal(m.group(1).replace(",", "")));
        }
    }
}
