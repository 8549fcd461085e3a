package com.threatsentinel.core.incident;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Masks personal and payment data before it is written to disk.
 *
 * <ul>
 * <li>keys listed as PII fields become {@value #MASK}</li>
 * <li>{@code card_number} keeps its last four characters</li>
 * <li>values of payment token fields longer than eight characters keep their
 * first four</li>
 * </ul>
 *
 * <p>
 * Only the top level of the given map is inspected. Maps are never modified
 * in place.
 * </p>
 *
 * @since 1.0.0
 */
public class PiiMasker {

    static final String MASK = "[MASKED]";

    static final String CARD_NUMBER = "card_number";

    static final Set<String> PAYMENT_FIELDS = Set.of("payment_token", "account_number", "iban", "cvv");

    private final Set<String> piiFields;

    /**
     * @param piiFields keys whose values are always masked
     */
    public PiiMasker(List<String> piiFields) {
        this.piiFields = Set.copyOf(Objects.requireNonNull(piiFields, "piiFields must not be null"));
    }

    /**
     * @param data map to mask; may be {@code null}
     * @return masked copy, or {@code null} for {@code null} input
     */
    public Map<String, Object> mask(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        Map<String, Object> masked = new LinkedHashMap<>(data);
        for (Map.Entry<String, Object> e : masked.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (piiFields.contains(key)) {
                e.setValue(MASK);
            } else if (CARD_NUMBER.equals(key) && value instanceof String s && s.length() > 4) {
                e.setValue("XXXX-XXXX-XXXX-" + s.substring(s.length() - 4));
            } else if (PAYMENT_FIELDS.contains(key) && value instanceof String s && s.length() > 8) {
                e.setValue(s.substring(0, 4) + "..." + MASK);
            }
        }
        return masked;
    }
}
