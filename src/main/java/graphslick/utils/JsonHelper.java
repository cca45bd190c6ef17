package graphslick.utils;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Helpers for the JSON files GraphSlick reads.
 */
public class JsonHelper {

    /**
     * Read an address field. Addresses are either JSON integers or strings,
     * hexadecimal with a {@code 0x} prefix or decimal. Addresses are unsigned
     * 64-bit values, so negative numbers are rejected.
     * @param parent the object holding the field
     * @param field the field name
     * @return the address
     * @throws IllegalArgumentException if the field is missing or not an address
     */
    public static long readAddress(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing address field '" + field + "'");
        }
        if (node.isIntegralNumber()) {
            if (node.isBigInteger()) {
                var value = node.bigIntegerValue();
                if (value.signum() < 0 || value.bitLength() > 64) {
                    throw new IllegalArgumentException("Field '" + field + "' is out of address range: " + node);
                }
                return value.longValue();
            }
            long value = node.asLong();
            if (value < 0) {
                throw new IllegalArgumentException("Field '" + field + "' is a negative address: " + node);
            }
            return value;
        }
        if (node.isTextual()) {
            return parseAddress(node.asText());
        }
        throw new IllegalArgumentException("Field '" + field + "' is not an address: " + node);
    }

    public static long parseAddress(String text) {
        String value = text.trim();
        try {
            if (value.startsWith("0x") || value.startsWith("0X")) {
                return Long.parseUnsignedLong(value.substring(2), 16);
            }
            return Long.parseUnsignedLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid address: '" + text + "'", e);
        }
    }

    public static String formatAddress(long address) {
        return String.format("0x%x", address);
    }

    /**
     * Read an optional text field.
     * @return the text, or {@code defaultValue} if the field is missing or null
     */
    public static String readText(JsonNode parent, String field, String defaultValue) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        return node.asText();
    }
}
