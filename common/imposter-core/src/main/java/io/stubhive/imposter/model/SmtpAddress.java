package io.stubhive.imposter.model;

public record SmtpAddress(String address, String name) {

    /**
     * Parses {@code "Name" <addr>}, {@code Name <addr>} or a bare address.
     */
    public static SmtpAddress parse(String raw) {
        if (raw == null) {
            return new SmtpAddress("", "");
        }
        String value = raw.trim();
        int open = value.lastIndexOf('<');
        int close = value.lastIndexOf('>');
        if (open >= 0 && close > open) {
            String address = value.substring(open + 1, close).trim();
            String name = value.substring(0, open).trim();
            if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
                name = name.substring(1, name.length() - 1);
            }
            return new SmtpAddress(address, name);
        }
        return new SmtpAddress(value, "");
    }
}
