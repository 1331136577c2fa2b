package com.tonyguerra.net.pgwire.core.components;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields of an ErrorResponse or NoticeResponse.
 */
public record ServerError(String severity, String sqlState, String message, String detail, String hint) {

    public static ServerError parse(BackendMessage msg) {
        final var body = msg.body();
        final Map<Character, String> fields = new LinkedHashMap<>();

        while (body.hasRemaining()) {
            final byte code = body.get();
            if (code == 0) {
                break;
            }
            fields.put((char) code, BackendMessage.readCString(body));
        }

        // 'V' is the non-localized severity, present since 9.6
        final String severity = fields.getOrDefault('V', fields.get('S'));

        return new ServerError(severity, fields.get('C'), fields.get('M'), fields.get('D'), fields.get('H'));
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder();
        sb.append(severity != null ? severity : "ERROR").append(": ").append(message);
        if (sqlState != null) {
            sb.append(" (SQLSTATE ").append(sqlState).append(')');
        }
        if (detail != null) {
            sb.append(" Detail: ").append(detail);
        }
        if (hint != null) {
            sb.append(" Hint: ").append(hint);
        }

        return sb.toString();
    }
}
