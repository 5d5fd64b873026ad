package com.furnaceintel.pipeline.service;

import com.furnaceintel.pipeline.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns the raw text returned by the furnace API into records.
 *
 * The API wraps a Python-style literal ({@code [{'Timelogged': '05/29/2025 12:00:00 AM', 'TAG': 1.5}, ...]})
 * in XML and sometimes injects {@code <script>} blocks. Script spans are stripped, then the
 * remainder must parse completely as a list of flat string-keyed mappings. Anything else
 * fails the whole payload; no partial result is returned.
 */
@Component
@Slf4j
public class PayloadDecoder {

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script.*?</script>", Pattern.DOTALL);

    public List<RawRecord> decode(String raw) {
        if (raw == null) {
            throw new DecodeException("Payload is null");
        }
        String cleaned = SCRIPT_BLOCK.matcher(raw).replaceAll("").trim();

        List<RawRecord> records;
        try {
            records = toRecords(new LiteralReader(cleaned).readDocument());
        } catch (DecodeException e) {
            log.error("Failed to decode payload ({} chars): {}", cleaned.length(), e.getMessage());
            throw e;
        }

        log.info("Decoded payload into {} records", records.size());
        return records;
    }

    private List<RawRecord> toRecords(Object document) {
        if (!(document instanceof List<?> rows)) {
            throw new DecodeException("Expected a list of mappings but found " + describe(document));
        }
        List<RawRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object row = rows.get(i);
            if (!(row instanceof Map<?, ?> mapping)) {
                throw new DecodeException("Element " + i + " is " + describe(row) + ", not a mapping");
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : mapping.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new DecodeException("Element " + i + " has non-string key " + e.getKey());
                }
                Object value = e.getValue();
                if (value instanceof List<?> || value instanceof Map<?, ?>) {
                    throw new DecodeException("Element " + i + " key '" + key + "' holds a nested " + describe(value));
                }
                values.put(key, value);
            }
            records.add(RawRecord.of(values));
        }
        return records;
    }

    private static String describe(Object value) {
        if (value == null) return "None";
        if (value instanceof List<?>) return "list";
        if (value instanceof Map<?, ?>) return "mapping";
        return value.getClass().getSimpleName();
    }

    // ── Literal parsing ──────────────────────────────────────────────────────

    /**
     * Recursive-descent reader for the literal subset the API emits: lists, tuples, dicts,
     * quoted strings, numbers, True/False/None.
     */
    static final class LiteralReader {

        private final String src;
        private int pos;

        LiteralReader(String src) {
            this.src = src;
        }

        Object readDocument() {
            skipWhitespace();
            if (pos >= src.length()) {
                throw error("empty payload");
            }
            Object value = readValue();
            skipWhitespace();
            if (pos < src.length()) {
                throw error("unexpected trailing input");
            }
            return value;
        }

        private Object readValue() {
            skipWhitespace();
            if (pos >= src.length()) {
                throw error("unexpected end of input");
            }
            char c = src.charAt(pos);
            return switch (c) {
                case '[' -> readSequence('[', ']');
                case '(' -> readSequence('(', ')');
                case '{' -> readMapping();
                case '\'', '"' -> readString();
                default -> {
                    if (c == '-' || c == '+' || c == '.' || Character.isDigit(c)) {
                        yield readNumber();
                    }
                    if (Character.isLetter(c)) {
                        yield readKeyword();
                    }
                    throw error("unexpected character '" + c + "'");
                }
            };
        }

        private List<Object> readSequence(char open, char close) {
            expect(open);
            List<Object> items = new ArrayList<>();
            skipWhitespace();
            if (peek() == close) {
                pos++;
                return items;
            }
            while (true) {
                items.add(readValue());
                skipWhitespace();
                char c = next();
                if (c == close) return items;
                if (c != ',') throw error("expected ',' or '" + close + "'");
                skipWhitespace();
                if (peek() == close) {
                    pos++;
                    return items;
                }
            }
        }

        private Map<Object, Object> readMapping() {
            expect('{');
            Map<Object, Object> map = new LinkedHashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return map;
            }
            while (true) {
                Object key = readValue();
                skipWhitespace();
                expect(':');
                Object value = readValue();
                map.put(key, value);
                skipWhitespace();
                char c = next();
                if (c == '}') return map;
                if (c != ',') throw error("expected ',' or '}'");
                skipWhitespace();
                if (peek() == '}') {
                    pos++;
                    return map;
                }
            }
        }

        private String readString() {
            char quote = next();
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (pos >= src.length()) {
                    throw error("unterminated string");
                }
                char c = src.charAt(pos++);
                if (c == quote) break;
                if (c == '\n') throw error("newline in string");
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= src.length()) throw error("dangling escape");
                char esc = src.charAt(pos++);
                switch (esc) {
                    case '\\' -> sb.append('\\');
                    case '\'' -> sb.append('\'');
                    case '"' -> sb.append('"');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'x' -> sb.append((char) readHex(2));
                    case 'u' -> sb.append((char) readHex(4));
                    case '\n' -> { } // line continuation
                    default -> sb.append('\\').append(esc);
                }
            }
            return sb.toString();
        }

        private int readHex(int digits) {
            if (pos + digits > src.length()) throw error("truncated escape");
            String hex = src.substring(pos, pos + digits);
            try {
                pos += digits;
                return Integer.parseInt(hex, 16);
            } catch (NumberFormatException e) {
                throw error("bad escape \\" + hex);
            }
        }

        private Object readNumber() {
            int start = pos;
            if (peek() == '+' || peek() == '-') pos++;
            boolean isFloat = false;
            int digits = 0;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (Character.isDigit(c)) {
                    digits++;
                    pos++;
                } else if (c == '.' || c == 'e' || c == 'E') {
                    isFloat = true;
                    pos++;
                    if ((c == 'e' || c == 'E') && pos < src.length() && (peek() == '+' || peek() == '-')) {
                        pos++;
                    }
                } else {
                    break;
                }
            }
            String text = src.substring(start, pos);
            if (digits == 0) {
                throw error("malformed number '" + text + "'");
            }
            try {
                if (!isFloat) {
                    try {
                        return Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
                    } catch (NumberFormatException overflow) {
                        return Double.parseDouble(text);
                    }
                }
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw error("malformed number '" + text + "'");
            }
        }

        private Object readKeyword() {
            int start = pos;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
            String word = src.substring(start, pos);
            return switch (word) {
                case "True" -> Boolean.TRUE;
                case "False" -> Boolean.FALSE;
                case "None" -> null;
                default -> throw new DecodeException("Not a literal: '" + word + "' at offset " + start);
            };
        }

        private void skipWhitespace() {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
        }

        private char peek() {
            if (pos >= src.length()) throw error("unexpected end of input");
            return src.charAt(pos);
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }

        private void expect(char c) {
            if (next() != c) {
                pos--;
                throw error("expected '" + c + "'");
            }
        }

        private DecodeException error(String what) {
            return new DecodeException("Malformed payload literal: " + what + " at offset " + pos);
        }
    }
}
