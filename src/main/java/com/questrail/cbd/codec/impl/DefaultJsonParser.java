package com.questrail.cbd.codec.impl;

import com.questrail.cbd.codec.JsonParser;
import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.exceptions.JsonParseException;
import com.questrail.cbd.model.ArrayValue;
import com.questrail.cbd.model.BoolValue;
import com.questrail.cbd.model.FloatValue;
import com.questrail.cbd.model.IntegerValue;
import com.questrail.cbd.model.MapEntry;
import com.questrail.cbd.model.MapValue;
import com.questrail.cbd.model.NullValue;
import com.questrail.cbd.model.TextStringValue;
import com.questrail.cbd.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.questrail.cbd.exceptions.JsonParseException.Kind.*;

/**
 * DefaultJsonParser
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link JsonParser}.
 *
 * <p>A strict RFC 8259 recursive-descent reader over an in-memory string.
 * Nothing outside the grammar is tolerated: no comments, no trailing commas,
 * no single quotes, no bare words, no leading zeros.</p>
 *
 * <h2>Value mapping</h2>
 * <ul>
 *   <li>A number literal without {@code .}, {@code e} or {@code E} becomes an
 *       {@link IntegerValue} of arbitrary precision; any other number becomes
 *       a {@link FloatValue}.</li>
 *   <li>Objects become {@link MapValue}s with text keys in source order.
 *       Duplicate names are all kept.</li>
 * </ul>
 *
 * <p>Errors report the character offset of the problem together with its
 * 1-based line and column.</p>
 */
public final class DefaultJsonParser implements JsonParser
{
    private static final Logger log = LoggerFactory.getLogger(DefaultJsonParser.class);

    private final int maxDepth;

    public DefaultJsonParser()
    {
        this(CodecConfig.defaults());
    }

    public DefaultJsonParser(CodecConfig config)
    {
        this.maxDepth = Objects.requireNonNull(config, "config").maxDepth();
    }

    @Override
    public Value parse(String text)
    {
        Objects.requireNonNull(text, "text");

        final Session session = new Session(text);
        final Value value = session.parseDocument();
        log.debug("Parsed {} character(s) of JSON into {}", text.length(), value.getClass().getSimpleName());
        return value;
    }

    /**
     * Cursor over one input text.
     */
    private final class Session
    {
        private final String text;
        private int pos;

        Session(String text)
        {
            this.text = text;
        }

        Value parseDocument()
        {
            final Value value = parseValue(0);
            skipWhitespace();
            if (pos < text.length()) {
                throw error(TRAILING_DATA, pos,
                        "Unexpected " + describe(text.charAt(pos)) + " after the JSON value");
            }
            return value;
        }

        private Value parseValue(int depth)
        {
            skipWhitespace();
            final JsonToken token = JsonToken.startingWith(peek());

            switch (token) {
                case NULL:
                    consumeLiteral(token);
                    return NullValue.INSTANCE;
                case FALSE:
                    consumeLiteral(token);
                    return BoolValue.FALSE;
                case TRUE:
                    consumeLiteral(token);
                    return BoolValue.TRUE;
                case NUMBER:
                    return parseNumber();
                case STRING:
                    return new TextStringValue(parseString());
                case START_ARRAY:
                    return parseArray(depth);
                case START_OBJECT:
                    return parseObject(depth);
                case END_TEXT:
                    throw error(SYNTAX_ERROR, pos, "Unexpected end of input, expected a value");
                default:
                    throw error(SYNTAX_ERROR, pos, "Unexpected " + describe(text.charAt(pos)) + ", expected a value");
            }
        }

        private void consumeLiteral(JsonToken token)
        {
            final String literal = token.literal();
            if (!text.startsWith(literal, pos)) {
                throw error(SYNTAX_ERROR, pos, "Invalid literal, expected '" + literal + "'");
            }
            pos += literal.length();
        }

        private Value parseArray(int depth)
        {
            enter(depth);
            pos++; // [

            final List<Value> items = new ArrayList<>();
            skipWhitespace();
            if (peek() == ']') {
                pos++;
                return new ArrayValue(items);
            }

            while (true) {
                items.add(parseValue(depth + 1));
                skipWhitespace();

                final int c = peek();
                if (c == ',') {
                    pos++;
                }
                else if (c == ']') {
                    pos++;
                    return new ArrayValue(items);
                }
                else {
                    throw expected("',' or ']'");
                }
            }
        }

        private Value parseObject(int depth)
        {
            enter(depth);
            pos++; // {

            final List<MapEntry> entries = new ArrayList<>();
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return new MapValue(entries);
            }

            while (true) {
                skipWhitespace();
                if (peek() != '"') {
                    throw expected("a member name");
                }
                final TextStringValue key = new TextStringValue(parseString());

                skipWhitespace();
                if (peek() != ':') {
                    throw expected("':'");
                }
                pos++;

                entries.add(new MapEntry(key, parseValue(depth + 1)));
                skipWhitespace();

                final int c = peek();
                if (c == ',') {
                    pos++;
                }
                else if (c == '}') {
                    pos++;
                    return new MapValue(entries);
                }
                else {
                    throw expected("',' or '}'");
                }
            }
        }

        private Value parseNumber()
        {
            final int start = pos;
            boolean integral = true;

            if (peek() == '-') {
                pos++;
            }
            if (peek() == '0') {
                pos++;
                if (isDigit(peek())) {
                    throw error(SYNTAX_ERROR, pos, "Leading zeros are not allowed");
                }
            }
            else {
                requireDigits("integer part");
            }

            if (peek() == '.') {
                pos++;
                integral = false;
                requireDigits("fraction");
            }

            final int e = peek();
            if (e == 'e' || e == 'E') {
                pos++;
                integral = false;
                final int sign = peek();
                if (sign == '+' || sign == '-') {
                    pos++;
                }
                requireDigits("exponent");
            }

            final String literal = text.substring(start, pos);
            if (integral) {
                return new IntegerValue(new BigInteger(literal));
            }

            final double d = Double.parseDouble(literal);
            if (Double.isInfinite(d)) {
                throw error(SYNTAX_ERROR, start, "Number " + literal + " is out of range for a double");
            }
            return new FloatValue(d);
        }

        private void requireDigits(String part)
        {
            if (!isDigit(peek())) {
                throw error(SYNTAX_ERROR, pos, "Expected a digit in the " + part + " of a number");
            }
            while (isDigit(peek())) {
                pos++;
            }
        }

        private String parseString()
        {
            final int start = pos;
            pos++; // opening quote

            final StringBuilder sb = new StringBuilder();
            while (true) {
                if (pos >= text.length()) {
                    throw error(SYNTAX_ERROR, start, "Unterminated string");
                }

                final char c = text.charAt(pos);
                if (c == '"') {
                    pos++;
                    return sb.toString();
                }
                if (c == '\\') {
                    readEscape(sb, start);
                }
                else if (c < 0x20) {
                    throw error(SYNTAX_ERROR, pos, "Unescaped control character " + describe(c) + " in string");
                }
                else {
                    sb.append(c);
                    pos++;
                }
            }
        }

        private void readEscape(StringBuilder sb, int stringStart)
        {
            final int escapeStart = pos;
            pos++; // backslash
            if (pos >= text.length()) {
                throw error(SYNTAX_ERROR, stringStart, "Unterminated string");
            }

            final char e = text.charAt(pos++);
            switch (e) {
                case '"', '\\', '/' -> sb.append(e);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> {
                    final char unit = readHexUnit(escapeStart);
                    if (Character.isHighSurrogate(unit)) {
                        final int lowStart = pos;
                        if (!text.startsWith("\\u", pos)) {
                            throw error(INVALID_ESCAPE, escapeStart, "High surrogate escape is not followed by a low surrogate");
                        }
                        pos += 2;
                        final char low = readHexUnit(lowStart);
                        if (!Character.isLowSurrogate(low)) {
                            throw error(INVALID_ESCAPE, lowStart, "High surrogate escape is not followed by a low surrogate");
                        }
                        sb.append(unit).append(low);
                    }
                    else if (Character.isLowSurrogate(unit)) {
                        throw error(INVALID_ESCAPE, escapeStart, "Low surrogate escape without a preceding high surrogate");
                    }
                    else {
                        sb.append(unit);
                    }
                }
                default -> throw error(INVALID_ESCAPE, escapeStart, "Unknown escape " + describe(e));
            }
        }

        /**
         * Reads the four hex digits of a unicode escape; {@code pos} is just past the 'u'.
         */
        private char readHexUnit(int escapeStart)
        {
            if (pos + 4 > text.length()) {
                throw error(INVALID_ESCAPE, escapeStart, "Truncated unicode escape");
            }
            int unit = 0;
            for (int i = 0; i < 4; i++) {
                final int digit = hexValue(text.charAt(pos + i));
                if (digit < 0) {
                    throw error(INVALID_ESCAPE, escapeStart, "Unicode escape needs four hex digits");
                }
                unit = (unit << 4) | digit;
            }
            pos += 4;
            return (char) unit;
        }

        private void enter(int depth)
        {
            if (depth >= maxDepth) {
                throw error(DEPTH_EXCEEDED, pos, "Nesting exceeds the maximum depth of " + maxDepth);
            }
        }

        private void skipWhitespace()
        {
            while (JsonToken.startingWith(peek()) == JsonToken.WHITESPACE) {
                pos++;
            }
        }

        private int peek()
        {
            return (pos < text.length()) ? text.charAt(pos) : -1;
        }

        private JsonParseException expected(String what)
        {
            if (pos >= text.length()) {
                return error(SYNTAX_ERROR, pos, "Unexpected end of input, expected " + what);
            }
            return error(SYNTAX_ERROR, pos, "Unexpected " + describe(text.charAt(pos)) + ", expected " + what);
        }

        private JsonParseException error(JsonParseException.Kind kind, int offset, String message)
        {
            int line = 1;
            int lineStart = 0;
            for (int i = 0; i < offset && i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            return new JsonParseException(kind, offset, line, offset - lineStart + 1, message);
        }
    }

    private static boolean isDigit(int c)
    {
        return c >= '0' && c <= '9';
    }

    private static int hexValue(char c)
    {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static String describe(char c)
    {
        if (c < 0x20 || c > 0x7E) {
            return String.format("character U+%04X", (int) c);
        }
        return "'" + c + "'";
    }
}
