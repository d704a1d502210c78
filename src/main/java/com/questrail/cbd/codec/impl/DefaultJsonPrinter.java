package com.questrail.cbd.codec.impl;

import com.questrail.cbd.codec.Base64Codec;
import com.questrail.cbd.codec.JsonPrinter;
import com.questrail.cbd.config.ByteStringPolicy;
import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.config.JsonStyle;
import com.questrail.cbd.exceptions.JsonPrintException;
import com.questrail.cbd.model.ArrayValue;
import com.questrail.cbd.model.BoolValue;
import com.questrail.cbd.model.ByteStringValue;
import com.questrail.cbd.model.FloatValue;
import com.questrail.cbd.model.IntegerValue;
import com.questrail.cbd.model.MapEntry;
import com.questrail.cbd.model.MapValue;
import com.questrail.cbd.model.NullValue;
import com.questrail.cbd.model.SimpleValue;
import com.questrail.cbd.model.TagValue;
import com.questrail.cbd.model.TextStringValue;
import com.questrail.cbd.model.Value;
import com.fasterxml.jackson.core.io.NumberOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * DefaultJsonPrinter
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link JsonPrinter}.
 *
 * <p>Output is a single line with no indentation. Values without a direct
 * JSON counterpart are projected:</p>
 * <ul>
 *   <li>Tags print their content only</li>
 *   <li>Finite floats print as the shortest decimal that round-trips</li>
 *   <li>Simple values (including undefined) and non-finite floats print as
 *       {@code null}</li>
 *   <li>Byte strings print as unpadded base64 text, or are rejected,
 *       according to {@link ByteStringPolicy}</li>
 *   <li>Map keys follow {@link MapKeys}</li>
 * </ul>
 */
public final class DefaultJsonPrinter implements JsonPrinter
{
    private static final Logger log = LoggerFactory.getLogger(DefaultJsonPrinter.class);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final JsonStyle style;
    private final ByteStringPolicy byteStringPolicy;
    private final Base64Codec base64;

    public DefaultJsonPrinter()
    {
        this(CodecConfig.defaults());
    }

    public DefaultJsonPrinter(CodecConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.style = config.jsonStyle();
        this.byteStringPolicy = config.byteStringPolicy();
        this.base64 = new DefaultBase64Codec(config.base64Alphabet());
    }

    @Override
    public String print(Value value)
    {
        Objects.requireNonNull(value, "value");

        final StringBuilder sb = new StringBuilder();
        writeValue(sb, value);
        log.debug("Printed {} as {} character(s) of JSON", value.getClass().getSimpleName(), sb.length());
        return sb.toString();
    }

    private void writeValue(StringBuilder sb, Value value)
    {
        if (value instanceof NullValue || value instanceof SimpleValue) {
            sb.append("null");
        }
        else if (value instanceof BoolValue b) {
            sb.append(b.value());
        }
        else if (value instanceof IntegerValue i) {
            sb.append(i.value());
        }
        else if (value instanceof FloatValue f) {
            final double d = f.value();
            if (Double.isFinite(d)) {
                appendFloat(sb, d);
            }
            else {
                sb.append("null");
            }
        }
        else if (value instanceof ByteStringValue b) {
            if (byteStringPolicy == ByteStringPolicy.REJECT) {
                throw new JsonPrintException(JsonPrintException.Kind.UNSUPPORTED_VALUE,
                        "Byte string of " + b.length() + " byte(s) has no JSON rendering while byte strings are rejected");
            }
            writeString(sb, base64.encode(b.value()));
        }
        else if (value instanceof TextStringValue t) {
            writeString(sb, t.value());
        }
        else if (value instanceof ArrayValue a) {
            writeArray(sb, a.items());
        }
        else if (value instanceof MapValue m) {
            writeObject(sb, m.entries());
        }
        else if (value instanceof TagValue t) {
            writeValue(sb, t.content());
        }
        else {
            // Sealed interface should make this unreachable.
            throw new IllegalArgumentException("Unsupported value type: " + value.getClass());
        }
    }

    private void writeArray(StringBuilder sb, List<Value> items)
    {
        sb.append('[');
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(style.elementSeparator());
            }
            writeValue(sb, items.get(i));
        }
        sb.append(']');
    }

    private void writeObject(StringBuilder sb, List<MapEntry> entries)
    {
        sb.append('{');
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(style.elementSeparator());
            }
            final MapEntry entry = entries.get(i);
            writeString(sb, MapKeys.memberName(entry.key()));
            sb.append(style.memberSeparator());
            writeValue(sb, entry.value());
        }
        sb.append('}');
    }

    /**
     * Shortest decimal that parses back to {@code d}, always carrying a
     * fraction or exponent so it re-parses as a float.
     */
    static void appendFloat(StringBuilder sb, double d)
    {
        final String digits = NumberOutput.toString(d, true);
        sb.append(digits);
        if (digits.indexOf('.') < 0 && digits.indexOf('E') < 0) {
            sb.append(".0");
        }
    }

    private static void writeString(StringBuilder sb, String s)
    {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
                    }
                    else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
