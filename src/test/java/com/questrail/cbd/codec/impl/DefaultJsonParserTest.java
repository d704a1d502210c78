package com.questrail.cbd.codec.impl;

import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.exceptions.JsonParseException;
import com.questrail.cbd.model.MapValue;
import com.questrail.cbd.model.Value;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.questrail.cbd.exceptions.JsonParseException.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultJsonParserTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultJsonParser}.
 *
 * <p>Covers the value mapping (integer versus float, key order, duplicate
 * names) and the strictness of the grammar. Error tests assert the kind and
 * the character offset; a few also assert line and column.</p>
 */
final class DefaultJsonParserTest
{
    private final DefaultJsonParser parser = new DefaultJsonParser();

    @Test
    void parsesObject()
    {
        assertEquals(MapValue.builder().put("key", Value.text("value")).build(),
                parser.parse("{\"key\": \"value\"}"));
    }

    @Test
    void parsesLiteralsAndEmptyContainers()
    {
        assertEquals(Value.nullValue(), parser.parse("null"));
        assertEquals(Value.bool(true), parser.parse("true"));
        assertEquals(Value.bool(false), parser.parse("false"));
        assertEquals(Value.array(), parser.parse("[ ]"));
        assertEquals(MapValue.builder().build(), parser.parse("{ }"));
    }

    @Test
    void integerLiteralsBecomeIntegers()
    {
        assertEquals(Value.integer(42), parser.parse("42"));
        assertEquals(Value.integer(0), parser.parse("-0"));
        assertEquals(Value.integer(-17), parser.parse("-17"));
        assertEquals(Value.integer(new BigInteger("123456789012345678901234567890")),
                parser.parse("123456789012345678901234567890"));
    }

    @Test
    void fractionOrExponentMakesAFloat()
    {
        assertEquals(Value.floating(42.0), parser.parse("42.0"));
        assertEquals(Value.floating(100.0), parser.parse("1e2"));
        assertEquals(Value.floating(-0.25), parser.parse("-2.5E-1"));
        assertEquals(Value.floating(1.0), parser.parse("1.0"));
    }

    @Test
    void rejectsMalformedNumbers()
    {
        assertSyntaxError("01", 1);
        assertSyntaxError("-", 1);
        assertSyntaxError("1.", 2);
        assertSyntaxError("1e", 2);
        assertSyntaxError("1e+", 3);
        assertSyntaxError(".5", 0);
        assertSyntaxError("+1", 0);
    }

    @Test
    void rejectsNumbersThatOverflowADouble()
    {
        assertSyntaxError("1e999", 0);
    }

    @Test
    void decodesEscapes()
    {
        assertEquals(Value.text("a\nb"), parser.parse("\"a\\nb\""));
        assertEquals(Value.text("\"\\/\b\f\r\t"), parser.parse("\"\\\"\\\\\\/\\b\\f\\r\\t\""));
        assertEquals(Value.text("\u00e9"), parser.parse("\"\\u00e9\""));
        assertEquals(Value.text("\u00e9"), parser.parse("\"\\u00E9\""));
    }

    @Test
    void combinesSurrogatePairEscapes()
    {
        assertEquals(Value.text("\uD83D\uDE00"), parser.parse("\"\\ud83d\\ude00\""));
    }

    @Test
    void rejectsUnpairedSurrogateEscapes()
    {
        assertEquals(INVALID_ESCAPE, kindOf("\"\\ud83d\""));
        assertEquals(INVALID_ESCAPE, kindOf("\"\\ud83dx\""));
        assertEquals(INVALID_ESCAPE, kindOf("\"\\ud83d\\u0041\""));
        assertEquals(INVALID_ESCAPE, kindOf("\"\\ude00\""));
    }

    @Test
    void rejectsBadEscapes()
    {
        JsonParseException e = assertThrows(JsonParseException.class, () -> parser.parse("\"\\x\""));
        assertEquals(INVALID_ESCAPE, e.kind());
        assertEquals(1, e.position());

        assertEquals(INVALID_ESCAPE, kindOf("\"\\u12G4\""));
        assertEquals(INVALID_ESCAPE, kindOf("\"\\u12\""));
    }

    @Test
    void rejectsRawControlCharactersInStrings()
    {
        assertSyntaxError("\"a\tb\"", 2);
    }

    @Test
    void unterminatedStringReportsItsStart()
    {
        assertSyntaxError("[\"abc", 1);
    }

    @Test
    void rejectsTrailingCommas()
    {
        assertSyntaxError("[1,]", 3);
        assertSyntaxError("{\"a\":1,}", 7);
    }

    @Test
    void rejectsMissingColonAndBareWords()
    {
        assertSyntaxError("{\"a\" 1}", 5);
        assertSyntaxError("nul", 0);
        assertSyntaxError("hello", 0);
        assertSyntaxError("{a:1}", 1);
        assertSyntaxError("[1 2]", 3);
    }

    @Test
    void rejectsEmptyInput()
    {
        assertSyntaxError("", 0);
        assertSyntaxError(" \n ", 3);
    }

    @Test
    void contentAfterTheValueIsTrailingData()
    {
        JsonParseException e = assertThrows(JsonParseException.class, () -> parser.parse("1 2"));
        assertEquals(TRAILING_DATA, e.kind());
        assertEquals(2, e.position());

        assertEquals(TRAILING_DATA, kindOf("{} x"));
        assertEquals(TRAILING_DATA, kindOf("nullx"));
    }

    @Test
    void allowsInsignificantWhitespace()
    {
        assertEquals(Value.array(Value.integer(1), Value.integer(2)), parser.parse(" \t\r\n[ 1 , 2 ]\n"));
    }

    @Test
    void keepsDuplicateKeysInOrder()
    {
        MapValue map = (MapValue) parser.parse("{\"a\":1,\"b\":2,\"a\":3}");

        assertEquals(3, map.size());
        assertEquals(Value.text("a"), map.entries().get(0).key());
        assertEquals(Value.text("b"), map.entries().get(1).key());
        assertEquals(Value.text("a"), map.entries().get(2).key());
        assertEquals(Value.integer(3), map.entries().get(2).value());
    }

    @Test
    void errorsCarryLineAndColumn()
    {
        JsonParseException e = assertThrows(JsonParseException.class, () -> parser.parse("[\n  1,\n  x]"));

        assertEquals(SYNTAX_ERROR, e.kind());
        assertEquals(9, e.position());
        assertEquals(3, e.line());
        assertEquals(3, e.column());
        assertTrue(e.describe().contains("line 3, column 3"));
    }

    @Test
    void nestingBeyondMaxDepthIsRejected()
    {
        DefaultJsonParser shallow = new DefaultJsonParser(CodecConfig.builder().withMaxDepth(2).build());

        assertEquals(Value.array(Value.array(Value.integer(1))), shallow.parse("[[1]]"));

        JsonParseException e = assertThrows(JsonParseException.class, () -> shallow.parse("[[[1]]]"));
        assertEquals(DEPTH_EXCEEDED, e.kind());
        assertEquals(2, e.position());

        assertEquals(DEPTH_EXCEEDED, assertThrows(JsonParseException.class,
                () -> shallow.parse("{\"a\":{\"b\":{}}}")).kind());
    }

    @Test
    void adversarialNestingIsBoundedByDefault()
    {
        String input = "[".repeat(100_000);

        assertEquals(DEPTH_EXCEEDED, kindOf(input));
    }

    private void assertSyntaxError(String text, long position)
    {
        JsonParseException e = assertThrows(JsonParseException.class, () -> parser.parse(text));
        assertEquals(SYNTAX_ERROR, e.kind(), () -> "kind for " + text);
        assertEquals(position, e.position(), () -> "position for " + text);
    }

    private JsonParseException.Kind kindOf(String text)
    {
        return assertThrows(JsonParseException.class, () -> parser.parse(text)).kind();
    }
}
