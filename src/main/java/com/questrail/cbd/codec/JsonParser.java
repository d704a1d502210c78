package com.questrail.cbd.codec;

import com.questrail.cbd.exceptions.JsonParseException;
import com.questrail.cbd.model.Value;

/**
 * Parses JSON text (RFC 8259) into the {@link Value} model.
 */
public interface JsonParser
{
    /**
     * Parse text holding exactly one JSON value, optionally surrounded by
     * insignificant whitespace.
     *
     * @throws JsonParseException if the text is not exactly one valid JSON value
     */
    Value parse(String text);
}
