package com.questrail.cbd.codec.impl;

import com.questrail.cbd.exceptions.JsonPrintException;
import com.questrail.cbd.model.IntegerValue;
import com.questrail.cbd.model.TagValue;
import com.questrail.cbd.model.TextStringValue;
import com.questrail.cbd.model.Value;

/**
 * Policy for turning CBOR map keys into JSON member names.
 *
 * <ul>
 *   <li>Tags are looked through, as they are for values.</li>
 *   <li>Text strings are used as they are.</li>
 *   <li>Integers use their decimal form.</li>
 *   <li>Anything else has no member name.</li>
 * </ul>
 */
final class MapKeys
{
    private MapKeys()
    {
    }

    static String memberName(Value key)
    {
        Value k = key;
        while (k instanceof TagValue t) {
            k = t.content();
        }

        if (k instanceof TextStringValue t) {
            return t.value();
        }
        if (k instanceof IntegerValue i) {
            return i.value().toString();
        }
        throw new JsonPrintException(JsonPrintException.Kind.NON_STRING_MAP_KEY,
                "Map key " + k + " cannot be used as a JSON member name");
    }
}
