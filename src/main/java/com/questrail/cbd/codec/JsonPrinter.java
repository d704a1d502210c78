package com.questrail.cbd.codec;

import com.questrail.cbd.exceptions.JsonPrintException;
import com.questrail.cbd.model.Value;

/**
 * Emits JSON text corresponding to a {@link Value}.
 */
public interface JsonPrinter
{
    /**
     * @throws JsonPrintException if the value contains something with no JSON
     *         rendering under the configured policies
     */
    String print(Value value);
}
