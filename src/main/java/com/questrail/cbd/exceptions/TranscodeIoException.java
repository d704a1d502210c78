package com.questrail.cbd.exceptions;

import java.io.IOException;

/**
 * Reading the input or writing the output failed.
 */
public final class TranscodeIoException extends TranscodeException
{
    public TranscodeIoException(String message, IOException cause) {
        super(message, NO_POSITION, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }

    @Override
    public String kindName() {
        return "IoError";
    }
}
