package org.abstractica.voicecontrol.impl.protocol;

/**
 * Thrown when a control payload cannot be decoded.
 */
public class MalformedMessageException extends RuntimeException
{
    public MalformedMessageException(String message)
    {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
