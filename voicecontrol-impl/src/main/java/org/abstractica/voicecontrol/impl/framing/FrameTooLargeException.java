package org.abstractica.voicecontrol.impl.framing;

/**
 * Thrown when a frame header announces a payload above the configured limit.
 *
 * <p>The stream cannot be resynchronized after this; the connection should be
 * closed.</p>
 */
public class FrameTooLargeException extends RuntimeException
{
    private final long frameLength;
    private final int maxFrameLength;

    public FrameTooLargeException(long frameLength, int maxFrameLength)
    {
        super("Frame length " + frameLength + " exceeds maximum " + maxFrameLength);
        this.frameLength = frameLength;
        this.maxFrameLength = maxFrameLength;
    }

    public long getFrameLength()
    {
        return frameLength;
    }

    public int getMaxFrameLength()
    {
        return maxFrameLength;
    }
}
