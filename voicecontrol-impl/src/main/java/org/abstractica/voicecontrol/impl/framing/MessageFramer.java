package org.abstractica.voicecontrol.impl.framing;

import org.abstractica.voicecontrol.impl.protocol.MalformedMessageException;
import org.abstractica.voicecontrol.impl.protocol.PayloadCodec;
import org.abstractica.voicecontrol.message.ControlMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Length-delimited framing for the control channel.
 *
 * <p>Wire format of one frame:</p>
 * <pre>
 * [length: 4 bytes, unsigned, big-endian]
 * [payload: length bytes]
 * </pre>
 *
 * <p>Incoming bytes are accumulated until whole frames are available, so
 * arbitrary fragmentation and batching by the transport are both handled.
 * A partial frame is kept until the rest arrives.</p>
 *
 * <p>A failure never discards messages that precede it in the stream. If a
 * call decodes complete frames before hitting an oversized header or, under
 * {@link DecodeFailurePolicy#FAIL}, an undecodable payload, it returns those
 * messages and holds the failure back until {@link #checkFailure()} or the
 * next {@code addData} call.</p>
 *
 * <p>Owned by a single connection. Not thread-safe.</p>
 */
public class MessageFramer
{
    private static final Logger LOG = LoggerFactory.getLogger(MessageFramer.class);

    /**
     * Size of the length header in bytes.
     */
    public static final int HEADER_LENGTH = 4;

    /**
     * Default upper bound on a frame's payload length.
     */
    public static final int DEFAULT_MAX_FRAME_LENGTH = 1024 * 1024;

    private static final int INITIAL_CAPACITY = 1024;

    private final int maxFrameLength;
    private final DecodeFailurePolicy failurePolicy;

    private byte[] buffer;
    private int start;
    private int end;
    private long malformedFrames;
    private RuntimeException pendingFailure;

    /**
     * Creates a framer with the default limit that skips malformed frames.
     */
    public MessageFramer()
    {
        this(DEFAULT_MAX_FRAME_LENGTH, DecodeFailurePolicy.SKIP);
    }

    /**
     * Creates a framer.
     *
     * @param maxFrameLength largest accepted payload length in bytes
     * @param failurePolicy  handling of undecodable payloads
     */
    public MessageFramer(int maxFrameLength, DecodeFailurePolicy failurePolicy)
    {
        if (maxFrameLength <= 0)
        {
            throw new IllegalArgumentException("maxFrameLength must be positive: " + maxFrameLength);
        }
        this.maxFrameLength = maxFrameLength;
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.buffer = new byte[INITIAL_CAPACITY];
    }

    // ========== Encoding ==========

    /**
     * Encodes a message as one frame.
     *
     * @param message the message to encode
     * @return length header followed by the payload
     * @throws IllegalArgumentException if the payload exceeds the frame limit
     */
    public byte[] encode(ControlMessage message)
    {
        byte[] payload = PayloadCodec.encode(message);
        if (payload.length > maxFrameLength)
        {
            throw new IllegalArgumentException(
                    "Payload of " + payload.length + " bytes exceeds maximum " + maxFrameLength);
        }

        ByteBuffer frame = ByteBuffer.allocate(HEADER_LENGTH + payload.length);
        frame.putInt(payload.length);
        frame.put(payload);
        return frame.array();
    }

    // ========== Decoding ==========

    /**
     * Appends received bytes and decodes every complete frame.
     *
     * @param chunk bytes as read from the connection
     * @return decoded messages in stream order, possibly empty
     * @throws FrameTooLargeException    if a header announces an oversized frame
     *                                   and no message precedes it
     * @throws MalformedMessageException if a payload is undecodable, the policy
     *                                   is {@link DecodeFailurePolicy#FAIL} and
     *                                   no message precedes it
     */
    public List<ControlMessage> addData(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        return addData(chunk, 0, chunk.length);
    }

    /**
     * Appends part of an array and decodes every complete frame.
     *
     * @param chunk  source array
     * @param offset first byte to append
     * @param length number of bytes to append
     * @return decoded messages in stream order, possibly empty
     * @throws FrameTooLargeException    see {@link #addData(byte[])}
     * @throws MalformedMessageException see {@link #addData(byte[])}
     */
    public List<ControlMessage> addData(byte[] chunk, int offset, int length)
    {
        Objects.requireNonNull(chunk, "chunk");
        Objects.checkFromIndexSize(offset, length, chunk.length);

        append(chunk, offset, length);
        checkFailure();

        List<ControlMessage> messages = new ArrayList<>();
        try
        {
            decodeFrames(messages);
        }
        catch (FrameTooLargeException | MalformedMessageException e)
        {
            if (messages.isEmpty())
            {
                throw e;
            }
            pendingFailure = e;
        }

        if (start == end)
        {
            start = 0;
            end = 0;
        }
        return messages.isEmpty() ? Collections.emptyList() : messages;
    }

    /**
     * Throws the failure held back by the last {@code addData} call, if any.
     *
     * <p>The failure is cleared once thrown.</p>
     *
     * @throws FrameTooLargeException    if an oversized header was held back
     * @throws MalformedMessageException if an undecodable payload was held back
     */
    public void checkFailure()
    {
        RuntimeException failure = pendingFailure;
        if (failure != null)
        {
            pendingFailure = null;
            throw failure;
        }
    }

    /**
     * Returns whether a failure is held back for {@link #checkFailure()}.
     */
    public boolean hasPendingFailure()
    {
        return pendingFailure != null;
    }

    /**
     * Discards all buffered bytes, including any partial frame, and any
     * held-back failure.
     */
    public void reset()
    {
        pendingFailure = null;
        clearBuffer();
    }

    /**
     * Returns the number of received bytes not yet consumed as frames.
     */
    public int bufferedBytes()
    {
        return end - start;
    }

    /**
     * Returns the number of frames skipped because they could not be decoded.
     */
    public long malformedFrames()
    {
        return malformedFrames;
    }

    private void decodeFrames(List<ControlMessage> messages)
    {
        while (end - start >= HEADER_LENGTH)
        {
            long frameLength = peekLength();
            if (frameLength > maxFrameLength)
            {
                // No way to find the next frame boundary.
                clearBuffer();
                throw new FrameTooLargeException(frameLength, maxFrameLength);
            }

            int frameEnd = start + HEADER_LENGTH + (int) frameLength;
            if (frameEnd > end)
            {
                return; // partial frame, wait for more data
            }

            int payloadStart = start + HEADER_LENGTH;
            start = frameEnd;
            decodeInto(messages, payloadStart, (int) frameLength);
        }
    }

    private void clearBuffer()
    {
        start = 0;
        end = 0;
        if (buffer.length > INITIAL_CAPACITY)
        {
            buffer = new byte[INITIAL_CAPACITY];
        }
    }

    private void decodeInto(List<ControlMessage> messages, int offset, int length)
    {
        try
        {
            messages.add(PayloadCodec.decode(ByteBuffer.wrap(buffer, offset, length).slice()));
        }
        catch (MalformedMessageException e)
        {
            malformedFrames++;
            if (failurePolicy == DecodeFailurePolicy.FAIL)
            {
                throw e;
            }
            LOG.warn("Skipping malformed frame of {} bytes: {}", length, e.getMessage());
        }
    }

    private long peekLength()
    {
        return ((buffer[start] & 0xFFL) << 24)
                | ((buffer[start + 1] & 0xFFL) << 16)
                | ((buffer[start + 2] & 0xFFL) << 8)
                | (buffer[start + 3] & 0xFFL);
    }

    private void append(byte[] chunk, int offset, int length)
    {
        if (length == 0)
        {
            return;
        }

        if (end + length > buffer.length)
        {
            int pending = end - start;
            int required = pending + length;
            if (required > buffer.length)
            {
                int capacity = Math.max(buffer.length * 2, required);
                buffer = Arrays.copyOfRange(buffer, start, start + capacity);
            }
            else
            {
                System.arraycopy(buffer, start, buffer, 0, pending);
            }
            start = 0;
            end = pending;
        }

        System.arraycopy(chunk, offset, buffer, end, length);
        end += length;
    }
}
