package org.abstractica.voicecontrol.impl.control;

import org.abstractica.voicecontrol.impl.framing.MessageFramer;
import org.abstractica.voicecontrol.message.ControlMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory transport that decodes everything written to it.
 */
class RecordingTransport implements ControlTransport
{
    private final MessageFramer reader = new MessageFramer();
    private final List<ControlMessage> sent = new ArrayList<>();
    private int closeCount;
    private boolean failWrites;

    @Override
    public synchronized void write(byte[] bytes) throws IOException
    {
        if (failWrites)
        {
            throw new IOException("broken pipe");
        }
        sent.addAll(reader.addData(bytes));
    }

    @Override
    public synchronized void close()
    {
        closeCount++;
    }

    @Override
    public String describePeer()
    {
        return "test-peer";
    }

    synchronized List<ControlMessage> sent()
    {
        return new ArrayList<>(sent);
    }

    synchronized int closeCount()
    {
        return closeCount;
    }

    synchronized void failWrites()
    {
        failWrites = true;
    }
}
