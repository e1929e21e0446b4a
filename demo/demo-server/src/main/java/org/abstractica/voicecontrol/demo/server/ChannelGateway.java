package org.abstractica.voicecontrol.demo.server;

import org.abstractica.voicecontrol.ControlChannel;
import org.abstractica.voicecontrol.Session;
import org.abstractica.voicecontrol.WelcomePayload;
import org.abstractica.voicecontrol.handlers.ControlGateway;
import org.abstractica.voicecontrol.message.ControlMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Minimal gateway: tracks channel membership and tells channel members when
 * someone joins or leaves.
 */
public class ChannelGateway implements ControlGateway
{
    private static final Logger LOG = LoggerFactory.getLogger(ChannelGateway.class);

    private final Map<Integer, Member> members = new ConcurrentHashMap<>();

    @Override
    public void onEstablished(ControlChannel channel, Session session, WelcomePayload welcome)
    {
        members.put(session.getNumericId(), new Member(channel, session));
    }

    @Override
    public void onMessage(ControlChannel channel, Session session, ControlMessage message)
    {
        if (message instanceof ControlMessage.ChannelJoin join)
        {
            if (session.getSubscribedChannels().add(join.channelId()))
            {
                notifyChannel(join.channelId(), new ControlMessage.UserJoin(session.getNumericId(), join.channelId()));
            }
        }
        else if (message instanceof ControlMessage.ChannelLeave leave)
        {
            if (session.getSubscribedChannels().remove(leave.channelId()))
            {
                notifyChannel(leave.channelId(), new ControlMessage.UserLeave(session.getNumericId(), leave.channelId()));
            }
        }
        else
        {
            LOG.info("Unhandled {} from session {}", message.tag(), session.getNumericId());
            channel.send(new ControlMessage.Error("unsupported", "Unsupported message: " + message.tag()));
        }
    }

    @Override
    public void onClosed(Session session)
    {
        members.remove(session.getNumericId());
        for (Integer channelId : session.getSubscribedChannels())
        {
            notifyChannel(channelId, new ControlMessage.UserLeave(session.getNumericId(), channelId));
        }
    }

    private void notifyChannel(int channelId, ControlMessage message)
    {
        for (Member member : members.values())
        {
            if (member.session().getSubscribedChannels().contains(channelId))
            {
                member.channel().send(message);
            }
        }
    }

    private record Member(ControlChannel channel, Session session)
    {
    }
}
