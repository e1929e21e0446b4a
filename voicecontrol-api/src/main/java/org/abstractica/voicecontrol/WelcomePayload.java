package org.abstractica.voicecontrol;

import java.util.Base64;
import java.util.Objects;

/**
 * Data handed to a client once per new session so it can tag and
 * authenticate its datagrams.
 *
 * @param numericId the session's numeric ID
 * @param secret    the session secret, base64 encoded
 */
public record WelcomePayload(int numericId, String secret)
{
    public WelcomePayload
    {
        if (numericId < 1 || numericId > 65535)
        {
            throw new IllegalArgumentException("Numeric ID must be 1-65535: " + numericId);
        }
        Objects.requireNonNull(secret, "secret");
    }

    /**
     * Builds the welcome payload for a session.
     *
     * @param session the newly created session
     * @return the payload
     */
    public static WelcomePayload of(Session session)
    {
        Objects.requireNonNull(session, "session");
        return new WelcomePayload(
                session.getNumericId(),
                Base64.getEncoder().encodeToString(session.getSecret())
        );
    }
}
