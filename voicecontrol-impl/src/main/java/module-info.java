/**
 * Voice control implementation module.
 *
 * <p>Provides the default implementation of the voice control API.</p>
 */
module voicecontrol.impl
{
    requires voicecontrol.api;
    requires org.slf4j;

    // Export the server factory and the directory for external use
    exports org.abstractica.voicecontrol.impl.server;
    exports org.abstractica.voicecontrol.impl.directory;

    // Export framing and payload codec for building clients
    exports org.abstractica.voicecontrol.impl.framing;
    exports org.abstractica.voicecontrol.impl.protocol;
}
