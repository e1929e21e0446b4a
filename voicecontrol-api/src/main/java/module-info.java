/**
 * Voice control API module.
 *
 * <p>Provides the session directory contract, the control message model and
 * the gateway interfaces of the voice control core.</p>
 */
module voicecontrol.api
{
    exports org.abstractica.voicecontrol;
    exports org.abstractica.voicecontrol.handlers;
    exports org.abstractica.voicecontrol.message;
}
