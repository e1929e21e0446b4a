/**
 * Demo server module.
 *
 * <p>Demonstrates server-side use of the voice control core with a simple
 * channel gateway.</p>
 */
module demo.server
{
    requires voicecontrol.api;
    requires voicecontrol.impl;
    requires org.slf4j;
}
