/**
 * Latest-value retention for sticky events, one entry per exact event class.
 */
package relaykit.sticky;
