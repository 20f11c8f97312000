/**
 * Service provider interfaces for plugging in observability backends.
 */
package relaykit.spi;
