/**
 * Typed extraction of component arguments.
 *
 * <p>{@link relaykit.args.Arguments} is an immutable bundle keyed by
 * {@link relaykit.args.ArgKey}; {@link relaykit.args.Argument} resolves one entry with
 * optional or required semantics.
 */
package relaykit.args;
