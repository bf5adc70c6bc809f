/**
 * This library contains the data model of DeployR: hardware {@link
 * Topology topologies} as reported by hosts, {@link Request requests} as
 * written by the user, and the {@link Deployment} that results from
 * {@link Matcher matching} requested instances to hosts.
 *
 * <p>Everything in this package is immutable after construction and free of
 * any transport or runtime concerns, so a deployment can be computed and
 * checked without starting a single participant.  All classes read and write
 * the JSON formats exchanged between participants; parse errors are
 * reported via {@link RequestParseException}.
 */
package eu.nebulouscloud.deployr.model;
