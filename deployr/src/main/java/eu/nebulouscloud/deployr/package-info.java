/**
 * This package implements DeployR, which deploys a set of requested
 * instances onto a set of hosts and connects them with channels.
 *
 * <p>Every host runs one participant.  The coordinator participant gathers
 * the hardware topologies of all hosts, pairs each instance with a
 * compatible host (see {@link eu.nebulouscloud.deployr.model.Matcher}) and
 * sends the resulting deployment to everyone.  Each participant then runs
 * the function of the instance it was paired with.
 *
 * <p>The entry points are {@link Main} and {@link LocalExecution} (command
 * line) and {@link DeploymentDriver} (embedding).  {@link DeployR}
 * implements the per-participant deployment phases.  The runtime is
 * abstracted by {@link eu.nebulouscloud.deployr.backend.Backend}; the
 * package {@link eu.nebulouscloud.deployr.local} implements it with
 * threads.
 */
package eu.nebulouscloud.deployr;
