/**
 * Application layer for layered configuration.
 * <p><strong>Role:</strong> Hosts the {@code ConfigSource} port and the resolver that merges ranked sources into one
 * logical, typed configuration tree.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; sources are shared by reference across every view of one tree.</p>
 */
package ca.gc.cra.layeredconfig.application;
