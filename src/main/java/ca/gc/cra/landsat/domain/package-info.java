/**
 * Core domain model for Landsat archive resolution, MTL metadata, and band indexing.
 * <p><strong>Role:</strong> Domain layer types without filesystem or library dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.gc.cra.landsat.domain;
