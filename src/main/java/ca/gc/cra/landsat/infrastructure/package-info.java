/**
 * Adapters implementing application ports: archive containers and JSON output.
 * <p><strong>Role:</strong> Infrastructure layer; the only code that touches Commons Compress and Jackson.</p>
 */
package ca.gc.cra.landsat.infrastructure;
