/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.presetgraph.exception.PresetGraphException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.presetgraph.exception.ProviderException} - A completion call
 *       failed (missing/invalid key, HTTP error, malformed response). Caught at the node
 *       boundary and shown as the node's result</li>
 *   <li>{@link com.phillippitts.presetgraph.exception.MissingContextException} - A block needs
 *       captured bytes the run does not carry. Aborts the branch</li>
 *   <li>{@link com.phillippitts.presetgraph.exception.InvalidPipelineException} - The block
 *       graph failed validation before the run started</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining.
 *
 * @since 1.0
 */
package com.phillippitts.presetgraph.exception;
