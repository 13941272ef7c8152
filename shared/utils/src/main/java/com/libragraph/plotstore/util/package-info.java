/**
 * Shared utilities for all Plotstore modules.
 *
 * <p>Contains the GUID, alias and timestamp rules that every storage backend must
 * apply identically ({@link com.libragraph.plotstore.util.ImageIds},
 * {@link com.libragraph.plotstore.util.Aliases},
 * {@link com.libragraph.plotstore.util.UtcTimestamps}).
 * No framework dependencies.
 */
package com.libragraph.plotstore.util;
