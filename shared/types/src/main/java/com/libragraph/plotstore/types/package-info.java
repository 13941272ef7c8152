/**
 * Pure Java value types shared across all Plotstore modules.
 *
 * <p>{@link com.libragraph.plotstore.types.ImageFormat} and
 * {@link com.libragraph.plotstore.types.BlobKey}. GUID and alias rules live in
 * {@code shared/utils}. No framework dependencies.
 */
package com.libragraph.plotstore.types;
