/**
 * Shared utilities for all salvage modules.
 *
 * <p>Contains {@link com.libragraph.salvage.util.ContentHash} (BLAKE3-128), the byte-order
 * helpers {@link com.libragraph.salvage.util.BigEndian} and
 * {@link com.libragraph.salvage.util.LittleEndian}, and the read-only
 * {@link com.libragraph.salvage.util.buffer buffer layer} (BinaryData, RamBuffer, FileBuffer).
 * No framework dependencies.
 */
package com.libragraph.salvage.util;
