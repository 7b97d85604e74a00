/**
 * Pure Java value types shared across all salvage modules.
 *
 * <p>Classification enums for carved files, coverage attribution and runtime strings.
 * ContentHash and the buffer types live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.salvage.types;
