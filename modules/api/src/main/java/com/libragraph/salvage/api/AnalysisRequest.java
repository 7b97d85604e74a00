package com.libragraph.salvage.api;

import java.util.List;

/**
 * Body of {@code POST /api/analysis}.
 *
 * @param path       dump file readable by the server
 * @param categories file category labels to carve; null or empty carves all
 * @param verbose    log every diagnostic at INFO
 * @param strings    run string pool extraction; defaults to true
 */
public record AnalysisRequest(String path, List<String> categories, Boolean verbose, Boolean strings) {
}
