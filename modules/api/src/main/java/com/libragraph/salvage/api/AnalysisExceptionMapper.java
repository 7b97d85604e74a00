package com.libragraph.salvage.api;

import com.libragraph.salvage.core.analysis.AnalysisException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * Reports unreadable or oversized dumps as 422 with the failing offset.
 */
@Provider
public class AnalysisExceptionMapper implements ExceptionMapper<AnalysisException> {

    @Override
    public Response toResponse(AnalysisException e) {
        return Response.status(422)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of(
                        "error", String.valueOf(e.getMessage()),
                        "operation", String.valueOf(e.operation()),
                        "offset", e.offset()))
                .build();
    }
}
