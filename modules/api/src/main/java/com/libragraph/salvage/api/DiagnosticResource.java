package com.libragraph.salvage.api;

import com.libragraph.salvage.core.analysis.AnalysisSettings;
import com.libragraph.salvage.formats.api.SignatureFormat;
import com.libragraph.salvage.formats.registry.FormatRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    FormatRegistry formatRegistry;

    @Inject
    AnalysisSettings settings;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Salvage is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile
        );
    }

    @GET
    @Path("/formats")
    public List<Map<String, Object>> formats() {
        return formatRegistry.formats().stream()
                .map(DiagnosticResource::describe)
                .toList();
    }

    @GET
    @Path("/settings")
    public Map<String, Object> settings() {
        return Map.of(
                "workerCount", settings.workerCount(),
                "maxFilesPerType", settings.maxFilesPerType(),
                "maxRecordSize", settings.maxRecordSize(),
                "maxBufferBytes", settings.maxBufferSize(),
                "stringMinLength", settings.strings().minLength(),
                "stringMaxLength", settings.strings().maxLength(),
                "provenanceWindow", settings.strings().provenanceWindow()
        );
    }

    private static Map<String, Object> describe(SignatureFormat format) {
        return Map.of(
                "id", format.id(),
                "category", format.category().label(),
                "priority", format.getDetectionCriteria().priority(),
                "minSize", format.getDetectionCriteria().minSize(),
                "maxSize", format.getDetectionCriteria().maxSize()
        );
    }
}
