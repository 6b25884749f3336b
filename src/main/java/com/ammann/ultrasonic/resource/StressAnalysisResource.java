/* (C)2026 */
package com.ammann.ultrasonic.resource;

import com.ammann.ultrasonic.config.AnalysisConfiguration;
import com.ammann.ultrasonic.dto.AnalysisRequestDTO;
import com.ammann.ultrasonic.dto.AnalysisResponseDTO;
import com.ammann.ultrasonic.dto.StatisticsReportDTO;
import com.ammann.ultrasonic.dto.StatisticsRequestDTO;
import com.ammann.ultrasonic.exception.ValidationException;
import com.ammann.ultrasonic.model.AnalysisResult;
import com.ammann.ultrasonic.model.MeasurementPoint;
import com.ammann.ultrasonic.model.StatisticsReport;
import com.ammann.ultrasonic.properties.ApiProperties;
import com.ammann.ultrasonic.service.MeasurementTableService;
import com.ammann.ultrasonic.service.StressAnalysisService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST resource for acoustoelastic stress index analysis of ultrasonic scans.
 *
 * <p>Accepts an in-memory measurement table with its analysis parameters and returns
 * the augmented table, interpolated grid, statistics report and colour scale hints.
 * Loading files and rendering plots are left to the client.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Analysis.BASE)
@Tag(name = "Stress Analysis API", description = "Ultrasonic acoustoelastic stress index analysis")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StressAnalysisResource {

    private static final Logger LOG = Logger.getLogger(StressAnalysisResource.class);

    @Inject
    MeasurementTableService measurementTableService;

    @Inject
    StressAnalysisService stressAnalysisService;

    @ConfigProperty(name = "stress.grid.default-mesh-step-mm", defaultValue = "1.0")
    double defaultMeshStepMm = AnalysisConfiguration.DEFAULT_MESH_STEP_MM;

    @POST
    @Operation(
            summary = "Run stress analysis",
            description = "Computes velocities, the relative stress index (longitudinal) or birefringence (shear), "
                    + "an interpolated heatmap grid and summary statistics for a measurement table"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Analysis completed",
                    content = @Content(schema = @Schema(implementation = AnalysisResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Missing columns or invalid parameters"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyze(AnalysisRequestDTO request) {
        if (request == null || request.parameters() == null) {
            throw ValidationException.missingParameter("parameters", "every analysis");
        }

        LOG.debugf("Analysis request: mode=%s", request.parameters().mode());

        long start = System.nanoTime();
        AnalysisConfiguration configuration = request.parameters().toConfiguration(defaultMeshStepMm);
        List<MeasurementPoint> points =
                measurementTableService.toMeasurementPoints(request.table(), configuration.mode());
        AnalysisResult result = stressAnalysisService.analyze(points, configuration);
        long processingTimeNs = System.nanoTime() - start;

        return Response.ok(AnalysisResponseDTO.from(result, processingTimeNs)).build();
    }

    @POST
    @Path(ApiProperties.Analysis.STATISTICS)
    @Operation(
            summary = "Summarize index values",
            description = "Descriptive statistics of precomputed index values with an optional qualitative "
                    + "stress estimate when a positive acoustoelastic constant K is supplied"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Statistics computed",
                    content = @Content(schema = @Schema(implementation = StatisticsReportDTO.class))),
            @APIResponse(responseCode = "400", description = "Values missing")
    })
    public Response statistics(StatisticsRequestDTO request) {
        if (request == null) {
            throw ValidationException.missingParameter("values", "a statistics request");
        }

        LOG.debugf("Statistics request: values=%d, K=%s",
                request.values() != null ? request.values().size() : 0, request.calibrationConstant());

        StatisticsReport report = stressAnalysisService.summarize(request.values(), request.calibrationConstant());
        return Response.ok(StatisticsReportDTO.from(report)).build();
    }
}
