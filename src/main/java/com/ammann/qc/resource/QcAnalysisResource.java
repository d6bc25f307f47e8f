/* (C)2026 */
package com.ammann.qc.resource;

import com.ammann.qc.config.AnalyteRegistry;
import com.ammann.qc.dto.AnalysisReportDTO;
import com.ammann.qc.dto.AnalysisRequestDTO;
import com.ammann.qc.dto.AnalyteDTO;
import com.ammann.qc.dto.MethodComparisonDTO;
import com.ammann.qc.dto.MethodComparisonRequestDTO;
import com.ammann.qc.enumeration.Sensitivity;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.AnalysisReport;
import com.ammann.qc.model.MethodComparisonResult;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.properties.ApiProperties;
import com.ammann.qc.service.MethodComparisonService;
import com.ammann.qc.service.QcAnalysisService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for batch QC analysis and method comparison.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Qc.BASE)
@Tag(name = "QC Analysis API", description = "Batch fault detection on QC series")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class QcAnalysisResource {

    private static final Logger LOG = Logger.getLogger(QcAnalysisResource.class);
    private static final String INLINE_LABEL = "inline";

    @Inject QcAnalysisService analysisService;

    @Inject AnalyteRegistry analyteRegistry;

    @Inject MethodComparisonService comparisonService;

    @POST
    @Path(ApiProperties.Qc.ANALYZE)
    @Operation(
            summary = "Analyse a QC series",
            description =
                    "Runs Westgard rules, CUSUM, EWMA, robust anomaly, trend and run-pattern"
                            + " detection and returns the merged report")
    public Response analyze(AnalysisRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        List<Double> values = request.values();
        if (values == null || values.isEmpty()) {
            throw ValidationException.insufficientData("measurements", 1, 0);
        }
        if (values.contains(null)) {
            throw ValidationException.invalidParameter("values", "null", "numbers only");
        }

        ProcessParameters params = resolveParameters(request);
        String label = request.analyte() != null ? request.analyte() : INLINE_LABEL;
        LOG.debugf("Analysis requested for '%s' with %d values", label, values.size());

        AnalysisReport report = analysisService.analyze(label, values, params);
        return Response.ok(AnalysisReportDTO.from(label, report, Instant.now())).build();
    }

    @GET
    @Path(ApiProperties.Qc.ANALYTES)
    @Operation(
            summary = "Configured analytes",
            description = "Returns the analytes with their target process parameters")
    public Response getAnalytes() {
        List<AnalyteDTO> analytes =
                analyteRegistry.all().entrySet().stream()
                        .map(
                                e ->
                                        AnalyteDTO.from(
                                                e.getKey(),
                                                analyteRegistry.unitOf(e.getKey()).orElse(null),
                                                e.getValue()))
                        .toList();
        return Response.ok(analytes).build();
    }

    @POST
    @Path(ApiProperties.Qc.COMPARE)
    @Operation(
            summary = "Compare two measurement methods",
            description =
                    "Returns Bland-Altman limits of agreement, Pearson and Spearman correlation,"
                            + " the regression of methodB on methodA and paired t, independent t"
                            + " and Mann-Whitney U tests, plus a one-way ANOVA when groups are given")
    public Response compare(MethodComparisonRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        if (request.analyte() != null && analyteRegistry.find(request.analyte()).isEmpty()) {
            throw new NotFoundException("Unknown analyte: " + request.analyte());
        }
        String label = request.analyte() != null ? request.analyte() : INLINE_LABEL;
        LOG.debugf("Method comparison requested for '%s'", label);

        MethodComparisonResult result =
                comparisonService.compare(request.methodA(), request.methodB(), request.groups());
        return Response.ok(MethodComparisonDTO.from(label, result, Instant.now())).build();
    }

    ProcessParameters resolveParameters(AnalysisRequestDTO request) {
        ProcessParameters configured = null;
        if (request.analyte() != null) {
            configured =
                    analyteRegistry
                            .find(request.analyte())
                            .orElseThrow(
                                    () -> new NotFoundException("Unknown analyte: " + request.analyte()));
        }

        ProcessParameters.Builder builder;
        if (configured != null) {
            builder =
                    configured.toBuilder(
                            request.mean() != null ? request.mean() : configured.getMean(),
                            request.std() != null ? request.std() : configured.getStd());
        } else if (request.mean() != null && request.std() != null) {
            builder = ProcessParameters.builder(request.mean(), request.std());
        } else {
            throw new ValidationException("Either 'analyte' or both 'mean' and 'std' are required");
        }

        if (request.sensitivity() != null) {
            Sensitivity sensitivity = AnalyteRegistry.parseSensitivity("sensitivity", request.sensitivity());
            builder.sensitivity(sensitivity, analyteRegistry.sensitivityTable());
        } else if (configured == null) {
            builder.sensitivity(Sensitivity.MEDIUM, analyteRegistry.sensitivityTable());
        }
        if (request.teaPercent() != null) {
            builder.totalAllowableErrorPercent(request.teaPercent());
        }
        return builder.build();
    }
}
