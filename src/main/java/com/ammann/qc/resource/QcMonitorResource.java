/* (C)2026 */
package com.ammann.qc.resource;

import com.ammann.qc.dto.MeasurementRequestDTO;
import com.ammann.qc.dto.MonitorSnapshotDTO;
import com.ammann.qc.exception.GlobalExceptionHandler.ErrorResponse;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.properties.ApiProperties;
import com.ammann.qc.service.MonitorSnapshot;
import com.ammann.qc.service.QcMonitorService;
import com.ammann.qc.service.QueuedMeasurementSource;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for the real-time QC monitor.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Qc.BASE)
@Tag(name = "QC Monitor API", description = "Real-time monitoring of configured analytes")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class QcMonitorResource {

    private static final Logger LOG = Logger.getLogger(QcMonitorResource.class);

    @Inject QcMonitorService monitorService;

    @Inject QueuedMeasurementSource measurementSource;

    @Context UriInfo uriInfo;

    @POST
    @Path(ApiProperties.Monitor.MEASUREMENTS)
    @Operation(
            summary = "Submit measurement",
            description = "Queues a measurement; the monitor evaluates it on one of its next ticks")
    public Response submitMeasurement(
            @PathParam(ApiProperties.ANALYTE_PARAM) String analyte, MeasurementRequestDTO request) {
        requireMonitored(analyte);
        if (request == null || request.value() == null) {
            throw ValidationException.invalidParameter("value", null, "a number");
        }
        if (!measurementSource.offer(analyte, request.value())) {
            Response.Status status = Response.Status.TOO_MANY_REQUESTS;
            ErrorResponse error =
                    new ErrorResponse(
                            "QUEUE_FULL",
                            "Measurement queue for " + analyte + " is full",
                            uriInfo != null ? uriInfo.getPath() : null,
                            status.getStatusCode());
            return Response.status(status).entity(error).build();
        }
        return Response.accepted(
                        Map.of("analyte", analyte, "pending", measurementSource.pending(analyte)))
                .build();
    }

    @GET
    @Path(ApiProperties.Monitor.ANALYTE)
    @Operation(
            summary = "Monitor snapshot",
            description = "Returns trailing values, recent violations and statistics of an analyte")
    public Response getSnapshot(@PathParam(ApiProperties.ANALYTE_PARAM) String analyte) {
        MonitorSnapshot snapshot =
                monitorService
                        .snapshot(analyte)
                        .orElseThrow(() -> new NotFoundException("Analyte not monitored: " + analyte));
        return Response.ok(
                        MonitorSnapshotDTO.from(
                                snapshot, monitorService.isRunning(), measurementSource.pending(analyte)))
                .build();
    }

    @POST
    @Path(ApiProperties.Monitor.STOP)
    @Operation(summary = "Stop monitor", description = "Skips further ticks; retained state is kept")
    public Response stop() {
        LOG.info("Monitor stop requested");
        monitorService.stop();
        return Response.ok(Map.of("running", monitorService.isRunning())).build();
    }

    @POST
    @Path(ApiProperties.Monitor.START)
    @Operation(summary = "Start monitor", description = "Resumes processing of queued measurements")
    public Response start() {
        LOG.info("Monitor start requested");
        monitorService.start();
        return Response.ok(Map.of("running", monitorService.isRunning())).build();
    }

    private void requireMonitored(String analyte) {
        if (!monitorService.isMonitored(analyte)) {
            throw new NotFoundException("Analyte not monitored: " + analyte);
        }
    }
}
