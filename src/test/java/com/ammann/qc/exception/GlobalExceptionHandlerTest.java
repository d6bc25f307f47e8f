/* (C)2026 */
package com.ammann.qc.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsValidationExceptionToBadRequest() {
        Response response =
                handler.toResponse(ValidationException.invalidParameter("std", 0.0, "finite number > 0"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.message).contains("'std'");
        assertThat(body.status).isEqualTo(400);
    }

    @Test
    void mapsNotFoundTo404WithPath() {
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/v1/qc/monitor/glucose");
        handler.uriInfo = uriInfo;

        Response response = handler.toResponse(new NotFoundException("Analyte not monitored: glucose"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
        assertThat(body.path).isEqualTo("/api/v1/qc/monitor/glucose");
        assertThat(body.timestamp).isNotNull();
    }

    @Test
    void keepsStatusOfOtherWebApplicationExceptions() {
        Response response = handler.toResponse(new BadRequestException("malformed JSON"));

        assertThat(response.getStatus()).isEqualTo(400);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("HTTP_ERROR");
    }

    @Test
    void mapsUnhandledTo500() {
        Response response = handler.toResponse(new IllegalStateException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).doesNotContain("boom");
    }
}
