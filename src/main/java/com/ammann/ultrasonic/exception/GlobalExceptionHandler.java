/* (C)2026 */
package com.ammann.ultrasonic.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Global JAX-RS exception mapper that translates pipeline and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Schema and validation failures are client errors (HTTP 400). Unhandled
 * exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof SchemaException schemaException) {
            LOG.debugf("Rejected dataset for path %s: %s", path, exception.getMessage());
            ErrorResponse body = new ErrorResponse(
                    "SCHEMA_ERROR",
                    exception.getMessage(),
                    path,
                    Response.Status.BAD_REQUEST.getStatusCode());
            body.missingColumns = schemaException.getMissingColumns();
            return Response.status(Response.Status.BAD_REQUEST).entity(body).build();
        }

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof WebApplicationException webException
                && webException.getResponse().getStatus() < 500) {
            Response.Status status = Response.Status.fromStatusCode(webException.getResponse().getStatus());
            return createResponse(
                    status != null ? status : Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "REQUEST_ERROR",
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }


    /**
     * Structured error response body returned to API clients.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse
    {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;
        public List<String> missingColumns;

        public ErrorResponse(String code, String message)
        {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status)
        {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
