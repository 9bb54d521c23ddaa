package com.maestro.dispatch.api;

import com.maestro.core.model.AlreadyRunningException;
import com.maestro.core.model.CommunicationNotFoundException;
import com.maestro.core.model.CyclicDependencyException;
import com.maestro.core.model.ExecutionNotFoundException;
import com.maestro.core.model.MaestroException;
import com.maestro.core.model.StepNotFoundException;
import com.maestro.core.model.TemplateNotFoundException;
import com.maestro.core.model.UnsupportedExportFormatException;
import com.maestro.core.model.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps orchestration exceptions to JSON error responses.
 */
final class ApiErrors {

    private ApiErrors() {}

    static ResponseEntity<Object> toResponse(MaestroException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        HttpStatus status;
        if (e instanceof ExecutionNotFoundException || e instanceof TemplateNotFoundException
                || e instanceof StepNotFoundException || e instanceof CommunicationNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof AlreadyRunningException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof CyclicDependencyException cycle) {
            body.put("cycle", cycle.getUnplacedStepIds());
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof ValidationException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof UnsupportedExportFormatException unsupported) {
            body.put("supported_formats", unsupported.getSupportedFormats());
            status = unsupported.isDeclared() ? HttpStatus.NOT_IMPLEMENTED : HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status).body(body);
    }
}
