package stac.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import stac.core.model.common.FeatureDisabledException;
import stac.core.model.common.ResourceConflictException;
import stac.core.model.common.ResourceNotFoundException;

/**
 * Maps core exceptions to RFC 7807 Problem Details.
 *
 * <p>Backend failures other than these propagate unchanged and surface as 500.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapResourceNotFound(ResourceNotFoundException e) {
        LOG.debugv("Not found: {0}", e.getMessage());
        return toResponse(StacProblem.resourceNotFound(e.resourceType(), e.resourceId()));
    }

    @ServerExceptionMapper
    public Response mapResourceConflict(ResourceConflictException e) {
        LOG.debugv("Conflict: {0}", e.getMessage());
        return toResponse(StacProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapFeatureDisabled(FeatureDisabledException e) {
        LOG.debugv("Feature disabled: {0}", e.feature());
        return toResponse(StacProblem.featureDisabled(e.feature()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(StacProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
