package com.koni.eventcache.infrastructure.web.exception;

import com.koni.eventcache.domain.exception.DeviceRegistryUnavailableException;
import com.koni.eventcache.domain.exception.ValidationException;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

/**
 * Maps exceptions raised by GraphQL data fetchers to GraphQL errors,
 * mirroring the status mapping of {@link GlobalExceptionHandler}.
 */
@Slf4j
@Component
public class GraphQlExceptionResolver extends DataFetcherExceptionResolverAdapter {

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        if (ex instanceof ValidationException) {
            log.warn("GraphQL validation error: {}", ex.getMessage());
            return error(env, ErrorType.BAD_REQUEST, ex.getMessage());
        }
        if (ex instanceof DeviceRegistryUnavailableException) {
            log.error("Device registry unavailable: {}", ex.getMessage(), ex);
            return error(env, ErrorType.INTERNAL_ERROR, "Device registry temporarily unavailable");
        }
        log.error("Unexpected GraphQL error: {}", ex.getMessage(), ex);
        return error(env, ErrorType.INTERNAL_ERROR, "Internal server error");
    }

    private static GraphQLError error(DataFetchingEnvironment env, ErrorType type, String message) {
        return GraphqlErrorBuilder.newError(env)
                .errorType(type)
                .message(message)
                .build();
    }
}
