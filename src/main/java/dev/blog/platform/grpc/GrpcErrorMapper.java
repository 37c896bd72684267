package dev.blog.platform.grpc;

import dev.blog.platform.exception.BusinessException;
import dev.blog.platform.exception.ErrorKind;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;

/**
 * Mapping table from domain error kind to gRPC status
 */
@Slf4j
public final class GrpcErrorMapper {

    private GrpcErrorMapper() {
    }

    public static Status.Code codeOf(ErrorKind kind) {
        return switch (kind) {
            case USER_NOT_FOUND, POST_NOT_FOUND -> Status.Code.NOT_FOUND;
            case USER_ALREADY_EXISTS -> Status.Code.ALREADY_EXISTS;
            case INVALID_CREDENTIALS, JWT -> Status.Code.UNAUTHENTICATED;
            case FORBIDDEN -> Status.Code.PERMISSION_DENIED;
            case VALIDATION -> Status.Code.INVALID_ARGUMENT;
            case DATABASE, PASSWORD_HASH -> Status.Code.INTERNAL;
        };
    }

    public static StatusRuntimeException toStatusException(BusinessException e) {
        Status.Code code = codeOf(e.getKind());
        if (code == Status.Code.INTERNAL) {
            log.error("RPC failed: kind={}, retryable={}, message={}",
                    e.getKind(), e.isRetryable(), e.getMessage(), e);
        } else {
            log.warn("RPC rejected: kind={}, message={}", e.getKind(), e.getMessage());
        }
        return Status.fromCode(code)
                .withDescription(e.getPublicMessage())
                .asRuntimeException();
    }

    public static StatusRuntimeException internal(RuntimeException e) {
        log.error("Unexpected RPC failure: {}", e.getMessage(), e);
        return Status.INTERNAL
                .withDescription(BusinessException.INTERNAL_ERROR_MESSAGE)
                .asRuntimeException();
    }

    public static StatusRuntimeException invalidArgument(String message) {
        log.warn("RPC rejected: {}", message);
        return Status.INVALID_ARGUMENT.withDescription(message).asRuntimeException();
    }
}
