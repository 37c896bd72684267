package dev.blog.platform.grpc;

import dev.blog.platform.security.BearerTokens;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import org.springframework.stereotype.Component;

/**
 * Copies the {@code authorization} metadata entry into the call context.
 * Verification happens in the handlers that need an identity, so public RPCs pass through untouched.
 */
@Component
public class AuthorizationServerInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> AUTHORIZATION_KEY =
            Metadata.Key.of(BearerTokens.AUTHORIZATION, Metadata.ASCII_STRING_MARSHALLER);

    static final Context.Key<String> AUTHORIZATION = Context.key("authorization");

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        String authorization = headers.get(AUTHORIZATION_KEY);
        Context context = Context.current().withValue(AUTHORIZATION, authorization);
        return Contexts.interceptCall(context, call, headers, next);
    }
}
