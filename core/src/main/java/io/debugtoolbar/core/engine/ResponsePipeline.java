package io.debugtoolbar.core.engine;

import io.debugtoolbar.core.encoding.CodecRegistry;
import io.debugtoolbar.core.encoding.DecompressionCascade;
import io.debugtoolbar.core.model.RequestInfo;
import io.debugtoolbar.core.spi.ResponseHook;
import io.debugtoolbar.core.spi.ResponseSink;
import java.util.Objects;

/**
 * Shared, immutable half of the interception pipeline: settings, codecs and the stateless
 * stages. Creates one {@link ResponseInterceptor} per response. Thread-safe.
 */
public final class ResponsePipeline {

    private final InterceptionSettings settings;
    private final CodecRegistry codecs;
    private final EligibilityGate gate;
    private final DecompressionCascade cascade;
    private final ToolbarInjector injector;
    private final HeaderRewriter rewriter;

    public ResponsePipeline(InterceptionSettings settings, CodecRegistry codecs) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.codecs = Objects.requireNonNull(codecs, "codecs must not be null");
        this.gate = new EligibilityGate(settings);
        this.cascade = new DecompressionCascade(codecs, settings.maxBodyBytes());
        this.injector = new ToolbarInjector(settings.insertBefore());
        this.rewriter = new HeaderRewriter();
    }

    /**
     * Starts intercepting one response.
     *
     * @param request the request being answered
     * @param hook supplies the fragment and observes the outcome
     * @param downstream where the (possibly rewritten) events go
     * @return the sink the application's response events must be sent to
     */
    public ResponseInterceptor intercept(RequestInfo request, ResponseHook hook, ResponseSink downstream) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(hook, "hook must not be null");
        Objects.requireNonNull(downstream, "downstream must not be null");
        return new ResponseInterceptor(settings, gate, cascade, injector, rewriter, request, hook, downstream);
    }

    public InterceptionSettings settings() {
        return settings;
    }

    public CodecRegistry codecs() {
        return codecs;
    }

    public EligibilityGate gate() {
        return gate;
    }
}
