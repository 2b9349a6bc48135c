package io.debugtoolbar.javalin;

import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.engine.ResponseInterceptor;
import io.debugtoolbar.core.model.RequestInfo;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Servlet filter that runs the toolbar around every request.
 *
 * <p>
 * Requests the toolbar does not apply to (disabled, host not allowed, excluded path, vetoed by the
 * configured predicate) go through untouched. For the others the response is wrapped in a
 * {@link CapturingResponseWrapper} feeding a {@link ResponseInterceptor}, whose output goes to the
 * real response through a {@link ServletResponseSink}.
 */
public final class DebugToolbarFilter extends HttpFilter {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DebugToolbarFilter.class);

    private final transient DebugToolbar toolbar;

    public DebugToolbarFilter(DebugToolbar toolbar) {
        this.toolbar = toolbar;
    }

    @Override
    protected void doFilter(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        RequestInfo info = requestInfo(request);
        if (!toolbar.config().shouldShowToolbar(info)
                || toolbar.pipeline().gate().isExcluded(info.path())) {
            chain.doFilter(request, response);
            return;
        }

        RequestContext context = toolbar.processRequest(info);
        recordRequest(context, request);
        ServletResponseSink sink = new ServletResponseSink(response);
        ResponseInterceptor interceptor = toolbar.intercept(info, context, sink);
        CapturingResponseWrapper wrapper = new CapturingResponseWrapper(response, interceptor, sink);
        try {
            try {
                chain.doFilter(request, wrapper);
            } catch (IOException | ServletException | RuntimeException e) {
                abandon(interceptor, e);
                throw e;
            }
            if (request.isAsyncStarted()) {
                LOG.debug("Async response for {} {}, toolbar passes it through", info.method(), info.path());
                wrapper.detach();
                request.getAsyncContext().addListener(new FinishOnComplete(wrapper, info));
                return;
            }
            wrapper.finish();
        } finally {
            if (RequestContext.current() == context) {
                RequestContext.unbind();
            }
        }
    }

    private static void abandon(ResponseInterceptor interceptor, Exception failure) {
        try {
            interceptor.abandon();
        } catch (IOException flushFailure) {
            failure.addSuppressed(flushFailure);
        }
    }

    static RequestInfo requestInfo(HttpServletRequest request) {
        String path = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && path.startsWith(contextPath)) {
            path = path.substring(contextPath.length());
        }
        return new RequestInfo(
                request.getMethod(), path.isEmpty() ? "/" : path, request.getServerName(), request.getQueryString());
    }

    /** Request details shown by the request panel. */
    private static void recordRequest(RequestContext context, HttpServletRequest request) {
        context.putMetadata("scheme", request.getScheme());
        context.putMetadata("content_type", request.getContentType());
        context.putMetadata("client_host", request.getRemoteAddr());
        context.putMetadata("client_port", request.getRemotePort());

        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        context.putMetadata("headers", headers);

        context.putMetadata("query_params", queryParams(request.getQueryString()));

        Map<String, String> cookies = new LinkedHashMap<>();
        Cookie[] requestCookies = request.getCookies();
        if (requestCookies != null) {
            for (Cookie cookie : requestCookies) {
                cookies.put(cookie.getName(), cookie.getValue());
            }
        }
        context.putMetadata("cookies", cookies);
    }

    /** Decodes the query string only; form bodies are left for the application to read. */
    static Map<String, List<String>> queryParams(String query) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            params.computeIfAbsent(name, n -> new ArrayList<>()).add(value);
        }
        return params;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    /** Sends the final chunk of a detached async response once the container completes it. */
    private static final class FinishOnComplete implements AsyncListener {

        private final CapturingResponseWrapper wrapper;
        private final RequestInfo request;

        FinishOnComplete(CapturingResponseWrapper wrapper, RequestInfo request) {
            this.wrapper = wrapper;
            this.request = request;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            try {
                wrapper.finish();
            } catch (IOException | IllegalStateException e) {
                LOG.debug("Could not finish async response for {} {}: {}", request.method(), request.path(), e.toString());
            }
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            LOG.debug("Async response for {} {} timed out", request.method(), request.path());
        }

        @Override
        public void onError(AsyncEvent event) {
            LOG.debug("Async response for {} {} failed", request.method(), request.path(), event.getThrowable());
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }
    }
}
