package ippnotify.netty.http;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import ippnotify.api.annotation.AnnotationResolver;
import ippnotify.api.model.IppStatus;
import ippnotify.api.request.IppRequest;
import ippnotify.api.response.IppException;
import ippnotify.auth.util.HttpHeaderUtils;
import ippnotify.common.component.AuthenticationService;
import ippnotify.netty.Constants;
import ippnotify.util.JsonUtil;

/**
 * Turns an HTTP POST carrying a JSON IPP message into the {@link IppRequest} subclass registered for its operation. Failures are passed
 * down the pipeline as {@link IppException} messages for {@link IppExceptionHandler}.
 */
public class IppRequestDecoder extends MessageToMessageDecoder<FullHttpRequest> implements IppHttpHandler {

    private static final Logger log = LoggerFactory.getLogger(IppRequestDecoder.class);
    private static final String LOG_RECEIVED_REQUEST = "Received HTTP request {}";
    private static final String LOG_PARSED_REQUEST = "Parsed request {}";

    private final AuthenticationService authenticationService;

    public IppRequestDecoder(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @Override
    public void decode(ChannelHandlerContext ctx, FullHttpRequest msg, List<Object> out) throws Exception {

        log.trace(LOG_RECEIVED_REQUEST, msg);
        int requestId = 0;
        try {
            if (!msg.method().equals(HttpMethod.POST)) {
                log.warn("Unhandled HTTP request type {}", msg.method());
                throw IppException.transport(HttpResponseStatus.METHOD_NOT_ALLOWED.code(), "unhandled method type");
            }
            final String path = new QueryStringDecoder(msg.uri()).path();
            final String printerName = getPrinterName(path);

            ObjectMapper mapper = JsonUtil.getObjectMapper();
            JsonNode root;
            try {
                root = mapper.readTree(msg.content().toString(StandardCharsets.UTF_8));
            } catch (JsonProcessingException e) {
                throw new IppException(IppStatus.CLIENT_ERROR_BAD_REQUEST, "Unable to parse request", e.getOriginalMessage(), e);
            }
            if (root == null || !root.isObject()) {
                throw new IppException(IppStatus.CLIENT_ERROR_BAD_REQUEST, "Request body is not an IPP message");
            }
            requestId = root.path("request-id").asInt(0);
            String operation = root.path("operation").asText(null);
            if (StringUtils.isBlank(operation)) {
                throw new IppException(IppStatus.CLIENT_ERROR_BAD_REQUEST, "Missing operation");
            }
            Class<? extends IppRequest> requestClass = AnnotationResolver.getClassForOperation(operation);
            if (requestClass == null) {
                throw new IppException(IppStatus.SERVER_ERROR_OPERATION_NOT_SUPPORTED, "Operation " + operation + " is not supported");
            }
            IppRequest request;
            try {
                request = mapper.treeToValue(root, requestClass);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new IppException(IppStatus.CLIENT_ERROR_BAD_REQUEST, "Unable to parse request", e.getMessage(), e);
            }
            request.setPrinterName(printerName);
            request.addHeaders(HttpHeaderUtils.toMultimap(msg.headers()));
            log.trace(LOG_PARSED_REQUEST, request);
            try {
                request.validate();
            } catch (IllegalArgumentException e) {
                throw new IppException(IppStatus.CLIENT_ERROR_BAD_REQUEST, e.getMessage());
            }
            authenticationService.enforceAccess(request);
            out.add(request);
        } catch (IppException e) {
            out.clear();
            // route to IppExceptionHandler
            out.add(e.setRequestId(requestId));
        }
    }

    /**
     * @return the printer named by the path, or null for the system path
     * @throws IppException
     *             with HTTP 404 for any other path
     */
    static String getPrinterName(String path) throws IppException {
        if (Constants.SYSTEM_PATH.equals(path)) {
            return null;
        }
        if (path.startsWith(Constants.PRINTER_PATH_PREFIX)) {
            String name = path.substring(Constants.PRINTER_PATH_PREFIX.length());
            if (StringUtils.isNotBlank(name) && !name.contains("/")) {
                return name;
            }
        }
        throw IppException.transport(HttpResponseStatus.NOT_FOUND.code(), "No IPP service at " + path);
    }
}
