package ippnotify.netty.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import ippnotify.api.model.IppResponse;
import ippnotify.api.response.IppErrorResponse;
import ippnotify.api.response.IppException;
import ippnotify.netty.Constants;
import ippnotify.util.JsonUtil;

public interface IppHttpHandler {

    Logger LOG = LoggerFactory.getLogger(IppHttpHandler.class);

    /**
     * Answers with an IPP response message. IPP status travels in the body, so the HTTP status is always 200.
     */
    default void sendIppResponse(ChannelHandlerContext ctx, IppResponse ippResponse) throws JsonProcessingException {
        byte[] buf = JsonUtil.getObjectMapper().writeValueAsBytes(ippResponse);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK, Unpooled.copiedBuffer(buf));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, Constants.JSON_TYPE);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        sendResponse(ctx, response);
    }

    /**
     * Answers an {@link IppException}: as an IPP response when it carries an IPP status, as an HTTP error otherwise.
     */
    default void sendIppError(ChannelHandlerContext ctx, IppException e) throws JsonProcessingException {
        if (e.getHttpCode() != HttpResponseStatus.OK.code()) {
            sendHttpError(ctx, e);
            return;
        }
        LOG.debug("Returning IPP status {}: {}", e.getStatus(), e.getMessage());
        IppResponse response = new IppResponse(e.getRequestId());
        response.setStatus(e.getStatus(), e.getMessage());
        sendIppResponse(ctx, response);
    }

    default void sendHttpError(ChannelHandlerContext ctx, IppException e) throws JsonProcessingException {
        LOG.error("Error in pipeline, response code: {}, message: {}", e.getHttpCode(), e.getMessage());
        byte[] buf = JsonUtil.getObjectMapper().writeValueAsBytes(new IppErrorResponse(e));
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.valueOf(e.getHttpCode()),
                        Unpooled.copiedBuffer(buf));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, Constants.JSON_TYPE);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        if (e.getHttpCode() == HttpResponseStatus.METHOD_NOT_ALLOWED.code()) {
            response.headers().set(HttpHeaderNames.ALLOW, "POST");
        }
        sendResponse(ctx, response);
    }

    default void sendResponse(ChannelHandlerContext ctx, Object msg) {
        ChannelFuture f = ctx.writeAndFlush(msg);
        LOG.trace(Constants.LOG_RETURNING_RESPONSE, msg);
        if (f.isDone() && !f.isSuccess()) {
            LOG.error(Constants.ERR_WRITING_RESPONSE, f.cause());
        }
    }

}
