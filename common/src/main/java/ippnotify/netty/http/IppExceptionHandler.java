package ippnotify.netty.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import ippnotify.api.model.IppStatus;
import ippnotify.api.response.IppException;

@Sharable
public class IppExceptionHandler extends SimpleChannelInboundHandler<IppException> implements IppHttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(IppExceptionHandler.class);

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, IppException msg) throws Exception {
        this.sendIppError(ctx, msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        LOG.error("Exception in pipeline", cause);
        if (cause instanceof IppException) {
            this.sendIppError(ctx, (IppException) cause);
        } else if (null != cause.getCause() && cause.getCause() instanceof IppException) {
            this.sendIppError(ctx, (IppException) cause.getCause());
        } else {
            this.sendIppError(ctx, new IppException(IppStatus.SERVER_ERROR_INTERNAL_ERROR, cause.getMessage()));
        }
    }
}
