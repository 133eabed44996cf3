package net.spookly.hyping.client;

import java.net.InetSocketAddress;
import java.net.PortUnreachableException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import net.spookly.hyping.protocol.MalformedMessageException;
import net.spookly.hyping.protocol.QueryCodec;
import net.spookly.hyping.protocol.QueryTransportException;
import net.spookly.hyping.status.StatusRecord;

/**
 * Completes a single query with the first datagram that comes back from the server.
 */
final class QueryClientHandler extends SimpleChannelInboundHandler<DatagramPacket> {
    private static final Logger LOGGER = Logger.getLogger(QueryClientHandler.class.getName());

    private final InetSocketAddress serverAddress;
    private final CompletableFuture<QueryResult> result;
    private volatile long sentAtNanos;

    QueryClientHandler(InetSocketAddress serverAddress, CompletableFuture<QueryResult> result) {
        this.serverAddress = Objects.requireNonNull(serverAddress, "serverAddress");
        this.result = Objects.requireNonNull(result, "result");
    }

    void markSent(long nanos) {
        sentAtNanos = nanos;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
        long receivedAt = System.nanoTime();
        if (!serverAddress.equals(packet.sender())) {
            LOGGER.log(Level.FINE, "Ignoring datagram from unexpected peer " + packet.sender());
            return;
        }
        if (result.isDone()) {
            return;
        }
        try {
            StatusRecord status = QueryCodec.decodeResponse(packet.content());
            long elapsed = Math.max(1L, receivedAt - sentAtNanos);
            result.complete(new QueryResult(status, Duration.ofNanos(elapsed)));
        } catch (MalformedMessageException e) {
            LOGGER.log(Level.FINE, "Malformed response from " + serverAddress + ": " + e.getMessage());
            result.completeExceptionally(e);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof PortUnreachableException) {
            // Surfaces as a timeout; the caller decides whether to retry.
            LOGGER.log(Level.FINE, "Port unreachable for " + serverAddress);
            return;
        }
        result.completeExceptionally(new QueryTransportException("Query socket failed", cause));
    }
}
