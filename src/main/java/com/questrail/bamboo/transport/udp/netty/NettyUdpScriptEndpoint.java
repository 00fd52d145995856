package com.questrail.bamboo.transport.udp.netty;

import com.questrail.bamboo.transport.ScriptEndpoint;
import com.questrail.bamboo.transport.ScriptEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpScriptEndpoint
 * =============================================================================
 * Netty-backed {@link ScriptEndpoint} that exchanges bridge payloads with an
 * out-of-process renderer helper over loopback datagrams.
 *
 * <h2>Addressing</h2>
 * The endpoint binds {@code bindAddress} and sends every payload to
 * {@code peerAddress}. Datagrams from any other sender are ignored.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]} before reaching the listener.
 *
 * <h2>Ordering</h2>
 * Inbound callbacks are serialized on the single channel event loop. A bridge
 * payload must fit into one datagram; oversized payloads are the sender's
 * problem and are not fragmented here.
 */
public final class NettyUdpScriptEndpoint implements ScriptEndpoint
{
    private final InetSocketAddress bindAddress;
    private final InetSocketAddress peerAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile ScriptEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpScriptEndpoint(InetSocketAddress bindAddress, InetSocketAddress peerAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.peerAddress = Objects.requireNonNull(peerAddress, "peerAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(ScriptEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        ScriptEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                down.set(false);
                l.onTransportUp();
            }
            else {
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();
        notifyDown(null);
    }

    @Override
    public void send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            // Not bound yet; the bridge channel's timeouts cover lost payloads.
            return;
        }
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, peerAddress));
    }

    /** The bound local address, or {@code null} before the bind completes. */
    public InetSocketAddress localAddress()
    {
        Channel ch = channel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }

    private void notifyDown(Throwable cause)
    {
        ScriptEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private ScriptEndpointListener requireListener()
    {
        ScriptEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("ScriptEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * Forwards datagram payloads from the peer to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            ScriptEndpointListener l = listener;
            if (l == null || !peerAddress.equals(packet.sender())) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onPayload(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
