package com.questrail.callwatch.protocol.ami.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks for one connection are delivered serially, in stream order.
 * Netty endpoints deliver them on the channel's event loop.</p>
 */
public interface StreamEndpointListener
{
    /**
     * The connection is open and writable. Carries no protocol meaning.
     */
    void onTransportUp();

    /**
     * The connection attempt failed, or an open connection was lost.
     *
     * @param cause the failure, or {@code null} for an orderly close by the peer
     */
    void onTransportDown(Throwable cause);

    /**
     * A chunk of the inbound stream. Chunk boundaries are arbitrary and carry no
     * meaning.
     *
     * <p>For Netty-backed implementations the adapter copies from {@code ByteBuf}
     * into a {@code byte[]} and releases reference-counted buffers internally.</p>
     */
    void onBytes(byte[] chunk);
}
