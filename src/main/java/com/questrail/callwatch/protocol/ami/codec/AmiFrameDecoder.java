package com.questrail.callwatch.protocol.ami.codec;

import java.util.List;

/**
 * AmiFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level framer for the manager protocol's line-oriented stream.
 *
 * <p>This interface defines the inbound boundary between raw TCP bytes, which
 * arrive in chunks of arbitrary size, and complete protocol blocks (a block is
 * the ordered list of lines preceding an empty line).</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Accumulating partial lines across chunks</li>
 *   <li>Splitting lines on LF and removing an optional trailing CR</li>
 *   <li>Delimiting blocks at empty lines</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for splitting lines into
 * fields or classifying blocks; that happens in
 * {@code com.questrail.callwatch.protocol.ami.internal.decode.AmiMessageParser}.</p>
 *
 * <p>Implementations are stateful per connection and are not thread-safe. The
 * owner calls {@link #reset()} whenever a new connection begins.</p>
 */
public interface AmiFrameDecoder
{
    /**
     * Feed one chunk of bytes and collect the blocks it completes.
     *
     * <p>Feeding the same byte stream split at any chunk boundaries yields the
     * same sequence of blocks.</p>
     *
     * @param chunk bytes as received from the transport; may be empty
     * @return blocks completed by this chunk, in stream order (possibly empty)
     */
    List<List<String>> decode(byte[] chunk);

    /**
     * Discard any partial line or block and start over for a new connection.
     */
    void reset();

    /**
     * Number of oversized blocks discarded since construction.
     */
    long droppedBlocks();
}
