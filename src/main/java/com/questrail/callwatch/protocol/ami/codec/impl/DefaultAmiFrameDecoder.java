package com.questrail.callwatch.protocol.ami.codec.impl;

import com.questrail.callwatch.protocol.ami.codec.AmiFrameDecoder;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DefaultAmiFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AmiFrameDecoder}.
 *
 * <p>The decoder performs the following steps, in order, for every byte:</p>
 * <ol>
 *   <li>Accumulate bytes until LF; bytes are decoded as UTF-8 only once a whole
 *       line is present, so multi-byte characters split across chunks survive</li>
 *   <li>Strip one trailing CR</li>
 *   <li>Empty line: close the pending block (or skip it if nothing is pending)</li>
 *   <li>Whitespace-only line with nothing pending: skip it</li>
 *   <li>First line of a connection without a colon: emit it alone (greeting)</li>
 *   <li>Otherwise append the line to the pending block</li>
 * </ol>
 *
 * <p><strong>Oversized blocks.</strong> When a pending block (or a single
 * unterminated line) exceeds {@code maxBlockBytes}, everything up to the next
 * empty line is discarded and {@link #droppedBlocks()} is incremented.</p>
 */
public final class DefaultAmiFrameDecoder implements AmiFrameDecoder
{
    public static final int DEFAULT_MAX_BLOCK_BYTES = 64 * 1024;

    private static final byte LF = '\n';
    private static final byte CR = '\r';

    private final int maxBlockBytes;

    private final ByteArrayOutputStream line = new ByteArrayOutputStream(128);
    private final List<String> block = new ArrayList<>();
    private int blockBytes;
    private boolean discarding;
    private boolean discardedLineHasText;
    private boolean firstLine = true;
    private long dropped;

    public DefaultAmiFrameDecoder()
    {
        this(DEFAULT_MAX_BLOCK_BYTES);
    }

    public DefaultAmiFrameDecoder(int maxBlockBytes)
    {
        if (maxBlockBytes <= 0) {
            throw new IllegalArgumentException("maxBlockBytes must be > 0");
        }
        this.maxBlockBytes = maxBlockBytes;
    }

    @Override
    public List<List<String>> decode(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");

        List<List<String>> out = new ArrayList<>();
        for (byte b : chunk) {
            if (b == LF) {
                endOfLine(out);
                continue;
            }
            if (discarding) {
                if (b != CR) {
                    discardedLineHasText = true;
                }
                continue;
            }
            line.write(b);
            if (blockBytes + line.size() > maxBlockBytes) {
                startDiscarding();
            }
        }
        return out;
    }

    @Override
    public void reset()
    {
        line.reset();
        block.clear();
        blockBytes = 0;
        discarding = false;
        discardedLineHasText = false;
        firstLine = true;
    }

    @Override
    public long droppedBlocks()
    {
        return dropped;
    }

    private void endOfLine(List<List<String>> out)
    {
        int len = line.size();
        byte[] raw = line.toByteArray();
        line.reset();
        if (len > 0 && raw[len - 1] == CR) {
            len--;
        }

        if (discarding) {
            if (!discardedLineHasText) {
                // Resynchronized at the block terminator.
                discarding = false;
            }
            discardedLineHasText = false;
            return;
        }

        if (len == 0) {
            if (!block.isEmpty()) {
                out.add(List.copyOf(block));
                block.clear();
                blockBytes = 0;
            }
            return;
        }

        String text = new String(raw, 0, len, StandardCharsets.UTF_8);
        if (block.isEmpty() && text.isBlank()) {
            return;
        }

        if (firstLine) {
            firstLine = false;
            if (block.isEmpty() && text.indexOf(':') < 0) {
                out.add(List.of(text));
                return;
            }
        }

        block.add(text);
        blockBytes += len + 2;
    }

    private void startDiscarding()
    {
        discarding = true;
        discardedLineHasText = true;
        dropped++;
        line.reset();
        block.clear();
        blockBytes = 0;
    }
}
