/**
 * Manager Protocol Codec (Wire Level)
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the manager
 * protocol: the rules that turn a TCP byte stream into blocks of text lines and
 * outbound actions back into bytes.</p>
 *
 * <h2>Wire rules</h2>
 * <ul>
 *   <li>Text is UTF-8; each line ends in CRLF (a bare LF is tolerated).</li>
 *   <li>A block is a run of {@code Name: Value} lines ended by an empty line.</li>
 *   <li>On connect the server sends a single greeting line
 *       ({@code Asterisk Call Manager/x.y.z}) that has no block terminator.</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk
 *        → AmiFrameDecoder      (line and block framing)
 *            → List&lt;String&gt;  (one block)
 *                → AmiMessageParser
 *                    → AmiMessage
 * </pre>
 *
 * <p>Framing defects (oversized blocks) are counted and dropped here; they never
 * reach the parser and never disturb the blocks around them.</p>
 */
package com.questrail.callwatch.protocol.ami.codec;
