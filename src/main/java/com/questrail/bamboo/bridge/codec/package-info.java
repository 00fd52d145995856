/**
 * Bridge Codec
 * =============================================================================
 *
 * <p>Boundary between the bytes a {@code ScriptEndpoint} carries and the
 * {@link com.questrail.bamboo.bridge.model.BridgeMessage} variants the
 * channel routes.</p>
 *
 * <pre>
 *   byte[] (UTF-8 JSON text)
 *        → BridgeMessageDecoder
 *            → BridgeMessage
 *                → BridgeChannel
 * </pre>
 *
 * <p>A payload the decoder rejects raises {@link BridgeDecodeException}. The
 * channel drops such payloads without disturbing any pending call.</p>
 *
 * <h2>Wire form</h2>
 * <p>Every message is one JSON object with a {@code type} discriminator:
 * {@code message}, {@code call}, {@code callResult}, {@code setStyle},
 * {@code setDragRegions}, {@code windowOp} or {@code eval}. A {@code message}
 * whose event is a reserved name carries the typed variant's fields in its
 * {@code data} object and decodes to that variant.</p>
 */
package com.questrail.bamboo.bridge.codec;
