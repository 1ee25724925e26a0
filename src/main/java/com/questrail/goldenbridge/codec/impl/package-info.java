/**
 * Oracle wire codec: implementation
 * =============================================================================
 *
 * <p>Concrete encoders and decoders for the line-oriented oracle protocol.</p>
 *
 * <pre>
 *   client side:  DefaultBatchEncoder  →  stdin
 *                 stdout  →  FramedOutputDecoder (batch) | PlainCsvDecoder (single)
 *
 *   oracle side:  FrameWriter  →  stdout
 * </pre>
 *
 * <p>This layer is strictly:</p>
 * <ul>
 *   <li>transport-agnostic (it sees whole strings, never streams)</li>
 *   <li>semantics-free (values remain strings)</li>
 *   <li>strict about structure (every deviation is a
 *       {@link com.questrail.goldenbridge.codec.FrameProtocolException})</li>
 * </ul>
 */
package com.questrail.goldenbridge.codec.impl;
