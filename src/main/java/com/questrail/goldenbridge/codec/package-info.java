/**
 * Oracle Wire Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> between the bridge
 * and an oracle process. The oracle speaks line-oriented text over its
 * standard streams:</p>
 *
 * <pre>
 *   stdin  (batch):  &lt;module&gt; &lt;k&gt;=&lt;v&gt; ...            one request per line
 *
 *   stdout (batch):  #BEGIN dump=&lt;module&gt; &lt;k&gt;=&lt;v&gt; ...
 *                    &lt;header: comma-joined column names&gt;
 *                    &lt;data row&gt;*
 *                    #END
 *                    (blank lines may separate frames)
 *
 *   stdout (single): &lt;header&gt; NEWLINE &lt;data row&gt;*     no framing
 * </pre>
 *
 * <h2>Protocol constraints</h2>
 * <ul>
 *   <li>No quoting or escaping: field values never contain commas or line
 *       breaks, and argument tokens never contain {@code '='} or whitespace.
 *       The emitting side enforces this.</li>
 *   <li>Floating-point fields use fixed scientific notation with 12 fractional
 *       digits, independent of locale. The codec never interprets them.</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Set&lt;DumpRequest&gt;
 *        → BatchEncoder            (stdin text)
 *            → oracle process
 *                → OracleOutputDecoder  (stdout text)
 *                    → Map&lt;DumpRequest, RawTable&gt;
 *                        → schema validation
 * </pre>
 */
package com.questrail.goldenbridge.codec;
