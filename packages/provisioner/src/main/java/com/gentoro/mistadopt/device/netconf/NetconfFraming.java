package com.gentoro.mistadopt.device.netconf;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** NETCONF 1.0 end-of-message framing ({@code ]]>]]>}), RFC 6242 section 4.3. */
final class NetconfFraming {
  static final String DELIMITER = "]]>]]>";
  private static final byte[] DELIMITER_BYTES = DELIMITER.getBytes(StandardCharsets.US_ASCII);

  private NetconfFraming() {}

  static void write(OutputStream out, String message) throws IOException {
    out.write(message.getBytes(StandardCharsets.UTF_8));
    out.write(DELIMITER_BYTES);
    out.flush();
  }

  /**
   * Read one message, without the delimiter.
   *
   * @throws EOFException when the stream ends before a complete message
   */
  static String read(InputStream in) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(4096);
    byte[] tail = new byte[DELIMITER_BYTES.length];
    long count = 0;
    while (true) {
      int b = in.read();
      if (b < 0) {
        throw new EOFException("Session closed by device before end of message");
      }
      buffer.write(b);
      System.arraycopy(tail, 1, tail, 0, tail.length - 1);
      tail[tail.length - 1] = (byte) b;
      if (++count >= tail.length && Arrays.equals(tail, DELIMITER_BYTES)) {
        byte[] bytes = buffer.toByteArray();
        return new String(bytes, 0, bytes.length - DELIMITER_BYTES.length, StandardCharsets.UTF_8);
      }
    }
  }
}
