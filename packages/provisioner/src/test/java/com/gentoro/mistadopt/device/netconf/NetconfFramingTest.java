package com.gentoro.mistadopt.device.netconf;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class NetconfFramingTest {

  private static InputStream stream(String s) {
    return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void readsConsecutiveMessages() throws Exception {
    InputStream in = stream("<hello/>]]>]]><rpc-reply><ok/></rpc-reply>]]>]]>");

    assertEquals("<hello/>", NetconfFraming.read(in));
    assertEquals("<rpc-reply><ok/></rpc-reply>", NetconfFraming.read(in));
  }

  @Test
  void handlesPartialDelimiterInsideMessage() throws Exception {
    InputStream in = stream("a]]]>]]]>]>]]>]]>");

    assertEquals("a]]]>]]]>]>", NetconfFraming.read(in));
  }

  @Test
  void failsOnTruncatedMessage() {
    assertThrows(EOFException.class, () -> NetconfFraming.read(stream("<rpc-reply>]]>")));
  }

  @Test
  void writesMessageWithDelimiter() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    NetconfFraming.write(out, "<commit/>");

    assertEquals("<commit/>]]>]]>", out.toString(StandardCharsets.UTF_8));
  }
}
