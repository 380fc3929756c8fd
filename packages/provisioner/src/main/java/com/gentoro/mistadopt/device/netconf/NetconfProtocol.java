package com.gentoro.mistadopt.device.netconf;

import com.gentoro.mistadopt.exception.DeviceSessionException;
import com.gentoro.mistadopt.orchestrator.FailureCategory;
import com.gentoro.mistadopt.transform.PushConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NETCONF 1.0 message exchange with a Junos device over an already established byte stream.
 *
 * <p>Configuration is loaded with the Junos {@code load-configuration} RPC in {@code set} format,
 * which is what the Mist adoption command consists of.
 */
public class NetconfProtocol {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(NetconfProtocol.class);

  static final String BASE_NS = "urn:ietf:params:xml:ns:netconf:base:1.0";
  static final String HELLO =
      "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
          + "<hello xmlns=\"" + BASE_NS + "\"><capabilities>"
          + "<capability>urn:ietf:params:netconf:base:1.0</capability>"
          + "</capabilities></hello>";

  private final String host;
  private final InputStream in;
  private final OutputStream out;
  private final AtomicInteger messageId = new AtomicInteger();

  public NetconfProtocol(String host, InputStream in, OutputStream out) {
    this.host = host;
    this.in = in;
    this.out = out;
  }

  /** Exchange {@code <hello>} messages. */
  public void hello() throws DeviceSessionException {
    try {
      NetconfFraming.write(out, HELLO);
      String serverHello = NetconfFraming.read(in);
      if (!serverHello.contains("hello")) {
        throw new DeviceSessionException(
            FailureCategory.CONNECT_ERROR, "Unexpected NETCONF greeting from " + host);
      }
      log.debug("{}: NETCONF hello exchanged", host);
    } catch (IOException e) {
      throw new DeviceSessionException(
          FailureCategory.CONNECT_ERROR,
          "NETCONF hello with %s failed: %s".formatted(host, e.getMessage()),
          e);
    }
  }

  public void loadSetConfiguration(PushConfig config) throws DeviceSessionException {
    String body =
        "<load-configuration action=\"set\" format=\"text\"><configuration-set>"
            + escapeXml(config.text())
            + "</configuration-set></load-configuration>";
    RpcReply reply = rpc("load-configuration", body);
    if (reply.hasErrors()) {
      throw new DeviceSessionException(
          FailureCategory.COMMIT_ERROR,
          "Load configuration failed on %s: %s".formatted(host, String.join("; ", reply.errors())));
    }
    if (!reply.ok()) {
      throw new DeviceSessionException(
          FailureCategory.COMMIT_ERROR, "Load configuration on %s was not acknowledged".formatted(host));
    }
  }

  public void commit() throws DeviceSessionException {
    RpcReply reply = rpc("commit", "<commit/>");
    if (reply.hasErrors()) {
      throw new DeviceSessionException(
          FailureCategory.COMMIT_ERROR,
          "Commit failed on %s: %s".formatted(host, String.join("; ", reply.errors())));
    }
    if (!reply.ok()) {
      throw new DeviceSessionException(
          FailureCategory.COMMIT_ERROR, "Commit on %s was not acknowledged".formatted(host));
    }
  }

  /** Politely end the session; failures are only logged. */
  public void closeSession() {
    try {
      rpc("close-session", "<close-session/>");
    } catch (DeviceSessionException e) {
      log.debug("{}: close-session not acknowledged: {}", host, e.getMessage());
    }
  }

  private RpcReply rpc(String operation, String body) throws DeviceSessionException {
    int id = messageId.incrementAndGet();
    String request =
        "<rpc message-id=\"%d\" xmlns=\"%s\">%s</rpc>".formatted(id, BASE_NS, body);
    try {
      NetconfFraming.write(out, request);
      String response = NetconfFraming.read(in);
      log.trace("{}: {} reply:\n{}", host, operation, response);
      return RpcReply.parse(response);
    } catch (IOException e) {
      throw new DeviceSessionException(
          FailureCategory.COMMIT_ERROR,
          "NETCONF %s on %s failed: %s".formatted(operation, host, e.getMessage()),
          e);
    }
  }

  static String escapeXml(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&' -> sb.append("&amp;");
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&apos;");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}
