package com.gentoro.mistadopt.device.netconf;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed {@code <rpc-reply>}. Only what the provisioner needs is kept: whether an {@code <ok/>}
 * was present anywhere and the messages of {@code <rpc-error>} elements with severity {@code
 * error}. Warnings are ignored.
 */
record RpcReply(boolean ok, List<String> errors) {
  private static final XmlMapper XML = new XmlMapper();

  static RpcReply parse(String xml) throws IOException {
    JsonNode root = XML.readTree(xml);
    boolean ok = root != null && root.findValue("ok") != null;

    List<String> errors = new ArrayList<>();
    if (root != null) {
      for (JsonNode node : root.findValues("rpc-error")) {
        if (node.isArray()) {
          node.forEach(e -> collectError(e, errors));
        } else {
          collectError(node, errors);
        }
      }
    }
    return new RpcReply(ok, List.copyOf(errors));
  }

  boolean hasErrors() {
    return !errors.isEmpty();
  }

  private static void collectError(JsonNode error, List<String> errors) {
    String severity = error.path("error-severity").asText("error").trim();
    if ("warning".equalsIgnoreCase(severity)) return;
    String message = error.path("error-message").asText("").trim();
    if (message.isEmpty()) {
      message = error.path("error-tag").asText("rpc-error").trim();
    }
    errors.add(message);
  }
}
