package com.gentoro.mistadopt.device.netconf;

import com.gentoro.mistadopt.device.DeviceSession;
import com.gentoro.mistadopt.exception.DeviceSessionException;
import com.gentoro.mistadopt.inventory.DeviceRecord;
import com.gentoro.mistadopt.orchestrator.FailureCategory;
import com.gentoro.mistadopt.transform.PushConfig;
import java.io.BufferedInputStream;
import java.io.IOException;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelSubsystem;
import org.apache.sshd.client.session.ClientSession;

/** {@link DeviceSession} speaking NETCONF over the SSH {@code netconf} subsystem. */
public class NetconfSshSession implements DeviceSession {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(NetconfSshSession.class);

  static final String SUBSYSTEM = "netconf";

  private final SshClient client;
  private final DeviceRecord device;
  private final NetconfSettings settings;

  private ClientSession session;
  private ChannelSubsystem channel;
  private NetconfProtocol protocol;

  NetconfSshSession(SshClient client, DeviceRecord device, NetconfSettings settings) {
    this.client = client;
    this.device = device;
    this.settings = settings;
  }

  @Override
  public void connect() throws DeviceSessionException {
    try {
      session =
          client
              .connect(device.username(), device.ip(), settings.port())
              .verify(settings.timeout().toMillis())
              .getSession();
      log.debug("{}: SSH connected on port {}", device.ip(), settings.port());
    } catch (IOException e) {
      throw new DeviceSessionException(
          FailureCategory.CONNECT_ERROR,
          "Unable to establish NETCONF connection with %s: %s".formatted(device.ip(), e.getMessage()),
          e);
    }
  }

  @Override
  public void authenticate() throws DeviceSessionException {
    requireSession();
    try {
      session.addPasswordIdentity(device.password());
      session.auth().verify(settings.timeout().toMillis());
    } catch (IOException e) {
      throw new DeviceSessionException(
          FailureCategory.AUTH_ERROR,
          "Authentication as '%s' on %s failed: %s"
              .formatted(device.username(), device.ip(), e.getMessage()),
          e);
    }

    try {
      channel = session.createSubsystemChannel(SUBSYSTEM);
      channel.open().verify(settings.timeout().toMillis());
    } catch (IOException e) {
      throw new DeviceSessionException(
          FailureCategory.CONNECT_ERROR,
          "NETCONF subsystem unavailable on %s: %s".formatted(device.ip(), e.getMessage()),
          e);
    }
    protocol =
        new NetconfProtocol(
            device.ip(),
            new BufferedInputStream(channel.getInvertedOut()),
            channel.getInvertedIn());
    protocol.hello();
  }

  @Override
  public void loadConfiguration(PushConfig config) throws DeviceSessionException {
    requireProtocol().loadSetConfiguration(config);
  }

  @Override
  public void commit() throws DeviceSessionException {
    requireProtocol().commit();
  }

  @Override
  public void close() {
    if (protocol != null) {
      protocol.closeSession();
    }
    if (channel != null) {
      try {
        channel.close();
      } catch (IOException e) {
        log.debug("{}: closing NETCONF channel failed: {}", device.ip(), e.getMessage());
      }
    }
    if (session != null) {
      try {
        session.close();
      } catch (IOException e) {
        log.debug("{}: closing SSH session failed: {}", device.ip(), e.getMessage());
      }
    }
    protocol = null;
    channel = null;
    session = null;
  }

  private void requireSession() {
    if (session == null) {
      throw new IllegalStateException("Not connected to " + device.ip());
    }
  }

  private NetconfProtocol requireProtocol() {
    if (protocol == null) {
      throw new IllegalStateException("No NETCONF session with " + device.ip());
    }
    return protocol;
  }
}
