package com.gentoro.mistadopt.device.netconf;

import com.gentoro.mistadopt.device.DeviceSession;
import com.gentoro.mistadopt.device.DeviceSessionFactory;
import com.gentoro.mistadopt.inventory.DeviceRecord;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.core.CoreModuleProperties;

/** Creates NETCONF-over-SSH sessions from one shared SSH client. Host keys are not verified. */
public class NetconfSessionFactory implements DeviceSessionFactory, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(NetconfSessionFactory.class);

  private final SshClient client;
  private final NetconfSettings settings;

  public NetconfSessionFactory(NetconfSettings settings) {
    this.settings = settings;
    this.client = SshClient.setUpDefaultClient();
    client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
    CoreModuleProperties.IDLE_TIMEOUT.set(client, settings.timeout());
    client.start();
    log.debug("SSH client started (port {}, timeout {})", settings.port(), settings.timeout());
  }

  @Override
  public DeviceSession create(DeviceRecord device) {
    return new NetconfSshSession(client, device, settings);
  }

  @Override
  public void close() {
    client.stop();
  }
}
