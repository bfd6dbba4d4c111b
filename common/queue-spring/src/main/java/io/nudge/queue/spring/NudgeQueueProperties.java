package io.nudge.queue.spring;

import io.nudge.queue.channel.ChannelNaming;
import io.nudge.queue.diagnostics.AsyncErrorNotifier;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nudge.queue")
public class NudgeQueueProperties {

  private boolean enabled = true;
  private final Listener listener = new Listener();
  private final Dispatch dispatch = new Dispatch();
  private final Schema schema = new Schema();
  private final Diagnostics diagnostics = new Diagnostics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Listener getListener() {
    return listener;
  }

  public Dispatch getDispatch() {
    return dispatch;
  }

  public Schema getSchema() {
    return schema;
  }

  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  public static class Listener {

    private String channelNamespace = ChannelNaming.DEFAULT_LISTENER_NAMESPACE;

    public String getChannelNamespace() {
      return channelNamespace;
    }

    public void setChannelNamespace(String channelNamespace) {
      this.channelNamespace = channelNamespace;
    }
  }

  public static class Dispatch {

    private boolean enabled = true;
    private String channelNamespace = ChannelNaming.DEFAULT_LOCKER_NAMESPACE;
    private Ticket ticket = Ticket.JOB_ID;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getChannelNamespace() {
      return channelNamespace;
    }

    public void setChannelNamespace(String channelNamespace) {
      this.channelNamespace = channelNamespace;
    }

    public Ticket getTicket() {
      return ticket;
    }

    public void setTicket(Ticket ticket) {
      this.ticket = ticket;
    }
  }

  /**
   * How the dispatcher draws the ticket that selects a locker slot.
   */
  public enum Ticket {
    JOB_ID,
    RANDOM
  }

  public static class Schema {

    private boolean migrate = true;

    public boolean isMigrate() {
      return migrate;
    }

    public void setMigrate(boolean migrate) {
      this.migrate = migrate;
    }
  }

  public static class Diagnostics {

    private String threadName = AsyncErrorNotifier.DEFAULT_THREAD_NAME;

    public String getThreadName() {
      return threadName;
    }

    public void setThreadName(String threadName) {
      this.threadName = threadName;
    }
  }
}
