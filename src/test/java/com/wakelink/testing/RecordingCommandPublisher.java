package com.wakelink.testing;

import com.wakelink.command.CommandKind;
import com.wakelink.command.CommandPublisher;
import com.wakelink.command.DeviceCommand;

import java.util.ArrayList;
import java.util.List;

/**
 * Публикатор, который запоминает команды вместо отправки.
 */
public class RecordingCommandPublisher implements CommandPublisher {

  private final List<DeviceCommand> published = new ArrayList<>();
  private boolean failing;

  @Override
  public synchronized boolean publish(DeviceCommand command) {
    published.add(command);
    return !failing;
  }

  public synchronized void setFailing(boolean failing) {
    this.failing = failing;
  }

  public synchronized List<DeviceCommand> all() {
    return new ArrayList<>(published);
  }

  public synchronized List<DeviceCommand> ofKind(CommandKind kind) {
    List<DeviceCommand> result = new ArrayList<>();
    for (DeviceCommand command : published) {
      if (command.getKind() == kind) {
        result.add(command);
      }
    }
    return result;
  }

  public synchronized void clear() {
    published.clear();
  }
}
