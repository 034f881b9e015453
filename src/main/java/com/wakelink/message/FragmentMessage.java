package com.wakelink.message;

/**
 * Один фрагмент снимка.
 */
public class FragmentMessage extends InboundMessage {

  private final String artifactName;
  private final int index;
  private final byte[] bytes;

  public FragmentMessage(String deviceId, String artifactName, int index, byte[] bytes) {
    super(deviceId);
    this.artifactName = artifactName;
    this.index = index;
    this.bytes = bytes;
  }

  @Override
  public MessageType getType() {
    return MessageType.FRAGMENT;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public int getIndex() {
    return index;
  }

  public byte[] getBytes() {
    return bytes;
  }
}
