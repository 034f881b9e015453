package com.wakelink.store;

import com.wakelink.model.ArtifactKey;

import java.util.List;

/**
 * Снимок нельзя собрать: не хватает фрагментов.
 */
public class AssemblyException extends Exception {

  private final ArtifactKey key;
  private final List<Integer> missing;

  public AssemblyException(ArtifactKey key, List<Integer> missing) {
    super("Нельзя собрать " + key + ": отсутствуют фрагменты " + missing);
    this.key = key;
    this.missing = List.copyOf(missing);
  }

  public ArtifactKey getKey() {
    return key;
  }

  public List<Integer> getMissing() {
    return missing;
  }
}
