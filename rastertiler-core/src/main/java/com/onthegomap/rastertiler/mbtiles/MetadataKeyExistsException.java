package com.onthegomap.rastertiler.mbtiles;

/** Thrown when a metadata write without overwrite hits a key that is already present. */
public class MetadataKeyExistsException extends IllegalArgumentException {

  private final String key;

  public MetadataKeyExistsException(String key) {
    super("Metadata key '" + key + "' already exists, use overwrite to replace it");
    this.key = key;
  }

  public String key() {
    return key;
  }
}
