package io.b2mash.storagebridge.exception;

/** Base type for errors raised by the storage facade. Carries a short title and a detail line. */
public abstract class StorageException extends RuntimeException {

  private final String title;

  protected StorageException(String title, String detail) {
    super(detail);
    this.title = title;
  }

  public String getTitle() {
    return title;
  }

  public String getDetail() {
    return getMessage();
  }
}
