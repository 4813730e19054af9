package com.ospicorp.outageanalytics.store;

/** Transport or response failure while talking to the time-series store. */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
