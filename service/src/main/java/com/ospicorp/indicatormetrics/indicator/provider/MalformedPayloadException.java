package com.ospicorp.indicatormetrics.indicator.provider;

/** Raised while parsing an upstream body that does not have the documented shape. */
class MalformedPayloadException extends RuntimeException {

  MalformedPayloadException(String message) {
    super(message);
  }
}
