package com.mk.fx.qa.loadgen.rest;

import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  private long headerBytes;
  private long bodyBytes;
  private boolean bodyReadFailed;
  private long responseTimeMs;

  /** Header bytes plus whatever part of the body was read. */
  public long totalBytes() {
    return headerBytes + bodyBytes;
  }
}
