/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.common;

import javax.annotation.Nullable;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;


public final class Failure {
  private final FailureType _type;
  private final String _message;
  private final Throwable _cause;

  public Failure(FailureType type, String message, @Nullable Throwable cause) {
    _type = validateNotNull(type, "Failure type cannot be null.");
    _message = message;
    _cause = cause;
  }

  public Failure(FailureType type, String message) {
    this(type, message, null);
  }

  public FailureType type() {
    return _type;
  }

  public String message() {
    return _message;
  }

  @Nullable
  public Throwable cause() {
    return _cause;
  }

  @Override
  public String toString() {
    return _cause == null ? String.format("%s: %s", _type, _message)
                          : String.format("%s: %s (%s)", _type, _message, _cause);
  }
}
