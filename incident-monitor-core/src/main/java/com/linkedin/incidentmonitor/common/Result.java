/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.incidentmonitor.common;

import static com.linkedin.incidentmonitor.common.utils.Utils.validateNotNull;

/**
 * Either a value or a {@link Failure}. Used for operations whose failures are expected and handled by the caller
 * instead of propagated.
 *
 * @param <T> The type of the value.
 */
public final class Result<T> {
  private final T _value;
  private final Failure _failure;

  private Result(T value, Failure failure) {
    _value = value;
    _failure = failure;
  }

  public static <T> Result<T> success(T value) {
    return new Result<>(validateNotNull(value, "Successful result must have a value."), null);
  }

  public static <T> Result<T> failure(Failure failure) {
    return new Result<>(null, validateNotNull(failure, "Failure cannot be null."));
  }

  public static <T> Result<T> failure(FailureType type, String message) {
    return failure(new Failure(type, message));
  }

  public static <T> Result<T> failure(FailureType type, String message, Throwable cause) {
    return failure(new Failure(type, message, cause));
  }

  public boolean isSuccess() {
    return _failure == null;
  }

  /**
   * @return The value of a successful result.
   * @throws IllegalStateException if the result is a failure.
   */
  public T value() {
    if (_failure != null) {
      throw new IllegalStateException("No value present for failed result " + _failure);
    }
    return _value;
  }

  /**
   * @return The failure of a failed result.
   * @throws IllegalStateException if the result is a success.
   */
  public Failure failure() {
    if (_failure == null) {
      throw new IllegalStateException("No failure present for successful result.");
    }
    return _failure;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success{" + _value + '}' : "Failure{" + _failure + '}';
  }
}
