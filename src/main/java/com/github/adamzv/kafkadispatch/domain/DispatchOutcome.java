package com.github.adamzv.kafkadispatch.domain;

public enum DispatchOutcome {
  SUCCEEDED,
  DEAD_LETTERED,
  // shutdown during a backoff wait, offset left uncommitted
  ABORTED
}
