package com.example.detectionledger.core.audit;

/** Lifecycle of one run. {@link #SUCCESS} and {@link #FAILED} are terminal. */
public enum RunState {
  NOT_STARTED,
  RUNNING,
  SUCCESS,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCESS || this == FAILED;
  }
}
