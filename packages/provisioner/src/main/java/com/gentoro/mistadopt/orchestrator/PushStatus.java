package com.gentoro.mistadopt.orchestrator;

public enum PushStatus {
  SUCCESS,
  FAILED
}
