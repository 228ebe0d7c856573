package edu.illinois.twopc.coordinator;

public enum Outcome {
  COMMITTED, ABORTED
}
