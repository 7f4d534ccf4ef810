package io.agenthub.model;

public enum ApprovalStatus {
  PENDING,
  RESOLVED
}
