package com.example.inbox.model;

public enum TargetKind {
  ISSUE,
  PULL_REQUEST,
  RELEASE,
  DISCUSSION,
  CI_BUILD,
  UNKNOWN
}
