package com.example.inbox.model;

public enum PullRequestState {
  OPEN,
  CLOSED,
  MERGED
}
