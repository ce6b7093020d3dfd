package com.example.inbox.model;

public enum DiscussionState {
  ANSWERED,
  UNANSWERED
}
