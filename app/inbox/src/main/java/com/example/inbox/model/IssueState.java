package com.example.inbox.model;

public enum IssueState {
  OPEN,
  CLOSED
}
