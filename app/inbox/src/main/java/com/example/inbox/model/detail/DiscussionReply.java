package com.example.inbox.model.detail;

import java.time.Instant;

public record DiscussionReply(String author, String body, Instant createdAt) {}
